package com.avocado.bonus_ledger.client;

import com.avocado.bonus_ledger.client.dto.ClientResponse;
import com.avocado.bonus_ledger.client.dto.RegisterClientRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client registration as mirrored from the point of sale. The bonus balance is read-only here.
 */
@RestController
@RequestMapping("/api/clients")
@RequiredArgsConstructor
public class ClientController {

    private final ClientService clientService;

    @PutMapping("/{clientId}")
    public ClientResponse registerClient(@PathVariable("clientId") Long clientId,
                                         @Valid @RequestBody RegisterClientRequest request) {
        return ClientResponse.from(clientService.registerClient(
            clientId, request.getFirstname(), request.getLastname(), request.getPhone()));
    }

    @GetMapping("/{clientId}")
    public ResponseEntity<ClientResponse> getClient(@PathVariable("clientId") Long clientId) {
        return clientService.findById(clientId)
            .map(client -> ResponseEntity.ok(ClientResponse.from(client)))
            .orElse(ResponseEntity.notFound().build());
    }
}
