package com.avocado.bonus_ledger.admin.dto;

import com.avocado.bonus_ledger.settings.SystemSetting;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class SettingResponse {

    @JsonProperty("key")
    String key;

    @JsonProperty("value")
    String value;

    @JsonProperty("description")
    String description;

    @JsonProperty("updated_at")
    LocalDateTime updatedAt;

    public static SettingResponse from(SystemSetting setting) {
        return SettingResponse.builder()
            .key(setting.getKey())
            .value(setting.getValue())
            .description(setting.getDescription())
            .updatedAt(setting.getUpdatedAt())
            .build();
    }
}
