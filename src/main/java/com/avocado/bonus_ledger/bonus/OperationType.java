package com.avocado.bonus_ledger.bonus;

/**
 * Kinds of bonus ledger entries.
 *
 * EARN and SPEND are produced by the posting engine. ADJUST is produced by manual
 * operator corrections. EXPIRE is reserved for an expiry process and is never
 * written by this service.
 */
public enum OperationType {
    EARN,
    SPEND,
    ADJUST,
    EXPIRE
}
