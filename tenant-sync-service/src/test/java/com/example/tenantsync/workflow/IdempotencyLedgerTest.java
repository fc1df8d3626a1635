package com.example.tenantsync.workflow;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdempotencyLedgerTest {

    @Test
    void add_RejectsKeyAlreadyPresent() {
        IdempotencyLedger ledger = new IdempotencyLedger(10);

        assertThat(ledger.add("created-a1-u1-o1")).isTrue();
        assertThat(ledger.add("created-a1-u1-o1")).isFalse();
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    void add_EvictsOldestBeyondCapacity() {
        IdempotencyLedger ledger = new IdempotencyLedger(3);

        ledger.add("k1");
        ledger.add("k2");
        ledger.add("k3");
        ledger.add("k4");

        assertThat(ledger.snapshot()).containsExactly("k2", "k3", "k4");
        assertThat(ledger.contains("k1")).isFalse();
    }

    @Test
    void restore_PutsCarriedKeysBeforeKeysRecordedEarlier() {
        IdempotencyLedger ledger = new IdempotencyLedger(3);
        ledger.add("new-1");

        ledger.restore(List.of("old-1", "old-2", "old-3"));

        // old-1 is the oldest and falls off
        assertThat(ledger.snapshot()).containsExactly("old-2", "old-3", "new-1");
    }

    @Test
    void restore_IgnoresNullAndDuplicates() {
        IdempotencyLedger ledger = new IdempotencyLedger(5);
        ledger.add("k1");

        ledger.restore(null);
        ledger.restore(List.of("k1", "k2"));

        assertThat(ledger.snapshot()).containsExactly("k1", "k2");
    }

    @Test
    void constructor_RejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new IdempotencyLedger(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
