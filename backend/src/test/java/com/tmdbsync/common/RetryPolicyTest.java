package com.tmdbsync.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsBaseDelay() {
        RetryPolicy policy = new RetryPolicy(200L, 1.5, 2.0, 60_000L, 6);
        assertThat(policy.delayMs(0)).isEqualTo(200L);
    }

    @Test
    void delayMs_fixedMultiplier_isDeterministic() {
        RetryPolicy policy = new RetryPolicy(100L, 2.0, 2.0, 60_000L, 6);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
        assertThat(policy.delayMs(3)).isEqualTo(800L);
    }

    @Test
    void delayMs_randomMultiplier_staysWithinBounds() {
        RetryPolicy policy = new RetryPolicy(1000L, 1.5, 2.0, 60_000L, 6);
        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayMs(2)).isBetween(2250L, 4000L);
        }
    }

    @Test
    void delayMs_neverExceedsCeiling() {
        RetryPolicy policy = new RetryPolicy(1000L, 2.0, 2.0, 60_000L, 100);
        assertThat(policy.delayMs(10)).isEqualTo(60_000L);
        assertThat(policy.delayMs(99)).isEqualTo(60_000L);
    }

    @Test
    void capMs_clampsServerHint() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();
        assertThat(policy.capMs(2_000L)).isEqualTo(2_000L);
        assertThat(policy.capMs(600_000L)).isEqualTo(60_000L);
        assertThat(policy.capMs(-5L)).isZero();
    }

    @Test
    void defaultPolicy_hasExpectedBudget() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(6);
        assertThat(RetryPolicy.defaultPolicy().getMaxDelayMs()).isEqualTo(60_000L);
    }

    @Test
    void constructor_rejectsShrinkingMultiplier() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0.5, 2.0, 1000L, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
