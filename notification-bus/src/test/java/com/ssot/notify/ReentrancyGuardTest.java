package com.ssot.notify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ReentrancyGuardTest {

    @Test
    @DisplayName("Should never drop outside a dispatch")
    void shouldNotDropWhenIdle() {
        ReentrancyGuard guard = new ReentrancyGuard(0);

        assertThat(guard.shouldDrop()).isFalse();
        assertThat(guard.isDispatching()).isFalse();
    }

    @Test
    @DisplayName("Should drop once depth exceeds the bound")
    void shouldDropBeyondBound() {
        ReentrancyGuard guard = new ReentrancyGuard(2);

        guard.enter();
        guard.enter();
        assertThat(guard.shouldDrop()).isFalse();
        guard.enter();
        assertThat(guard.shouldDrop()).isTrue();
        assertThat(guard.getDepth()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reset when the outermost dispatch exits")
    void shouldResetOnExit() {
        ReentrancyGuard guard = new ReentrancyGuard(1);
        guard.enter();
        guard.enter();

        guard.exit();
        assertThat(guard.isDispatching()).isTrue();
        guard.exit();
        assertThat(guard.isDispatching()).isFalse();
        assertThat(guard.getDepth()).isZero();

        guard.exit();
        assertThat(guard.getDepth()).isZero();
    }
}
