package com.ssot.notify;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.*;

@DisplayName("NotificationBusException Tests")
class NotificationBusExceptionTest {

    @Test
    @DisplayName("Should create exception with message")
    void shouldCreateExceptionWithMessage() {
        NotificationBusException exception = new NotificationBusException("Batch timer could not be scheduled");

        assertThat(exception)
            .isInstanceOf(RuntimeException.class)
            .hasMessage("Batch timer could not be scheduled")
            .hasNoCause();
    }

    @Test
    @DisplayName("Should keep the scheduler rejection as cause")
    void shouldCreateExceptionWithMessageAndCause() {
        Throwable cause = new RejectedExecutionException("Scheduler is shut down");

        NotificationBusException exception = new NotificationBusException("Batch timer could not be scheduled", cause);

        assertThat(exception)
            .isInstanceOf(RuntimeException.class)
            .hasMessage("Batch timer could not be scheduled")
            .hasCause(cause);
    }

    @Test
    @DisplayName("Should handle null cause")
    void shouldHandleNullCause() {
        NotificationBusException exception = new NotificationBusException("Test", null);

        assertThat(exception.getMessage()).isEqualTo("Test");
        assertThat(exception.getCause()).isNull();
    }
}
