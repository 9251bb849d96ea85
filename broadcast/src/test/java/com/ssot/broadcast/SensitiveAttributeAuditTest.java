package com.ssot.broadcast;

import com.ssot.notify.AttributeSpace;
import com.ssot.notify.ChangeEvent;
import com.ssot.notify.NotificationBusConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SensitiveAttributeAuditTest {

    private AttributeSpace bus;

    @BeforeEach
    void setUp() {
        bus = new AttributeSpace(NotificationBusConfig.builder()
            .enableBatching(false)
            .enableLogging(false)
            .build());
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private void change(String attributeName) {
        bus.publish(ChangeEvent.builder().entityType("Utente").entityId("utente-1")
            .attributeName(attributeName).newValue("secret").build());
    }

    @Test
    @DisplayName("Should audit only attributes whose name contains password")
    void shouldAuditPasswordAttributes() {
        SensitiveAttributeAudit audit = new SensitiveAttributeAudit(bus);
        audit.start();

        change("password");
        change("oldPassword_hash");
        change("email");

        assertThat(audit.getAuditedChanges()).isEqualTo(2);
        assertThat(audit.getAttributeGlob()).isEqualTo("*password*");
    }

    @Test
    @DisplayName("Should honour a custom glob")
    void shouldUseCustomGlob() {
        SensitiveAttributeAudit audit = new SensitiveAttributeAudit(bus, "iban_*");
        audit.start();

        change("iban_primary");
        change("password");

        assertThat(audit.getAuditedChanges()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop auditing after close")
    void shouldStopOnClose() {
        SensitiveAttributeAudit audit = new SensitiveAttributeAudit(bus);
        audit.start();
        change("password");

        audit.close();
        change("password");

        assertThat(audit.getAuditedChanges()).isEqualTo(1);
        assertThat(bus.stats().getActiveSubscriptions()).isZero();
    }

    @Test
    @DisplayName("Should reject an empty glob")
    void shouldRejectEmptyGlob() {
        assertThatThrownBy(() -> new SensitiveAttributeAudit(bus, ""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
