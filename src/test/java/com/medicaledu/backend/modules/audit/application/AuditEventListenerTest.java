package com.medicaledu.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.modules.payments.domain.PaymentEvents;
import com.medicaledu.backend.modules.users.domain.UserEvents;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuditEventListenerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private AuditLogService auditLogService;

    private AuditEventListener listener;

    @BeforeEach
    void setUp() {
        listener = new AuditEventListener(auditLogService, new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void eventPayloadBecomesNewValues() {
        UUID paymentId = UUID.randomUUID();
        UUID bookingId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        PaymentEvents.Succeeded event = new PaymentEvents.Succeeded(paymentId, NOW, bookingId, userId,
                new BigDecimal("20.00"), "USD");

        listener.onDomainEvent(event);

        ArgumentCaptor<Map<String, Object>> newValues = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(auditLogService).record(eq("Payment"), eq(paymentId), eq(event.auditAction()), isNull(), isNull(),
                newValues.capture(), metadata.capture());
        assertThat(newValues.getValue())
                .containsEntry("bookingId", bookingId.toString())
                .containsEntry("userId", userId.toString())
                .containsEntry("currency", "USD")
                .doesNotContainKeys("aggregateId", "occurredAt");
        assertThat(metadata.getValue())
                .containsEntry("eventType", "Succeeded")
                .containsEntry("occurredAt", NOW.toString());
    }

    @Test
    void loginIsAttributedToTheUser() {
        UUID userId = UUID.randomUUID();

        listener.onDomainEvent(new UserEvents.LoggedIn(userId, NOW));

        verify(auditLogService).record(eq("User"), eq(userId), eq(AuditActionType.LOGIN), eq(userId), isNull(),
                isNull(), eq(Map.of("eventType", "LoggedIn", "occurredAt", NOW.toString())));
    }
}
