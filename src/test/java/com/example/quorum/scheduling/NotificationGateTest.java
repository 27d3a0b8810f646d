package com.example.quorum.scheduling;

import com.example.quorum.domain.AgentTier;
import com.example.quorum.domain.NotificationOutcome;
import com.example.quorum.notification.NotificationService;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NotificationGateTest {

    private final NotificationService notificationService = mock(NotificationService.class);
    private final QuietHours quietHours = new QuietHours(true, 22, 7, ZoneId.of("UTC"));
    private final AgentDefinition agent = AgentDefinition.builder()
            .name("closer").displayName("The Closer").tier(AgentTier.ACT).build();

    private NotificationGate gateAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new NotificationGate(notificationService, quietHours, clock);
    }

    @Test
    void suppressesDuringQuietHours() {
        NotificationGate gate = gateAt("2026-03-10T23:00:00Z");

        NotificationOutcome outcome = gate.offer(agent, new AgentNotification("Overdue", "Two tasks are overdue"));

        assertEquals(NotificationOutcome.SUPPRESSED, outcome);
        assertTrue(gate.isQuietNow());
        verifyNoInteractions(notificationService);
    }

    @Test
    void deliversOutsideQuietHours() {
        when(notificationService.send(any(), any(), any())).thenReturn(NotificationOutcome.DELIVERED);
        NotificationGate gate = gateAt("2026-03-10T12:00:00Z");

        NotificationOutcome outcome = gate.offer(agent, new AgentNotification("Overdue", "Two tasks are overdue"));

        assertEquals(NotificationOutcome.DELIVERED, outcome);
        verify(notificationService).send("The Closer", "Overdue", "Two tasks are overdue");
    }

    @Test
    void nothingToOfferIsNone() {
        assertEquals(NotificationOutcome.NONE, gateAt("2026-03-10T12:00:00Z").offer(agent, null));
        verifyNoInteractions(notificationService);
    }
}
