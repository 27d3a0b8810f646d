package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumProperties;
import com.example.quorum.domain.NotificationOutcome;
import com.example.quorum.notification.NotificationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * The single point where quiet hours apply. Findings are already persisted by
 * the time a notification reaches the gate; a suppressed notification loses
 * nothing but the ping.
 */
@Slf4j
@Component
public class NotificationGate {

    private final NotificationService notificationService;
    private final QuietHours quietHours;
    private final Clock clock;

    @Autowired
    public NotificationGate(NotificationService notificationService, QuorumProperties properties, Clock clock) {
        this(notificationService, QuietHours.from(properties.getScheduler()), clock);
    }

    NotificationGate(NotificationService notificationService, QuietHours quietHours, Clock clock) {
        this.notificationService = notificationService;
        this.quietHours = quietHours;
        this.clock = clock;
    }

    public NotificationOutcome offer(AgentDefinition agent, AgentNotification notification) {
        if (notification == null) {
            return NotificationOutcome.NONE;
        }
        if (quietHours.isQuiet(clock.instant())) {
            log.info("Quiet hours: suppressed notification '{}' from {}", notification.title(), agent.getName());
            return NotificationOutcome.SUPPRESSED;
        }
        return notificationService.send(agent.getDisplayName(), notification.title(), notification.message());
    }

    public boolean isQuietNow() {
        return quietHours.isQuiet(clock.instant());
    }

    public QuietHours quietHours() {
        return quietHours;
    }
}
