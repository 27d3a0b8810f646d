package com.example.quorum.scheduling;

import com.example.quorum.config.QuorumProperties;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Daily window {@code [startHour, endHour)} in a fixed zone during which
 * notifications are held back. A window with start after end wraps past
 * midnight (22 to 7); start equal to end means no quiet hours.
 */
public record QuietHours(boolean enabled, int startHour, int endHour, ZoneId zone) {

    public QuietHours {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 23) {
            throw new IllegalArgumentException("Quiet hours must be within 0-23, got " + startHour + "-" + endHour);
        }
    }

    public static QuietHours from(QuorumProperties.SchedulerConfig cfg) {
        QuorumProperties.SchedulerConfig.QuietHoursConfig q = cfg.getQuietHours();
        return new QuietHours(q.isEnabled(), q.getStartHour(), q.getEndHour(), ZoneId.of(cfg.getZone()));
    }

    public boolean isQuiet(Instant instant) {
        if (!enabled || startHour == endHour) return false;
        int hour = instant.atZone(zone).getHour();
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }
}
