package com.example.quorum.scheduling;

import com.example.quorum.domain.AgentTier;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which record kinds each tier may write.
 */
public final class TierPolicy {

    private static final Map<AgentTier, Set<RecordKind>> ALLOWED = new EnumMap<>(AgentTier.class);

    static {
        ALLOWED.put(AgentTier.OBSERVE, EnumSet.of(RecordKind.DOCUMENT, RecordKind.EVENT));
        ALLOWED.put(AgentTier.ACT, EnumSet.of(RecordKind.TASK, RecordKind.OBSERVATION, RecordKind.EVENT));
        ALLOWED.put(AgentTier.REFLECT, EnumSet.of(RecordKind.EVENT, RecordKind.OBSERVATION, RecordKind.DOCUMENT));
    }

    private TierPolicy() {
    }

    public static boolean allows(AgentTier tier, RecordKind kind) {
        return ALLOWED.get(tier).contains(kind);
    }

    public static Set<RecordKind> allowed(AgentTier tier) {
        return EnumSet.copyOf(ALLOWED.get(tier));
    }
}
