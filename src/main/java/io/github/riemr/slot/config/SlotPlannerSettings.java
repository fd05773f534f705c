package io.github.riemr.slot.config;

import io.github.riemr.slot.domain.model.BreakPattern;
import io.github.riemr.slot.optimization.entity.PriorityPolicy;

import java.time.Duration;

public record SlotPlannerSettings(
        Duration slotLength,
        PriorityPolicy priorityPolicy,
        boolean shuffleEnabled,
        Duration shuffleTimeLimit,
        int shuffleMaxAttempts,
        BreakPattern breakPattern
) {
    public static final Duration DEFAULT_SLOT_LENGTH = Duration.ofMinutes(25);
    public static final Duration DEFAULT_SHUFFLE_TIME_LIMIT = Duration.ofMillis(200);
    public static final int DEFAULT_SHUFFLE_MAX_ATTEMPTS = 200;
    public static final BreakPattern DEFAULT_BREAK_PATTERN =
            new BreakPattern(4, Duration.ofMinutes(5), Duration.ofMinutes(30));

    public static SlotPlannerSettings defaults() {
        return new SlotPlannerSettings(DEFAULT_SLOT_LENGTH, PriorityPolicy.LOWER_VALUE_FIRST, true,
                DEFAULT_SHUFFLE_TIME_LIMIT, DEFAULT_SHUFFLE_MAX_ATTEMPTS, BreakPattern.NONE);
    }

    public SlotPlannerSettings withSlotLength(Duration length) {
        return new SlotPlannerSettings(length, priorityPolicy, shuffleEnabled, shuffleTimeLimit, shuffleMaxAttempts, breakPattern);
    }

    public SlotPlannerSettings withPriorityPolicy(PriorityPolicy policy) {
        return new SlotPlannerSettings(slotLength, policy, shuffleEnabled, shuffleTimeLimit, shuffleMaxAttempts, breakPattern);
    }

    public SlotPlannerSettings withShuffleEnabled(boolean enabled) {
        return new SlotPlannerSettings(slotLength, priorityPolicy, enabled, shuffleTimeLimit, shuffleMaxAttempts, breakPattern);
    }

    public SlotPlannerSettings withBreakPattern(BreakPattern pattern) {
        return new SlotPlannerSettings(slotLength, priorityPolicy, shuffleEnabled, shuffleTimeLimit, shuffleMaxAttempts, pattern);
    }
}
