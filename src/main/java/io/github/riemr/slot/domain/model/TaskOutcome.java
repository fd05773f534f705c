package io.github.riemr.slot.domain.model;

import io.github.riemr.slot.optimization.entity.TaskStatus;

import java.util.List;

public record TaskOutcome(
        String taskId,
        TaskStatus status,
        int requiredSlots,
        int claimedSlots,
        int shortfall,
        List<Integer> slotIndices
) {}
