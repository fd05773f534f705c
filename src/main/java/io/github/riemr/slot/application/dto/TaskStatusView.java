package io.github.riemr.slot.application.dto;

import java.util.List;

public record TaskStatusView(
    String id,
    String status,
    int requiredSlots,
    int claimedSlots,
    int shortfall,
    List<Integer> slotIndices
) {}
