package io.github.riemr.slot.application.dto;

import java.util.List;

public record ScheduleResponse(
    List<SlotView> slots,
    List<TaskStatusView> tasks,
    List<String> unschedulableTaskIds
) {}
