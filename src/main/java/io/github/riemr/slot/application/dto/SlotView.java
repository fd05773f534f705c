package io.github.riemr.slot.application.dto;

import java.time.LocalDateTime;

public record SlotView(int index, LocalDateTime start, LocalDateTime end, String taskId) {}
