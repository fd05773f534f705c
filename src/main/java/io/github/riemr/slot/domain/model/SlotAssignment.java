package io.github.riemr.slot.domain.model;

import java.time.LocalDateTime;

public record SlotAssignment(int index, LocalDateTime start, LocalDateTime end, String taskId) {

    public boolean isEmpty() {
        return taskId == null;
    }
}
