package io.github.riemr.slot.optimization.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 割当の最小単位。assignedTaskId が null なら空きスロット。
 */
@Getter
@Setter
@ToString
public class Slot {

    private final int index;
    private final LocalDateTime start;
    private final LocalDateTime end;

    private String assignedTaskId;

    public Slot(int index, LocalDateTime start, LocalDateTime end) {
        this.index = index;
        this.start = start;
        this.end = end;
    }

    public boolean isEmpty() {
        return assignedTaskId == null;
    }

    public Slot copy() {
        Slot s = new Slot(index, start, end);
        s.setAssignedTaskId(assignedTaskId);
        return s;
    }
}
