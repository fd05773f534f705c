package io.github.riemr.slot.domain.model;

import java.time.LocalDateTime;

/**
 * 作業可能な時間帯 [start, end)。スロットはこの範囲内にのみ生成される。
 */
public record ActivePeriod(LocalDateTime start, LocalDateTime end) {

    public boolean isMalformed() {
        return start == null || end == null || end.isBefore(start);
    }

    public boolean overlapsOrTouches(ActivePeriod other) {
        return !other.start.isAfter(end) && !start.isAfter(other.end);
    }
}
