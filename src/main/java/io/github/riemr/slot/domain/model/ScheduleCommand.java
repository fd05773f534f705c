package io.github.riemr.slot.domain.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Schedule 操作の入力一式。
 * horizonStart / rngSeed / slotLength は null 可（それぞれ現在時刻、非決定的シード、設定値を使用）。
 */
public record ScheduleCommand(
        List<ActivePeriod> activePeriods,
        List<TaskSpec> tasks,
        LocalDateTime horizonStart,
        Long rngSeed,
        Duration slotLength
) {
    public ScheduleCommand(List<ActivePeriod> activePeriods, List<TaskSpec> tasks,
                           LocalDateTime horizonStart, Long rngSeed) {
        this(activePeriods, tasks, horizonStart, rngSeed, null);
    }
}
