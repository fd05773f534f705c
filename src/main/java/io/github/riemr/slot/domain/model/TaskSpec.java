package io.github.riemr.slot.domain.model;

import java.time.LocalDateTime;

/**
 * スケジューリング対象タスクの入力スナップショット。
 * durationSlots はスロット数（1 以上）、priority の大小どちらを優先するかは PriorityPolicy で決まる。
 */
public record TaskSpec(
        String id,
        int durationSlots,
        LocalDateTime start,
        LocalDateTime due,
        int priority
) {}
