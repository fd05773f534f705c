package io.github.riemr.slot.domain.model;

import io.github.riemr.slot.optimization.entity.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * 1 回のスケジューリング結果。スロット列（index 順）とタスク毎の充足状況。
 */
public record ScheduleResult(List<SlotAssignment> slots, List<TaskOutcome> tasks) {

    public Optional<TaskOutcome> outcome(String taskId) {
        return tasks.stream().filter(t -> t.taskId().equals(taskId)).findFirst();
    }

    /** 必要スロット数に届かなかったタスク ID（入力順） */
    public List<String> unschedulableTaskIds() {
        return tasks.stream()
                .filter(t -> t.status() == TaskStatus.UNSCHEDULABLE)
                .map(TaskOutcome::taskId)
                .toList();
    }
}
