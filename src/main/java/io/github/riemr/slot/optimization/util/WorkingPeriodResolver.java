package io.github.riemr.slot.optimization.util;

import io.github.riemr.slot.domain.model.TaskSpec;
import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.entity.Slot;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public final class WorkingPeriodResolver {
    private WorkingPeriodResolver() {}

    /**
     * Slot indices available to the task: slots starting at or after max(horizonStart, task.start)
     * and ending no later than task.due, in slot order. The result may span gaps between active periods.
     */
    public static List<Integer> workingPeriod(TaskSpec task, List<Slot> slots, LocalDateTime horizonStart) {
        LocalDateTime from = task.start().isAfter(horizonStart) ? task.start() : horizonStart;
        List<Integer> res = new ArrayList<>();
        for (Slot s : slots) {
            if (s.getStart().isBefore(from)) continue;
            if (s.getEnd().isAfter(task.due())) break;
            res.add(s.getIndex());
        }
        return res;
    }

    /** Tasks whose working period is empty come back already UNSCHEDULABLE. */
    public static List<PlanningTask> resolveAll(List<TaskSpec> tasks, List<Slot> slots, LocalDateTime horizonStart) {
        return tasks.stream()
                .map(t -> new PlanningTask(t, workingPeriod(t, slots, horizonStart)))
                .toList();
    }
}
