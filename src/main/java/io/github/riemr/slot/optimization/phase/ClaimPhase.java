package io.github.riemr.slot.optimization.phase;

import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.entity.TaskStatus;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * 初期割当フェーズ。
 * 作業期間の短い（選択肢の少ない）タスクから順に、作業期間の先頭から空きスロットを必要数まで確保する。
 * このフェーズでは他タスクの確保済みスロットを奪わない。
 */
public class ClaimPhase implements SlotPhaseCommand {

    private static final Logger log = LoggerFactory.getLogger(ClaimPhase.class);

    static final Comparator<PlanningTask> CLAIM_ORDER = Comparator
            .comparingInt(PlanningTask::getWorkingPeriodLength)
            .thenComparing(PlanningTask::getId);

    @Override
    public void changeWorkingSchedule(SlotSchedule schedule) {
        List<PlanningTask> order = schedule.getTaskList().stream()
                .filter(t -> t.getStatus() != TaskStatus.UNSCHEDULABLE)
                .sorted(CLAIM_ORDER)
                .toList();

        int totalClaimed = 0;
        for (PlanningTask task : order) {
            int before = task.getClaimedSlots();
            for (int idx : task.getWorkingPeriod()) {
                if (task.isSatisfied()) break;
                if (schedule.occupantOf(idx) == null) {
                    schedule.claim(idx, task);
                }
            }
            totalClaimed += task.getClaimedSlots() - before;
            if (log.isDebugEnabled()) {
                log.debug("CLAIM task={} window={} claimed={}/{}", task.getId(), task.getWorkingPeriodLength(),
                        task.getClaimedSlots(), task.getDuration());
            }
        }
        log.info("CLAIM done: tasks={}, slotsClaimed={}, unsatisfied={}",
                order.size(), totalClaimed, schedule.tasksBelowDuration().size());
    }
}
