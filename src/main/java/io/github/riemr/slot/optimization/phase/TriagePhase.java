package io.github.riemr.slot.optimization.phase;

import io.github.riemr.slot.domain.SlotInvariantViolationException;
import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 初期割当で必要数に届かなかったタスク間の競合解消フェーズ。
 * <p>
 * 1 パスでは、未充足タスクを優先度の低い順に処理する。各タスクは作業期間を先頭から走査し、
 * 空き、または自分より優先度が厳密に低いタスクが持つスロットを 1 つずつ奪う。
 * 追い出されたタスクは次のパス以降、自分の順番で再評価される（同一ステップ内で連鎖しない）。
 * 1 パスで 1 件も奪取がなければ終了し、なお不足するタスクは UNSCHEDULABLE とする（確保済み分は保持）。
 * <p>
 * 奪取のたびにスロットの占有者の優先順位が上がるか空きが埋まるため、奪取回数は
 * スロット数 × 優先度の種類数 を超えない。パス数がこの上限を超えた場合は不変条件違反として扱う。
 */
public class TriagePhase implements SlotPhaseCommand {

    private static final Logger log = LoggerFactory.getLogger(TriagePhase.class);

    public record TriageOutcome(int passes, int captures, int emptySlotCaptures) {}

    @Override
    public void changeWorkingSchedule(SlotSchedule schedule) {
        triage(schedule);
    }

    public TriageOutcome triage(SlotSchedule schedule) {
        int bound = passBound(schedule);
        int passes = 0;
        int captures = 0;
        int emptyCaptures = 0;

        while (true) {
            if (passes >= bound) {
                throw new SlotInvariantViolationException("Triage did not reach a fixpoint within " + bound + " passes");
            }
            passes++;

            List<PlanningTask> contenders = schedule.tasksBelowDuration().stream()
                    .sorted(schedule.leastFavoredFirst())
                    .toList();

            int passCaptures = 0;
            for (PlanningTask task : contenders) {
                for (int idx : task.getWorkingPeriod()) {
                    if (task.isSatisfied()) break;
                    PlanningTask occupant = schedule.occupantOf(idx);
                    if (occupant == task) continue;
                    if (occupant != null && !schedule.isMoreFavored(task, occupant)) continue;

                    PlanningTask evicted = schedule.capture(idx, task);
                    passCaptures++;
                    if (evicted == null) {
                        emptyCaptures++;
                        log.debug("TRIAGE pass={} task={} took empty slot {}", passes, task.getId(), idx);
                    } else {
                        log.debug("TRIAGE pass={} task={} took slot {} from {}", passes, task.getId(), idx, evicted.getId());
                    }
                }
            }
            captures += passCaptures;
            if (passCaptures == 0) break;
        }

        List<PlanningTask> shortTasks = schedule.tasksBelowDuration();
        shortTasks.forEach(PlanningTask::markUnschedulable);

        log.info("TRIAGE done: passes={}, captures={}, unschedulable={}", passes, captures, shortTasks.size());
        return new TriageOutcome(passes, captures, emptyCaptures);
    }

    static int passBound(SlotSchedule schedule) {
        long levels = schedule.getTaskList().stream().mapToInt(PlanningTask::getPriority).distinct().count();
        long bound = (long) schedule.getSlotCount() * Math.max(1, levels) + 1;
        return (int) Math.min(Integer.MAX_VALUE, bound);
    }
}
