package io.github.riemr.slot.optimization.phase;

import io.github.riemr.slot.domain.SlotInvariantViolationException;
import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * 表示用の並べ替えフェーズ。どのタスクが何スロット持つかは変えず、どのスロットを持つかだけを無作為化する。
 * 左から順に各スロット i について、i 以降で「双方の占有者が交換後も自分の作業期間内に収まる」スロットを
 * 候補として集め（i 自身を含む）、一様に 1 つ選んで交換する。
 */
public class ShufflePhase implements SlotPhaseCommand {

    private static final Logger log = LoggerFactory.getLogger(ShufflePhase.class);

    private final Random random;

    public ShufflePhase(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public void changeWorkingSchedule(SlotSchedule schedule) {
        Map<String, Integer> before = schedule.claimedCounts();
        int n = schedule.getSlotCount();
        int swaps = 0;

        for (int i = 0; i < n; i++) {
            List<Integer> candidates = candidates(schedule, i);
            int j = candidates.get(random.nextInt(candidates.size()));
            if (j != i) {
                schedule.swap(i, j);
                swaps++;
            }
        }

        for (PlanningTask t : schedule.getTaskList()) {
            int held = schedule.slotIndicesOf(t.getId()).size();
            if (held != before.get(t.getId())) {
                throw new SlotInvariantViolationException("Shuffle changed the slot count of " + t.getId());
            }
        }
        log.debug("SHUFFLE done: slots={}, swaps={}", n, swaps);
    }

    static List<Integer> candidates(SlotSchedule schedule, int i) {
        PlanningTask left = schedule.occupantOf(i);
        List<Integer> res = new ArrayList<>();
        res.add(i);
        for (int j = i + 1; j < schedule.getSlotCount(); j++) {
            if (left != null && !left.inWorkingPeriod(j)) continue;
            PlanningTask right = schedule.occupantOf(j);
            if (right != null && !right.inWorkingPeriod(i)) continue;
            res.add(j);
        }
        return res;
    }
}
