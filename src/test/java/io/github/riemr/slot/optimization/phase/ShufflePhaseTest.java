package io.github.riemr.slot.optimization.phase;

import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.entity.PriorityPolicy;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static io.github.riemr.slot.optimization.SlotScheduleFixtures.hourlySlots;
import static io.github.riemr.slot.optimization.SlotScheduleFixtures.range;
import static io.github.riemr.slot.optimization.SlotScheduleFixtures.task;
import static io.github.riemr.slot.optimization.SlotScheduleFixtures.workedScenario;
import static org.assertj.core.api.Assertions.assertThat;

class ShufflePhaseTest {

    private static SlotSchedule allocatedWorkedScenario() {
        SlotSchedule s = workedScenario(PriorityPolicy.LOWER_VALUE_FIRST);
        new ClaimPhase().changeWorkingSchedule(s);
        new TriagePhase().changeWorkingSchedule(s);
        return s;
    }

    @Test
    void keepsCountsAndWorkingPeriods_forManySeeds() {
        for (long seed = 0; seed < 200; seed++) {
            SlotSchedule s = allocatedWorkedScenario();
            Map<String, Integer> before = s.claimedCounts();

            new ShufflePhase(new Random(seed)).changeWorkingSchedule(s);

            for (PlanningTask t : s.getTaskList()) {
                List<Integer> held = s.slotIndicesOf(t.getId());
                assertThat(held).hasSize(before.get(t.getId()));
                assertThat(held).allMatch(t::inWorkingPeriod);
            }
            s.verifyInvariants();
        }
    }

    @Test
    void sameSeed_sameLayout() {
        SlotSchedule first = allocatedWorkedScenario();
        SlotSchedule second = allocatedWorkedScenario();

        new ShufflePhase(new Random(42L)).changeWorkingSchedule(first);
        new ShufflePhase(new Random(42L)).changeWorkingSchedule(second);

        for (String id : List.of("A", "B", "C")) {
            assertThat(first.slotIndicesOf(id)).isEqualTo(second.slotIndicesOf(id));
        }
    }

    @Test
    void layoutActuallyVaries_acrossSeeds() {
        Set<List<Integer>> layouts = new HashSet<>();
        for (long seed = 0; seed < 50; seed++) {
            SlotSchedule s = allocatedWorkedScenario();
            new ShufflePhase(new Random(seed)).changeWorkingSchedule(s);
            layouts.add(s.slotIndicesOf("A"));
        }
        assertThat(layouts).hasSizeGreaterThan(1);
    }

    @Test
    void candidates_requireLegalityForBothOccupants() {
        // slot 0: x (window 0..1), slot 1: y (window 1..2), slot 2: empty
        SlotSchedule s = new SlotSchedule(hourlySlots(3), List.of(
                task("x", 1, 1, range(0, 1)),
                task("y", 1, 1, range(1, 2))
        ), PriorityPolicy.LOWER_VALUE_FIRST);
        s.claim(0, s.task("x"));
        s.claim(1, s.task("y"));

        // x may move to 1 only if y may move to 0, which it may not; slot 2 is outside x's window
        assertThat(ShufflePhase.candidates(s, 0)).containsExactly(0);
        // y may move to the empty slot 2
        assertThat(ShufflePhase.candidates(s, 1)).containsExactly(1, 2);
    }

    @Test
    void emptySlot_acceptsAnyOccupantWillingToMove() {
        SlotSchedule s = new SlotSchedule(hourlySlots(3), List.of(
                task("x", 1, 1, range(1, 2)),
                task("z", 1, 1, range(0, 2))
        ), PriorityPolicy.LOWER_VALUE_FIRST);
        s.claim(1, s.task("x"));
        s.claim(2, s.task("z"));

        assertThat(ShufflePhase.candidates(s, 0)).containsExactly(0, 2);
    }

    @Test
    void singleSlotWindow_neverMoves() {
        SlotSchedule s = new SlotSchedule(hourlySlots(4), List.of(
                task("pinned", 1, 1, range(2, 2)),
                task("free", 2, 1, range(0, 3))
        ), PriorityPolicy.LOWER_VALUE_FIRST);
        new ClaimPhase().changeWorkingSchedule(s);

        for (long seed = 0; seed < 20; seed++) {
            SlotSchedule copy = s.copy();
            new ShufflePhase(new Random(seed)).changeWorkingSchedule(copy);
            assertThat(copy.slotIndicesOf("pinned")).containsExactly(2);
        }
    }
}
