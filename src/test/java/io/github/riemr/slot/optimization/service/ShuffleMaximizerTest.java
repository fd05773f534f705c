package io.github.riemr.slot.optimization.service;

import io.github.riemr.slot.optimization.SlotScheduleFixtures;
import io.github.riemr.slot.optimization.entity.PriorityPolicy;
import io.github.riemr.slot.optimization.phase.ClaimPhase;
import io.github.riemr.slot.optimization.phase.TriagePhase;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class ShuffleMaximizerTest {

    private SlotSchedule base;

    @BeforeEach
    void setUp() {
        base = SlotScheduleFixtures.workedScenario(PriorityPolicy.LOWER_VALUE_FIRST);
        new ClaimPhase().changeWorkingSchedule(base);
        new TriagePhase().changeWorkingSchedule(base);
    }

    @Test
    void stopsAtMaxAttempts() {
        ShuffleMaximizer.Outcome outcome = new ShuffleMaximizer(Duration.ofSeconds(10), 5)
                .maximize(base, r -> 0.0, new Random(1));

        assertThat(outcome.attempts()).isEqualTo(5);
    }

    @Test
    void flatGoal_returnsBaseLayout() {
        ShuffleMaximizer.Outcome outcome = new ShuffleMaximizer(Duration.ofSeconds(10), 50)
                .maximize(base, r -> 1.0, new Random(1));

        assertThat(outcome.best()).isSameAs(base);
        assertThat(outcome.score()).isEqualTo(1.0);
    }

    @Test
    void keepsStrictlyBetterLayout_withoutTouchingBase() {
        List<Integer> baseB = base.slotIndicesOf("B");

        ShuffleMaximizer.Outcome outcome = new ShuffleMaximizer(Duration.ofSeconds(10), 200)
                .maximize(base, r -> -r.outcome("B").orElseThrow().slotIndices().get(0), new Random(3));

        assertThat(baseB).containsExactly(5);
        assertThat(base.slotIndicesOf("B")).containsExactly(5);
        assertThat(outcome.best().slotIndicesOf("B")).containsExactly(4);
        assertThat(outcome.score()).isEqualTo(-4.0);
        outcome.best().verifyInvariants();
        assertThat(outcome.best().claimedCounts()).isEqualTo(base.claimedCounts());
    }
}
