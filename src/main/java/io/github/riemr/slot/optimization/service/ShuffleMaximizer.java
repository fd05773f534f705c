package io.github.riemr.slot.optimization.service;

import io.github.riemr.slot.domain.model.ScheduleResult;
import io.github.riemr.slot.optimization.phase.ShufflePhase;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * シャッフルを時間上限・試行回数上限まで繰り返し、目的関数のスコアが最も高い配置を残す。
 * 各試行は基準配置のコピーに対して行うため、件数や作業期間の制約はシャッフル単体と同じく保たれる。
 */
@Slf4j
public final class ShuffleMaximizer {

    public record Outcome(SlotSchedule best, double score, int attempts) {}

    private final Duration timeLimit;
    private final int maxAttempts;

    public ShuffleMaximizer(Duration timeLimit, int maxAttempts) {
        this.timeLimit = timeLimit;
        this.maxAttempts = maxAttempts;
    }

    /** 基準配置（シャッフル前）のスコアを上回った配置だけを採用する */
    public Outcome maximize(SlotSchedule base, ToDoubleFunction<ScheduleResult> goal, Random random) {
        long deadline = System.nanoTime() + timeLimit.toNanos();
        ShufflePhase shuffle = new ShufflePhase(random);

        SlotSchedule best = base;
        double scoreToBeat = goal.applyAsDouble(base.toResult());
        int attempts = 0;
        while (attempts < maxAttempts && System.nanoTime() < deadline) {
            SlotSchedule copy = base.copy();
            shuffle.changeWorkingSchedule(copy);
            double score = goal.applyAsDouble(copy.toResult());
            if (score > scoreToBeat) {
                best = copy;
                scoreToBeat = score;
            }
            attempts++;
        }
        log.debug("SHUFFLE-MAX attempts={}, bestScore={}", attempts, scoreToBeat);
        return new Outcome(best, scoreToBeat, attempts);
    }
}
