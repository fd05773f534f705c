package io.github.riemr.slot.optimization.service;

import io.github.riemr.slot.config.SlotPlannerSettings;
import io.github.riemr.slot.domain.ScheduleValidationException;
import io.github.riemr.slot.domain.model.ActivePeriod;
import io.github.riemr.slot.domain.model.BreakPattern;
import io.github.riemr.slot.domain.model.ScheduleCommand;
import io.github.riemr.slot.domain.model.ScheduleResult;
import io.github.riemr.slot.domain.model.TaskSpec;
import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.entity.Slot;
import io.github.riemr.slot.optimization.phase.ClaimPhase;
import io.github.riemr.slot.optimization.phase.ShufflePhase;
import io.github.riemr.slot.optimization.phase.TriagePhase;
import io.github.riemr.slot.optimization.solution.SlotSchedule;
import io.github.riemr.slot.optimization.util.SlotSlicer;
import io.github.riemr.slot.optimization.util.WorkingPeriodResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * スロット割当の実行サービス。
 * <ul>
 *   <li>入力検証（計算開始前にすべて行い、部分的な結果は返さない）</li>
 *   <li>スロット生成 → 作業期間の解決 → 初期割当 → トリアージ → シャッフル を順に実行</li>
 *   <li>各フェーズの境界で不変条件を検査</li>
 * </ul>
 * 作業状態は呼び出し毎に生成して破棄するため、並行呼び出しで共有する可変状態はない。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlotScheduleService {

    /* === Collaborators === */
    private final SlotPlannerSettings settings;
    private final Clock clock;

    /* ===================================================================== */
    /* Public API                                                            */
    /* ===================================================================== */

    /**
     * タスク群にスロットを割り当てる。
     *
     * @param activePeriods 作業可能な時間帯
     * @param tasks         対象タスク（1 件以上）
     * @param horizonStart  計画開始時刻（null なら現在時刻）
     * @param rngSeed       シャッフル用シード（null なら非決定的）
     * @throws ScheduleValidationException 入力不備
     */
    public ScheduleResult schedule(List<ActivePeriod> activePeriods, List<TaskSpec> tasks,
                                   LocalDateTime horizonStart, Long rngSeed) {
        return schedule(new ScheduleCommand(activePeriods, tasks, horizonStart, rngSeed));
    }

    public ScheduleResult schedule(ScheduleCommand command) {
        long started = System.nanoTime();
        SlotSchedule schedule = prepareAndAllocate(command);

        if (settings.shuffleEnabled()) {
            new ShufflePhase(randomFor(command.rngSeed())).changeWorkingSchedule(schedule);
            schedule.verifyInvariants();
        }

        ScheduleResult result = schedule.toResult();
        logSummary(result, started);
        return result;
    }

    /**
     * 割当後、シャッフルを繰り返して goal のスコアが最も高い配置を返す。
     * どの試行も基準配置を上回らなければシャッフル前の配置を返す。
     */
    public ScheduleResult scheduleMaximizing(ScheduleCommand command, ToDoubleFunction<ScheduleResult> goal) {
        long started = System.nanoTime();
        SlotSchedule schedule = prepareAndAllocate(command);

        ShuffleMaximizer maximizer = new ShuffleMaximizer(settings.shuffleTimeLimit(), settings.shuffleMaxAttempts());
        ShuffleMaximizer.Outcome outcome = maximizer.maximize(schedule, goal, randomFor(command.rngSeed()));
        outcome.best().verifyInvariants();

        ScheduleResult result = outcome.best().toResult();
        log.info("Shuffle maximizing: attempts={}, score={}", outcome.attempts(), outcome.score());
        logSummary(result, started);
        return result;
    }

    /* ===================================================================== */
    /* Internal                                                              */
    /* ===================================================================== */

    /** 検証からトリアージまで（シャッフル前の状態） */
    SlotSchedule prepareAndAllocate(ScheduleCommand command) {
        validate(command);

        Duration slotLength = command.slotLength() != null ? command.slotLength() : settings.slotLength();
        LocalDateTime horizonStart = command.horizonStart() != null ? command.horizonStart() : LocalDateTime.now(clock);
        LocalDateTime horizonEnd = command.tasks().stream()
                .map(TaskSpec::due)
                .max(Comparator.naturalOrder())
                .orElseThrow();

        List<Slot> slots = SlotSlicer.slice(horizonStart, horizonEnd,
                command.activePeriods() == null ? List.of() : command.activePeriods(), slotLength,
                settings.breakPattern() == null ? BreakPattern.NONE : settings.breakPattern());
        if (slots.isEmpty()) {
            throw new ScheduleValidationException("No slots between " + horizonStart + " and " + horizonEnd
                    + " within the active periods");
        }

        List<PlanningTask> tasks = WorkingPeriodResolver.resolveAll(command.tasks(), slots, horizonStart);
        SlotSchedule schedule = new SlotSchedule(slots, tasks, settings.priorityPolicy());
        log.info("Schedule start: slots={}, tasks={}, emptyWindow={}, slotLength={}", slots.size(), tasks.size(),
                tasks.stream().filter(t -> !t.hasWorkingPeriod()).count(), slotLength);

        new ClaimPhase().changeWorkingSchedule(schedule);
        schedule.verifyInvariants();

        new TriagePhase().changeWorkingSchedule(schedule);
        schedule.verifyInvariants();
        return schedule;
    }

    private void validate(ScheduleCommand command) {
        if (command == null) {
            throw new ScheduleValidationException("command is required");
        }
        List<TaskSpec> tasks = command.tasks();
        if (tasks == null || tasks.isEmpty()) {
            throw new ScheduleValidationException("At least one task is required");
        }
        Set<String> ids = new HashSet<>();
        for (TaskSpec t : tasks) {
            if (t == null || t.id() == null || t.id().isBlank()) {
                throw new ScheduleValidationException("Task id is required");
            }
            if (!ids.add(t.id())) {
                throw new ScheduleValidationException("Duplicate task id: " + t.id());
            }
            if (t.durationSlots() <= 0) {
                throw new ScheduleValidationException("Task " + t.id() + " duration must be >= 1: " + t.durationSlots());
            }
            if (t.start() == null || t.due() == null) {
                throw new ScheduleValidationException("Task " + t.id() + " start and due are required");
            }
            if (t.due().isBefore(t.start())) {
                throw new ScheduleValidationException("Task " + t.id() + " due " + t.due() + " precedes start " + t.start());
            }
        }
        if (command.activePeriods() != null) {
            for (ActivePeriod p : command.activePeriods()) {
                if (p == null || p.isMalformed()) {
                    throw new ScheduleValidationException("Malformed active period: " + p);
                }
            }
        }
        Duration slotLength = command.slotLength();
        if (slotLength != null && (slotLength.isNegative() || slotLength.isZero())) {
            throw new ScheduleValidationException("Slot length must be positive: " + slotLength);
        }
    }

    private static Random randomFor(Long seed) {
        return seed == null ? new Random() : new Random(seed);
    }

    private void logSummary(ScheduleResult result, long startedNanos) {
        long satisfied = result.tasks().size() - result.unschedulableTaskIds().size();
        log.info("Schedule done: slots={}, tasks={}, satisfied={}, unschedulable={}, elapsed={}ms",
                result.slots().size(), result.tasks().size(), satisfied, result.unschedulableTaskIds().size(),
                (System.nanoTime() - startedNanos) / 1_000_000);
    }
}
