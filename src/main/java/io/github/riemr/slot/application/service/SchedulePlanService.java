package io.github.riemr.slot.application.service;

import io.github.riemr.slot.application.dto.ActivePeriodRequest;
import io.github.riemr.slot.application.dto.ScheduleRequest;
import io.github.riemr.slot.application.dto.ScheduleResponse;
import io.github.riemr.slot.application.dto.SlotView;
import io.github.riemr.slot.application.dto.TaskRequest;
import io.github.riemr.slot.application.dto.TaskStatusView;
import io.github.riemr.slot.config.SlotPlannerSettings;
import io.github.riemr.slot.domain.ScheduleValidationException;
import io.github.riemr.slot.domain.model.ActivePeriod;
import io.github.riemr.slot.domain.model.ScheduleCommand;
import io.github.riemr.slot.domain.model.ScheduleResult;
import io.github.riemr.slot.domain.model.TaskSpec;
import io.github.riemr.slot.optimization.service.SlotScheduleService;
import io.github.riemr.slot.optimization.util.SlotSlicer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * REST リクエストとスケジューリング本体の橋渡し。
 */
@Service
public class SchedulePlanService {
    private final SlotScheduleService slotScheduleService;
    private final SlotPlannerSettings settings;

    public SchedulePlanService(SlotScheduleService slotScheduleService, SlotPlannerSettings settings) {
        this.slotScheduleService = slotScheduleService;
        this.settings = settings;
    }

    public ScheduleResponse plan(ScheduleRequest req) {
        ScheduleResult result = slotScheduleService.schedule(toCommand(req));
        return toResponse(result);
    }

    ScheduleCommand toCommand(ScheduleRequest req) {
        Duration slotLength = Optional.ofNullable(req.getSlotLength()).orElse(settings.slotLength());
        List<ActivePeriod> periods = Optional.ofNullable(req.getActivePeriods()).orElse(List.of()).stream()
                .map(this::toPeriod)
                .toList();
        List<TaskSpec> tasks = Optional.ofNullable(req.getTasks()).orElse(List.of()).stream()
                .map(t -> toSpec(t, slotLength))
                .toList();
        return new ScheduleCommand(periods, tasks, req.getHorizonStart(), req.getRngSeed(), slotLength);
    }

    private ActivePeriod toPeriod(ActivePeriodRequest p) {
        if (p == null) {
            throw new ScheduleValidationException("Active period entry must not be null");
        }
        return new ActivePeriod(p.getStart(), p.getEnd());
    }

    private TaskSpec toSpec(TaskRequest t, Duration slotLength) {
        if (t == null) {
            throw new ScheduleValidationException("Task entry must not be null");
        }
        int duration;
        if (t.getDurationSlots() != null) {
            duration = t.getDurationSlots();
        } else if (t.getEstimatedLength() != null) {
            Duration worked = Optional.ofNullable(t.getWorkedLength()).orElse(Duration.ZERO);
            try {
                duration = SlotSlicer.slotsRequired(t.getEstimatedLength().minus(worked), slotLength);
            } catch (ArithmeticException e) {
                throw new ScheduleValidationException("Task " + t.getId() + ": estimatedLength out of range");
            }
        } else {
            throw new ScheduleValidationException("Task " + t.getId() + ": durationSlots or estimatedLength is required");
        }
        int priority = Optional.ofNullable(t.getPriority()).orElse(0);
        return new TaskSpec(t.getId(), duration, t.getStart(), t.getDue(), priority);
    }

    private ScheduleResponse toResponse(ScheduleResult result) {
        List<SlotView> slots = result.slots().stream()
                .map(s -> new SlotView(s.index(), s.start(), s.end(), s.taskId()))
                .toList();
        List<TaskStatusView> tasks = result.tasks().stream()
                .map(t -> new TaskStatusView(t.taskId(), t.status().name(), t.requiredSlots(), t.claimedSlots(),
                        t.shortfall(), t.slotIndices()))
                .toList();
        return new ScheduleResponse(slots, tasks, result.unschedulableTaskIds());
    }
}
