package io.github.riemr.slot.optimization.entity;

import io.github.riemr.slot.domain.SlotInvariantViolationException;
import io.github.riemr.slot.domain.model.TaskSpec;
import lombok.Getter;
import lombok.ToString;

import java.util.BitSet;
import java.util.List;

/**
 * 1 回の実行中だけ使う作業用タスク。呼び出し側の TaskSpec は変更しない。
 * claimedSlots は常に 0..duration に収まり、duration に達した時点で SATISFIED になる。
 */
@Getter
@ToString(exclude = "workingPeriodMask")
public class PlanningTask {

    private final TaskSpec spec;
    /** 利用可能なスロット index（昇順） */
    private final List<Integer> workingPeriod;
    private final BitSet workingPeriodMask;

    private int claimedSlots;
    private TaskStatus status;

    public PlanningTask(TaskSpec spec, List<Integer> workingPeriod) {
        this.spec = spec;
        this.workingPeriod = List.copyOf(workingPeriod);
        this.workingPeriodMask = new BitSet();
        workingPeriod.forEach(workingPeriodMask::set);
        this.claimedSlots = 0;
        this.status = workingPeriod.isEmpty() ? TaskStatus.UNSCHEDULABLE : TaskStatus.UNSATISFIED;
    }

    private PlanningTask(PlanningTask other) {
        this.spec = other.spec;
        this.workingPeriod = other.workingPeriod;
        this.workingPeriodMask = (BitSet) other.workingPeriodMask.clone();
        this.claimedSlots = other.claimedSlots;
        this.status = other.status;
    }

    public String getId() {
        return spec.id();
    }

    public int getDuration() {
        return spec.durationSlots();
    }

    public int getPriority() {
        return spec.priority();
    }

    public int getWorkingPeriodLength() {
        return workingPeriod.size();
    }

    public boolean hasWorkingPeriod() {
        return !workingPeriod.isEmpty();
    }

    public boolean inWorkingPeriod(int slotIndex) {
        return slotIndex >= 0 && workingPeriodMask.get(slotIndex);
    }

    public boolean isSatisfied() {
        return claimedSlots == getDuration();
    }

    public int getShortfall() {
        return getDuration() - claimedSlots;
    }

    public void claimOne() {
        if (claimedSlots >= getDuration()) {
            throw new SlotInvariantViolationException("Task " + getId() + " already holds " + claimedSlots + " of " + getDuration());
        }
        claimedSlots++;
        if (isSatisfied()) {
            status = TaskStatus.SATISFIED;
        }
    }

    public void releaseOne() {
        if (claimedSlots <= 0) {
            throw new SlotInvariantViolationException("Task " + getId() + " holds no slot to release");
        }
        claimedSlots--;
        status = TaskStatus.UNSATISFIED;
    }

    public void markUnschedulable() {
        if (isSatisfied()) {
            throw new SlotInvariantViolationException("Satisfied task " + getId() + " cannot be unschedulable");
        }
        status = TaskStatus.UNSCHEDULABLE;
    }

    public PlanningTask copy() {
        return new PlanningTask(this);
    }
}
