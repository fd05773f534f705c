package io.github.riemr.slot.optimization.solution;

import io.github.riemr.slot.domain.SlotInvariantViolationException;
import io.github.riemr.slot.domain.model.ScheduleResult;
import io.github.riemr.slot.domain.model.SlotAssignment;
import io.github.riemr.slot.domain.model.TaskOutcome;
import io.github.riemr.slot.optimization.entity.PlanningTask;
import io.github.riemr.slot.optimization.entity.PriorityPolicy;
import io.github.riemr.slot.optimization.entity.Slot;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1 回のスケジューリング実行の作業状態（スロット占有とタスク毎の確保数）。
 * 各フェーズはこのオブジェクトだけを書き換え、実行終了とともに破棄される。
 * 占有の変更は必ず claim / capture / swap を通し、確保数と占有の整合を保つ。
 */
@Getter
public class SlotSchedule {

    private final List<Slot> slotList;
    private final Map<String, PlanningTask> taskMap;
    private final PriorityPolicy priorityPolicy;

    public SlotSchedule(List<Slot> slotList, List<PlanningTask> taskList, PriorityPolicy priorityPolicy) {
        this.slotList = slotList;
        this.taskMap = new LinkedHashMap<>();
        for (PlanningTask t : taskList) {
            if (taskMap.putIfAbsent(t.getId(), t) != null) {
                throw new SlotInvariantViolationException("Duplicate task id " + t.getId());
            }
        }
        this.priorityPolicy = priorityPolicy;
    }

    public List<PlanningTask> getTaskList() {
        return List.copyOf(taskMap.values());
    }

    public int getSlotCount() {
        return slotList.size();
    }

    public PlanningTask task(String id) {
        PlanningTask t = taskMap.get(id);
        if (t == null) {
            throw new SlotInvariantViolationException("Unknown task id " + id);
        }
        return t;
    }

    /** 指定スロットの占有タスク。空きなら null */
    public PlanningTask occupantOf(int slotIndex) {
        String id = slotList.get(slotIndex).getAssignedTaskId();
        return id == null ? null : task(id);
    }

    /** priority の方が other より優先されるか（同値は false） */
    public boolean isMoreFavored(PlanningTask task, PlanningTask other) {
        return priorityPolicy.isMoreFavored(task.getPriority(), other.getPriority());
    }

    /** 優先度の低い（譲る側の）タスクから順。同順位は ID 順 */
    public Comparator<PlanningTask> leastFavoredFirst() {
        return Comparator.comparing(PlanningTask::getPriority, priorityPolicy.precedence())
                .thenComparing(PlanningTask::getId);
    }

    /** 空きスロットを取得する。既に埋まっているスロットへの claim は不変条件違反。 */
    public void claim(int slotIndex, PlanningTask task) {
        Slot slot = slotList.get(slotIndex);
        if (!slot.isEmpty()) {
            throw new SlotInvariantViolationException("Slot " + slotIndex + " already held by " + slot.getAssignedTaskId()
                    + ", cannot claim for " + task.getId());
        }
        requireInWorkingPeriod(task, slotIndex);
        task.claimOne();
        slot.setAssignedTaskId(task.getId());
    }

    /**
     * スロットを奪取する。空き、または task より優先度が厳密に低いタスクの保持スロットのみ対象。
     *
     * @return 追い出したタスク（空きスロットだった場合は null）
     */
    public PlanningTask capture(int slotIndex, PlanningTask task) {
        PlanningTask occupant = occupantOf(slotIndex);
        if (occupant == null) {
            claim(slotIndex, task);
            return null;
        }
        if (occupant == task || !isMoreFavored(task, occupant)) {
            throw new SlotInvariantViolationException("Task " + task.getId() + " may not capture slot " + slotIndex
                    + " from " + occupant.getId());
        }
        requireInWorkingPeriod(task, slotIndex);
        occupant.releaseOne();
        slotList.get(slotIndex).setAssignedTaskId(null);
        claim(slotIndex, task);
        return occupant;
    }

    /** 2 スロットの中身を入れ替える。どちらの占有者も自身の作業期間内に留まる必要がある。 */
    public void swap(int left, int right) {
        PlanningTask l = occupantOf(left);
        PlanningTask r = occupantOf(right);
        if (l != null) requireInWorkingPeriod(l, right);
        if (r != null) requireInWorkingPeriod(r, left);
        Slot ls = slotList.get(left);
        Slot rs = slotList.get(right);
        String tmp = ls.getAssignedTaskId();
        ls.setAssignedTaskId(rs.getAssignedTaskId());
        rs.setAssignedTaskId(tmp);
    }

    /** 必要数に届いていない、作業期間を持つタスク（入力順） */
    public List<PlanningTask> tasksBelowDuration() {
        return taskMap.values().stream()
                .filter(PlanningTask::hasWorkingPeriod)
                .filter(t -> !t.isSatisfied())
                .toList();
    }

    public List<Integer> slotIndicesOf(String taskId) {
        List<Integer> res = new ArrayList<>();
        for (Slot s : slotList) {
            if (taskId.equals(s.getAssignedTaskId())) res.add(s.getIndex());
        }
        return res;
    }

    public int occupiedSlotCount() {
        return (int) slotList.stream().filter(s -> !s.isEmpty()).count();
    }

    public Map<String, Integer> claimedCounts() {
        Map<String, Integer> res = new LinkedHashMap<>();
        taskMap.values().forEach(t -> res.put(t.getId(), t.getClaimedSlots()));
        return res;
    }

    /**
     * 二重割当なし・作業期間内・確保数の整合を検査する。違反は修正せず例外とする。
     */
    public void verifyInvariants() {
        Map<String, Integer> held = new HashMap<>();
        for (Slot s : slotList) {
            if (s.isEmpty()) continue;
            PlanningTask t = task(s.getAssignedTaskId());
            requireInWorkingPeriod(t, s.getIndex());
            held.merge(t.getId(), 1, Integer::sum);
        }
        for (PlanningTask t : taskMap.values()) {
            int h = held.getOrDefault(t.getId(), 0);
            if (h != t.getClaimedSlots()) {
                throw new SlotInvariantViolationException("Task " + t.getId() + " holds " + h + " slots but counts "
                        + t.getClaimedSlots());
            }
            if (t.getClaimedSlots() > t.getDuration()) {
                throw new SlotInvariantViolationException("Task " + t.getId() + " exceeds its duration");
            }
        }
    }

    public SlotSchedule copy() {
        List<Slot> slots = slotList.stream().map(Slot::copy).toList();
        List<PlanningTask> tasks = taskMap.values().stream().map(PlanningTask::copy).toList();
        return new SlotSchedule(slots, tasks, priorityPolicy);
    }

    public ScheduleResult toResult() {
        List<SlotAssignment> slots = slotList.stream()
                .map(s -> new SlotAssignment(s.getIndex(), s.getStart(), s.getEnd(), s.getAssignedTaskId()))
                .toList();
        List<TaskOutcome> outcomes = taskMap.values().stream()
                .map(t -> new TaskOutcome(t.getId(), t.getStatus(), t.getDuration(), t.getClaimedSlots(),
                        t.getShortfall(), slotIndicesOf(t.getId())))
                .toList();
        return new ScheduleResult(slots, outcomes);
    }

    private static void requireInWorkingPeriod(PlanningTask task, int slotIndex) {
        if (!task.inWorkingPeriod(slotIndex)) {
            throw new SlotInvariantViolationException("Slot " + slotIndex + " is outside the working period of " + task.getId());
        }
    }
}
