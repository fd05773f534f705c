package io.github.riemr.slot.optimization.entity;

public enum TaskStatus {
    UNSATISFIED,
    SATISFIED,
    /** 作業期間が空、またはトリアージ後も必要数に届かない */
    UNSCHEDULABLE
}
