package io.github.riemr.slot.optimization.entity;

import java.util.Comparator;

/**
 * priority 値のどちらを優先するかの取り決め。
 * {@link #precedence()} は優先度の低い（譲る側の）値から順に並ぶ Comparator を返す。
 */
public enum PriorityPolicy {
    /** 1 が最優先（数値が小さいほど優先） */
    LOWER_VALUE_FIRST,
    /** 数値が大きいほど優先 */
    HIGHER_VALUE_FIRST;

    public Comparator<Integer> precedence() {
        return this == LOWER_VALUE_FIRST ? Comparator.<Integer>reverseOrder() : Comparator.<Integer>naturalOrder();
    }

    public boolean isMoreFavored(int priority, int other) {
        return precedence().compare(priority, other) > 0;
    }

    public static PriorityPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("priority policy is blank");
        }
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
