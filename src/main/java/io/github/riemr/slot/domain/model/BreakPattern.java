package io.github.riemr.slot.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * ポモドーロ式の休憩配置。作業スロットの後に短い休憩、breakInterval 個ごとに長い休憩を空ける。
 * 連続区間（日）の先頭でカウントは 0 に戻る。breakInterval が 0 なら休憩を入れない。
 */
public record BreakPattern(int breakInterval, Duration shortBreak, Duration longBreak) {

    public static final BreakPattern NONE = new BreakPattern(0, Duration.ZERO, Duration.ZERO);

    public BreakPattern {
        Objects.requireNonNull(shortBreak, "shortBreak");
        Objects.requireNonNull(longBreak, "longBreak");
        if (breakInterval < 0 || shortBreak.isNegative() || longBreak.isNegative()) {
            throw new IllegalArgumentException("Invalid break pattern: interval=" + breakInterval
                    + ", short=" + shortBreak + ", long=" + longBreak);
        }
    }

    public boolean isEnabled() {
        return breakInterval > 0;
    }

    /** slotsInRun 個目の作業スロットの直後に空ける時間 */
    public Duration gapAfter(int slotsInRun) {
        if (!isEnabled()) return Duration.ZERO;
        return slotsInRun % breakInterval == 0 ? longBreak : shortBreak;
    }
}
