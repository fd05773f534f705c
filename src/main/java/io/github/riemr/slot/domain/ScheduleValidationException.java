package io.github.riemr.slot.domain;

/**
 * 呼び出し側の入力不備。スケジューリング計算の開始前に送出され、部分的な結果は返さない。
 */
public class ScheduleValidationException extends IllegalArgumentException {

    public ScheduleValidationException(String message) {
        super(message);
    }
}
