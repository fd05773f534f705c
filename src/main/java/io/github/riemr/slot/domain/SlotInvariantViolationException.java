package io.github.riemr.slot.domain;

/**
 * 実装バグを示す不変条件違反（二重割当、作業期間外の保持など）。回復せずに呼び出し元へ伝播させる。
 */
public class SlotInvariantViolationException extends IllegalStateException {

    public SlotInvariantViolationException(String message) {
        super(message);
    }
}
