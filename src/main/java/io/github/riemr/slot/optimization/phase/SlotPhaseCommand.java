package io.github.riemr.slot.optimization.phase;

import io.github.riemr.slot.optimization.solution.SlotSchedule;

/**
 * スケジュールの作業状態を書き換える 1 フェーズ。フェーズは状態を持たず、前フェーズの完了後に順に実行される。
 */
public interface SlotPhaseCommand {

    void changeWorkingSchedule(SlotSchedule schedule);
}
