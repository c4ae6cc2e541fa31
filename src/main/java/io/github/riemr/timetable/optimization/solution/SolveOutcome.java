package io.github.riemr.timetable.optimization.solution;

import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;

import java.time.Duration;
import java.util.Map;

/**
 * 探索結果。SOLVED の場合のみ assignment に全変数の割当が入る。
 * 失敗時は到達した最大の部分割当サイズを bestPartialSize で返す。
 */
public record SolveOutcome(
    SolveStatus status,
    Map<Lecture, LectureSlot> assignment,
    long iterations,
    Duration elapsed,
    int bestPartialSize,
    int totalVariables
) {
    public boolean isSolved() {
        return status.isSolved();
    }

    public static SolveOutcome failed(SolveStatus status, long iterations, Duration elapsed,
                                      int bestPartialSize, int totalVariables) {
        return new SolveOutcome(status, Map.of(), iterations, elapsed, bestPartialSize, totalVariables);
    }
}
