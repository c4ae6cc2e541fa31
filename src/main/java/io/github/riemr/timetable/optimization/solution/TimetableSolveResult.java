package io.github.riemr.timetable.optimization.solution;

import io.github.riemr.timetable.optimization.entity.Conflict;

import java.util.List;

/**
 * 1 回の求解の最終結果。score / statistics は SOLVED の場合のみ設定される。
 */
public record TimetableSolveResult(
    TimetableProblem problem,
    SolveOutcome outcome,
    ScoreBreakdown score,
    SolutionStatistics statistics,
    List<Conflict> conflicts
) {
    public SolveStatus status() {
        return outcome.status();
    }

    public boolean isSolved() {
        return outcome.isSolved();
    }
}
