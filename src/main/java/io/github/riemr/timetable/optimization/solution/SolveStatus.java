package io.github.riemr.timetable.optimization.solution;

/**
 * 探索の状態。TIMED_OUT と EXHAUSTED はどちらも「解なし」として扱い、区別は診断用のみ。
 */
public enum SolveStatus {
    SOLVED,
    TIMED_OUT,
    EXHAUSTED;

    public boolean isSolved() {
        return this == SOLVED;
    }
}
