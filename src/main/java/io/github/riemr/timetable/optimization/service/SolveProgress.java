package io.github.riemr.timetable.optimization.service;

/** 進捗通知 1 回分のスナップショット */
public record SolveProgress(int assignedCount, int totalCount, long iterations, long elapsedMillis) {

    public int percent() {
        if (totalCount <= 0) return 0;
        return (int) Math.min(100, Math.round(assignedCount * 100.0 / totalCount));
    }
}
