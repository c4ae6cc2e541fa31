package io.github.riemr.timetable.application.dto;

public record SolveStatusDto(
    String status,
    int progress,
    long expectedFinishMillis,
    String phase,
    int assignedCount,
    int totalCount,
    long iterations
) {
    public SolveStatusDto(String status, int progress, long expectedFinishMillis, String phase) {
        this(status, progress, expectedFinishMillis, phase, 0, 0, 0L);
    }

    public static SolveStatusDto unknown() {
        return new SolveStatusDto("UNKNOWN", 0, 0, "未開始");
    }
}
