package io.github.riemr.timetable.application.dto;

import io.github.riemr.timetable.domain.model.Course;
import io.github.riemr.timetable.domain.model.Instructor;
import io.github.riemr.timetable.domain.model.ReferenceData;
import io.github.riemr.timetable.domain.model.TimeSlot;
import io.github.riemr.timetable.optimization.entity.Conflict;
import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;
import io.github.riemr.timetable.optimization.solution.ProblemSummary;
import io.github.riemr.timetable.optimization.solution.ScoreBreakdown;
import io.github.riemr.timetable.optimization.solution.SolutionStatistics;
import io.github.riemr.timetable.optimization.solution.TimetableSolveResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 求解結果のレスポンス。並び順は割当順のまま（表示用の整列は呼び出し側で行う）。
 */
public record TimetableResultDto(
    String status,
    long iterations,
    long elapsedMillis,
    int bestPartialSize,
    int totalLectures,
    ProblemSummary summary,
    List<LectureAssignmentDto> assignments,
    ScoreBreakdown score,
    SolutionStatistics statistics,
    List<String> conflicts,
    List<String> diagnostics
) {
    public static TimetableResultDto from(TimetableSolveResult result) {
        ReferenceData ref = result.problem().getReferenceData();
        List<LectureAssignmentDto> rows = new ArrayList<>();
        for (Map.Entry<Lecture, LectureSlot> e : result.outcome().assignment().entrySet()) {
            Lecture lecture = e.getKey();
            LectureSlot slot = e.getValue();
            TimeSlot ts = ref.findTimeslot(slot.getTimeslotId()).orElse(null);
            rows.add(new LectureAssignmentDto(
                    lecture.getSectionId(),
                    lecture.getCourseId(),
                    ref.findCourse(lecture.getCourseId()).map(Course::getName).orElse(null),
                    lecture.getLectureNumber(),
                    slot.getTimeslotId(),
                    ts == null ? null : ts.getDay(),
                    ts == null ? null : ts.getStartTime(),
                    ts == null ? null : ts.getEndTime(),
                    slot.getRoomId(),
                    slot.getInstructorId(),
                    ref.findInstructor(slot.getInstructorId()).map(Instructor::getName).orElse(null)));
        }
        return new TimetableResultDto(
                result.status().name(),
                result.outcome().iterations(),
                result.outcome().elapsed().toMillis(),
                result.outcome().bestPartialSize(),
                result.outcome().totalVariables(),
                ProblemSummary.of(result.problem()),
                rows,
                result.score(),
                result.statistics(),
                result.conflicts().stream().map(Conflict::describe).toList(),
                result.problem().getDiagnostics());
    }
}
