package io.github.riemr.timetable.application.dto;

import java.time.DayOfWeek;
import java.time.LocalTime;

/** 割当 1 件の表示用行。名称はマスタから補完し、見つからない場合は null */
public record LectureAssignmentDto(
    String sectionId,
    String courseId,
    String courseName,
    int lectureNumber,
    String timeslotId,
    DayOfWeek day,
    LocalTime startTime,
    LocalTime endTime,
    String roomId,
    String instructorId,
    String instructorName
) {
}
