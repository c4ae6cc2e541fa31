package io.github.riemr.timetable.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * 講師マスタ（参照のみ）。
 * 担当可能科目と、任意で 1 曜日だけの不可曜日を持つ。
 */
@Value
@Builder
@Jacksonized
public class Instructor {
    String id;
    String name;
    String role;
    /** null の場合は全曜日勤務可 */
    DayOfWeek unavailableDay;
    @Singular(ignoreNullCollections = true)
    Set<String> qualifiedCourses;

    public boolean canTeach(String courseId) {
        return courseId != null && qualifiedCourses.contains(courseId);
    }

    public boolean isAvailableOn(DayOfWeek day) {
        return unavailableDay == null || unavailableDay != day;
    }
}
