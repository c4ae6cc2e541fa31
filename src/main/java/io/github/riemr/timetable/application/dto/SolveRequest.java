package io.github.riemr.timetable.application.dto;

import io.github.riemr.timetable.domain.model.Course;
import io.github.riemr.timetable.domain.model.Instructor;
import io.github.riemr.timetable.domain.model.Room;
import io.github.riemr.timetable.domain.model.Section;
import io.github.riemr.timetable.domain.model.TimeSlot;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;
import java.util.Set;

/**
 * 求解リクエスト。マスタ一式（取込済み）と、任意の上書き設定を受け取る。
 * sectionIds が空の場合は全セクションを対象とする。
 */
public record SolveRequest(
    @NotNull List<Course> courses,
    @NotNull List<Instructor> instructors,
    @NotNull List<Room> rooms,
    @NotNull List<TimeSlot> timeslots,
    @NotNull List<Section> sections,
    List<String> sectionIds,
    @PositiveOrZero Long timeoutSeconds,
    Long seed,
    WeightOverrides weights,
    Set<String> earlySlots,
    Set<String> lateSlots,
    @PositiveOrZero Double roomDistanceThreshold,
    String roomDistanceScope,
    String balanceDays
) {
    public SolveRequest(List<Course> courses, List<Instructor> instructors, List<Room> rooms,
                        List<TimeSlot> timeslots, List<Section> sections, List<String> sectionIds,
                        Long timeoutSeconds, Long seed) {
        this(courses, instructors, rooms, timeslots, sections, sectionIds, timeoutSeconds, seed,
                null, null, null, null, null, null);
    }
}
