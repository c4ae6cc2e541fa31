package io.github.riemr.timetable.optimization.solution;

import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;

import java.util.Map;
import java.util.TreeMap;

/** 解の利用状況（時限・講師・教室ごとのコマ数） */
public record SolutionStatistics(
    int totalAssigned,
    Map<String, Integer> timeslotUsage,
    Map<String, Integer> instructorLoad,
    Map<String, Integer> roomUsage
) {
    public static SolutionStatistics of(Map<Lecture, LectureSlot> assignment) {
        Map<String, Integer> timeslots = new TreeMap<>();
        Map<String, Integer> instructors = new TreeMap<>();
        Map<String, Integer> rooms = new TreeMap<>();
        for (LectureSlot slot : assignment.values()) {
            timeslots.merge(slot.getTimeslotId(), 1, Integer::sum);
            instructors.merge(slot.getInstructorId(), 1, Integer::sum);
            rooms.merge(slot.getRoomId(), 1, Integer::sum);
        }
        return new SolutionStatistics(assignment.size(), timeslots, instructors, rooms);
    }
}
