package io.github.riemr.timetable.optimization.entity;

import lombok.Value;

/** 割当値 (時限, 教室, 講師) */
@Value
public class LectureSlot {
    String timeslotId;
    String roomId;
    String instructorId;

    @Override
    public String toString() {
        return "(" + timeslotId + ", " + roomId + ", " + instructorId + ")";
    }
}
