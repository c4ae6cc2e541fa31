package io.github.riemr.timetable.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * 時限マスタ（参照のみ）。position は同一曜日内での並び順。
 */
@Value
@Builder
@Jacksonized
public class TimeSlot {
    String id;
    DayOfWeek day;
    int position;
    LocalTime startTime;
    LocalTime endTime;

    @Override
    public String toString() {
        return day + " " + startTime + "-" + endTime;
    }
}
