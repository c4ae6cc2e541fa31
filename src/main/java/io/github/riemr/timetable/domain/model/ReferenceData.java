package io.github.riemr.timetable.domain.model;

import io.github.riemr.timetable.domain.InvalidProblemException;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 取込済みマスタの参照テーブル。ID をキーにした読み取り専用ビューを提供する。
 * 生成後は変更されないため、複数の求解ジョブから共有してよい。
 */
public final class ReferenceData {

    private final Map<String, Course> courses;
    private final Map<String, Instructor> instructors;
    private final Map<String, Room> rooms;
    private final Map<String, TimeSlot> timeslots;
    private final Map<String, Section> sections;
    private final Map<DayOfWeek, List<TimeSlot>> timeslotsByDay;

    private ReferenceData(List<Course> courses,
                          List<Instructor> instructors,
                          List<Room> rooms,
                          List<TimeSlot> timeslots,
                          List<Section> sections) {
        this.courses = index("course", courses, Course::getId);
        this.instructors = index("instructor", instructors, Instructor::getId);
        this.rooms = index("room", rooms, Room::getId);
        this.timeslots = index("timeslot", timeslots, TimeSlot::getId);
        this.sections = index("section", sections, Section::getId);

        Map<DayOfWeek, List<TimeSlot>> byDay = new LinkedHashMap<>();
        for (TimeSlot ts : this.timeslots.values()) {
            if (ts.getDay() == null) {
                throw new InvalidProblemException("timeslot " + ts.getId() + " has no day");
            }
            byDay.computeIfAbsent(ts.getDay(), d -> new ArrayList<>()).add(ts);
        }
        Map<DayOfWeek, List<TimeSlot>> frozen = new LinkedHashMap<>();
        byDay.forEach((day, list) -> {
            list.sort(Comparator.comparingInt(TimeSlot::getPosition));
            frozen.put(day, List.copyOf(list));
        });
        this.timeslotsByDay = Collections.unmodifiableMap(frozen);
    }

    public static ReferenceData of(List<Course> courses,
                                   List<Instructor> instructors,
                                   List<Room> rooms,
                                   List<TimeSlot> timeslots,
                                   List<Section> sections) {
        return new ReferenceData(courses, instructors, rooms, timeslots, sections);
    }

    private static <T> Map<String, T> index(String label, List<T> rows, Function<T, String> idOf) {
        if (rows == null) {
            throw new InvalidProblemException(label + " table is missing");
        }
        Map<String, T> map = new LinkedHashMap<>();
        for (T row : rows) {
            if (row == null) continue;
            String id = idOf.apply(row);
            if (id == null || id.isBlank()) {
                throw new InvalidProblemException(label + " without id");
            }
            if (map.putIfAbsent(id, row) != null) {
                throw new InvalidProblemException("duplicate " + label + " id: " + id);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    public Optional<Course> findCourse(String courseId) {
        return Optional.ofNullable(courses.get(courseId));
    }

    public Optional<Section> findSection(String sectionId) {
        return Optional.ofNullable(sections.get(sectionId));
    }

    public Optional<TimeSlot> findTimeslot(String timeslotId) {
        return Optional.ofNullable(timeslots.get(timeslotId));
    }

    public Optional<Instructor> findInstructor(String instructorId) {
        return Optional.ofNullable(instructors.get(instructorId));
    }

    public Optional<Room> findRoom(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    /** 担当可能な講師（マスタ登録順） */
    public List<Instructor> qualifiedInstructors(String courseId) {
        return instructors.values().stream().filter(i -> i.canTeach(courseId)).toList();
    }

    /** 指定種別の教室（マスタ登録順） */
    public List<Room> roomsOfType(RoomType type) {
        return rooms.values().stream().filter(r -> r.getType() == type).toList();
    }

    /** 全時限（マスタ登録順） */
    public List<TimeSlot> timeslots() {
        return List.copyOf(timeslots.values());
    }

    /** 曜日内の時限を position 昇順で返す */
    public List<TimeSlot> timeslotsOn(DayOfWeek day) {
        return timeslotsByDay.getOrDefault(day, List.of());
    }

    /** 週を構成する曜日（時限マスタの初出順） */
    public List<DayOfWeek> weekdays() {
        return List.copyOf(timeslotsByDay.keySet());
    }

    public List<Section> sections() {
        return List.copyOf(sections.values());
    }

    public int courseCount() {
        return courses.size();
    }
}
