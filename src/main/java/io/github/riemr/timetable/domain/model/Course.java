package io.github.riemr.timetable.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 科目マスタ（参照のみ）。
 * type は "Lecture" / "Lecture and Lab" のような表示ラベルをそのまま保持する。
 */
@Value
@Builder
@Jacksonized
public class Course {
    String id;
    String name;
    int credits;
    String type;

    /** 実習室が必要な科目か */
    public boolean requiresLab() {
        return type != null && type.contains("Lab");
    }

    public RoomType requiredRoomType() {
        return requiresLab() ? RoomType.LAB : RoomType.LECTURE;
    }
}
