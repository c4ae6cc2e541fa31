package io.github.riemr.timetable.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/** 教室種別。JSON では "Lecture" / "Lab" を大文字小文字を問わず受け付ける */
public enum RoomType {
    LECTURE,
    LAB;

    @JsonCreator
    public static RoomType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return RoomType.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
