package io.github.riemr.timetable.optimization.entity;

/** ハード制約の種別 */
public enum ConflictKind {
    /** 同一講師が同一時限に複数コマ */
    INSTRUCTOR("Instructor"),
    /** 同一教室が同一時限に複数コマ */
    ROOM("Room"),
    /** 同一セクションが同一時限に複数コマ */
    SECTION("Section");

    private final String label;

    ConflictKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
