package io.github.riemr.timetable.optimization.entity;

import lombok.Value;

import java.util.List;

/**
 * ハード制約違反 1 件。key は衝突した資源と時限 (例: PROF01@TS3)。
 */
@Value
public class Conflict {
    ConflictKind kind;
    String key;
    List<Lecture> lectures;

    public String describe() {
        return kind.getLabel() + " conflict at " + key + ": " + lectures;
    }
}
