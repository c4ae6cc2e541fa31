package io.github.riemr.timetable.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/** 学生セクション。履修科目は登録順を保持する。 */
@Value
@Builder
@Jacksonized
public class Section {
    String id;
    int studentCount;
    @Singular(ignoreNullCollections = true)
    List<String> courseIds;
}
