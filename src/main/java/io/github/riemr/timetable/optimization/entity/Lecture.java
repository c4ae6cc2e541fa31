package io.github.riemr.timetable.optimization.entity;

import lombok.Value;

/**
 * CSP 変数。セクション・科目・週内の回数で一意となる 1 コマの講義。
 * 不変オブジェクトとしてそのままマップのキーに使う。
 */
@Value
public class Lecture {
    String sectionId;
    String courseId;
    int lectureNumber;

    /** ログ表示用の変数名 (例: S1_L1_AID312_L2) */
    public String variableName() {
        return sectionId + "_" + courseId + "_L" + lectureNumber;
    }

    @Override
    public String toString() {
        return variableName();
    }
}
