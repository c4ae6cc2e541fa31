package io.github.riemr.timetable.optimization.config;

/**
 * 連続コマの教室距離を評価する際、どの講義の教室を比較するか。
 * 既定は {@link #ANY_LECTURE_IN_SLOT}。これまでのスコアと一致するが、
 * セクション／講師で絞り込まずに教室を引くため、他セクションの教室と比較することがある。
 * 自身の講義どうしだけを比較したい場合は {@link #OWN_SESSIONS} を明示的に指定する。
 */
public enum RoomDistanceScope {
    /** 評価対象のセクション／講師自身の講義の教室を比較する（既定とはスコアが異なりうる） */
    OWN_SESSIONS,
    /**
     * 該当時限を使う任意の講義の教室を比較する（割当の走査順で最後に見つかったもの）。
     * セクション／講師で絞り込まない。
     */
    ANY_LECTURE_IN_SLOT;

    public static RoomDistanceScope fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return RoomDistanceScope.valueOf(code.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
