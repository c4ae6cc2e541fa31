package io.github.riemr.timetable.optimization.config;

/**
 * 週内バランスの標準偏差をどの曜日について取るか。
 */
public enum BalanceDays {
    /** セクションに授業がある曜日のみ（既定） */
    SCHEDULED_DAYS,
    /** 時限マスタの全曜日。授業のない曜日は 0 コマとして数える */
    WHOLE_WEEK;

    public static BalanceDays fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return BalanceDays.valueOf(code.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
