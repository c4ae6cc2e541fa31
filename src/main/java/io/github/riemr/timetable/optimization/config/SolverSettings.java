package io.github.riemr.timetable.optimization.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/** 探索の既定設定（timetable.solver.*） */
@Value
@Builder(toBuilder = true)
public class SolverSettings {
    /** リクエストで指定できる探索時間の上限 */
    public static final Duration MAX_TIMEOUT = Duration.ofDays(7);

    @Builder.Default Duration timeout = Duration.ofSeconds(300);
    /** 進捗通知の間隔（判断ステップ数） */
    @Builder.Default int progressInterval = 100;
    /** null の場合は毎回ランダム */
    Long seed;
    /** 非同期ジョブの結果を終了後に保持する期間 */
    @Builder.Default Duration resultRetention = Duration.ofMinutes(30);
}
