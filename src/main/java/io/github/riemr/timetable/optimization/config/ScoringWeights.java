package io.github.riemr.timetable.optimization.config;

import io.github.riemr.timetable.domain.InvalidProblemException;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * ソフト制約の重みと閾値。既定値は application.yml（timetable.scoring.*）から、
 * リクエストごとの上書きは {@link #toBuilder()} で行う。
 */
@Value
@Builder(toBuilder = true)
public class ScoringWeights {
    @Builder.Default double gapWeight = 10;
    @Builder.Default double balanceWeight = 5;
    @Builder.Default double earlyWeight = 3;
    @Builder.Default double lateWeight = 3;
    @Builder.Default double roomDistanceWeight = 8;
    @Builder.Default double roomDistanceThreshold = 2;
    @Builder.Default Set<String> earlySlots = Set.of("TS0", "TS4", "TS8", "TS12", "TS16");
    @Builder.Default Set<String> lateSlots = Set.of("TS3", "TS7", "TS11", "TS15", "TS19");
    @Builder.Default RoomDistanceScope roomDistanceScope = RoomDistanceScope.ANY_LECTURE_IN_SLOT;
    @Builder.Default BalanceDays balanceDays = BalanceDays.SCHEDULED_DAYS;

    public static ScoringWeights defaults() {
        return ScoringWeights.builder().build();
    }

    /** 負の重みや NaN を拒否する */
    public ScoringWeights validate() {
        check("gap", gapWeight);
        check("balance", balanceWeight);
        check("early", earlyWeight);
        check("late", lateWeight);
        check("roomDistance", roomDistanceWeight);
        check("roomDistanceThreshold", roomDistanceThreshold);
        if (earlySlots == null || lateSlots == null || roomDistanceScope == null || balanceDays == null) {
            throw new InvalidProblemException("scoring configuration is incomplete");
        }
        return this;
    }

    private static void check(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new InvalidProblemException("weight " + name + " must be a non-negative number: " + value);
        }
    }
}
