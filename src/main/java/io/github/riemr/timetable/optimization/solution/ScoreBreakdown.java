package io.github.riemr.timetable.optimization.solution;

/**
 * 品質スコアの内訳。
 * score = base - gapPenalty + balanceBonus - timePreferencePenalty - roomDistancePenalty
 */
public record ScoreBreakdown(
    double base,
    double gapPenalty,
    double balanceBonus,
    double timePreferencePenalty,
    double roomDistancePenalty,
    double score,
    QualityRating rating
) {
    public static final double BASE_SCORE = 1000.0;

    public static ScoreBreakdown of(double gapPenalty, double balanceBonus,
                                    double timePreferencePenalty, double roomDistancePenalty) {
        double score = BASE_SCORE - gapPenalty + balanceBonus - timePreferencePenalty - roomDistancePenalty;
        return new ScoreBreakdown(BASE_SCORE, gapPenalty, balanceBonus, timePreferencePenalty,
                roomDistancePenalty, score, QualityRating.of(score));
    }
}
