package io.github.riemr.timetable.optimization.solution;

public enum QualityRating {
    EXCELLENT(900),
    GOOD(800),
    FAIR(700),
    ACCEPTABLE(600),
    NEEDS_IMPROVEMENT(Double.NEGATIVE_INFINITY);

    private final double minScore;

    QualityRating(double minScore) {
        this.minScore = minScore;
    }

    public static QualityRating of(double score) {
        for (QualityRating r : values()) {
            if (score >= r.minScore) return r;
        }
        return NEEDS_IMPROVEMENT;
    }
}
