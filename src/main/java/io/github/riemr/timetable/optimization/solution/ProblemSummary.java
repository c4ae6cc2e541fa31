package io.github.riemr.timetable.optimization.solution;

import io.github.riemr.timetable.optimization.entity.Lecture;

import java.util.IntSummaryStatistics;
import java.util.Map;
import java.util.TreeMap;

/** 問題規模の概要（ログ出力・診断用） */
public record ProblemSummary(
    int variableCount,
    int domainCount,
    int minDomainSize,
    int maxDomainSize,
    double averageDomainSize,
    Map<String, Integer> lecturesPerSection
) {
    public static ProblemSummary of(TimetableProblem problem) {
        IntSummaryStatistics stats = problem.getDomains().values().stream()
                .mapToInt(java.util.List::size)
                .summaryStatistics();
        Map<String, Integer> perSection = new TreeMap<>();
        for (Lecture lecture : problem.getLectures()) {
            perSection.merge(lecture.getSectionId(), 1, Integer::sum);
        }
        boolean empty = stats.getCount() == 0;
        return new ProblemSummary(
                problem.variableCount(),
                problem.getDomains().size(),
                empty ? 0 : stats.getMin(),
                empty ? 0 : stats.getMax(),
                stats.getAverage(),
                perSection);
    }
}
