package io.github.riemr.timetable.optimization.solution;

import io.github.riemr.timetable.domain.model.ReferenceData;
import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 1 回の求解リクエスト分の CSP 問題。
 * 変数（講義）とそのドメインは構築後に変更されず、探索は参照のみ行う。
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class TimetableProblem {

    /** 変数（構築順を保持。MRV の同点時はこの順で先勝ち） */
    @ToString.Include
    private final List<Lecture> lectures;

    /** 講義ごとの候補値（挿入順） */
    private final Map<Lecture, List<LectureSlot>> domains;

    private final ReferenceData referenceData;

    /** 構築時の警告（科目不明・担当講師なし等） */
    @ToString.Include
    private final List<String> diagnostics;

    public TimetableProblem(List<Lecture> lectures,
                            Map<Lecture, List<LectureSlot>> domains,
                            ReferenceData referenceData,
                            List<String> diagnostics) {
        this.lectures = List.copyOf(lectures);
        Map<Lecture, List<LectureSlot>> copy = new LinkedHashMap<>();
        for (Lecture lecture : this.lectures) {
            copy.put(lecture, List.copyOf(domains.getOrDefault(lecture, List.of())));
        }
        this.domains = Collections.unmodifiableMap(copy);
        this.referenceData = referenceData;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<LectureSlot> domainOf(Lecture lecture) {
        return domains.getOrDefault(lecture, List.of());
    }

    public int variableCount() {
        return lectures.size();
    }

    /** ドメインが空の講義（最初の 1 件） */
    public Optional<Lecture> firstEmptyDomain() {
        return lectures.stream().filter(l -> domainOf(l).isEmpty()).findFirst();
    }
}
