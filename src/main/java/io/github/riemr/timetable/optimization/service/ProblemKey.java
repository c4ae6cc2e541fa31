package io.github.riemr.timetable.optimization.service;

import java.util.List;
import java.util.Objects;

/**
 * 非同期求解ジョブの識別子。対象セクション（ソート済み）とリクエスト内容のフィンガープリントで一意。
 */
public final class ProblemKey {
    private final List<String> sectionIds;
    private final int fingerprint;

    public ProblemKey(List<String> sectionIds, int fingerprint) {
        this.sectionIds = sectionIds == null ? List.of() : sectionIds.stream().sorted().toList();
        this.fingerprint = fingerprint;
    }

    public List<String> getSectionIds() { return sectionIds; }
    public int getFingerprint() { return fingerprint; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProblemKey that = (ProblemKey) o;
        return fingerprint == that.fingerprint &&
               Objects.equals(sectionIds, that.sectionIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sectionIds, fingerprint);
    }

    @Override
    public String toString() {
        return (sectionIds.isEmpty() ? "ALL" : String.join(",", sectionIds)) + "#" + Integer.toHexString(fingerprint);
    }
}
