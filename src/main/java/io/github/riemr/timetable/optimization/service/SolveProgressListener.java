package io.github.riemr.timetable.optimization.service;

/**
 * 探索中の進捗通知。一定ステップごとに探索スレッドから呼ばれる。
 * 実装はソルバーの状態を変更してはならない。
 */
@FunctionalInterface
public interface SolveProgressListener {

    void onProgress(SolveProgress progress);

    SolveProgressListener NONE = progress -> { };
}
