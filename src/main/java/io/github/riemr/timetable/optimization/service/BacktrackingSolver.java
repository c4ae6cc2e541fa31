package io.github.riemr.timetable.optimization.service;

import io.github.riemr.timetable.domain.InvalidProblemException;
import io.github.riemr.timetable.optimization.constraint.HardConstraintChecker;
import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;
import io.github.riemr.timetable.optimization.solution.SolveOutcome;
import io.github.riemr.timetable.optimization.solution.SolveStatus;
import io.github.riemr.timetable.optimization.solution.TimetableProblem;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * バックトラッキング探索。
 * <ul>
 *   <li>変数選択: MRV（現在の部分割当に対する残り候補数が最小の変数。同数は先勝ち）</li>
 *   <li>値順序: ドメインをランダムにシャッフル（乱数源は注入可能）</li>
 *   <li>時系列バックトラック: 仮割当 → 再帰 → 失敗時に取り消し</li>
 * </ul>
 * 部分割当はこのインスタンスが所有する唯一の可変状態。1 インスタンスにつき 1 回だけ solve できる。
 * 健全（返す解は必ずハード制約を満たす）だが、時間制限下での完全性は保証しない。
 */
@Slf4j
public class BacktrackingSolver {

    private final TimetableProblem problem;
    private final HardConstraintChecker checker;
    private final Random random;
    private final SolveProgressListener progressListener;
    private final int progressInterval;

    private final Map<Lecture, LectureSlot> assignment = new LinkedHashMap<>();
    private final AtomicBoolean used = new AtomicBoolean();

    private long iterations;
    private long startNanos;
    private long budgetNanos;
    private int bestPartialSize;
    private boolean timedOut;

    public BacktrackingSolver(TimetableProblem problem,
                              HardConstraintChecker checker,
                              Random random,
                              SolveProgressListener progressListener,
                              int progressInterval) {
        this.problem = problem;
        this.checker = checker;
        this.random = random;
        this.progressListener = progressListener == null ? SolveProgressListener.NONE : progressListener;
        this.progressInterval = Math.max(1, progressInterval);
    }

    public BacktrackingSolver(TimetableProblem problem, HardConstraintChecker checker, Random random) {
        this(problem, checker, random, SolveProgressListener.NONE, 100);
    }

    public SolveOutcome solve(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new InvalidProblemException("timeout must be zero or positive: " + timeout);
        }
        if (problem == null || problem.variableCount() == 0) {
            throw new InvalidProblemException("no lectures to schedule");
        }
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("BacktrackingSolver instance has already been used; create a new one per solve");
        }

        int total = problem.variableCount();
        log.info("Starting CSP solver: variables={}, timeout={}s", total, timeout.toSeconds());

        Optional<Lecture> empty = problem.firstEmptyDomain();
        if (empty.isPresent()) {
            log.warn("Lecture {} has an empty domain; problem is infeasible as posed", empty.get());
            return SolveOutcome.failed(SolveStatus.EXHAUSTED, 0, Duration.ZERO, 0, total);
        }

        startNanos = System.nanoTime();
        budgetNanos = toBudgetNanos(timeout);
        boolean solved = backtrack();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        SolveOutcome outcome;
        if (solved) {
            outcome = new SolveOutcome(SolveStatus.SOLVED,
                    Collections.unmodifiableMap(new LinkedHashMap<>(assignment)),
                    iterations, elapsed, total, total);
        } else {
            SolveStatus status = timedOut ? SolveStatus.TIMED_OUT : SolveStatus.EXHAUSTED;
            outcome = SolveOutcome.failed(status, iterations, elapsed, bestPartialSize, total);
        }
        log.info("CSP solver finished: status={}, time={}ms, iterations={}, best={}/{}",
                outcome.status(), elapsed.toMillis(), iterations, outcome.bestPartialSize(), total);
        return outcome;
    }

    private boolean backtrack() {
        iterations++;

        if (assignment.size() == problem.variableCount()) {
            return true;
        }
        long elapsed = System.nanoTime() - startNanos;
        if (elapsed > budgetNanos) {
            if (!timedOut) {
                log.info("Timeout reached after {} iterations ({}/{} assigned)",
                        iterations, assignment.size(), problem.variableCount());
            }
            timedOut = true;
            return false;
        }
        if (iterations % progressInterval == 0) {
            reportProgress(elapsed);
        }

        Lecture lecture = selectUnassignedVariable();
        if (lecture == null) {
            return false;
        }

        for (LectureSlot value : orderDomainValues(lecture)) {
            if (!checker.isConsistent(lecture, value, assignment)) continue;

            assignment.put(lecture, value);
            bestPartialSize = Math.max(bestPartialSize, assignment.size());

            if (backtrack()) {
                return true;
            }
            assignment.remove(lecture);
            if (timedOut) {
                return false;
            }
        }
        return false;
    }

    /**
     * MRV。未割当変数ごとに現在の部分割当と矛盾しない値の数を数え直し、最小のものを選ぶ。
     * 残り 0 の変数が見つかった時点でこの分岐は行き詰まりなので null を返す。
     */
    private Lecture selectUnassignedVariable() {
        Lecture best = null;
        int minRemaining = Integer.MAX_VALUE;
        for (Lecture lecture : problem.getLectures()) {
            if (assignment.containsKey(lecture)) continue;
            int remaining = 0;
            for (LectureSlot value : problem.domainOf(lecture)) {
                if (checker.isConsistent(lecture, value, assignment)) {
                    remaining++;
                    if (remaining >= minRemaining) break;
                }
            }
            if (remaining < minRemaining) {
                minRemaining = remaining;
                best = lecture;
                if (remaining == 0) {
                    return null;
                }
            }
        }
        return best;
    }

    private List<LectureSlot> orderDomainValues(Lecture lecture) {
        List<LectureSlot> ordered = new ArrayList<>(problem.domainOf(lecture));
        Collections.shuffle(ordered, random);
        return ordered;
    }

    /** 約 292 年を超える上限は実質無制限として Long.MAX_VALUE に丸める */
    static long toBudgetNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    private void reportProgress(long elapsedNanos) {
        SolveProgress progress = new SolveProgress(assignment.size(), problem.variableCount(),
                iterations, Duration.ofNanos(elapsedNanos).toMillis());
        log.debug("Progress: {}/{} assigned (iteration {})",
                progress.assignedCount(), progress.totalCount(), progress.iterations());
        try {
            progressListener.onProgress(progress);
        } catch (RuntimeException ex) {
            log.warn("Progress listener failed: {}", ex.getMessage());
        }
    }

    public long getIterations() {
        return iterations;
    }
}
