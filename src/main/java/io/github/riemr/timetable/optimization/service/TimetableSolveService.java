package io.github.riemr.timetable.optimization.service;

import io.github.riemr.timetable.application.dto.SolveRequest;
import io.github.riemr.timetable.application.dto.SolveStatusDto;
import io.github.riemr.timetable.application.dto.SolveTicket;
import io.github.riemr.timetable.application.dto.WeightOverrides;
import io.github.riemr.timetable.domain.InvalidProblemException;
import io.github.riemr.timetable.domain.model.ReferenceData;
import io.github.riemr.timetable.optimization.config.BalanceDays;
import io.github.riemr.timetable.optimization.config.RoomDistanceScope;
import io.github.riemr.timetable.optimization.config.ScoringWeights;
import io.github.riemr.timetable.optimization.config.SolverSettings;
import io.github.riemr.timetable.optimization.constraint.HardConstraintChecker;
import io.github.riemr.timetable.optimization.constraint.QualityScorer;
import io.github.riemr.timetable.optimization.entity.Conflict;
import io.github.riemr.timetable.optimization.phase.LectureDomainBuilder;
import io.github.riemr.timetable.optimization.solution.ScoreBreakdown;
import io.github.riemr.timetable.optimization.solution.SolutionStatistics;
import io.github.riemr.timetable.optimization.solution.SolveOutcome;
import io.github.riemr.timetable.optimization.solution.SolveStatus;
import io.github.riemr.timetable.optimization.solution.TimetableProblem;
import io.github.riemr.timetable.optimization.solution.TimetableSolveResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 時間割の求解を制御するサービス。
 * <ul>
 *   <li>マスタから問題（変数・ドメイン）を構築し、バックトラッキングで解く</li>
 *   <li>解が得られた場合のみ品質スコアと統計を計算</li>
 *   <li>非同期ジョブはチケットで管理し、進捗をポーリングで公開</li>
 *   <li>終了したジョブは保持期間（timetable.solver.result-retention）の経過後に破棄</li>
 * </ul>
 * ソルバーはジョブごとに新規生成する（部分割当がインスタンスに紐づくため）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimetableSolveService {

    /* === Collaborators === */
    private final LectureDomainBuilder domainBuilder;
    private final HardConstraintChecker checker;
    private final QualityScorer qualityScorer;
    private final SolverSettings solverSettings;
    private final ScoringWeights scoringWeights;
    private final ExecutorService timetableSolverExecutor;

    /* === Runtime State === */
    private final Map<String, SolveJob> jobMap = new ConcurrentHashMap<>();
    // ProblemKey -> 実行中チケット（同一キーの再投入は同じチケットを返す）
    private final Map<ProblemKey, String> keyTicketMap = new ConcurrentHashMap<>();

    /* ===================================================================== */
    /* Public API                                                            */
    /* ===================================================================== */

    /**
     * 同期で求解する。入力不正は探索前に {@link InvalidProblemException} を送出する。
     * 時間切れ・解なしは例外ではなく結果のステータスで返す。
     */
    public TimetableSolveResult solve(SolveRequest request) {
        return run(prepare(request), SolveProgressListener.NONE);
    }

    /**
     * 非同期で求解を開始する。入力検証と問題構築は呼び出しスレッドで行う。
     *
     * @return 進捗確認・結果取得に使うチケット
     */
    public SolveTicket startSolve(SolveRequest request) {
        PreparedSolve prepared = prepare(request);
        ProblemKey key = new ProblemKey(request.sectionIds(), fingerprint(request));
        evictExpired();

        // 同一キーの判定と登録は compute で原子的に行う
        AtomicReference<SolveJob> created = new AtomicReference<>();
        String ticketId = keyTicketMap.compute(key, (k, existing) -> {
            if (existing != null) {
                SolveJob running = jobMap.get(existing);
                if (running != null && !running.isFinished()) {
                    return existing;
                }
            }
            String id = UUID.randomUUID().toString();
            SolveJob job = new SolveJob(key, prepared.problem().variableCount(), Instant.now(), prepared.timeout());
            jobMap.put(id, job);
            created.set(job);
            return id;
        });

        SolveJob job = created.get();
        if (job == null) {
            log.info("Solve for {} already running; reusing ticket {}", key, ticketId);
            return new SolveTicket(ticketId);
        }

        timetableSolverExecutor.submit(() -> {
            job.status = "SOLVING";
            try {
                job.result = run(prepared, job::update);
                job.status = job.result.status().name();
            } catch (RuntimeException ex) {
                log.error("Solver failed for problem {}", key, ex);
                job.status = "FAILED";
            } finally {
                job.finishedAt = Instant.now();
                keyTicketMap.remove(key, ticketId);
            }
        });
        log.info("Queued solve for {} as ticket {} ({} lectures)", key, ticketId, prepared.problem().variableCount());
        return new SolveTicket(ticketId);
    }

    public SolveStatusDto getStatus(String ticketId) {
        evictExpired();
        SolveJob job = ticketId == null ? null : jobMap.get(ticketId);
        if (job == null) {
            return SolveStatusDto.unknown();
        }
        SolveProgress p = job.progress;
        long finish = job.startedAt.plus(job.timeout).toEpochMilli();
        int pct = job.isFinished() ? 100 : (p == null ? 0 : p.percent());
        return new SolveStatusDto(job.status, pct, finish, job.phase(),
                p == null ? 0 : p.assignedCount(), job.totalCount, p == null ? 0 : p.iterations());
    }

    public Optional<TimetableSolveResult> fetchResult(String ticketId) {
        evictExpired();
        SolveJob job = ticketId == null ? null : jobMap.get(ticketId);
        return job == null ? Optional.empty() : Optional.ofNullable(job.result);
    }

    /* ===================================================================== */
    /* Helper                                                                */
    /* ===================================================================== */

    /** 終了から保持期間を過ぎたジョブを結果ごと破棄する */
    private void evictExpired() {
        Instant cutoff = Instant.now().minus(solverSettings.getResultRetention());
        jobMap.entrySet().removeIf(e -> {
            Instant finishedAt = e.getValue().finishedAt;
            if (finishedAt == null || finishedAt.isAfter(cutoff)) {
                return false;
            }
            log.debug("Evicting finished solve {} ({})", e.getKey(), e.getValue().key);
            return true;
        });
    }

    private TimetableSolveResult run(PreparedSolve prepared, SolveProgressListener listener) {
        TimetableProblem problem = prepared.problem();
        BacktrackingSolver solver = new BacktrackingSolver(problem, checker, prepared.random(),
                listener, solverSettings.getProgressInterval());
        SolveOutcome outcome = solver.solve(prepared.timeout());

        if (!outcome.isSolved()) {
            log.warn("No timetable found: status={}, best partial {}/{}",
                    outcome.status(), outcome.bestPartialSize(), outcome.totalVariables());
            return new TimetableSolveResult(problem, outcome, null, null, List.of());
        }

        List<Conflict> conflicts = checker.findAllConflicts(outcome.assignment());
        if (!conflicts.isEmpty()) {
            // 探索は健全なので通常は起きない
            log.error("Solved timetable has {} hard constraint violations: {}", conflicts.size(), conflicts);
        }
        ScoreBreakdown score = qualityScorer.score(outcome.assignment(), problem, prepared.weights());
        log.info("Timetable quality: score={} ({}) gap=-{} balance=+{} time=-{} room=-{}",
                String.format("%.2f", score.score()), score.rating(),
                score.gapPenalty(), score.balanceBonus(), score.timePreferencePenalty(), score.roomDistancePenalty());
        return new TimetableSolveResult(problem, outcome, score, SolutionStatistics.of(outcome.assignment()), conflicts);
    }

    private PreparedSolve prepare(SolveRequest request) {
        if (request == null) {
            throw new InvalidProblemException("request body is missing");
        }
        Duration timeout = solverSettings.getTimeout();
        if (request.timeoutSeconds() != null) {
            if (request.timeoutSeconds() < 0) {
                throw new InvalidProblemException("timeoutSeconds must be zero or positive: " + request.timeoutSeconds());
            }
            if (request.timeoutSeconds() > SolverSettings.MAX_TIMEOUT.toSeconds()) {
                throw new InvalidProblemException("timeoutSeconds must not exceed "
                        + SolverSettings.MAX_TIMEOUT.toSeconds() + ": " + request.timeoutSeconds());
            }
            timeout = Duration.ofSeconds(request.timeoutSeconds());
        }
        ScoringWeights weights = resolveWeights(request);

        ReferenceData referenceData = ReferenceData.of(request.courses(), request.instructors(),
                request.rooms(), request.timeslots(), request.sections());
        TimetableProblem problem = domainBuilder.build(referenceData, request.sectionIds());
        if (problem.variableCount() == 0) {
            throw new InvalidProblemException("no lectures to schedule for sections " + request.sectionIds());
        }

        Long seed = request.seed() != null ? request.seed() : solverSettings.getSeed();
        Random random = seed != null ? new Random(seed) : new Random();
        return new PreparedSolve(problem, timeout, weights, random);
    }

    private ScoringWeights resolveWeights(SolveRequest request) {
        ScoringWeights.ScoringWeightsBuilder b = scoringWeights.toBuilder();
        WeightOverrides w = request.weights();
        if (w != null) {
            if (w.gap() != null) b.gapWeight(w.gap());
            if (w.balance() != null) b.balanceWeight(w.balance());
            if (w.early() != null) b.earlyWeight(w.early());
            if (w.late() != null) b.lateWeight(w.late());
            if (w.roomDistance() != null) b.roomDistanceWeight(w.roomDistance());
        }
        if (request.earlySlots() != null) b.earlySlots(Set.copyOf(request.earlySlots()));
        if (request.lateSlots() != null) b.lateSlots(Set.copyOf(request.lateSlots()));
        if (request.roomDistanceThreshold() != null) b.roomDistanceThreshold(request.roomDistanceThreshold());
        if (request.roomDistanceScope() != null) {
            RoomDistanceScope scope = RoomDistanceScope.fromCode(request.roomDistanceScope());
            if (scope == null) {
                throw new InvalidProblemException("unknown roomDistanceScope: " + request.roomDistanceScope());
            }
            b.roomDistanceScope(scope);
        }
        if (request.balanceDays() != null) {
            BalanceDays days = BalanceDays.fromCode(request.balanceDays());
            if (days == null) {
                throw new InvalidProblemException("unknown balanceDays: " + request.balanceDays());
            }
            b.balanceDays(days);
        }
        return b.build().validate();
    }

    private static int fingerprint(SolveRequest request) {
        return Objects.hash(request.courses(), request.instructors(), request.rooms(), request.timeslots(),
                request.sections(), request.timeoutSeconds(), request.seed(), request.weights(),
                request.earlySlots(), request.lateSlots(), request.roomDistanceThreshold(), request.roomDistanceScope(),
                request.balanceDays());
    }

    private record PreparedSolve(TimetableProblem problem, Duration timeout, ScoringWeights weights, Random random) {
    }

    /** 非同期ジョブ 1 件の状態。探索スレッドが書き込み、ポーリング側が読む */
    private static final class SolveJob {
        final ProblemKey key;
        final int totalCount;
        final Instant startedAt;
        final Duration timeout;
        volatile String status = "QUEUED";
        volatile SolveProgress progress;
        volatile TimetableSolveResult result;
        volatile Instant finishedAt;

        SolveJob(ProblemKey key, int totalCount, Instant startedAt, Duration timeout) {
            this.key = key;
            this.totalCount = totalCount;
            this.startedAt = startedAt;
            this.timeout = timeout;
        }

        void update(SolveProgress p) {
            this.progress = p;
        }

        boolean isFinished() {
            return result != null || "FAILED".equals(status);
        }

        String phase() {
            if ("QUEUED".equals(status)) return "待機中";
            if ("SOLVING".equals(status)) return "探索中";
            if ("FAILED".equals(status)) return "エラー";
            if (SolveStatus.TIMED_OUT.name().equals(status)) return "時間切れ";
            if (SolveStatus.EXHAUSTED.name().equals(status)) return "解なし";
            return "完了";
        }
    }
}
