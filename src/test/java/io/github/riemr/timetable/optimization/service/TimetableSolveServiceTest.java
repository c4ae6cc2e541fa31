package io.github.riemr.timetable.optimization.service;

import io.github.riemr.timetable.application.dto.SolveRequest;
import io.github.riemr.timetable.application.dto.SolveStatusDto;
import io.github.riemr.timetable.application.dto.SolveTicket;
import io.github.riemr.timetable.application.dto.TimetableResultDto;
import io.github.riemr.timetable.application.dto.WeightOverrides;
import io.github.riemr.timetable.domain.InvalidProblemException;
import io.github.riemr.timetable.domain.model.RoomType;
import io.github.riemr.timetable.optimization.config.ScoringWeights;
import io.github.riemr.timetable.optimization.config.SolverSettings;
import io.github.riemr.timetable.optimization.constraint.HardConstraintChecker;
import io.github.riemr.timetable.optimization.constraint.QualityScorer;
import io.github.riemr.timetable.optimization.nearby.RoomDistanceMeter;
import io.github.riemr.timetable.optimization.phase.LectureDomainBuilder;
import io.github.riemr.timetable.optimization.solution.SolveStatus;
import io.github.riemr.timetable.optimization.solution.TimetableSolveResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.github.riemr.timetable.TimetableFixtures.course;
import static io.github.riemr.timetable.TimetableFixtures.instructor;
import static io.github.riemr.timetable.TimetableFixtures.room;
import static io.github.riemr.timetable.TimetableFixtures.section;
import static io.github.riemr.timetable.TimetableFixtures.week;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimetableSolveServiceTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ScoringWeights weights = ScoringWeights.defaults();
    private final TimetableSolveService service = new TimetableSolveService(
            new LectureDomainBuilder(),
            new HardConstraintChecker(),
            new QualityScorer(new RoomDistanceMeter(), weights),
            SolverSettings.builder().timeout(Duration.ofSeconds(10)).build(),
            weights,
            executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static SolveRequest request(List<String> sectionIds, Long timeoutSeconds, Long seed) {
        return new SolveRequest(
                List.of(course("C1", 3, "Lecture"), course("C2", 1, "Lecture and Lab")),
                List.of(instructor("P1", null, "C1"), instructor("P2", DayOfWeek.TUESDAY, "C2")),
                List.of(room("R101", RoomType.LECTURE), room("L201", RoomType.LAB)),
                week(4, DayOfWeek.MONDAY, DayOfWeek.TUESDAY),
                List.of(section("S1", "C1", "C2")),
                sectionIds, timeoutSeconds, seed);
    }

    @Test
    void solve_returnsScoredTimetable() {
        TimetableSolveResult result = service.solve(request(List.of(), 5L, 11L));

        assertThat(result.status()).isEqualTo(SolveStatus.SOLVED);
        assertThat(result.outcome().assignment()).hasSize(3);
        assertThat(result.conflicts()).isEmpty();
        assertThat(result.score()).isNotNull();
        assertThat(result.statistics().totalAssigned()).isEqualTo(3);
        assertThat(result.statistics().instructorLoad()).containsEntry("P1", 2).containsEntry("P2", 1);

        TimetableResultDto dto = TimetableResultDto.from(result);
        assertThat(dto.status()).isEqualTo("SOLVED");
        assertThat(dto.summary().variableCount()).isEqualTo(3);
        assertThat(dto.assignments()).hasSize(3).allSatisfy(row -> {
            assertThat(row.courseName()).endsWith(" name");
            assertThat(row.day()).isNotNull();
        });
    }

    @Test
    void solve_sameSeedGivesSameTimetable() {
        TimetableSolveResult first = service.solve(request(List.of(), 5L, 99L));
        TimetableSolveResult second = service.solve(request(List.of(), 5L, 99L));

        assertThat(second.outcome().assignment()).isEqualTo(first.outcome().assignment());
    }

    @Test
    void solve_appliesWeightOverrides() {
        SolveRequest base = request(List.of(), 5L, 11L);
        SolveRequest noTimePenalty = new SolveRequest(base.courses(), base.instructors(), base.rooms(),
                base.timeslots(), base.sections(), base.sectionIds(), 5L, 11L,
                new WeightOverrides(null, null, 0.0, 0.0, null), null, null, null, null, null);

        assertThat(service.solve(noTimePenalty).score().timePreferencePenalty()).isZero();
    }

    @Test
    void solve_rejectsNegativeTimeout() {
        assertThatThrownBy(() -> service.solve(request(List.of(), -1L, null)))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("timeoutSeconds");
    }

    @Test
    void solve_rejectsTimeoutAboveMaximum() {
        long tooLong = SolverSettings.MAX_TIMEOUT.toSeconds() + 1;

        assertThatThrownBy(() -> service.solve(request(List.of(), tooLong, null)))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("must not exceed");
        assertThatThrownBy(() -> service.startSolve(request(List.of(), Long.MAX_VALUE, null)))
                .isInstanceOf(InvalidProblemException.class);
    }

    @Test
    void solve_rejectsUnknownBalanceDays() {
        SolveRequest base = request(List.of(), 5L, 11L);
        SolveRequest bad = new SolveRequest(base.courses(), base.instructors(), base.rooms(),
                base.timeslots(), base.sections(), base.sectionIds(), 5L, 11L,
                null, null, null, null, null, "weekend");

        assertThatThrownBy(() -> service.solve(bad))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("balanceDays");
    }

    @Test
    void solve_rejectsRequestWithNothingToSchedule() {
        assertThatThrownBy(() -> service.solve(request(List.of("S404"), 5L, null)))
                .isInstanceOf(InvalidProblemException.class);
    }

    @Test
    void solve_rejectsUnknownRoomDistanceScope() {
        SolveRequest base = request(List.of(), 5L, 11L);
        SolveRequest bad = new SolveRequest(base.courses(), base.instructors(), base.rooms(),
                base.timeslots(), base.sections(), base.sectionIds(), 5L, 11L,
                null, null, null, null, "teleport", null);

        assertThatThrownBy(() -> service.solve(bad))
                .isInstanceOf(InvalidProblemException.class)
                .hasMessageContaining("roomDistanceScope");
    }

    @Test
    void startSolve_runsInBackgroundAndExposesResult() throws Exception {
        SolveTicket ticket = service.startSolve(request(List.of("S1"), 5L, 3L));

        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        SolveStatusDto status = service.getStatus(ticket.ticketId());
        assertThat(status.status()).isEqualTo("SOLVED");
        assertThat(status.progress()).isEqualTo(100);
        assertThat(status.phase()).isEqualTo("完了");
        assertThat(status.totalCount()).isEqualTo(3);

        Optional<TimetableSolveResult> result = service.fetchResult(ticket.ticketId());
        assertThat(result).isPresent();
        assertThat(result.get().isSolved()).isTrue();
    }

    @Test
    void startSolve_reusesTicketWhileSameProblemIsRunning() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        executor.submit(() -> {
            release.await();
            return null;
        });
        try {
            SolveTicket first = service.startSolve(request(List.of("S1"), 5L, 3L));
            SolveTicket second = service.startSolve(request(List.of("S1"), 5L, 3L));
            SolveTicket other = service.startSolve(request(List.of("S1"), 5L, 4L));

            assertThat(second.ticketId()).isEqualTo(first.ticketId());
            assertThat(other.ticketId()).isNotEqualTo(first.ticketId());
            assertThat(service.getStatus(first.ticketId()).phase()).isEqualTo("待機中");
        } finally {
            release.countDown();
        }
    }

    @Test
    void startSolve_concurrentSubmissionsShareOneTicket() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        executor.submit(() -> {
            release.await();
            return null;
        });
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<SolveTicket>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(callers.submit(() -> service.startSolve(request(List.of("S1"), 5L, 3L))));
            }
            Set<String> ids = new HashSet<>();
            for (Future<SolveTicket> f : futures) {
                ids.add(f.get(10, TimeUnit.SECONDS).ticketId());
            }
            assertThat(ids).hasSize(1);
        } finally {
            release.countDown();
            callers.shutdownNow();
        }
    }

    @Test
    void finishedJobs_areEvictedAfterRetention() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        TimetableSolveService shortLived = new TimetableSolveService(
                new LectureDomainBuilder(),
                new HardConstraintChecker(),
                new QualityScorer(new RoomDistanceMeter(), weights),
                SolverSettings.builder().timeout(Duration.ofSeconds(10)).resultRetention(Duration.ZERO).build(),
                weights,
                pool);
        try {
            SolveTicket finished = shortLived.startSolve(request(List.of("S1"), 5L, 3L));
            pool.submit(() -> null).get(10, TimeUnit.SECONDS);

            SolveTicket next = shortLived.startSolve(request(List.of("S1"), 5L, 4L));

            assertThat(shortLived.getStatus(finished.ticketId()).status()).isEqualTo("UNKNOWN");
            assertThat(shortLived.fetchResult(finished.ticketId())).isEmpty();
            assertThat(next.ticketId()).isNotEqualTo(finished.ticketId());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void finishedJobs_stayAvailableWithinRetention() throws Exception {
        SolveTicket ticket = service.startSolve(request(List.of("S1"), 5L, 3L));
        executor.submit(() -> null).get(10, TimeUnit.SECONDS);

        service.startSolve(request(List.of("S1"), 5L, 4L));

        assertThat(service.fetchResult(ticket.ticketId())).isPresent();
    }

    @Test
    void unknownTicket_hasNoStatusOrResult() {
        assertThat(service.getStatus("missing").status()).isEqualTo("UNKNOWN");
        assertThat(service.fetchResult("missing")).isEmpty();
    }
}
