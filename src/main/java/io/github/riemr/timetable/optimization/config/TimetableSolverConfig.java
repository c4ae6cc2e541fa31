package io.github.riemr.timetable.optimization.config;

import io.github.riemr.timetable.optimization.nearby.RoomDistanceMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Configuration
@Slf4j
public class TimetableSolverConfig {

    // 探索の上限時間（既定: 5分）
    @Value("${timetable.solver.timeout:PT300S}")
    private String solverTimeout;
    @Value("${timetable.solver.progress-interval:100}")
    private int progressInterval;
    // 空なら毎回ランダム
    @Value("${timetable.solver.seed:}")
    private String seed;
    @Value("${timetable.solver.result-retention:PT30M}")
    private String resultRetention;
    @Value("${timetable.solver.parallelism:2}")
    private int parallelism;

    @Value("${timetable.scoring.gap-weight:10}")
    private double gapWeight;
    @Value("${timetable.scoring.balance-weight:5}")
    private double balanceWeight;
    @Value("${timetable.scoring.early-weight:3}")
    private double earlyWeight;
    @Value("${timetable.scoring.late-weight:3}")
    private double lateWeight;
    @Value("${timetable.scoring.room-distance-weight:8}")
    private double roomDistanceWeight;
    @Value("${timetable.scoring.room-distance-threshold:2}")
    private double roomDistanceThreshold;
    @Value("${timetable.scoring.early-slots:TS0,TS4,TS8,TS12,TS16}")
    private String earlySlots;
    @Value("${timetable.scoring.late-slots:TS3,TS7,TS11,TS15,TS19}")
    private String lateSlots;
    // 既定は同一時限の任意の講義の教室を比較
    @Value("${timetable.scoring.room-distance-scope:ANY_LECTURE_IN_SLOT}")
    private String roomDistanceScope;
    @Value("${timetable.scoring.balance-days:SCHEDULED_DAYS}")
    private String balanceDays;

    @Bean
    public SolverSettings solverSettings() {
        Long fixedSeed = null;
        if (seed != null && !seed.isBlank()) {
            try {
                fixedSeed = Long.parseLong(seed.trim());
            } catch (NumberFormatException ex) {
                log.warn("Ignoring invalid timetable.solver.seed '{}'; search order stays random", seed);
            }
        }
        Duration timeout = parseDurationTolerant(solverTimeout, Duration.ofSeconds(300));
        if (timeout.compareTo(SolverSettings.MAX_TIMEOUT) > 0) {
            log.warn("timetable.solver.timeout {} exceeds {}; clamped", timeout, SolverSettings.MAX_TIMEOUT);
            timeout = SolverSettings.MAX_TIMEOUT;
        }
        return SolverSettings.builder()
                .timeout(timeout)
                .progressInterval(Math.max(1, progressInterval))
                .seed(fixedSeed)
                .resultRetention(parseDurationTolerant(resultRetention, Duration.ofMinutes(30)))
                .build();
    }

    @Bean
    public ScoringWeights scoringWeights() {
        RoomDistanceScope scope = RoomDistanceScope.fromCode(roomDistanceScope);
        if (scope == null) {
            log.warn("Unknown timetable.scoring.room-distance-scope '{}'; using ANY_LECTURE_IN_SLOT", roomDistanceScope);
            scope = RoomDistanceScope.ANY_LECTURE_IN_SLOT;
        }
        BalanceDays days = BalanceDays.fromCode(balanceDays);
        if (days == null) {
            log.warn("Unknown timetable.scoring.balance-days '{}'; using SCHEDULED_DAYS", balanceDays);
            days = BalanceDays.SCHEDULED_DAYS;
        }
        return ScoringWeights.builder()
                .gapWeight(gapWeight)
                .balanceWeight(balanceWeight)
                .earlyWeight(earlyWeight)
                .lateWeight(lateWeight)
                .roomDistanceWeight(roomDistanceWeight)
                .roomDistanceThreshold(roomDistanceThreshold)
                .earlySlots(splitIds(earlySlots))
                .lateSlots(splitIds(lateSlots))
                .roomDistanceScope(scope)
                .balanceDays(days)
                .build()
                .validate();
    }

    @Bean
    public RoomDistanceMeter roomDistanceMeter() {
        return new RoomDistanceMeter();
    }

    // 非同期求解用。ジョブごとにソルバーインスタンスを生成するため共有状態はない
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService timetableSolverExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread t = new Thread(r, "timetable-solver-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    static Set<String> splitIds(String raw) {
        if (raw == null || raw.isBlank()) return Set.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    static Duration parseDurationTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        try {
            if (s.startsWith("P")) {
                if (s.matches("^PT\\d+$")) s = s + "S"; // fix common mistake
                return Duration.parse(s);
            }
            String ls = s.toLowerCase();
            if (ls.endsWith("ms")) return Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2)));
            if (ls.endsWith("s")) return Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("m")) return Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.endsWith("h")) return Duration.ofHours(Long.parseLong(ls.substring(0, ls.length() - 1)));
            if (ls.matches("^\\d+$")) return Duration.ofSeconds(Long.parseLong(ls));
        } catch (RuntimeException ex) {
            log.warn("Unparseable duration '{}', falling back to {}", raw, def);
            return def;
        }
        log.warn("Unrecognized duration '{}', falling back to {}", raw, def);
        return def;
    }
}
