package io.github.riemr.timetable.optimization.constraint;

import io.github.riemr.timetable.domain.model.ReferenceData;
import io.github.riemr.timetable.domain.model.TimeSlot;
import io.github.riemr.timetable.optimization.config.BalanceDays;
import io.github.riemr.timetable.optimization.config.RoomDistanceScope;
import io.github.riemr.timetable.optimization.config.ScoringWeights;
import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;
import io.github.riemr.timetable.optimization.nearby.RoomDistanceMeter;
import io.github.riemr.timetable.optimization.solution.ScoreBreakdown;
import io.github.riemr.timetable.optimization.solution.TimetableProblem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 完成した時間割の品質スコア（ソフト制約）を計算する。探索には一切影響しない。
 * <ul>
 *   <li>空きコマペナルティ（セクション × 曜日）</li>
 *   <li>週内バランスボーナス（曜日別コマ数の標準偏差。対象曜日は {@link BalanceDays}）</li>
 *   <li>早朝・夕方の時限ペナルティ</li>
 *   <li>連続コマの教室距離ペナルティ（セクション視点・講師視点を別々に合算）</li>
 * </ul>
 * 副作用はなく、同じ入力に対して常に同じ値を返す。
 */
@Component
@RequiredArgsConstructor
public class QualityScorer {

    private static final double BALANCE_CEILING = 5.0;

    private final RoomDistanceMeter roomDistanceMeter;
    private final ScoringWeights defaultWeights;

    public ScoreBreakdown score(Map<Lecture, LectureSlot> assignment, TimetableProblem problem) {
        return score(assignment, problem, defaultWeights);
    }

    public ScoreBreakdown score(Map<Lecture, LectureSlot> assignment, TimetableProblem problem, ScoringWeights weights) {
        List<Session> sessions = toSessions(assignment, problem.getReferenceData());
        return ScoreBreakdown.of(
                gapPenalty(sessions, weights),
                balanceBonus(sessions, problem.getReferenceData(), weights),
                timePreferencePenalty(sessions, weights),
                roomDistancePenalty(sessions, weights));
    }

    double gapPenalty(List<Session> sessions, ScoringWeights weights) {
        double penalty = 0.0;
        for (List<Session> daily : groupByDay(sessions, s -> s.lecture.getSectionId()).values()) {
            if (daily.size() < 2) continue;
            for (int i = 0; i + 1 < daily.size(); i++) {
                int gap = daily.get(i + 1).dayIndex - daily.get(i).dayIndex - 1;
                if (gap > 0) {
                    penalty += gap * weights.getGapWeight();
                }
            }
        }
        return penalty;
    }

    double balanceBonus(List<Session> sessions, ReferenceData referenceData, ScoringWeights weights) {
        Map<String, Map<DayOfWeek, Integer>> perSection = new LinkedHashMap<>();
        for (Session s : sessions) {
            perSection.computeIfAbsent(s.lecture.getSectionId(), k -> new HashMap<>())
                    .merge(s.timeslot.getDay(), 1, Integer::sum);
        }

        double bonus = 0.0;
        for (Map<DayOfWeek, Integer> counts : perSection.values()) {
            List<Integer> values = new ArrayList<>();
            if (weights.getBalanceDays() == BalanceDays.WHOLE_WEEK) {
                for (DayOfWeek d : referenceData.weekdays()) values.add(counts.getOrDefault(d, 0));
            } else {
                values.addAll(counts.values());
            }
            if (values.isEmpty()) continue;

            double mean = 0.0;
            for (int v : values) mean += v;
            mean /= values.size();
            double variance = 0.0;
            for (int v : values) {
                double diff = v - mean;
                variance += diff * diff;
            }
            double stdDev = Math.sqrt(variance / values.size());
            bonus += Math.max(0.0, BALANCE_CEILING - stdDev) * weights.getBalanceWeight();
        }
        return bonus;
    }

    double timePreferencePenalty(List<Session> sessions, ScoringWeights weights) {
        double penalty = 0.0;
        for (Session s : sessions) {
            String ts = s.slot.getTimeslotId();
            if (weights.getEarlySlots().contains(ts)) penalty += weights.getEarlyWeight();
            if (weights.getLateSlots().contains(ts)) penalty += weights.getLateWeight();
        }
        return penalty;
    }

    double roomDistancePenalty(List<Session> sessions, ScoringWeights weights) {
        // ANY_LECTURE_IN_SLOT 用: 時限 → その時限を使う最後の講義の教室
        Map<String, String> lastRoomBySlot = new HashMap<>();
        for (Session s : sessions) {
            lastRoomBySlot.put(s.slot.getTimeslotId(), s.slot.getRoomId());
        }
        double penalty = 0.0;
        for (List<Session> daily : groupByDay(sessions, s -> s.lecture.getSectionId()).values()) {
            penalty += consecutiveRoomPenalty(daily, lastRoomBySlot, weights);
        }
        for (List<Session> daily : groupByDay(sessions, s -> s.slot.getInstructorId()).values()) {
            penalty += consecutiveRoomPenalty(daily, lastRoomBySlot, weights);
        }
        return penalty;
    }

    private double consecutiveRoomPenalty(List<Session> daily, Map<String, String> lastRoomBySlot, ScoringWeights weights) {
        double penalty = 0.0;
        for (int i = 0; i + 1 < daily.size(); i++) {
            Session current = daily.get(i);
            Session next = daily.get(i + 1);
            if (next.dayIndex != current.dayIndex + 1) continue;

            String currentRoom;
            String nextRoom;
            if (weights.getRoomDistanceScope() == RoomDistanceScope.ANY_LECTURE_IN_SLOT) {
                currentRoom = lastRoomBySlot.get(current.slot.getTimeslotId());
                nextRoom = lastRoomBySlot.get(next.slot.getTimeslotId());
            } else {
                currentRoom = current.slot.getRoomId();
                nextRoom = next.slot.getRoomId();
            }
            int distance = roomDistanceMeter.distance(currentRoom, nextRoom);
            if (distance > weights.getRoomDistanceThreshold()) {
                penalty += distance * weights.getRoomDistanceWeight();
            }
        }
        return penalty;
    }

    /** (owner, 曜日) ごとに曜日内の並び順でソートしたセッション列 */
    private Map<String, List<Session>> groupByDay(List<Session> sessions, Function<Session, String> ownerOf) {
        Map<String, List<Session>> grouped = new LinkedHashMap<>();
        for (Session s : sessions) {
            String key = ownerOf.apply(s) + "|" + s.timeslot.getDay();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(s);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparingInt(s -> s.dayIndex)));
        return grouped;
    }

    private List<Session> toSessions(Map<Lecture, LectureSlot> assignment, ReferenceData referenceData) {
        Map<String, Integer> dayIndexOf = new HashMap<>();
        for (DayOfWeek day : referenceData.weekdays()) {
            List<TimeSlot> ordered = referenceData.timeslotsOn(day);
            for (int i = 0; i < ordered.size(); i++) {
                dayIndexOf.put(ordered.get(i).getId(), i);
            }
        }
        List<Session> sessions = new ArrayList<>(assignment.size());
        for (Map.Entry<Lecture, LectureSlot> e : assignment.entrySet()) {
            LectureSlot slot = e.getValue();
            var ts = referenceData.findTimeslot(slot.getTimeslotId());
            // 時限マスタにない割当は評価対象外
            if (ts.isEmpty()) continue;
            sessions.add(new Session(e.getKey(), slot, ts.get(), dayIndexOf.get(ts.get().getId())));
        }
        return sessions;
    }

    static final class Session {
        final Lecture lecture;
        final LectureSlot slot;
        final TimeSlot timeslot;
        final int dayIndex;

        Session(Lecture lecture, LectureSlot slot, TimeSlot timeslot, int dayIndex) {
            this.lecture = lecture;
            this.slot = slot;
            this.timeslot = timeslot;
            this.dayIndex = dayIndex;
        }
    }
}
