package io.github.riemr.timetable.optimization.constraint;

import io.github.riemr.timetable.optimization.entity.Conflict;
import io.github.riemr.timetable.optimization.entity.ConflictKind;
import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * ハード制約の判定。
 * <ul>
 *   <li>講師の二重予約禁止（同一講師 × 同一時限）</li>
 *   <li>教室の二重予約禁止（同一教室 × 同一時限）</li>
 *   <li>セクションの二重予約禁止（同一セクション × 同一時限）</li>
 * </ul>
 * 状態を持たず、引数の割当も変更しない。
 */
@Component
public class HardConstraintChecker {

    /**
     * assignment に lecture := candidate を反映した結果の割当が、3 種のハード制約をすべて満たすか。
     * 既存の割当同士の衝突も判定対象に含む。割当マップの複製は作らない。
     */
    public boolean isConsistent(Lecture lecture, LectureSlot candidate, Map<Lecture, LectureSlot> assignment) {
        // 新しい値と既存の割当の衝突を先に見る（大半の棄却はここ）
        for (Map.Entry<Lecture, LectureSlot> e : assignment.entrySet()) {
            Lecture other = e.getKey();
            if (other.equals(lecture)) continue;
            if (clashes(lecture, candidate, other, e.getValue())) return false;
        }

        Set<String> instructorKeys = new HashSet<>();
        Set<String> roomKeys = new HashSet<>();
        Set<String> sectionKeys = new HashSet<>();
        for (Map.Entry<Lecture, LectureSlot> e : assignment.entrySet()) {
            if (e.getKey().equals(lecture)) continue;
            LectureSlot slot = e.getValue();
            if (!instructorKeys.add(instructorKey(slot))
                    || !roomKeys.add(roomKey(slot))
                    || !sectionKeys.add(sectionKey(e.getKey(), slot))) {
                return false;
            }
        }
        return true;
    }

    /** 割当全体に違反が 1 件もないか */
    public boolean isValid(Map<Lecture, LectureSlot> assignment) {
        return findAllConflicts(assignment).isEmpty();
    }

    /**
     * 違反を列挙する（診断用。探索からは参照しない）。
     * 1 組の講義が講師・教室・セクションすべてで衝突した場合は 3 件として返す。
     */
    public List<Conflict> findAllConflicts(Map<Lecture, LectureSlot> assignment) {
        List<Conflict> conflicts = new ArrayList<>();
        collect(assignment, ConflictKind.INSTRUCTOR, e -> instructorKey(e.getValue()), conflicts);
        collect(assignment, ConflictKind.ROOM, e -> roomKey(e.getValue()), conflicts);
        collect(assignment, ConflictKind.SECTION, e -> sectionKey(e.getKey(), e.getValue()), conflicts);
        return conflicts;
    }

    private void collect(Map<Lecture, LectureSlot> assignment,
                         ConflictKind kind,
                         Function<Map.Entry<Lecture, LectureSlot>, String> keyOf,
                         List<Conflict> out) {
        Map<String, List<Lecture>> grouped = new LinkedHashMap<>();
        for (Map.Entry<Lecture, LectureSlot> e : assignment.entrySet()) {
            grouped.computeIfAbsent(keyOf.apply(e), k -> new ArrayList<>()).add(e.getKey());
        }
        grouped.forEach((key, lectures) -> {
            if (lectures.size() > 1) {
                out.add(new Conflict(kind, key, List.copyOf(lectures)));
            }
        });
    }

    private static boolean clashes(Lecture a, LectureSlot sa, Lecture b, LectureSlot sb) {
        if (!Objects.equals(sa.getTimeslotId(), sb.getTimeslotId())) return false;
        return Objects.equals(sa.getInstructorId(), sb.getInstructorId())
                || Objects.equals(sa.getRoomId(), sb.getRoomId())
                || Objects.equals(a.getSectionId(), b.getSectionId());
    }

    private static String instructorKey(LectureSlot slot) {
        return slot.getInstructorId() + "@" + slot.getTimeslotId();
    }

    private static String roomKey(LectureSlot slot) {
        return slot.getRoomId() + "@" + slot.getTimeslotId();
    }

    private static String sectionKey(Lecture lecture, LectureSlot slot) {
        return lecture.getSectionId() + "@" + slot.getTimeslotId();
    }
}
