package io.github.riemr.timetable.optimization.phase;

import io.github.riemr.timetable.domain.model.Course;
import io.github.riemr.timetable.domain.model.Instructor;
import io.github.riemr.timetable.domain.model.ReferenceData;
import io.github.riemr.timetable.domain.model.Room;
import io.github.riemr.timetable.domain.model.Section;
import io.github.riemr.timetable.domain.model.TimeSlot;
import io.github.riemr.timetable.optimization.entity.Lecture;
import io.github.riemr.timetable.optimization.entity.LectureSlot;
import io.github.riemr.timetable.optimization.solution.ProblemSummary;
import io.github.riemr.timetable.optimization.solution.TimetableProblem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 探索前フェーズ: 講義（CSP 変数）と各講義のドメインを生成する。
 * <ul>
 *   <li>週あたりコマ数は単位数から決定</li>
 *   <li>ドメインは単項制約（教室種別・担当資格・不可曜日）を満たす値のみ</li>
 *   <li>マスタ欠損は警告として記録し、構築自体は継続</li>
 * </ul>
 */
@Component
@Slf4j
public class LectureDomainBuilder {

    /**
     * 指定セクション分の問題を構築する。sectionIds が空ならマスタ上の全セクション。
     */
    public TimetableProblem build(ReferenceData referenceData, List<String> sectionIds) {
        List<String> diagnostics = new ArrayList<>();
        List<Lecture> lectures = buildLectures(referenceData, sectionIds, diagnostics);
        Map<Lecture, List<LectureSlot>> domains = buildDomains(lectures, referenceData, diagnostics);
        TimetableProblem problem = new TimetableProblem(lectures, domains, referenceData, diagnostics);

        if (log.isInfoEnabled()) {
            ProblemSummary summary = ProblemSummary.of(problem);
            log.info("Problem built from {} courses: variables={}, domainSize(min={}, max={}, avg={}), perSection={}",
                    referenceData.courseCount(), summary.variableCount(), summary.minDomainSize(), summary.maxDomainSize(),
                    String.format("%.1f", summary.averageDomainSize()), summary.lecturesPerSection());
        }
        return problem;
    }

    /** 単位数 → 週あたりコマ数 */
    public static int sessionsPerWeek(int credits) {
        switch (credits) {
            case 1:
            case 2:
                return 1;
            case 3:
            case 4:
                return 2;
            case 5:
                return 3;
            default:
                return 2;
        }
    }

    public List<Lecture> buildLectures(ReferenceData referenceData, List<String> sectionIds, List<String> diagnostics) {
        List<String> targets = (sectionIds == null || sectionIds.isEmpty())
                ? referenceData.sections().stream().map(Section::getId).toList()
                : sectionIds;

        Set<Lecture> lectures = new LinkedHashSet<>();
        for (String sectionId : targets) {
            var section = referenceData.findSection(sectionId);
            if (section.isEmpty()) {
                warn(diagnostics, "Section " + sectionId + " not found, skipped");
                continue;
            }
            Set<String> seenCourses = new LinkedHashSet<>();
            for (String courseId : section.get().getCourseIds()) {
                if (!seenCourses.add(courseId)) {
                    warn(diagnostics, "Course " + courseId + " listed twice for section " + sectionId + ", duplicate skipped");
                    continue;
                }
                var course = referenceData.findCourse(courseId);
                if (course.isEmpty()) {
                    warn(diagnostics, "Course " + courseId + " not found (section " + sectionId + "), skipped");
                    continue;
                }
                int sessions = sessionsPerWeek(course.get().getCredits());
                for (int n = 1; n <= sessions; n++) {
                    lectures.add(new Lecture(sectionId, courseId, n));
                }
                log.debug("{} / {}: {} lectures/week", sectionId, courseId, sessions);
            }
        }
        return new ArrayList<>(lectures);
    }

    /**
     * ドメイン生成。時限 → 教室 → 講師 の順で列挙し、不可曜日の講師は除外する。
     * 並び順は値順序付けの初期値にすぎず、探索時にシャッフルされる。
     */
    public Map<Lecture, List<LectureSlot>> buildDomains(List<Lecture> lectures,
                                                        ReferenceData referenceData,
                                                        List<String> diagnostics) {
        Map<Lecture, List<LectureSlot>> domains = new LinkedHashMap<>();
        List<TimeSlot> timeslots = referenceData.timeslots();

        for (Lecture lecture : lectures) {
            List<LectureSlot> domain = new ArrayList<>();
            domains.put(lecture, domain);

            var course = referenceData.findCourse(lecture.getCourseId());
            if (course.isEmpty()) {
                continue;
            }
            Course c = course.get();
            List<Instructor> instructors = referenceData.qualifiedInstructors(c.getId());
            if (instructors.isEmpty()) {
                warn(diagnostics, "No qualified instructor for " + c.getId() + " (" + lecture.variableName() + ")");
                continue;
            }
            List<Room> rooms = referenceData.roomsOfType(c.requiredRoomType());
            if (rooms.isEmpty()) {
                warn(diagnostics, "No " + c.requiredRoomType() + " room for " + c.getId() + " (" + lecture.variableName() + ")");
                continue;
            }

            for (TimeSlot ts : timeslots) {
                for (Room room : rooms) {
                    for (Instructor instructor : instructors) {
                        if (!instructor.isAvailableOn(ts.getDay())) continue;
                        domain.add(new LectureSlot(ts.getId(), room.getId(), instructor.getId()));
                    }
                }
            }
            log.debug("{}: {} possible assignments", lecture.variableName(), domain.size());
        }
        return domains;
    }

    private void warn(List<String> diagnostics, String message) {
        log.warn(message);
        diagnostics.add(message);
    }
}
