package io.github.riemr.timetable.presentation.controller;

import io.github.riemr.timetable.application.dto.SolveRequest;
import io.github.riemr.timetable.application.dto.SolveStatusDto;
import io.github.riemr.timetable.application.dto.SolveTicket;
import io.github.riemr.timetable.application.dto.TimetableResultDto;
import io.github.riemr.timetable.optimization.service.TimetableSolveService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

@Controller
@RequiredArgsConstructor
@RequestMapping("/timetable")
@Slf4j
public class TimetableSolveController {

    private final TimetableSolveService service;

    // 同期実行: 探索が終わるまでブロックする
    @PostMapping("/api/solve")
    @ResponseBody
    public TimetableResultDto solve(@Valid @RequestBody SolveRequest req) {
        log.info("Starting timetable solve for sections={}, timeout={}s", req.sectionIds(), req.timeoutSeconds());
        return TimetableResultDto.from(service.solve(req));
    }

    @PostMapping("/api/solve/start")
    @ResponseBody
    public SolveTicket start(@Valid @RequestBody SolveRequest req) {
        log.info("Queueing timetable solve for sections={}", req.sectionIds());
        return service.startSolve(req);
    }

    @GetMapping("/api/solve/{id}/status")
    @ResponseBody
    public SolveStatusDto status(@PathVariable("id") String id) {
        return service.getStatus(id);
    }

    // 未完了・不明なチケットは 404
    @GetMapping("/api/solve/{id}/result")
    @ResponseBody
    public ResponseEntity<TimetableResultDto> result(@PathVariable("id") String id) {
        return service.fetchResult(id)
                .map(TimetableResultDto::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
