package io.github.riemr.timetable.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.timetable.application.dto.SolveRequest;
import io.github.riemr.timetable.application.dto.SolveStatusDto;
import io.github.riemr.timetable.application.dto.SolveTicket;
import io.github.riemr.timetable.domain.InvalidProblemException;
import io.github.riemr.timetable.optimization.service.TimetableSolveService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TimetableSolveController.class)
@AutoConfigureMockMvc(addFilters = false)
class TimetableSolveControllerTest {

    @SpringBootConfiguration
    @Import({TimetableSolveController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    TimetableSolveService service;

    @BeforeEach
    void setup() {
        Mockito.reset(service);
    }

    private Map<String, Object> body() {
        var req = new LinkedHashMap<String, Object>();
        req.put("courses", List.of(Map.of("id", "C1", "name", "Algorithms", "credits", 3, "type", "Lecture")));
        req.put("instructors", List.of(Map.of("id", "P1", "name", "Dr. A", "role", "Professor",
                "unavailableDay", "Friday", "qualifiedCourses", List.of("C1"))));
        req.put("rooms", List.of(Map.of("id", "R101", "type", "Lecture", "capacity", 40)));
        req.put("timeslots", List.of(Map.of("id", "TS0", "day", "Monday", "position", 0,
                "startTime", "09:00", "endTime", "10:20")));
        req.put("sections", List.of(Map.of("id", "S1", "studentCount", 30, "courseIds", List.of("C1"))));
        req.put("timeoutSeconds", 5);
        return req;
    }

    @Test
    void start_returnsTicket_andParsesMasters() throws Exception {
        when(service.startSolve(any(SolveRequest.class))).thenReturn(new SolveTicket("t-1"));

        mockMvc.perform(post("/timetable/api/solve/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.ticketId").value("t-1"));

        ArgumentCaptor<SolveRequest> captor = ArgumentCaptor.forClass(SolveRequest.class);
        verify(service, times(1)).startSolve(captor.capture());
        SolveRequest sent = captor.getValue();
        assertThat(sent.timeoutSeconds()).isEqualTo(5L);
        assertThat(sent.instructors().get(0).getUnavailableDay()).isEqualTo(java.time.DayOfWeek.FRIDAY);
        assertThat(sent.rooms().get(0).getType()).isEqualTo(io.github.riemr.timetable.domain.model.RoomType.LECTURE);
        assertThat(sent.sections().get(0).getCourseIds()).containsExactly("C1");
    }

    @Test
    void start_returns400_whenTableMissing() throws Exception {
        var req = body();
        req.remove("rooms");

        mockMvc.perform(post("/timetable/api/solve/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("rooms is invalid"));
        verifyNoInteractions(service);
    }

    @Test
    void solve_returns400_whenProblemInvalid() throws Exception {
        when(service.solve(any(SolveRequest.class)))
                .thenThrow(new InvalidProblemException("no lectures to schedule for sections []"));

        mockMvc.perform(post("/timetable/api/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("no lectures to schedule for sections []"));
    }

    @Test
    void status_delegatesToService() throws Exception {
        when(service.getStatus("t-1")).thenReturn(new SolveStatusDto("SOLVING", 40, 1000L, "探索中", 2, 5, 300L));

        mockMvc.perform(get("/timetable/api/solve/{id}/status", "t-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SOLVING"))
                .andExpect(jsonPath("$.progress").value(40))
                .andExpect(jsonPath("$.assignedCount").value(2));
    }

    @Test
    void result_returns404_untilFinished() throws Exception {
        when(service.fetchResult("t-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/timetable/api/solve/{id}/result", "t-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void start_returns400_whenBodyIsNotJson() throws Exception {
        mockMvc.perform(post("/timetable/api/solve/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("malformed request body"));
        verifyNoInteractions(service);
    }

    @Test
    void unexpectedFailure_returns500() throws Exception {
        when(service.getStatus("boom")).thenThrow(new IllegalStateException("broken"));

        mockMvc.perform(get("/timetable/api/solve/{id}/status", "boom"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal Server Error"))
                .andExpect(jsonPath("$.exceptionType").value("IllegalStateException"));
    }
}
