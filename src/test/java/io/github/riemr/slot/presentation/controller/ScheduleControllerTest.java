package io.github.riemr.slot.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.slot.application.service.SchedulePlanService;
import io.github.riemr.slot.config.SlotPlannerSettings;
import io.github.riemr.slot.optimization.service.SlotScheduleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ScheduleController.class)
@AutoConfigureMockMvc(addFilters = false)
class ScheduleControllerTest {

    @SpringBootConfiguration
    @Import({ScheduleController.class, GlobalExceptionHandler.class, SchedulePlanService.class, SlotScheduleService.class})
    static class TestApplication {
        @Bean
        SlotPlannerSettings slotPlannerSettings() {
            return SlotPlannerSettings.defaults();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-03-30T09:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    private static Map<String, Object> task(String id, Object durationSlots, String start, String due, int priority) {
        var t = new LinkedHashMap<String, Object>();
        t.put("id", id);
        if (durationSlots != null) t.put("durationSlots", durationSlots);
        t.put("start", start);
        t.put("due", due);
        t.put("priority", priority);
        return t;
    }

    private static Map<String, Object> workedRequest() {
        var req = new LinkedHashMap<String, Object>();
        req.put("horizonStart", "2024-03-30T09:00:00");
        req.put("rngSeed", 1);
        req.put("slotLength", "PT1H");
        req.put("activePeriods", List.of(Map.of("start", "2024-03-30T09:00:00", "end", "2024-03-30T19:00:00")));
        req.put("tasks", List.of(
                task("A", 7, "2024-03-30T09:00:00", "2024-03-30T19:00:00", 1),
                task("B", 1, "2024-03-30T13:00:00", "2024-03-30T15:00:00", 2),
                task("C", 3, "2024-03-30T14:00:00", "2024-03-30T19:00:00", 3)));
        return req;
    }

    @Test
    void schedule_returnsSlotsAndStatuses() throws Exception {
        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(workedRequest())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.slots", hasSize(10)))
                .andExpect(jsonPath("$.slots[0].index").value(0))
                .andExpect(jsonPath("$.tasks[0].status").value("SATISFIED"))
                .andExpect(jsonPath("$.tasks[0].slotIndices", hasSize(7)))
                .andExpect(jsonPath("$.tasks[2].status").value("UNSCHEDULABLE"))
                .andExpect(jsonPath("$.tasks[2].shortfall").value(1))
                .andExpect(jsonPath("$.unschedulableTaskIds[0]").value("C"));
    }

    @Test
    void schedule_returns400_whenTaskHasNoLength() throws Exception {
        var req = workedRequest();
        req.put("tasks", List.of(task("A", null, "2024-03-30T09:00:00", "2024-03-30T19:00:00", 1)));

        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Task A: durationSlots or estimatedLength is required"));
    }

    @Test
    void schedule_returns400_whenDueBeforeStart() throws Exception {
        var req = workedRequest();
        req.put("tasks", List.of(task("A", 1, "2024-03-30T12:00:00", "2024-03-30T10:00:00", 1)));

        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("precedes start")));
    }

    @Test
    void schedule_returns400_whenTasksMissing() throws Exception {
        var req = workedRequest();
        req.put("tasks", List.of());

        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("tasks")));
    }

    @Test
    void schedule_returns400_whenTaskFieldsInvalid() throws Exception {
        var req = workedRequest();
        req.put("tasks", List.of(task("", 0, "2024-03-30T09:00:00", "2024-03-30T19:00:00", 1)));

        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("tasks[0].durationSlots")))
                .andExpect(jsonPath("$.error", containsString("tasks[0].id")));
    }

    @Test
    void schedule_returns400_whenBodyIsNotJson() throws Exception {
        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void schedule_returns400_whenActivePeriodEntryIsNull() throws Exception {
        String body = """
                {"activePeriods":[null],
                 "tasks":[{"id":"A","durationSlots":1,"start":"2024-03-30T09:00:00","due":"2024-03-30T10:00:00"}]}
                """;

        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("activePeriods")));
    }

    @Test
    void schedule_returns400_whenTaskEntryIsNull() throws Exception {
        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tasks\":[null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("tasks")));
    }

    @Test
    void schedule_returns400_whenEstimateOverflowsSlotCount() throws Exception {
        var req = workedRequest();
        req.put("slotLength", "PT1S");
        var task = task("A", null, "2024-03-30T09:00:00", "2024-03-30T19:00:00", 1);
        task.put("estimatedLength", "PT100000000H");
        req.put("tasks", List.of(task));

        mockMvc.perform(post("/api/schedule")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Task duration too large")));
    }
}
