package io.github.riemr.slot.presentation.controller;

import io.github.riemr.slot.application.dto.ScheduleRequest;
import io.github.riemr.slot.application.dto.ScheduleResponse;
import io.github.riemr.slot.application.service.SchedulePlanService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/schedule")
@Slf4j
public class ScheduleController {
    private final SchedulePlanService schedulePlanService;

    public ScheduleController(SchedulePlanService schedulePlanService) {
        this.schedulePlanService = schedulePlanService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ScheduleResponse> schedule(@Valid @RequestBody ScheduleRequest req) {
        log.debug("Schedule request: tasks={}, horizonStart={}", req.getTasks().size(), req.getHorizonStart());
        return ResponseEntity.ok(schedulePlanService.plan(req));
    }
}
