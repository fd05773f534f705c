package io.github.riemr.slot.application.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
public class ScheduleRequest {
    private LocalDateTime horizonStart; // optional, defaults to now
    private Long rngSeed;               // optional, fixed seed for reproducible layouts
    private Duration slotLength;        // optional, overrides slot.planner.slot-length

    @Valid
    private List<@NotNull ActivePeriodRequest> activePeriods = new ArrayList<>();

    @NotEmpty
    @Valid
    private List<@NotNull TaskRequest> tasks = new ArrayList<>();
}
