package io.github.riemr.slot.application.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRequest {
    @NotBlank
    private String id;

    // Either durationSlots, or estimatedLength (minus workedLength) rounded up to whole slots
    @Min(1)
    private Integer durationSlots;
    private Duration estimatedLength;
    private Duration workedLength;

    @NotNull
    private LocalDateTime start;
    @NotNull
    private LocalDateTime due;

    private Integer priority;
}
