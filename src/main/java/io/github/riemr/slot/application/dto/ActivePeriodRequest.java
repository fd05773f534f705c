package io.github.riemr.slot.application.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivePeriodRequest {
    @NotNull
    private LocalDateTime start;
    @NotNull
    private LocalDateTime end;
}
