package com.enms.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Training window [start, end) and driver names for a new baseline.
 * The driver count is checked by the trainer so the caller gets INSUFFICIENT_DRIVERS.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class TrainBaselineRequest {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    @NotNull(message = "start is required")
    private Instant start;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    @NotNull(message = "end is required")
    private Instant end;

    @Builder.Default
    private List<String> drivers = new ArrayList<>();

    // activate the new model right away when the machine has none
    private boolean activateIfFirst;
}
