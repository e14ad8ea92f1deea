package com.enms.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One bucket of consumption and driver values as delivered by a meter gateway.
 */
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class ReadingDTO {

    @NotBlank(message = "machineId is required")
    private String machineId;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    @NotNull(message = "consumption is required")
    private Double consumption;

    // driver name -> value; a driver not measured in this bucket is omitted
    @Builder.Default
    private Map<String, Double> drivers = new HashMap<>();
}
