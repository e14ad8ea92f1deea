package com.enms.dto;

import com.enms.source.Reading;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
public class ScoreReadingRequest {

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    @NotNull(message = "consumption is required")
    private Double consumption;

    @Builder.Default
    private Map<String, Double> drivers = new HashMap<>();

    public Reading toReading() {
        return new Reading(timestamp, drivers, consumption);
    }
}
