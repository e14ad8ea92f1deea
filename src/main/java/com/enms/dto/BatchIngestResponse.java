package com.enms.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Response for the reading batch endpoint.
 *
 * Tracks:
 * - accepted: new buckets stored
 * - deduped: identical re-deliveries ignored
 * - updated: existing buckets whose payload changed
 * - rejected: readings failing validation
 * - rejections: machine, timestamp and reason per rejected reading
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResponse {

    private int accepted;
    private int deduped;
    private int updated;
    private int rejected;

    @Builder.Default
    private List<RejectionDetail> rejections = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectionDetail {
        private String machineId;
        private Instant timestamp;
        private String reason;
    }
}
