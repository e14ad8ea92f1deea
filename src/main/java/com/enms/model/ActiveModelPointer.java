package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * The single "current active model" record per machine. Scorers resolve the
 * active baseline through this row; activation swaps replace modelId with a
 * compare-and-swap update so a reader sees either the old or the new model.
 */
@Entity
@Table(name = "active_model_pointers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveModelPointer {

    @Id
    @Column(length = 50)
    private String machineId;

    @Column(nullable = false)
    private UUID modelId;

    @Column(nullable = false)
    private Instant updatedAt;
}
