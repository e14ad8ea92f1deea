package com.enms.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A monitored machine. Owned by asset management; the analytics core only
 * reads the active flag to decide which machines the scheduler visits.
 */
@Entity
@Table(name = "machines")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Machine {

    @Id
    @Column(length = 50)
    private String id;

    @Column(length = 100)
    private String name;

    /**
     * Free-form type tag, e.g. "compressor", "boiler", "hvac".
     */
    @Column(length = 50)
    private String type;

    @Column(nullable = false)
    private boolean active;
}
