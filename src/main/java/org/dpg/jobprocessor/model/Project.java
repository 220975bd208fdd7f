package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Digitization workflow wrapper around one unit, tracked by the project tracker.
 */
@Entity
@Table(name = "projects")
@Data
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "unit_id", nullable = false)
    private Long unitId;

    private LocalDateTime finishedAt;

    @Column(columnDefinition = "TEXT")
    private String failureReason;

    private Integer totalDurationMins;
}
