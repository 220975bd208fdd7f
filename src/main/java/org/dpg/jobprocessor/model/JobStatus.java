package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One asynchronous operation. The row is written before any background work starts and is never
 * deleted; {@code endedAt} is set by the first terminal transition only.
 */
@Entity
@Table(name = "job_statuses")
@Data
public class JobStatus {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Embedded
    private Originator originator;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private JobState status;

    @Column(nullable = false)
    private int failures;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(nullable = false, updatable = false)
    private LocalDateTime startedAt;

    private LocalDateTime endedAt;
}
