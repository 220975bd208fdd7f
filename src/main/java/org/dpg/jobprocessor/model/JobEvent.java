package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * One append-only log line of a job.
 */
@Entity
@Table(name = "events")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_status_id", nullable = false, updatable = false)
    private Long jobStatusId;

    @Enumerated(EnumType.ORDINAL)
    @Column(nullable = false, updatable = false)
    private EventLevel level;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String text;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
