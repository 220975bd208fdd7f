package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "ap_trust_submissions")
@Data
public class ApTrustSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "metadata_id", nullable = false, unique = true)
    private Long metadataId;

    private String bag;

    private LocalDateTime requestedAt;

    private LocalDateTime submittedAt;

    private LocalDateTime processedAt;

    private boolean success;
}
