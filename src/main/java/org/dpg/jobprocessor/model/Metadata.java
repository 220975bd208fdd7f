package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Descriptive metadata record a unit and its master files are attached to.
 */
@Entity
@Table(name = "metadata")
@Data
public class Metadata {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pid")
    private String pid;

    @Column(name = "type", nullable = false)
    private MetadataType type;

    private String title;

    private String creatorName;

    private String catalogKey;

    private String callNumber;

    private String barcode;

    private boolean isPersonalItem;

    private boolean isManuscript;

    private boolean isCollection;

    private Long parentMetadataId;

    private Long availabilityPolicyId;

    @ManyToOne
    @JoinColumn(name = "ocr_hint_id")
    private OcrHint ocrHint;

    private String ocrLanguageHint;

    private Long preservationTierId;

    private String collectionId;

    @Column(name = "external_uri")
    private String externalUri;

    @Column(name = "date_dl_ingest")
    private LocalDateTime dateDlIngest;

    @Column(name = "date_dl_update")
    private LocalDateTime dateDlUpdate;
}
