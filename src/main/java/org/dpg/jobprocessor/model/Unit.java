package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * One batch of scanned pages. Only the finalization workflow and its sibling endpoints change it.
 */
@Entity
@Table(name = "units")
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Unit {

    @Id
    @ToString.Include
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @ManyToOne
    @JoinColumn(name = "metadata_id")
    private Metadata metadata;

    @ManyToOne
    @JoinColumn(name = "intended_use_id")
    private IntendedUse intendedUse;

    @ToString.Include
    @Column(name = "unit_status", nullable = false)
    private UnitStatus status;

    @Column(name = "include_in_dl")
    private boolean includeInDl;

    private boolean removeWatermark;

    private boolean reorder;

    private boolean completeScan;

    private boolean throwAway;

    @Column(name = "ocr_master_files")
    private boolean ocrMasterFiles;

    private int masterFilesCount;

    private LocalDateTime dateArchived;

    private LocalDateTime datePatronDeliverablesReady;

    @Column(name = "date_dl_deliverables_ready")
    private LocalDateTime dateDlDeliverablesReady;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Transient
    public boolean isDigitalCollectionBuilding() {
        return intendedUse != null && IntendedUse.DIGITAL_COLLECTION_BUILDING == intendedUse.getId();
    }
}
