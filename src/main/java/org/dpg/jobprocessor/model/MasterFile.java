package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * One archived page image of a unit.
 */
@Entity
@Table(name = "master_files")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MasterFile {

    public static final String PID_PREFIX = "tsm:";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pid")
    private String pid;

    @Column(name = "unit_id", nullable = false)
    private Long unitId;

    @Column(name = "metadata_id")
    private Long metadataId;

    @Column(nullable = false)
    private String filename;

    private String title;

    private String description;

    private long filesize;

    @Column(name = "md5")
    private String md5;

    @Column(columnDefinition = "TEXT")
    private String transcriptionText;

    private LocalDateTime dateArchived;

    @Column(name = "date_dl_ingest")
    private LocalDateTime dateDlIngest;

    @Column(name = "date_dl_update")
    private LocalDateTime dateDlUpdate;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public static String pidFor(final long masterFileId) {
        return PID_PREFIX + masterFileId;
    }
}
