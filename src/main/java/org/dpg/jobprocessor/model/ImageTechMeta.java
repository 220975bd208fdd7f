package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "image_tech_meta")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageTechMeta {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "master_file_id", nullable = false)
    private Long masterFileId;

    private String imageFormat;
    private int width;
    private int height;
    private int resolution;
    private String colorSpace;
    private int depth;
    private String compression;
    private String colorProfile;
    private String equipment;
    private String software;
    private String model;
    private String exifVersion;
    private LocalDateTime captureDate;
    @Column(name = "iso")
    private int iso;
    private String exposureBias;
    private String exposureTime;
    private String aperture;
    private double focalLength;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
