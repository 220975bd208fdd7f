package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "ocr_hints")
@Data
public class OcrHint {

    @Id
    private Long id;

    private String name;

    private boolean ocrCandidate;
}
