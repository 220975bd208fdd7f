package org.dpg.jobprocessor.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "orders")
@Data
public class Order {

    public static final String STATUS_APPROVED = "approved";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String orderStatus;

    private BigDecimal fee;

    private boolean feeWaived;

    private LocalDateTime dateOrderApproved;

    private LocalDateTime dateFinalizationBegun;

    private LocalDateTime dateArchivingComplete;

    private LocalDateTime datePatronDeliverablesComplete;

    private LocalDateTime dateCustomerNotified;

    @Transient
    public boolean isApproved() {
        return STATUS_APPROVED.equals(orderStatus);
    }
}
