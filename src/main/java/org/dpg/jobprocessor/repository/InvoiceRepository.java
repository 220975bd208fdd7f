package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    boolean existsByOrderIdAndDateFeePaidIsNotNull(Long orderId);
}
