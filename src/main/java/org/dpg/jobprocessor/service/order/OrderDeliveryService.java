package org.dpg.jobprocessor.service.order;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.exception.OrderNotReadyException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.Originator;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.InvoiceRepository;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether all patron deliverables of an order are ready, and if so whether the order can go
 * to the customer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderDeliveryService {

    public static final String JOB_NAME = "CheckOrderReadyForDelivery";

    private final OrderRepository orderRepository;
    private final UnitRepository unitRepository;
    private final InvoiceRepository invoiceRepository;
    private final JobStatusService jobStatusService;
    private final BackgroundJobRunner backgroundJobRunner;

    /**
     * Starts a standalone readiness check of an order.
     *
     * @return id of the check job.
     * @throws ResourceNotFoundException if the order does not exist.
     */
    public Long startCheck(final long orderId) {
        if (!orderRepository.existsById(orderId)) {
            throw new ResourceNotFoundException("order " + orderId + " not found");
        }
        final JobStatus job = jobStatusService.create(JOB_NAME, Originator.order(orderId));
        backgroundJobRunner.launch(job, running -> {
            jobStatusService.logInfo(running, "Start CheckOrderReadyForDelivery for order " + orderId);
            try {
                checkReadyForDelivery(running, orderId);
            } catch (final OrderNotReadyException e) {
                jobStatusService.logFatal(running, e.getMessage());
            }
        });
        return job.getId();
    }

    /**
     * Stamps the order's patron-deliverables-complete date once every deliverable unit is ready.
     * An order with unfinished units is not an error; the check just stops.
     *
     * @return true if the order is complete and may be delivered.
     * @throws OrderNotReadyException if the order is complete but not approved or has an unpaid fee.
     */
    public boolean checkReadyForDelivery(final JobStatus job, final long orderId) throws OrderNotReadyException {
        jobStatusService.logInfo(job, "Check if order " + orderId + " is ready for delivery");
        final Order order = orderRepository.findById(orderId)
                                           .orElseThrow(() -> new ResourceNotFoundException("Order " + orderId + " not found"));
        if (order.getDateCustomerNotified() != null) {
            jobStatusService.logError(job, "The date_customer_notified field on this order is filled out.  "
                    + "The order appears to have been delivered already.");
            return false;
        }

        final List<Long> unfinished = unitRepository.findByOrder_Id(orderId).stream()
                .filter(OrderDeliveryService::needsPatronDeliverables)
                .filter(unit -> unit.getDatePatronDeliverablesReady() == null)
                .map(Unit::getId)
                .collect(Collectors.toList());
        if (!unfinished.isEmpty()) {
            jobStatusService.logInfo(job, "Order is incomplete with units " + unfinished + " still unfinished");
            return false;
        }

        jobStatusService.logInfo(job, "Order is complete. Setting the date patron deliverables complete.");
        order.setDatePatronDeliverablesComplete(LocalDateTime.now());
        orderRepository.save(order);

        if (!order.isApproved()) {
            throw new OrderNotReadyException("Order does not have an order status of 'approved'.  Please correct before proceeding.");
        }
        if (hasUnpaidFee(order)) {
            throw new OrderNotReadyException("Order has an unpaid fee.");
        }
        jobStatusService.logInfo(job, "Order " + orderId + " has passed QA and is ready for delivery");
        return true;
    }

    private boolean hasUnpaidFee(final Order order) {
        if (order.isFeeWaived() || order.getFee() == null || order.getFee().compareTo(BigDecimal.ZERO) <= 0) {
            return false;
        }
        return !invoiceRepository.existsByOrderIdAndDateFeePaidIsNotNull(order.getId());
    }

    private static boolean needsPatronDeliverables(final Unit unit) {
        if (unit.getStatus() == UnitStatus.CANCELED) {
            return false;
        }
        return unit.getIntendedUse() == null || unit.getIntendedUse().getId() != IntendedUse.DIGITAL_COLLECTION_BUILDING;
    }
}
