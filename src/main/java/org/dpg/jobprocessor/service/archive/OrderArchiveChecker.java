package org.dpg.jobprocessor.service.archive;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Stamps an order's archiving-complete date once its last non-canceled unit has been archived.
 * <p>
 * Two units of one order finishing at the same moment may both see a zero count; both then stamp
 * the date, which is harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderArchiveChecker {

    private final UnitRepository unitRepository;
    private final OrderRepository orderRepository;
    private final JobStatusService jobStatusService;

    /**
     * @return true if every unit of the order is now archived.
     */
    public boolean checkOrderArchiveComplete(@Nullable final JobStatus job, final long orderId) {
        jobStatusService.logInfo(job, "Check if all units in order " + orderId + " are archived");
        final long remaining;
        try {
            remaining = unitRepository.countNotArchived(orderId, UnitStatus.CANCELED);
        } catch (final RuntimeException e) {
            log.error("Counting unarchived units of order {} failed", orderId, e);
            jobStatusService.logError(job, "Unable to determine if all units archived: " + e.getMessage());
            return false;
        }
        if (remaining > 0) {
            log.debug("Order {} still has {} unarchived units", orderId, remaining);
            return false;
        }

        orderRepository.findById(orderId).ifPresent(order -> {
            order.setDateArchivingComplete(LocalDateTime.now());
            orderRepository.save(order);
        });
        jobStatusService.logInfo(job, "All units in order " + orderId + " are archived.");
        return true;
    }
}
