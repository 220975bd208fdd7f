package org.dpg.jobprocessor.service.finalization;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.catalog.CatalogMetadataService;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

/**
 * Validates the settings of a unit before finalization touches any file. All checks run; each
 * failure is logged as a job error and the unit fails QA once at the end.
 * <p>
 * Two checks have side effects: a public-domain candidate is flagged for the digital library, and an
 * order that is not yet approved is approved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UnitQaService {

    static final String QA_FAILED = "Unit has failed the QA Unit Data Processor";

    /**
     * Items published before this year are treated as public domain.
     */
    static final int PUBLIC_DOMAIN_YEAR = 1923;

    private static final long DEFAULT_AVAILABILITY_POLICY = 1L;

    private final JobStatusService jobStatusService;
    private final CatalogMetadataService catalogMetadataService;
    private final UnitRepository unitRepository;
    private final MetadataRepository metadataRepository;
    private final OrderRepository orderRepository;

    public void qaUnit(final JobStatus job, final Unit unit) throws FinalizationException {
        jobStatusService.logInfo(job, "QA unit data");

        jobStatusService.logInfo(job, "Verify metadata");
        final Metadata metadata = unit.getMetadata();
        if (metadata == null) {
            throw new FinalizationException("Unit is not assigned to a metadata record");
        }

        jobStatusService.logInfo(job, "Verify DL settings");
        if (!unit.isIncludeInDl() && !unit.isReorder()) {
            autoPublish(job, unit);
        }

        boolean hasFailures = false;
        jobStatusService.logInfo(job, "Verify availability policy");
        if (unit.isIncludeInDl() && metadata.getAvailabilityPolicyId() == null
                && metadata.getType() != MetadataType.EXTERNAL) {
            jobStatusService.logError(job, "Availability policy must be set for all units flagged for inclusion in the DL");
            hasFailures = true;
        }

        jobStatusService.logInfo(job, "Verify intended use");
        if (unit.getIntendedUse() == null) {
            jobStatusService.logError(job, "Unit has no intended use.  All units that participate in this workflow must have an intended use.");
            hasFailures = true;
        }

        jobStatusService.logInfo(job, "Verify OCR settings");
        if (metadata.getOcrHint() == null) {
            jobStatusService.logError(job, "Unit metadata " + metadata.getId() + " has no OCR Hint. This is a required setting.");
            hasFailures = true;
        } else if (unit.isOcrMasterFiles()) {
            if (!metadata.getOcrHint().isOcrCandidate()) {
                jobStatusService.logError(job, "Unit is flagged to perform OCR, but the metadata setting indicates OCR is not possible.");
                hasFailures = true;
            }
            if (!StringUtils.hasText(metadata.getOcrLanguageHint())) {
                jobStatusService.logError(job, "Unit is flagged to perform OCR, but the required language hint for metadata "
                        + metadata.getId() + " is not set");
                hasFailures = true;
            }
        }

        if (unit.isIncludeInDl() && unit.isThrowAway()) {
            jobStatusService.logError(job, "Throw away units cannot be flagged for publication to the DL.");
            hasFailures = true;
        }

        jobStatusService.logInfo(job, "Verify order status");
        if (!approveOrder(job, unit.getOrder())) {
            hasFailures = true;
        }

        if (hasFailures) {
            throw new FinalizationException(QA_FAILED);
        }
        jobStatusService.logInfo(job, "Unit QA tests passed");
    }

    /**
     * Flags a complete scan of a published, pre-1923 catalog item for the digital library.
     */
    void autoPublish(final JobStatus job, final Unit unit) {
        jobStatusService.logInfo(job, "Checking unit for auto-publish");
        final Metadata metadata = unit.getMetadata();
        if (!unit.isCompleteScan()) {
            jobStatusService.logInfo(job, "Unit is not a complete scan and cannot be auto-published");
            return;
        }
        if (metadata.isManuscript() || metadata.isPersonalItem()) {
            jobStatusService.logInfo(job, "Unit is for a manuscript or personal item and cannot be auto-published");
            return;
        }
        if (metadata.getType() != MetadataType.SIRSI) {
            jobStatusService.logInfo(job, "Unit metadata is not from Sirsi and cannot be auto-published");
            return;
        }

        final int publicationYear = catalogMetadataService.publicationYear(metadata);
        if (publicationYear == 0 || publicationYear >= PUBLIC_DOMAIN_YEAR) {
            jobStatusService.logInfo(job, "Unit has no date or a date after " + PUBLIC_DOMAIN_YEAR
                    + " and cannot be auto-published");
            return;
        }

        jobStatusService.logInfo(job, "Unit is a candidate for auto-publishing");
        if (metadata.getAvailabilityPolicyId() == null) {
            metadata.setAvailabilityPolicyId(DEFAULT_AVAILABILITY_POLICY);
            metadataRepository.save(metadata);
        }
        unitRepository.flagForDigitalLibrary(unit.getId());
        unit.setIncludeInDl(true);
    }

    private boolean approveOrder(final JobStatus job, final Order order) {
        if (order.getDateOrderApproved() != null) {
            return true;
        }
        jobStatusService.logInfo(job, "Order " + order.getId() + " is not marked as approved. Since this unit is "
                + "undergoing finalization, the workflow has automatically changed the status to approved.");
        order.setOrderStatus(Order.STATUS_APPROVED);
        order.setDateOrderApproved(LocalDateTime.now());
        try {
            orderRepository.save(order);
            return true;
        } catch (final RuntimeException e) {
            log.error("Unable to approve order {}", order.getId(), e);
            jobStatusService.logError(job, "Unable to approve order: " + e.getMessage());
            return false;
        }
    }
}
