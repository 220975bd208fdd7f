package org.dpg.jobprocessor.service.finalization;

import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.OcrHint;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.catalog.CatalogMetadataService;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnitQaServiceTest {

    @Mock
    private JobStatusService jobStatusService;
    @Mock
    private CatalogMetadataService catalogMetadataService;
    @Mock
    private UnitRepository unitRepository;
    @Mock
    private MetadataRepository metadataRepository;
    @Mock
    private OrderRepository orderRepository;

    @InjectMocks
    private UnitQaService unitQaService;

    private final JobStatus job = new JobStatus();
    private Unit unit;
    private Metadata metadata;
    private Order order;

    @BeforeEach
    void setUp() {
        job.setId(3L);

        final OcrHint hint = new OcrHint();
        hint.setId(1L);
        hint.setOcrCandidate(true);

        metadata = new Metadata();
        metadata.setId(17L);
        metadata.setType(MetadataType.XML);
        metadata.setOcrHint(hint);
        metadata.setOcrLanguageHint("eng");

        order = new Order();
        order.setId(9L);
        order.setDateOrderApproved(LocalDateTime.now().minusDays(2));

        final IntendedUse use = new IntendedUse();
        use.setId(106L);

        unit = new Unit();
        unit.setId(42L);
        unit.setOrder(order);
        unit.setMetadata(metadata);
        unit.setIntendedUse(use);
    }

    @Test
    void validUnitPasses() throws Exception {
        // when
        unitQaService.qaUnit(job, unit);

        // then
        verify(jobStatusService).logInfo(job, "Unit QA tests passed");
        verify(jobStatusService, never()).logError(eq(job), anyString());
    }

    @Test
    void everyProblemIsLoggedBeforeFailing() {
        // given
        unit.setIntendedUse(null);
        unit.setIncludeInDl(true);
        unit.setThrowAway(true);
        metadata.setOcrHint(null);

        // when / then
        assertThatThrownBy(() -> unitQaService.qaUnit(job, unit))
                .isInstanceOf(FinalizationException.class)
                .hasMessage(UnitQaService.QA_FAILED);
        verify(jobStatusService).logError(job, "Availability policy must be set for all units flagged for inclusion in the DL");
        verify(jobStatusService).logError(job, "Unit has no intended use.  All units that participate in this workflow must have an intended use.");
        verify(jobStatusService).logError(job, "Unit metadata 17 has no OCR Hint. This is a required setting.");
        verify(jobStatusService).logError(job, "Throw away units cannot be flagged for publication to the DL.");
    }

    @Test
    void ocrFlagNeedsCandidateAndLanguage() {
        // given
        unit.setOcrMasterFiles(true);
        metadata.getOcrHint().setOcrCandidate(false);
        metadata.setOcrLanguageHint("");

        // when / then
        assertThatThrownBy(() -> unitQaService.qaUnit(job, unit)).isInstanceOf(FinalizationException.class);
        verify(jobStatusService).logError(job, "Unit is flagged to perform OCR, but the metadata setting indicates OCR is not possible.");
        verify(jobStatusService).logError(job, "Unit is flagged to perform OCR, but the required language hint for metadata 17 is not set");
    }

    @Test
    void missingMetadataFailsImmediately() {
        // given
        unit.setMetadata(null);

        // when / then
        assertThatThrownBy(() -> unitQaService.qaUnit(job, unit))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("Unit is not assigned to a metadata record");
    }

    @Test
    void unapprovedOrderIsApproved() throws Exception {
        // given
        order.setDateOrderApproved(null);

        // when
        unitQaService.qaUnit(job, unit);

        // then
        assertThat(order.getOrderStatus()).isEqualTo(Order.STATUS_APPROVED);
        assertThat(order.getDateOrderApproved()).isNotNull();
        verify(orderRepository).save(order);
    }

    @Test
    void itemPublishedIn1922IsFlaggedForDigitalLibrary() {
        // given
        givenAutoPublishCandidate();
        when(catalogMetadataService.publicationYear(metadata)).thenReturn(1922);

        // when
        unitQaService.autoPublish(job, unit);

        // then
        assertThat(unit.isIncludeInDl()).isTrue();
        assertThat(metadata.getAvailabilityPolicyId()).isEqualTo(1L);
        verify(metadataRepository).save(metadata);
        verify(unitRepository).flagForDigitalLibrary(42L);
    }

    @Test
    void itemPublishedIn1923IsNotFlagged() {
        // given
        givenAutoPublishCandidate();
        when(catalogMetadataService.publicationYear(metadata)).thenReturn(1923);

        // when
        unitQaService.autoPublish(job, unit);

        // then
        assertThat(unit.isIncludeInDl()).isFalse();
        verify(unitRepository, never()).flagForDigitalLibrary(anyLong());
    }

    @Test
    void undatedItemIsNotFlagged() {
        // given
        givenAutoPublishCandidate();
        when(catalogMetadataService.publicationYear(metadata)).thenReturn(0);

        // when
        unitQaService.autoPublish(job, unit);

        // then
        verify(unitRepository, never()).flagForDigitalLibrary(anyLong());
    }

    @Test
    void partialScanIsNeverAutoPublished() {
        // given
        givenAutoPublishCandidate();
        unit.setCompleteScan(false);

        // when
        unitQaService.autoPublish(job, unit);

        // then
        verify(jobStatusService).logInfo(job, "Unit is not a complete scan and cannot be auto-published");
        verify(unitRepository, never()).flagForDigitalLibrary(anyLong());
    }

    private void givenAutoPublishCandidate() {
        unit.setCompleteScan(true);
        metadata.setType(MetadataType.SIRSI);
        metadata.setCatalogKey("u123456");
    }
}
