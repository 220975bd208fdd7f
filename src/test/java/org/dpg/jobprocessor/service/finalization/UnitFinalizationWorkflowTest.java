package org.dpg.jobprocessor.service.finalization;

import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.exception.OcrException;
import org.dpg.jobprocessor.exception.OrderNotReadyException;
import org.dpg.jobprocessor.exception.PublicationException;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.deliverable.PatronDeliverableService;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.ocr.OcrService;
import org.dpg.jobprocessor.service.order.OrderDeliveryService;
import org.dpg.jobprocessor.service.project.ProjectCompletionValidator;
import org.dpg.jobprocessor.service.project.ProjectNotifier;
import org.dpg.jobprocessor.service.publish.DiscoveryPublishService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UnitFinalizationWorkflowTest {

    private static final long UNIT_ID = 42L;

    @Mock
    private UnitRepository unitRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private JobStatusService jobStatusService;
    @Mock
    private WorkDirectoryService workDirectoryService;
    @Mock
    private UnitQaService unitQaService;
    @Mock
    private FilesystemQaService filesystemQaService;
    @Mock
    private ImageImportService imageImportService;
    @Mock
    private OcrService ocrService;
    @Mock
    private DiscoveryPublishService discoveryPublishService;
    @Mock
    private PatronDeliverableService patronDeliverableService;
    @Mock
    private OrderDeliveryService orderDeliveryService;
    @Mock
    private ProjectCompletionValidator projectCompletionValidator;
    @Mock
    private ProjectNotifier projectNotifier;
    @Mock
    private FinalizationFailureHandler failureHandler;

    @InjectMocks
    private UnitFinalizationWorkflow workflow;

    @TempDir
    Path workDir;

    private JobStatus job;
    private Unit unit;
    private Order order;

    @BeforeEach
    void setUp() {
        job = new JobStatus();
        job.setId(1L);
        job.setName(UnitFinalizationService.JOB_NAME);
        job.setStartedAt(LocalDateTime.now());

        order = new Order();
        order.setId(9L);
        final Metadata metadata = new Metadata();
        metadata.setId(17L);
        metadata.setType(MetadataType.SIRSI);
        final IntendedUse use = new IntendedUse();
        use.setId(106L);

        unit = new Unit();
        unit.setId(UNIT_ID);
        unit.setOrder(order);
        unit.setMetadata(metadata);
        unit.setIntendedUse(use);
        unit.setStatus(UnitStatus.FINALIZING);
    }

    @Test
    void missingDirectoryFailsUnitBeforeAnyPhase() {
        // given
        final Path missing = workDir.resolve("000000042");
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(missing);

        // when
        workflow.run(job, UNIT_ID, UnitStatus.APPROVED);

        // then
        verify(failureHandler).failUnit(job, UNIT_ID, "Finalization directory " + missing + " does not exist.");
        verifyNoInteractions(unitQaService, filesystemQaService, imageImportService);
    }

    @Test
    void filesystemQaFailureStopsBeforeImport() throws Exception {
        // given
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(workDir);
        when(unitRepository.findById(UNIT_ID)).thenReturn(Optional.of(unit));
        doThrow(new FinalizationException("Filesystem QA failed with 2 errors"))
                .when(filesystemQaService).qaFilesystem(job, UNIT_ID, workDir);

        // when
        workflow.run(job, UNIT_ID, UnitStatus.ERROR);

        // then
        verify(failureHandler).failUnit(job, UNIT_ID, "Filesystem QA failed with 2 errors");
        verifyNoInteractions(imageImportService, projectNotifier);
        verify(unitRepository, never()).updateStatus(anyLong(), eq(UnitStatus.DONE));
        verify(jobStatusService).logInfo(job, "Restart finalization of unit 42");
    }

    @Test
    void approvedUnitRunsPhasesInOrderAndFinishes() throws Exception {
        // given
        final List<StagedImage> images = List.of(new StagedImage(workDir.resolve("000000042_0001.tif"),
                                                                 "000000042_0001.tif", 2_000_000L));
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(workDir);
        when(unitRepository.findById(UNIT_ID)).thenReturn(Optional.of(unit));
        when(filesystemQaService.listImages(workDir, UNIT_ID)).thenReturn(images);
        when(orderDeliveryService.checkReadyForDelivery(job, 9L)).thenReturn(true);

        // when
        workflow.run(job, UNIT_ID, UnitStatus.APPROVED);

        // then
        final InOrder inOrder = inOrder(unitQaService, filesystemQaService, imageImportService,
                                        patronDeliverableService, orderDeliveryService, projectCompletionValidator,
                                        unitRepository, projectNotifier, workDirectoryService);
        inOrder.verify(unitQaService).qaUnit(job, unit);
        inOrder.verify(filesystemQaService).qaFilesystem(job, UNIT_ID, workDir);
        inOrder.verify(imageImportService).importImages(job, unit, images);
        inOrder.verify(patronDeliverableService).generateUnitDeliverables(job, unit, images);
        inOrder.verify(orderDeliveryService).checkReadyForDelivery(job, 9L);
        inOrder.verify(projectCompletionValidator).validate(job, unit);
        inOrder.verify(unitRepository).updateStatus(UNIT_ID, UnitStatus.DONE);
        inOrder.verify(projectNotifier).finalizationSucceeded(eq(job), eq(UNIT_ID), anyLong());
        inOrder.verify(workDirectoryService).cleanup(job, UNIT_ID);

        verify(jobStatusService).logInfo(job, "Start finalization of unit 42");
        verify(orderRepository).save(order);
        verifyNoInteractions(ocrService, discoveryPublishService, failureHandler);
    }

    @Test
    void digitalCollectionUnitSkipsPatronDeliverablesAndPublishes() throws Exception {
        // given
        unit.getIntendedUse().setId(IntendedUse.DIGITAL_COLLECTION_BUILDING);
        unit.setIncludeInDl(true);
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(workDir);
        when(unitRepository.findById(UNIT_ID)).thenReturn(Optional.of(unit));
        when(filesystemQaService.listImages(workDir, UNIT_ID)).thenReturn(List.of());

        // when
        workflow.run(job, UNIT_ID, UnitStatus.ERROR);

        // then
        verify(discoveryPublishService).publish(job, unit.getMetadata());
        verifyNoInteractions(patronDeliverableService, orderDeliveryService, orderRepository);
        verify(unitRepository).updateStatus(UNIT_ID, UnitStatus.DONE);
    }

    @Test
    void unsupportedMetadataTypeFlaggedForDlIsPublishedAndItsErrorIsNotFatal() throws Exception {
        // given
        unit.getMetadata().setType(MetadataType.EXTERNAL);
        unit.setIncludeInDl(true);
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(workDir);
        when(unitRepository.findById(UNIT_ID)).thenReturn(Optional.of(unit));
        when(filesystemQaService.listImages(workDir, UNIT_ID)).thenReturn(List.of());
        doThrow(new PublicationException("Metadata 17 type ExternalMetadata is not supported for publication"))
                .when(discoveryPublishService).publish(job, unit.getMetadata());

        // when
        workflow.run(job, UNIT_ID, UnitStatus.ERROR);

        // then
        verify(discoveryPublishService).publish(job, unit.getMetadata());
        verify(jobStatusService, never()).logInfo(eq(job), contains("is not published to Virgo"));
        verify(unitRepository).updateStatus(UNIT_ID, UnitStatus.DONE);
        verifyNoInteractions(failureHandler);
    }

    @Test
    void ocrAndOrderProblemsAreLoggedNotFatal() throws Exception {
        // given
        unit.setOcrMasterFiles(true);
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(workDir);
        when(unitRepository.findById(UNIT_ID)).thenReturn(Optional.of(unit));
        when(filesystemQaService.listImages(workDir, UNIT_ID)).thenReturn(List.of());
        doThrow(new OcrException("ocr request failed 503:unavailable")).when(ocrService).requestUnitOcr(job, unit);
        when(orderDeliveryService.checkReadyForDelivery(any(), anyLong()))
                .thenThrow(new OrderNotReadyException("Order has an unpaid fee."));

        // when
        workflow.run(job, UNIT_ID, UnitStatus.ERROR);

        // then
        verify(jobStatusService).logError(job, "Unable to OCR unit: ocr request failed 503:unavailable");
        verify(jobStatusService).logError(job, "Order has an unpaid fee.");
        verify(unitRepository).updateStatus(UNIT_ID, UnitStatus.DONE);
        verifyNoInteractions(failureHandler);
    }

    @Test
    void validationFailureLeavesUnitUnfinished() throws Exception {
        // given
        when(workDirectoryService.finalizationDir(UNIT_ID)).thenReturn(workDir);
        when(unitRepository.findById(UNIT_ID)).thenReturn(Optional.of(unit));
        when(filesystemQaService.listImages(workDir, UNIT_ID)).thenReturn(List.of());
        doThrow(new FinalizationException("Unit was not archived"))
                .when(projectCompletionValidator).validate(job, unit);

        // when
        workflow.run(job, UNIT_ID, UnitStatus.ERROR);

        // then
        verify(failureHandler).failUnit(job, UNIT_ID, "Unit was not archived");
        verify(unitRepository, never()).updateStatus(UNIT_ID, UnitStatus.DONE);
        verify(workDirectoryService, never()).cleanup(any(), anyLong());
    }
}
