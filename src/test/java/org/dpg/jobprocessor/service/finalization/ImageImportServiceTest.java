package org.dpg.jobprocessor.service.finalization;

import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.exception.ExtractionException;
import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.model.ImageTechMeta;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.ImageTechMetaRepository;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.archive.ArchiveStore;
import org.dpg.jobprocessor.service.archive.FileSystemArchiveStore;
import org.dpg.jobprocessor.service.archive.OrderArchiveChecker;
import org.dpg.jobprocessor.service.catalog.CatalogMetadataService;
import org.dpg.jobprocessor.service.deliverable.PatronDeliverableService;
import org.dpg.jobprocessor.service.deliverable.PatronDeliverableService.NoticeContext;
import org.dpg.jobprocessor.service.iiif.IiifStore;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.techmeta.DescriptiveMetadata;
import org.dpg.jobprocessor.service.techmeta.TechMetadataExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageImportServiceTest {

    private static final long UNIT_ID = 42L;
    private static final String FIRST = "000000042_0001.tif";
    private static final String SECOND = "000000042_0002.tif";

    @Mock
    private JobStatusService jobStatusService;
    @Mock
    private TechMetadataExtractor techMetadataExtractor;
    @Mock
    private IiifStore iiifStore;
    @Mock
    private ArchiveStore archiveStore;
    @Mock
    private PatronDeliverableService patronDeliverableService;
    @Mock
    private CatalogMetadataService catalogMetadataService;
    @Mock
    private OrderArchiveChecker orderArchiveChecker;
    @Mock
    private WorkDirectoryService workDirectoryService;
    @Mock
    private MasterFileRepository masterFileRepository;
    @Mock
    private ImageTechMetaRepository imageTechMetaRepository;
    @Mock
    private UnitRepository unitRepository;

    @TempDir
    Path stagingDir;

    private ImageImportService service;
    private final JobStatus job = new JobStatus();
    private Unit unit;
    private StagedImage first;
    private StagedImage second;

    @BeforeEach
    void setUp() throws IOException {
        final JobProcessingConfig config = new JobProcessingConfig();
        config.getFinalization().setIiifBatchSize(1);
        service = new ImageImportService(jobStatusService, techMetadataExtractor, iiifStore, archiveStore,
                                         patronDeliverableService, catalogMetadataService, orderArchiveChecker,
                                         workDirectoryService, masterFileRepository, imageTechMetaRepository,
                                         unitRepository, new TaskExecutorAdapter(Runnable::run), config);
        job.setId(3L);

        final Order order = new Order();
        order.setId(9L);
        final Metadata metadata = new Metadata();
        metadata.setId(17L);
        metadata.setType(MetadataType.XML);
        final IntendedUse use = new IntendedUse();
        use.setId(106L);
        use.setDeliverableFormat("pdf");

        unit = new Unit();
        unit.setId(UNIT_ID);
        unit.setOrder(order);
        unit.setMetadata(metadata);
        unit.setIntendedUse(use);

        first = stage(FIRST, "first page");
        second = stage(SECOND, "second page");
    }

    @Test
    void newImageGetsMasterFileTechMetadataDerivativeArchiveAndDeliverable() throws Exception {
        // given
        unit.getIntendedUse().setDeliverableFormat("jpeg");
        final Path assembleDir = stagingDir.resolve("assemble");
        final String md5 = FileSystemArchiveStore.md5(first.path());
        final ImageTechMeta techMeta = techMeta(5L);
        when(techMetadataExtractor.extractDescriptive(first.path())).thenReturn(new DescriptiveMetadata("Page 1", null));
        when(masterFileRepository.findFirstByFilename(FIRST)).thenReturn(Optional.empty());
        when(masterFileRepository.save(any(MasterFile.class))).thenAnswer(invocation -> {
            final MasterFile saved = invocation.getArgument(0);
            if (saved.getId() == null) {
                saved.setId(5L);
            }
            return saved;
        });
        when(imageTechMetaRepository.findFirstByMasterFileId(5L)).thenReturn(Optional.empty());
        when(techMetadataExtractor.extract(first.path(), 5L)).thenReturn(techMeta);
        when(imageTechMetaRepository.save(techMeta)).thenReturn(techMeta);
        when(iiifStore.publish(first.path(), "tsm:5", "tiff", false)).thenReturn(true);
        when(workDirectoryService.ensureAssembleDir(UNIT_ID)).thenReturn(assembleDir);
        when(archiveStore.put(first.path(), UNIT_ID, FIRST)).thenReturn(md5);

        // when
        final int count = service.importImages(job, unit, List.of(first));

        // then
        assertThat(count).isEqualTo(1);
        final ArgumentCaptor<MasterFile> saved = ArgumentCaptor.forClass(MasterFile.class);
        verify(masterFileRepository, atLeastOnce()).save(saved.capture());
        final MasterFile masterFile = saved.getValue();
        assertThat(masterFile.getPid()).isEqualTo("tsm:5");
        assertThat(masterFile.getMd5()).isEqualTo(md5);
        assertThat(masterFile.getTitle()).isEqualTo("Page 1");
        assertThat(masterFile.getDateArchived()).isNotNull();
        verify(patronDeliverableService).createFileDeliverable(job, unit, masterFile, techMeta, first.path(),
                                                               assembleDir, NoticeContext.none());
        verify(unitRepository).markArchived(eq(UNIT_ID), eq(1), any(LocalDateTime.class));
        verify(orderArchiveChecker).checkOrderArchiveComplete(job, 9L);
        verify(jobStatusService, never()).logError(eq(job), anyString());
    }

    @Test
    void existingMasterFileAndTechMetadataAreReused() throws Exception {
        // given
        unit.setDateArchived(LocalDateTime.now().minusDays(1));
        final MasterFile masterFile = existing(first, 5L, "abc");
        when(iiifStore.publish(first.path(), "tsm:5", "tiff", false)).thenReturn(false);

        // when
        service.importImages(job, unit, List.of(first));

        // then
        verify(masterFileRepository, never()).save(any());
        verify(techMetadataExtractor, never()).extract(any(), anyLong());
        verify(imageTechMetaRepository, never()).save(any());
        verify(jobStatusService).logInfo(job, "Master file " + FIRST + " already exists");
        verifyNoInteractions(archiveStore, patronDeliverableService);
        assertThat(masterFile.getDateArchived()).isNull();
    }

    @Test
    void throwAwayUnitIsNeverArchived() throws Exception {
        // given
        unit.setThrowAway(true);
        existing(first, 5L, "abc");
        when(iiifStore.publish(first.path(), "tsm:5", "tiff", false)).thenReturn(true);

        // when
        service.importImages(job, unit, List.of(first));

        // then
        verifyNoInteractions(archiveStore);
        verify(unitRepository).markArchived(eq(UNIT_ID), eq(1), any(LocalDateTime.class));
    }

    @Test
    void retryArchivesOnlyFilesNotYetArchived() throws Exception {
        // given
        final MasterFile archived = existing(first, 5L, "abc");
        archived.setDateArchived(LocalDateTime.now().minusHours(1));
        final MasterFile pending = existing(second, 6L, "def");
        when(iiifStore.publish(any(Path.class), anyString(), eq("tiff"), eq(false))).thenReturn(false);
        when(archiveStore.put(second.path(), UNIT_ID, SECOND)).thenReturn("def");

        // when
        service.importImages(job, unit, List.of(first, second));

        // then
        verify(archiveStore, never()).put(first.path(), UNIT_ID, FIRST);
        verify(archiveStore).put(second.path(), UNIT_ID, SECOND);
        assertThat(pending.getDateArchived()).isNotNull();
    }

    @Test
    void archiveChecksumMismatchIsLoggedAsError() throws Exception {
        // given
        existing(first, 5L, "abc");
        when(iiifStore.publish(first.path(), "tsm:5", "tiff", false)).thenReturn(true);
        when(archiveStore.put(first.path(), UNIT_ID, FIRST)).thenReturn("0000");

        // when
        service.importImages(job, unit, List.of(first));

        // then
        verify(jobStatusService).logError(job, "Archive MD5 does not match source MD5 for " + FIRST);
        verify(unitRepository).markArchived(eq(UNIT_ID), eq(1), any(LocalDateTime.class));
    }

    @Test
    void reorderStopsAfterMasterFileRecords() throws Exception {
        // given
        unit.setReorder(true);
        existing(first, 5L, "abc");

        // when
        final int count = service.importImages(job, unit, List.of(first));

        // then
        assertThat(count).isEqualTo(1);
        verifyNoInteractions(iiifStore, archiveStore, patronDeliverableService, orderArchiveChecker);
        verify(unitRepository, never()).markArchived(anyLong(), anyInt(), any());
    }

    @Test
    void failedIiifBatchFailsPhaseAfterEveryBatchRan() throws Exception {
        // given
        existing(first, 5L, "abc");
        existing(second, 6L, "def");
        when(iiifStore.publish(first.path(), "tsm:5", "tiff", false)).thenThrow(new IOException("disk full"));
        when(iiifStore.publish(second.path(), "tsm:6", "tiff", false)).thenReturn(true);

        // when / then
        assertThatThrownBy(() -> service.importImages(job, unit, List.of(first, second)))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("IIIF publish failed: " + FIRST + ": disk full");
        verify(iiifStore).publish(second.path(), "tsm:6", "tiff", false);
        verify(jobStatusService).logError(job, "Unable to publish IIIF derivative for " + FIRST + ": disk full");
        verifyNoInteractions(archiveStore, orderArchiveChecker);
    }

    @Test
    void unreadableTechMetadataStopsPhaseBeforePublishOrArchive() throws Exception {
        // given
        final MasterFile masterFile = MasterFile.builder().id(5L).pid("tsm:5").filename(FIRST).md5("abc").build();
        when(techMetadataExtractor.extractDescriptive(first.path())).thenReturn(new DescriptiveMetadata("Page 1", null));
        when(masterFileRepository.findFirstByFilename(FIRST)).thenReturn(Optional.of(masterFile));
        when(imageTechMetaRepository.findFirstByMasterFileId(5L)).thenReturn(Optional.empty());
        when(techMetadataExtractor.extract(first.path(), 5L))
                .thenThrow(new ExtractionException("Image " + FIRST + " uses unsupported color space CMYK"));

        // when / then
        assertThatThrownBy(() -> service.importImages(job, unit, List.of(first)))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("Missing image tech metadata for 1 images: " + FIRST);
        verify(jobStatusService).logError(job, "Unable to create image tech metadata: Image " + FIRST
                + " uses unsupported color space CMYK");
        verifyNoInteractions(iiifStore, archiveStore, patronDeliverableService, orderArchiveChecker);
        verify(unitRepository, never()).markArchived(anyLong(), anyInt(), any());
    }

    private StagedImage stage(final String filename, final String content) throws IOException {
        final Path path = Files.writeString(stagingDir.resolve(filename), content);
        return new StagedImage(path, filename, Files.size(path));
    }

    private MasterFile existing(final StagedImage image, final long id, final String md5) throws Exception {
        final MasterFile masterFile = MasterFile.builder()
                                                .id(id)
                                                .pid(MasterFile.pidFor(id))
                                                .unitId(UNIT_ID)
                                                .filename(image.filename())
                                                .md5(md5)
                                                .build();
        when(techMetadataExtractor.extractDescriptive(image.path())).thenReturn(new DescriptiveMetadata("Page", null));
        when(masterFileRepository.findFirstByFilename(image.filename())).thenReturn(Optional.of(masterFile));
        when(imageTechMetaRepository.findFirstByMasterFileId(id)).thenReturn(Optional.of(techMeta(id)));
        return masterFile;
    }

    private static ImageTechMeta techMeta(final long masterFileId) {
        return ImageTechMeta.builder().masterFileId(masterFileId).imageFormat("tiff").width(2400).height(3600).build();
    }
}
