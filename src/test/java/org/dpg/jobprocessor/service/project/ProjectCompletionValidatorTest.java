package org.dpg.jobprocessor.service.project;

import org.dpg.jobprocessor.exception.FinalizationException;
import org.dpg.jobprocessor.model.ImageTechMeta;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.MasterFile;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.ImageTechMetaRepository;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.service.archive.ArchiveStore;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectCompletionValidatorTest {

    @Mock
    private MasterFileRepository masterFileRepository;
    @Mock
    private ImageTechMetaRepository imageTechMetaRepository;
    @Mock
    private ArchiveStore archiveStore;
    @Mock
    private JobStatusService jobStatusService;

    @InjectMocks
    private ProjectCompletionValidator validator;

    @TempDir
    Path archiveDir;

    private final JobStatus job = new JobStatus();
    private Unit unit;

    @BeforeEach
    void setUp() {
        final IntendedUse use = new IntendedUse();
        use.setId(106L);
        unit = new Unit();
        unit.setId(42L);
        unit.setIntendedUse(use);
        unit.setDateArchived(LocalDateTime.now());
        unit.setDatePatronDeliverablesReady(LocalDateTime.now());
    }

    @Test
    void completeUnitPasses() throws Exception {
        // given
        archived("000000042_0001.tif", "000000042_0002.tif");
        givenMasterFiles(masterFile(1L, "000000042_0001.tif", "Page 1"), masterFile(2L, "000000042_0002.tif", "Page 2"));
        when(imageTechMetaRepository.findByMasterFileIdIn(anyList())).thenReturn(List.of(techMeta(1L), techMeta(2L)));

        // when / then
        assertThatCode(() -> validator.validate(job, unit)).doesNotThrowAnyException();
    }

    @Test
    void unarchivedUnitFails() {
        // given
        unit.setDateArchived(null);
        givenMasterFiles();

        // when / then
        assertThatThrownBy(() -> validator.validate(job, unit))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("Unit was not archived");
    }

    @Test
    void archiveCountMustMatchMasterFiles() throws Exception {
        // given
        archived("000000042_0001.tif");
        givenMasterFiles(masterFile(1L, "000000042_0001.tif", "Page 1"), masterFile(2L, "000000042_0002.tif", "Page 2"));

        // when / then
        assertThatThrownBy(() -> validator.validate(job, unit))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("MasterFile / tif count mismatch. 1 tif files vs 2 MasterFiles");
    }

    @Test
    void untitledMasterFileFails() throws Exception {
        // given
        unit.setThrowAway(true);
        givenMasterFiles(masterFile(1L, "000000042_0001.tif", " "));
        when(imageTechMetaRepository.findByMasterFileIdIn(anyList())).thenReturn(List.of(techMeta(1L)));

        // when / then
        assertThatThrownBy(() -> validator.validate(job, unit))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("Masterfile 000000042_0001.tif missing desc metadata");
    }

    @Test
    void digitalCollectionUnitNeedsDlDate() {
        // given
        unit.setThrowAway(true);
        unit.getIntendedUse().setId(IntendedUse.DIGITAL_COLLECTION_BUILDING);
        unit.setIncludeInDl(true);
        givenMasterFiles();
        when(imageTechMetaRepository.findByMasterFileIdIn(anyList())).thenReturn(List.of());

        // when / then
        assertThatThrownBy(() -> validator.validate(job, unit))
                .isInstanceOf(FinalizationException.class)
                .hasMessage("DL deliverables ready date not set");
    }

    private void archived(final String... names) throws IOException {
        when(archiveStore.unitDirectory(42L)).thenReturn(archiveDir);
        for (final String name : names) {
            Files.write(archiveDir.resolve(name), new byte[]{0});
        }
        Files.write(archiveDir.resolve("000000042_0001.txt"), new byte[]{0});
    }

    private void givenMasterFiles(final MasterFile... masterFiles) {
        when(masterFileRepository.findByUnitIdOrderByFilenameAsc(42L)).thenReturn(List.of(masterFiles));
    }

    private static MasterFile masterFile(final long id, final String filename, final String title) {
        final MasterFile masterFile = new MasterFile();
        masterFile.setId(id);
        masterFile.setFilename(filename);
        masterFile.setTitle(title);
        return masterFile;
    }

    private static ImageTechMeta techMeta(final long masterFileId) {
        final ImageTechMeta techMeta = new ImageTechMeta();
        techMeta.setMasterFileId(masterFileId);
        return techMeta;
    }
}
