package org.dpg.jobprocessor.service.deliverable;

import org.dpg.jobprocessor.common.processexec.ProcessExecutor;
import org.dpg.jobprocessor.model.IntendedUse;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.repository.MasterFileRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.finalization.WorkDirectoryService;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PatronDeliverableServiceTest {

    @Mock
    private ProcessExecutor processExecutor;
    @Mock
    private WorkDirectoryService workDirectoryService;
    @Mock
    private MasterFileRepository masterFileRepository;
    @Mock
    private UnitRepository unitRepository;
    @Mock
    private JobStatusService jobStatusService;

    @InjectMocks
    private PatronDeliverableService service;

    private Unit unit;

    @BeforeEach
    void setUp() {
        final Metadata metadata = new Metadata();
        metadata.setTitle("Letters from the field");
        final IntendedUse use = new IntendedUse();
        use.setId(106L);
        unit = new Unit();
        unit.setId(42L);
        unit.setMetadata(metadata);
        unit.setIntendedUse(use);
    }

    @Test
    void privateStudyNoticeCarriesCatalogDetails() {
        // when
        final String notice = PatronDeliverableService.legalNotice(unit,
                new PatronDeliverableService.NoticeContext("MSS 1234", "SC-STKS"));

        // then
        assertThat(notice).startsWith("Title: Letters from the field\nCall Number: MSS 1234\nLocation: SC-STKS\n")
                          .contains("private study, scholarship, or research");
    }

    @Test
    void classroomNoticeOmitsEmptyCatalogDetails() {
        // given
        unit.getIntendedUse().setId(100L);

        // when
        final String notice = PatronDeliverableService.legalNotice(unit, PatronDeliverableService.NoticeContext.none());

        // then
        assertThat(notice).doesNotContain("Call Number").doesNotContain("Location")
                          .contains("classroom teaching");
    }

    @Test
    void longTitleIsTruncated() {
        // given
        unit.getMetadata().setTitle("x".repeat(300));

        // when
        final String notice = PatronDeliverableService.legalNotice(unit, PatronDeliverableService.NoticeContext.none());

        // then
        assertThat(notice.lines().findFirst()).hasValue("Title: " + "x".repeat(PatronDeliverableService.MAX_NOTICE_TITLE));
    }

    @Test
    void readyUnitIsNotRebuilt() throws Exception {
        // given
        final JobStatus job = new JobStatus();
        unit.setDatePatronDeliverablesReady(LocalDateTime.now());

        // when
        service.generateUnitDeliverables(job, unit, List.of());

        // then
        verify(jobStatusService).logInfo(job, "Patron deliverables already generated");
        verifyNoInteractions(processExecutor, unitRepository);
    }
}
