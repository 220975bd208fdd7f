package org.dpg.jobprocessor.service.aptrust;

import org.dpg.jobprocessor.common.apiclient.aptrust.ApTrustApiClient;
import org.dpg.jobprocessor.common.processexec.ProcessExecutor;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.dto.aptrust.ApTrustWorkItem;
import org.dpg.jobprocessor.exception.JobProcessorException;
import org.dpg.jobprocessor.exception.ResourceNotFoundException;
import org.dpg.jobprocessor.model.ApTrustSubmission;
import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Metadata;
import org.dpg.jobprocessor.model.MetadataType;
import org.dpg.jobprocessor.repository.ApTrustSubmissionRepository;
import org.dpg.jobprocessor.repository.MetadataRepository;
import org.dpg.jobprocessor.service.job.BackgroundJobRunner;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.dpg.jobprocessor.service.storage.S3ObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApTrustSubmissionServiceTest {

    @Mock
    private MetadataRepository metadataRepository;
    @Mock
    private ApTrustSubmissionRepository submissionRepository;
    @Mock
    private ApTrustApiClient apTrustApiClient;
    @Mock
    private S3ObjectStore s3ObjectStore;
    @Mock
    private ProcessExecutor processExecutor;
    @Mock
    private JobStatusService jobStatusService;
    @Mock
    private BackgroundJobRunner backgroundJobRunner;

    @TempDir
    Path bagDir;

    private ApTrustSubmissionService service;
    private Metadata metadata;
    private final JobStatus job = new JobStatus();

    @BeforeEach
    void setUp() {
        final JobProcessingConfig config = new JobProcessingConfig();
        config.setBagDir(bagDir.toString());
        config.getAptrust().setReceivingBucket("aptrust.receiving.test");
        service = new ApTrustSubmissionService(metadataRepository, submissionRepository, apTrustApiClient,
                                               s3ObjectStore, processExecutor, jobStatusService,
                                               backgroundJobRunner, config);
        metadata = new Metadata();
        metadata.setId(17L);
        metadata.setType(MetadataType.SIRSI);
        metadata.setPreservationTierId(2L);
        job.setId(4L);
    }

    @Test
    void bagNameIsDerivedFromTypeAndId() {
        assertThat(ApTrustSubmissionService.bagFileName(metadata))
                .isEqualTo("virginia.edu.tracksys-sirsimetadata-17.tar");
    }

    @Test
    void recordWithoutPreservationTierIsRejected() {
        // given
        metadata.setPreservationTierId(1L);
        when(metadataRepository.findById(17L)).thenReturn(Optional.of(metadata));

        // when / then
        assertThatThrownBy(() -> service.submit(17L, false))
                .isInstanceOf(JobProcessorException.class)
                .hasMessage("metadata 17 has not been assigned for aptrust preservation");
        verifyNoInteractions(jobStatusService);
    }

    @Test
    void collectionRecordIsRejected() {
        // given
        metadata.setCollection(true);
        when(metadataRepository.findById(17L)).thenReturn(Optional.of(metadata));

        // when / then
        assertThatThrownBy(() -> service.submit(17L, false))
                .isInstanceOf(JobProcessorException.class)
                .hasMessage("metadata 17 is a collection; submit its items individually");
        verifyNoInteractions(submissionRepository, jobStatusService);
    }

    @Test
    void submissionInProgressIsRejectedUnlessResubmitting() {
        // given
        final ApTrustSubmission existing = submission();
        when(submissionRepository.findByMetadataId(17L)).thenReturn(Optional.of(existing));
        when(apTrustApiClient.latestWorkItem(existing.getBag())).thenReturn(Optional.of(workItem("Started")));

        // when / then
        assertThatThrownBy(() -> service.prepare(metadata, false))
                .isInstanceOf(JobProcessorException.class)
                .hasMessage("submission is already in progress for metadata 17; status Started");
        assertThat(service.prepare(metadata, true)).isSameAs(existing);
    }

    @Test
    void failedSubmissionMayBeSentAgain() {
        // given
        final ApTrustSubmission existing = submission();
        when(submissionRepository.findByMetadataId(17L)).thenReturn(Optional.of(existing));
        when(apTrustApiClient.latestWorkItem(existing.getBag())).thenReturn(Optional.of(workItem("Failed")));

        // when / then
        assertThat(service.prepare(metadata, false)).isSameAs(existing);
    }

    @Test
    void validatedBagIsUploaded() throws Exception {
        // given
        final ApTrustSubmission submission = submission();
        final Path bag = Files.write(bagDir.resolve(submission.getBag()), new byte[]{1, 2, 3});

        // when
        service.doSubmission(job, metadata, submission);

        // then
        verify(processExecutor).run(List.of("apt-cmd", "bag", "validate", "-p", "aptrust", bag.toString()),
                                    "metadata 17", "apt-cmd");
        verify(s3ObjectStore).upload("aptrust.receiving.test", submission.getBag(), bag);
        assertThat(submission.getSubmittedAt()).isNotNull();
        assertThat(submission.getProcessedAt()).isNull();
    }

    @Test
    void missingBagFailsJob() {
        // given
        final ApTrustSubmission submission = submission();

        // when
        service.doSubmission(job, metadata, submission);

        // then
        verify(jobStatusService).logFatal(eq(job), startsWith("Metadata 17 APTrust submission failed: Bag "));
        assertThat(submission.getProcessedAt()).isNotNull();
        assertThat(submission.isSuccess()).isFalse();
        verifyNoInteractions(s3ObjectStore);
    }

    @Test
    void statusWithoutWorkItemIsNotFound() {
        // given
        when(metadataRepository.findById(17L)).thenReturn(Optional.of(metadata));
        when(submissionRepository.findByMetadataId(17L)).thenReturn(Optional.empty());
        when(apTrustApiClient.latestWorkItem(anyString())).thenReturn(Optional.empty());

        // when / then
        assertThatThrownBy(() -> service.status(17L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("17 has no aptrust status");
    }

    private ApTrustSubmission submission() {
        final ApTrustSubmission submission = new ApTrustSubmission();
        submission.setMetadataId(17L);
        submission.setBag(ApTrustSubmissionService.bagFileName(metadata));
        return submission;
    }

    private static ApTrustWorkItem workItem(final String status) {
        return new ApTrustWorkItem(1L, "virginia.edu.tracksys-sirsimetadata-17.tar", null, null, null,
                                   "Standard", null, status, null);
    }
}
