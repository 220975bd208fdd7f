package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.ApTrustSubmission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ApTrustSubmissionRepository extends JpaRepository<ApTrustSubmission, Long> {

    Optional<ApTrustSubmission> findByMetadataId(Long metadataId);
}
