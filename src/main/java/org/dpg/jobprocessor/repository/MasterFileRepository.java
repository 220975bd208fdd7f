package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.MasterFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MasterFileRepository extends JpaRepository<MasterFile, Long> {

    Optional<MasterFile> findFirstByFilename(String filename);

    List<MasterFile> findByUnitIdOrderByFilenameAsc(Long unitId);

    List<MasterFile> findByMetadataId(Long metadataId);

    List<MasterFile> findByMetadataIdAndUnitId(Long metadataId, Long unitId);
}
