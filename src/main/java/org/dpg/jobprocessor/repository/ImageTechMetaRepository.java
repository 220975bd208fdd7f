package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.ImageTechMeta;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ImageTechMetaRepository extends JpaRepository<ImageTechMeta, Long> {

    Optional<ImageTechMeta> findFirstByMasterFileId(Long masterFileId);

    List<ImageTechMeta> findByMasterFileIdIn(Collection<Long> masterFileIds);
}
