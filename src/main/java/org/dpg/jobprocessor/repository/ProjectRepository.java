package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    Optional<Project> findFirstByUnitId(Long unitId);
}
