package org.dpg.jobprocessor.repository;

import org.dpg.jobprocessor.model.Unit;
import org.dpg.jobprocessor.model.UnitStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link Unit} entity.
 */
@Repository
public interface UnitRepository extends JpaRepository<Unit, Long> {

    List<Unit> findByOrder_Id(Long orderId);

    List<Unit> findByMetadata_IdAndIncludeInDlTrue(Long metadataId);

    /**
     * Claims a unit for finalization in one statement. Only a unit that is not a reorder and is in one of
     * the {@code from} statuses is moved; a concurrent second claim matches no row.
     *
     * @return the number of rows moved to {@code finalizing}; 0 or 1.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.status = :finalizing WHERE u.id = :id AND u.status IN :from AND u.reorder = false")
    int claimForFinalization(@Param("id") Long id,
                             @Param("from") Collection<UnitStatus> from,
                             @Param("finalizing") UnitStatus finalizing);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.status = :status WHERE u.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") UnitStatus status);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.status = :to WHERE u.status = :from")
    int updateAllStatuses(@Param("from") UnitStatus from, @Param("to") UnitStatus to);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.includeInDl = true WHERE u.id = :id")
    int flagForDigitalLibrary(@Param("id") Long id);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.masterFilesCount = :count, u.dateArchived = :dateArchived WHERE u.id = :id")
    int markArchived(@Param("id") Long id, @Param("count") int count, @Param("dateArchived") LocalDateTime dateArchived);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.datePatronDeliverablesReady = :ready WHERE u.id = :id")
    int markPatronDeliverablesReady(@Param("id") Long id, @Param("ready") LocalDateTime ready);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Unit u SET u.dateDlDeliverablesReady = :ready WHERE u.id = :id AND u.dateDlDeliverablesReady IS NULL")
    int markDlDeliverablesReady(@Param("id") Long id, @Param("ready") LocalDateTime ready);

    /**
     * Counts the units of an order that still have to be archived. Canceled units never will be.
     */
    @Query("SELECT COUNT(u) FROM Unit u WHERE u.order.id = :orderId AND u.dateArchived IS NULL AND u.status <> :canceled")
    long countNotArchived(@Param("orderId") Long orderId, @Param("canceled") UnitStatus canceled);
}
