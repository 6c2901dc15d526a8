package org.caureq.hostwatch.repo;

import org.caureq.hostwatch.domain.AlertRecord;
import org.caureq.hostwatch.domain.AlertStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Alert records. Every status change is a conditional update on the current status so that
 * concurrent writers (sweep, operator acknowledgment) never overwrite each other.
 */
public interface AlertRepo extends JpaRepository<AlertRecord, Long> {

    Optional<AlertRecord> findByActiveKey(String activeKey);

    @EntityGraph(attributePaths = {"host", "checkType"})
    Page<AlertRecord> findAll(Pageable pageable);

    @EntityGraph(attributePaths = {"host", "checkType"})
    Page<AlertRecord> findByHost_HostnameIgnoreCase(String hostname, Pageable pageable);

    @EntityGraph(attributePaths = {"host", "checkType"})
    Page<AlertRecord> findByStatus(AlertStatus status, Pageable pageable);

    @EntityGraph(attributePaths = {"host", "checkType"})
    Page<AlertRecord> findByHost_HostnameIgnoreCaseAndStatus(String hostname, AlertStatus status, Pageable pageable);

    long countByStatus(AlertStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AlertRecord a set a.status = :resolved, a.activeKey = null, a.message = :message, a.updatedAt = :now " +
            "where a.id = :id and a.status in :active")
    int resolveIfActive(@Param("id") Long id,
                        @Param("message") String message,
                        @Param("now") Instant now,
                        @Param("resolved") AlertStatus resolved,
                        @Param("active") Collection<AlertStatus> active);

    /** Refreshes lastNotifiedAt only for an open alert whose last notification is older than cutoff. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AlertRecord a set a.lastNotifiedAt = :now " +
            "where a.id = :id and a.status = :open and (a.lastNotifiedAt is null or a.lastNotifiedAt <= :cutoff)")
    int touchNotifiedIfDue(@Param("id") Long id,
                           @Param("now") Instant now,
                           @Param("cutoff") Instant cutoff,
                           @Param("open") AlertStatus open);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update AlertRecord a set a.status = :acknowledged, a.updatedAt = :now where a.id = :id and a.status = :open")
    int acknowledgeIfOpen(@Param("id") Long id,
                          @Param("now") Instant now,
                          @Param("acknowledged") AlertStatus acknowledged,
                          @Param("open") AlertStatus open);
}
