package org.caureq.hostwatch.repo;

import org.caureq.hostwatch.domain.CheckType;
import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.HostCheckConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface HostCheckConfigRepo extends JpaRepository<HostCheckConfig, Long> {

    /** Configs to evaluate for a host: enabled on the host and enabled in the catalog. */
    @Query("select c from HostCheckConfig c join fetch c.checkType t " +
            "where c.host = :host and c.enabled = true and t.enabled = true order by t.id")
    List<HostCheckConfig> findEnabledForHost(@Param("host") Host host);

    Optional<HostCheckConfig> findByHostAndCheckType(Host host, CheckType checkType);

    List<HostCheckConfig> findByHostOrderByIdAsc(Host host);
}
