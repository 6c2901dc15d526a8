package org.caureq.hostwatch.repo;

import org.caureq.hostwatch.domain.Host;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface HostRepo extends JpaRepository<Host, Long> {
    Optional<Host> findByHostnameIgnoreCase(String hostname);
    List<Host> findByActiveTrueOrderByIdAsc();
}
