package org.caureq.hostwatch.repo;

import org.caureq.hostwatch.domain.Host;
import org.caureq.hostwatch.domain.Reading;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ReadingRepo extends JpaRepository<Reading, Long> {
    /** Latest reading by collection time; ties go to the last inserted row. */
    Optional<Reading> findFirstByHostOrderByCollectedAtDescIdDesc(Host host);
}
