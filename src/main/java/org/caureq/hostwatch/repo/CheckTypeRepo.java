package org.caureq.hostwatch.repo;

import org.caureq.hostwatch.domain.CheckType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CheckTypeRepo extends JpaRepository<CheckType, Long> {
    Optional<CheckType> findByCheckKey(String checkKey);
    List<CheckType> findAllByOrderByIdAsc();
}
