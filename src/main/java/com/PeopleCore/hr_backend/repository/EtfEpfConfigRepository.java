package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.EtfEpfConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EtfEpfConfigRepository extends JpaRepository<EtfEpfConfig, Long> {
    Optional<EtfEpfConfig> findByEmployeeId(Long employeeId);

    boolean existsByEmployeeId(Long employeeId);
}
