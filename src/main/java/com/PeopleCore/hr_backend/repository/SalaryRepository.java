package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.Salary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SalaryRepository extends JpaRepository<Salary, Long> {
    // Latest inserted row wins, whatever its effective date
    Optional<Salary> findFirstByEmployeeIdOrderByIdDesc(Long employeeId);

    List<Salary> findByEmployeeIdOrderByIdDesc(Long employeeId);
}
