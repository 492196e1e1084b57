package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import com.PeopleCore.hr_backend.model.Employee;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {
    boolean existsByEmployeeCode(String employeeCode);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Employee e WHERE e.id = :id")
    Optional<Employee> findForUpdate(@Param("id") Long id);

    List<Employee> findByStatusOrderByFullNameAsc(EmployeeStatus status);

    long countByStatus(EmployeeStatus status);

    @Query("SELECT e FROM Employee e WHERE " +
            "(:search IS NULL OR LOWER(e.fullName) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
            "LOWER(e.employeeCode) LIKE LOWER(CONCAT('%', :search, '%'))) AND " +
            "(:departmentId IS NULL OR e.department.id = :departmentId) AND " +
            "(:status IS NULL OR e.status = :status)")
    Page<Employee> searchEmployees(@Param("search") String search,
                                   @Param("departmentId") Long departmentId,
                                   @Param("status") EmployeeStatus status,
                                   Pageable pageable);

    // Employees who had joined by the end of the period; unknown joining dates are kept
    @Query("SELECT e FROM Employee e WHERE e.status = :status AND " +
            "(e.joiningDate IS NULL OR e.joiningDate <= :periodEnd) ORDER BY e.fullName ASC")
    List<Employee> findEligibleForPeriod(@Param("status") EmployeeStatus status,
                                         @Param("periodEnd") LocalDate periodEnd);

    @Query("SELECT e FROM Employee e WHERE e.status = :status AND " +
            "NOT EXISTS (SELECT c FROM EtfEpfConfig c WHERE c.employee = e) ORDER BY e.fullName ASC")
    List<Employee> findWithoutEtfEpfConfig(@Param("status") EmployeeStatus status);

    @Query("SELECT e FROM Employee e WHERE e.status = :status AND " +
            "(:departmentId IS NULL OR e.department.id = :departmentId) ORDER BY e.fullName ASC")
    List<Employee> findByStatusAndDepartment(@Param("status") EmployeeStatus status,
                                             @Param("departmentId") Long departmentId);
}
