package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.enums.LeaveStatus;
import com.PeopleCore.hr_backend.model.LeaveRequest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, Long> {

    @Query("""
        SELECT r FROM LeaveRequest r JOIN r.employee e
        WHERE (:status IS NULL OR r.status = :status)
        AND (:departmentId IS NULL OR r.department.id = :departmentId)
        AND (:fromDate IS NULL OR r.startDate >= :fromDate)
        AND (:toDate IS NULL OR r.endDate <= :toDate)
        AND (:search IS NULL
             OR LOWER(e.fullName) LIKE LOWER(CONCAT('%', :search, '%'))
             OR LOWER(e.employeeCode) LIKE LOWER(CONCAT('%', :search, '%')))
    """)
    Page<LeaveRequest> searchRequests(@Param("status") LeaveStatus status,
                                      @Param("departmentId") Long departmentId,
                                      @Param("fromDate") LocalDate fromDate,
                                      @Param("toDate") LocalDate toDate,
                                      @Param("search") String search,
                                      Pageable pageable);

    @Query("SELECT r FROM LeaveRequest r WHERE r.status = :status AND " +
            "r.endDate >= :fromDate AND r.startDate <= :toDate ORDER BY r.startDate ASC")
    List<LeaveRequest> findOverlapping(@Param("status") LeaveStatus status,
                                       @Param("fromDate") LocalDate fromDate,
                                       @Param("toDate") LocalDate toDate);

    @Query("SELECT r.leaveType.name, SUM(r.durationHours) FROM LeaveRequest r " +
            "WHERE r.status = :status AND r.startDate >= :yearStart AND r.startDate <= :yearEnd " +
            "GROUP BY r.leaveType.name ORDER BY r.leaveType.name")
    List<Object[]> sumHoursByType(@Param("status") LeaveStatus status,
                                  @Param("yearStart") LocalDate yearStart,
                                  @Param("yearEnd") LocalDate yearEnd);

    @Query("SELECT COUNT(DISTINCT r.employee.id) FROM LeaveRequest r WHERE r.status = :status AND " +
            "r.startDate <= :day AND r.endDate >= :day")
    long countEmployeesOnLeave(@Param("status") LeaveStatus status, @Param("day") LocalDate day);
}
