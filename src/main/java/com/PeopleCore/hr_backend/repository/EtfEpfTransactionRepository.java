package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.EtfEpfTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EtfEpfTransactionRepository extends JpaRepository<EtfEpfTransaction, Long> {
    boolean existsByEmployeeIdAndPeriodYearAndPeriodMonth(Long employeeId, int periodYear, int periodMonth);

    long countByEmployeeIdAndPeriodYearAndPeriodMonth(Long employeeId, int periodYear, int periodMonth);

    List<EtfEpfTransaction> findByPeriodYearAndPeriodMonthOrderByIdAsc(int periodYear, int periodMonth);

    @Query("""
        SELECT t.periodYear, t.periodMonth, COUNT(DISTINCT t.employee.id),
               SUM(t.grossSalary), SUM(t.employeeEpfAmount), SUM(t.epfEmployerShare),
               SUM(t.employerEtfAmount), MAX(t.processedAt)
        FROM EtfEpfTransaction t
        GROUP BY t.periodYear, t.periodMonth
        ORDER BY t.periodYear DESC, t.periodMonth DESC
    """)
    List<Object[]> summarizeByPeriod();
}
