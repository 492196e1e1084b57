package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.enums.TransferStatus;
import com.PeopleCore.hr_backend.model.PayrollTransfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PayrollTransferRepository extends JpaRepository<PayrollTransfer, Long> {
    Optional<PayrollTransfer> findByEmployeeIdAndPeriodYearAndPeriodMonth(Long employeeId, int periodYear,
                                                                          int periodMonth);

    long countByEmployeeIdAndPeriodYearAndPeriodMonth(Long employeeId, int periodYear, int periodMonth);

    long countByPeriodYearAndPeriodMonth(int periodYear, int periodMonth);

    long countByPeriodYearAndPeriodMonthAndStatus(int periodYear, int periodMonth, TransferStatus status);

    @Query("SELECT t FROM PayrollTransfer t WHERE " +
            "(:periodYear IS NULL OR t.periodYear = :periodYear) AND " +
            "(:periodMonth IS NULL OR t.periodMonth = :periodMonth) AND " +
            "(:status IS NULL OR t.status = :status) " +
            "ORDER BY t.periodYear DESC, t.periodMonth DESC, t.id ASC")
    List<PayrollTransfer> search(@Param("periodYear") Integer periodYear,
                                 @Param("periodMonth") Integer periodMonth,
                                 @Param("status") TransferStatus status);

    @Query("SELECT DISTINCT t.periodYear, t.periodMonth FROM PayrollTransfer t")
    List<Object[]> findTransferPeriods();
}
