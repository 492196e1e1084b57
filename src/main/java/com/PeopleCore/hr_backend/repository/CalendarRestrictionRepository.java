package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.CalendarRestriction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface CalendarRestrictionRepository extends JpaRepository<CalendarRestriction, Long> {
    Optional<CalendarRestriction> findByDate(LocalDate date);

    List<CalendarRestriction> findByDateBetweenOrderByDateAsc(LocalDate fromDate, LocalDate toDate);

    @Modifying
    @Query("DELETE FROM CalendarRestriction c WHERE c.date = :date")
    int deleteByRestrictionDate(@Param("date") LocalDate date);

    @Modifying
    @Query("DELETE FROM CalendarRestriction c WHERE c.id = :id")
    int deleteByRestrictionId(@Param("id") Long id);
}
