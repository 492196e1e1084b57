package com.PeopleCore.hr_backend.repository;

import com.PeopleCore.hr_backend.model.LeaveRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LeaveRuleRepository extends JpaRepository<LeaveRule, Long> {
    Optional<LeaveRule> findByGradeId(Long gradeId);
}
