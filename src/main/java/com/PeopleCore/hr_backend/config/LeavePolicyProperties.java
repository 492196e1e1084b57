package com.PeopleCore.hr_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalTime;

/**
 * Leave engine settings bound from {@code hr.leave.*}.
 * <p>
 * The leave-type ids decide which {@link com.PeopleCore.hr_backend.enums.LeaveCategory}
 * a request falls under when entitlement limits are checked.
 */
@Component
@ConfigurationProperties(prefix = "hr.leave")
@Data
public class LeavePolicyProperties {
    private BigDecimal workHoursPerDay = new BigDecimal("9.0");
    private String defaultStartTime = "09:00";
    private String defaultEndTime = "18:00";
    private BigDecimal breachTolerance = new BigDecimal("0.01");
    private Long annualTypeId = 1L;
    private Long medicalTypeId = 2L;

    public LocalTime startTime() {
        return LocalTime.parse(defaultStartTime);
    }

    public LocalTime endTime() {
        return LocalTime.parse(defaultEndTime);
    }
}
