package com.PeopleCore.hr_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import jakarta.annotation.PostConstruct;
import java.util.TimeZone;

@Slf4j
@Configuration
public class TimezoneConfig implements WebMvcConfigurer {

    @Value("${app.timezone:Asia/Colombo}")
    private String timezone;

    @PostConstruct
    public void init() {
        // Payroll periods and leave days are evaluated in local office time
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }
}
