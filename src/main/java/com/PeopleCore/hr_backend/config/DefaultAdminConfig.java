package com.PeopleCore.hr_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "admin.default")
@Data
public class DefaultAdminConfig {
    private String email = "admin@peoplecore.local";
    private String password = "ChangeMe@123";
    private String name = "System Administrator";
    private String phone = "+94110000000";
    private boolean enabled = true;
}
