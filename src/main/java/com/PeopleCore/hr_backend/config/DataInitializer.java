package com.PeopleCore.hr_backend.config;

import com.PeopleCore.hr_backend.enums.Role;
import com.PeopleCore.hr_backend.model.LeaveType;
import com.PeopleCore.hr_backend.model.User;
import com.PeopleCore.hr_backend.repository.LeaveTypeRepository;
import com.PeopleCore.hr_backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final UserRepository userRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final PasswordEncoder passwordEncoder;
    private final DefaultAdminConfig defaultAdminConfig;
    private final LeavePolicyProperties leavePolicy;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> {
            createOrUpdateDefaultAdmin();
            seedLeaveTypes();
        };
    }

    private void createOrUpdateDefaultAdmin() {
        String email = defaultAdminConfig.getEmail();
        String rawPassword = defaultAdminConfig.getPassword();

        userRepository.findByEmail(email).ifPresentOrElse(
                existingUser -> {
                    log.info("Admin user with email {} already exists", email);

                    if (!passwordEncoder.matches(rawPassword, existingUser.getPassword())) {
                        existingUser.setPassword(passwordEncoder.encode(rawPassword));
                        existingUser.setActive(true);
                        existingUser.setName(defaultAdminConfig.getName());
                        existingUser.setPhone(defaultAdminConfig.getPhone());
                        userRepository.save(existingUser);
                        log.info("Admin password updated");
                    }
                },
                () -> {
                    User admin = User.builder()
                            .name(defaultAdminConfig.getName())
                            .email(email)
                            .password(passwordEncoder.encode(rawPassword))
                            .role(Role.ADMIN)
                            .phone(defaultAdminConfig.getPhone())
                            .active(defaultAdminConfig.isEnabled())
                            .build();

                    userRepository.save(admin);
                    log.info("Default admin user created: {}", email);
                }
        );
    }

    private void seedLeaveTypes() {
        seedLeaveType(leavePolicy.getAnnualTypeId(), "Annual");
        seedLeaveType(leavePolicy.getMedicalTypeId(), "Medical");
    }

    private void seedLeaveType(Long id, String name) {
        if (!leaveTypeRepository.existsById(id)) {
            leaveTypeRepository.save(LeaveType.builder().id(id).name(name).build());
            log.info("Leave type seeded: {} ({})", name, id);
        }
    }
}
