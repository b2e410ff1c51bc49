package com.hamco.api.bootstrap;

import com.hamco.api.config.AppProperties;
import com.hamco.api.entity.User;
import com.hamco.api.entity.UserRole;
import com.hamco.api.repository.UserRepository;
import com.hamco.api.service.PasswordHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Seeds a verified admin from app.init.admin.* when both values are set and the address is unknown.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class UserInitializer implements CommandLineRunner {

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final AppProperties appProperties;

    @Override
    @Transactional
    public void run(String... args) {
        AppProperties.Admin admin = appProperties.init().admin();
        if (admin == null || isBlank(admin.email()) || isBlank(admin.password())) {
            log.debug("No bootstrap admin configured");
            return;
        }

        String email = admin.email().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmail(email)) {
            log.info("Bootstrap admin '{}' already present", email);
            return;
        }

        User user = User.builder()
                .email(email)
                .username(email.substring(0, email.indexOf('@') > 0 ? email.indexOf('@') : email.length()))
                .passwordHash(ensureEncoded(admin.password()))
                .role(UserRole.ADMIN)
                .emailVerified(true)
                .build();
        userRepository.save(user);
        log.info("Bootstrap admin '{}' added successfully.", email);
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return passwordHasher.hash(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
