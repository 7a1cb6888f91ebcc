package com.hronboard.backend.support;

import com.hronboard.backend.modules.auth.domain.AppUser;
import com.hronboard.backend.modules.auth.domain.UserRole;
import com.hronboard.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public AppUser ensureAdmin(String email, String rawPassword) {
        return ensureUser(email, rawPassword, UserRole.ADMIN);
    }

    public AppUser ensureHrManager(String email, String rawPassword) {
        return ensureUser(email, rawPassword, UserRole.HR_MANAGER);
    }

    public AppUser ensureEmployee(String email, String rawPassword) {
        return ensureUser(email, rawPassword, UserRole.EMPLOYEE);
    }

    public AppUser ensureUser(String email, String rawPassword, UserRole role) {
        AppUser user = appUserRepository.findByEmailIgnoreCase(email)
                .orElseGet(AppUser::new);
        user.setEmail(email.toLowerCase());
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setFirstName("Test");
        user.setLastName(role.getCode());
        user.setRole(role);
        user.setActive(true);
        user.setEmailVerified(true);
        user.setLoginAttempts(0);
        user.setLockedUntil(null);
        return appUserRepository.save(user);
    }
}
