package com.taskboard.servicebackend.user;

import com.taskboard.servicebackend.error.AuthenticationFailedException;
import com.taskboard.servicebackend.error.ConflictException;
import com.taskboard.servicebackend.error.NotFoundException;
import com.taskboard.servicebackend.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final AppUserRepository repository;
    private final PasswordEncoder passwordEncoder;

    public UserService(AppUserRepository repository, PasswordEncoder passwordEncoder) {
        this.repository = repository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional
    public AppUser registerUser(String name, String email, String rawPassword) {
        String normalizedName = name.trim();
        String normalizedEmail = normalizeEmail(email);

        if (repository.existsByEmail(normalizedEmail)) {
            log.debug("Registration rejected, email already in use: {}", normalizedEmail);
            throw ConflictException.emailTaken();
        }

        AppUser user = new AppUser(normalizedName, normalizedEmail, passwordEncoder.encode(rawPassword));
        AppUser saved;
        try {
            saved = repository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent registration with the same email
            throw ConflictException.emailTaken();
        }
        log.info("Registered new user {} ({})", saved.getId(), saved.getEmail());
        return saved;
    }

    public AppUser authenticate(String email, String rawPassword) {
        AppUser user = repository.findByEmail(normalizeEmail(email))
                .orElseThrow(() -> new AuthenticationFailedException("Incorrect email or password"));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            log.debug("Password mismatch for user {}", user.getId());
            throw new AuthenticationFailedException("Incorrect email or password");
        }
        log.info("User {} logged in", user.getId());
        return user;
    }

    public Optional<AppUser> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository.findById(id);
    }

    public AppUser getProfile(Long id) {
        return findById(id).orElseThrow(NotFoundException::user);
    }

    /**
     * Changes name and/or email; a {@code null} argument leaves that field as it is.
     */
    @Transactional
    public AppUser updateProfile(Long id, String name, String email) {
        if (name == null && email == null) {
            throw new ValidationException("No valid field supplied for update",
                    List.of("Provide name or email to update"));
        }
        AppUser user = getProfile(id);

        if (name != null) {
            user.setName(name.trim());
        }
        if (email != null) {
            String normalizedEmail = normalizeEmail(email);
            if (repository.existsByEmailAndIdNot(normalizedEmail, id)) {
                throw ConflictException.emailTaken();
            }
            user.setEmail(normalizedEmail);
        }

        try {
            AppUser saved = repository.saveAndFlush(user);
            log.info("Updated profile of user {}", id);
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw ConflictException.emailTaken();
        }
    }

    @Transactional
    public void changePassword(Long id, String currentPassword, String newPassword) {
        if (currentPassword.equals(newPassword)) {
            throw new ValidationException("New password must differ from the current password");
        }
        AppUser user = getProfile(id);
        if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw new ValidationException("Current password is incorrect");
        }
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        repository.save(user);
        log.info("Changed password of user {}", id);
    }

    private String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        return email.trim();
    }
}
