package com.jobly.board.service;

import com.jobly.board.error.NotFoundException;
import com.jobly.board.error.UnauthorizedException;
import com.jobly.board.error.ValidationException;
import com.jobly.board.model.Credentials;
import com.jobly.board.model.NewUser;
import com.jobly.board.model.User;
import com.jobly.board.model.UserDetail;
import com.jobly.board.model.UserUpdate;
import com.jobly.board.persistence.JobJdbcRepository;
import com.jobly.board.persistence.UserJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class UserService {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private final UserJdbcRepository users;
    private final JobJdbcRepository jobs;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserJdbcRepository users, JobJdbcRepository jobs, PasswordEncoder passwordEncoder) {
        this.users = users;
        this.jobs = jobs;
        this.passwordEncoder = passwordEncoder;
    }

    /** Checks the password and returns the user; unknown users and wrong passwords look the same. */
    public User authenticate(Credentials credentials) {
        String hash = users.findPasswordHash(credentials.username());
        if (hash == null || !passwordEncoder.matches(credentials.password(), hash)) {
            throw new UnauthorizedException("Invalid username/password");
        }
        return users.findByUsername(credentials.username());
    }

    @Transactional
    public User register(NewUser user) {
        if (users.existsByUsername(user.username())) {
            throw new ValidationException("Duplicate username: " + user.username());
        }
        User created = users.insert(user, passwordEncoder.encode(user.password()));
        log.info("Registered user {} (admin={})", created.username(), created.isAdmin());
        return created;
    }

    public List<User> findAll() {
        return users.findAll();
    }

    public UserDetail get(String username) {
        User user = users.findByUsername(username);
        if (user == null) {
            throw new NotFoundException("No user: " + username);
        }
        return UserDetail.of(user, users.findApplications(username));
    }

    public User update(String username, UserUpdate update) {
        String passwordHash = update.password() == null ? null : passwordEncoder.encode(update.password());
        User user = users.update(username, update.toUpdateSpec(passwordHash));
        if (user == null) {
            throw new NotFoundException("No user: " + username);
        }
        log.info("Updated user {}", username);
        return user;
    }

    public void remove(String username) {
        if (!users.delete(username)) {
            throw new NotFoundException("No user: " + username);
        }
        log.info("Removed user {}", username);
    }

    @Transactional
    public void applyToJob(String username, long jobId) {
        if (jobs.findById(jobId) == null) {
            throw new NotFoundException("No job: " + jobId);
        }
        if (!users.existsByUsername(username)) {
            throw new NotFoundException("No user: " + username);
        }
        if (users.hasApplied(username, jobId)) {
            throw new ValidationException("Already applied to job " + jobId + ": " + username);
        }
        users.insertApplication(username, jobId);
        log.info("User {} applied to job {}", username, jobId);
    }
}
