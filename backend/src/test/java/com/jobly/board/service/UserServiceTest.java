package com.jobly.board.service;

import com.jobly.board.error.NotFoundException;
import com.jobly.board.error.UnauthorizedException;
import com.jobly.board.error.ValidationException;
import com.jobly.board.model.Credentials;
import com.jobly.board.model.Job;
import com.jobly.board.model.User;
import com.jobly.board.model.UserUpdate;
import com.jobly.board.persistence.JobJdbcRepository;
import com.jobly.board.persistence.UserJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserJdbcRepository users;
    @Mock
    private JobJdbcRepository jobs;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private UserService service;

    @BeforeEach
    void setUp() {
        service = new UserService(users, jobs, passwordEncoder);
    }

    @Test
    void authenticateReturnsUserForCorrectPassword() {
        User user = new User("u1", "U", "One", "u1@example.com", false);
        when(users.findPasswordHash("u1")).thenReturn(passwordEncoder.encode("password1"));
        when(users.findByUsername("u1")).thenReturn(user);

        assertEquals(user, service.authenticate(new Credentials("u1", "password1")));
    }

    @Test
    void authenticateRejectsWrongPasswordAndUnknownUserAlike() {
        when(users.findPasswordHash("u1")).thenReturn(passwordEncoder.encode("password1"));
        when(users.findPasswordHash("ghost")).thenReturn(null);

        assertThatThrownBy(() -> service.authenticate(new Credentials("u1", "wrong")))
            .isInstanceOf(UnauthorizedException.class)
            .hasMessage("Invalid username/password");
        assertThatThrownBy(() -> service.authenticate(new Credentials("ghost", "password1")))
            .isInstanceOf(UnauthorizedException.class)
            .hasMessage("Invalid username/password");
    }

    @Test
    void updateHashesNewPassword() {
        when(users.update(eq("u1"), org.mockito.ArgumentMatchers.anyMap()))
            .thenReturn(new User("u1", "U", "One", "u1@example.com", false));

        service.update("u1", new UserUpdate(null, null, "newpassword", null));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, ?>> spec = ArgumentCaptor.forClass(Map.class);
        verify(users).update(eq("u1"), spec.capture());
        Object stored = spec.getValue().get("password");
        assertThat(stored).isInstanceOf(String.class).isNotEqualTo("newpassword");
        assertTrue(passwordEncoder.matches("newpassword", (String) stored));
    }

    @Test
    void applyToMissingJobIsNotFound() {
        when(jobs.findById(99L)).thenReturn(null);

        assertThatThrownBy(() -> service.applyToJob("u1", 99L))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("No job: 99");
        verify(users, never()).insertApplication(anyString(), anyLong());
    }

    @Test
    void applyTwiceIsRejected() {
        when(jobs.findById(7L)).thenReturn(new Job(7L, "Dev", 100, BigDecimal.ZERO, "c1"));
        when(users.existsByUsername("u1")).thenReturn(true);
        when(users.hasApplied("u1", 7L)).thenReturn(true);

        assertThatThrownBy(() -> service.applyToJob("u1", 7L)).isInstanceOf(ValidationException.class);
        verify(users, never()).insertApplication(anyString(), anyLong());
    }

    @Test
    void applyRecordsApplication() {
        when(jobs.findById(7L)).thenReturn(new Job(7L, "Dev", 100, BigDecimal.ZERO, "c1"));
        when(users.existsByUsername("u1")).thenReturn(true);
        when(users.hasApplied("u1", 7L)).thenReturn(false);

        service.applyToJob("u1", 7L);

        verify(users).insertApplication("u1", 7L);
    }
}
