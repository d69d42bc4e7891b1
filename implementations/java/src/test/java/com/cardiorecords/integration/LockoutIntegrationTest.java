package com.cardiorecords.integration;

import com.cardiorecords.application.AccountService;
import com.cardiorecords.application.AuthenticationResult;
import com.cardiorecords.application.Authenticator;
import com.cardiorecords.application.PrincipalAdministrationService;
import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.domain.repository.PrincipalRepository;
import com.cardiorecords.support.MutableClock;
import com.cardiorecords.support.TestClockConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class LockoutIntegrationTest {

    private static final String PASSWORD = "Secret1!";

    @Autowired
    AccountService accountService;

    @Autowired
    Authenticator authenticator;

    @Autowired
    PrincipalAdministrationService administrationService;

    @Autowired
    PrincipalRepository principals;

    @Autowired
    MutableClock clock;

    private String email;
    private UUID principalId;

    @BeforeEach
    void register() {
        email = "lockout-" + UUID.randomUUID() + "@example.com";
        principalId = accountService.register(email, PASSWORD, "Lockout Test").getPrincipal().getId();
    }

    private AuthException.Reason failedLogin(String password) {
        return assertThrows(AuthException.class, () -> authenticator.login(email, password)).getReason();
    }

    private Principal reload() {
        return principals.findById(principalId).orElseThrow();
    }

    private void lockAccount() {
        for (int i = 0; i < 5; i++) {
            assertEquals(AuthException.Reason.INVALID_CREDENTIALS, failedLogin("Wrong1!x"));
        }
    }

    @Test
    void fifth_failure_locks_and_correct_password_is_then_rejected() {
        for (int i = 1; i <= 4; i++) {
            assertEquals(AuthException.Reason.INVALID_CREDENTIALS, failedLogin("Wrong1!x"));
            assertEquals(i, reload().getFailedAttempts());
            assertNull(reload().getLockUntil());
        }

        assertEquals(AuthException.Reason.INVALID_CREDENTIALS, failedLogin("Wrong1!x"));
        Principal locked = reload();
        assertEquals(5, locked.getFailedAttempts());
        assertEquals(clock.instant().plus(Duration.ofMinutes(30)), locked.getLockUntil());

        assertEquals(AuthException.Reason.ACCOUNT_LOCKED, failedLogin(PASSWORD));
        assertEquals(AuthException.Reason.ACCOUNT_LOCKED, failedLogin("Wrong1!x"));
        assertEquals(5, reload().getFailedAttempts());
    }

    @Test
    void concurrent_failures_lock_once_and_stop_counting_at_threshold() throws Exception {
        int attempts = 12;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthException.Reason>> results = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                Callable<AuthException.Reason> attempt = () -> {
                    start.await();
                    return failedLogin("Wrong1!x");
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();
            for (Future<AuthException.Reason> result : results) {
                AuthException.Reason reason = result.get(30, TimeUnit.SECONDS);
                assertTrue(reason == AuthException.Reason.INVALID_CREDENTIALS
                        || reason == AuthException.Reason.ACCOUNT_LOCKED,
                    "unexpected outcome " + reason);
            }
        } finally {
            pool.shutdownNow();
        }

        Principal locked = reload();
        assertEquals(5, locked.getFailedAttempts());
        assertEquals(clock.instant().plus(Duration.ofMinutes(30)), locked.getLockUntil());
        assertEquals(AuthException.Reason.ACCOUNT_LOCKED, failedLogin(PASSWORD));
    }

    @Test
    void success_after_lock_window_resets_state() {
        lockAccount();

        clock.advance(Duration.ofMinutes(30).plusSeconds(1));
        AuthenticationResult result = authenticator.login(email, PASSWORD);

        assertNotNull(result.getToken().getValue());
        Principal reset = reload();
        assertEquals(0, reset.getFailedAttempts());
        assertNull(reset.getLockUntil());
        assertEquals(clock.instant(), reset.getLastLoginAt());
    }

    @Test
    void failure_after_lock_window_starts_a_new_count() {
        lockAccount();

        clock.advance(Duration.ofMinutes(31));

        assertEquals(AuthException.Reason.INVALID_CREDENTIALS, failedLogin("Wrong1!x"));
        Principal restarted = reload();
        assertEquals(1, restarted.getFailedAttempts());
        assertNull(restarted.getLockUntil());
    }

    @Test
    void success_before_threshold_resets_counter() {
        failedLogin("Wrong1!x");
        failedLogin("Wrong1!x");

        authenticator.login(email, PASSWORD);

        assertEquals(0, reload().getFailedAttempts());
    }

    @Test
    void admin_unlock_clears_lock() {
        lockAccount();

        administrationService.unlock(principalId);

        assertNotNull(authenticator.login(email, PASSWORD).getToken());
    }

    @Test
    void deactivation_rejects_live_token_and_login() {
        String token = authenticator.login(email, PASSWORD).getToken().getValue();
        assertEquals(principalId, authenticator.verify(token).getPrincipalId());

        administrationService.setActive(principalId, false);

        assertEquals(AuthException.Reason.ACCOUNT_DEACTIVATED,
            assertThrows(AuthException.class, () -> authenticator.verify(token)).getReason());
        assertEquals(AuthException.Reason.ACCOUNT_DEACTIVATED, failedLogin(PASSWORD));
    }

    @Test
    void role_change_does_not_touch_lockout_state() {
        failedLogin("Wrong1!x");
        failedLogin("Wrong1!x");

        administrationService.changeRole(principalId, Role.CLINICIAN);

        Principal changed = reload();
        assertEquals(2, changed.getFailedAttempts());
        assertEquals(Role.CLINICIAN, changed.getRole());
    }
}
