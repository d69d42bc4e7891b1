package com.cardiorecords.integration;

import com.cardiorecords.application.AccountService;
import com.cardiorecords.application.Authenticator;
import com.cardiorecords.application.IngestRecordCommand;
import com.cardiorecords.application.RecordService;
import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.domain.model.AnalysisSummary;
import com.cardiorecords.domain.model.Classification;
import com.cardiorecords.domain.model.Principal;
import com.cardiorecords.domain.model.ProtectedRecord;
import com.cardiorecords.domain.model.Role;
import com.cardiorecords.domain.model.Severity;
import com.cardiorecords.domain.repository.PrincipalRepository;
import com.cardiorecords.domain.repository.RecordSearchCriteria;
import com.cardiorecords.infrastructure.security.SecurityContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Page;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
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

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PostgresLockoutIntegrationTest {

    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("cardio_records")
            .withUsername("cardio")
            .withPassword("changeme");

    @DynamicPropertySource
    static void registerProps(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @AfterAll
    void tearDown() {
        postgres.stop();
    }

    @Autowired
    AccountService accountService;

    @Autowired
    Authenticator authenticator;

    @Autowired
    PrincipalRepository principals;

    @Autowired
    RecordService recordService;

    @Test
    void concurrent_failures_stop_counting_at_threshold() throws Exception {
        String email = "race-" + UUID.randomUUID() + "@example.com";
        UUID principalId = accountService.register(email, "Secret1!", "Race Test").getPrincipal().getId();

        int attempts = 12;
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AuthException.Reason>> results = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                Callable<AuthException.Reason> attempt = () -> {
                    start.await();
                    try {
                        authenticator.login(email, "Wrong1!x");
                        return null;
                    } catch (AuthException e) {
                        return e.getReason();
                    }
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

        Principal locked = principals.findById(principalId).orElseThrow();
        assertEquals(5, locked.getFailedAttempts(), "counter must stop at the threshold");
        assertNotNull(locked.getLockUntil());
        assertEquals(AuthException.Reason.ACCOUNT_LOCKED,
            assertThrows(AuthException.class, () -> authenticator.login(email, "Secret1!")).getReason());
    }

    @Test
    void record_search_filters_run_on_postgres() {
        UUID owner = accountService.register("records-" + UUID.randomUUID() + "@example.com", "Secret1!",
            "Records Test").getPrincipal().getId();
        SecurityContext context = SecurityContext.builder()
                .principalId(owner)
                .role(Role.USER)
                .tokenId("test")
                .tokenIssuedAt(Instant.now())
                .tokenExpiresAt(Instant.now().plusSeconds(60))
                .build();

        recordService.ingest(context, command(Classification.NORMAL, 0.91));
        recordService.ingest(context, command(Classification.AFIB, 0.77));

        Page<ProtectedRecord> all = recordService.list(context, RecordSearchCriteria.none(), 1, 20);
        Page<ProtectedRecord> afib = recordService.list(context,
            RecordSearchCriteria.builder().classification(Classification.AFIB).build(), 1, 20);

        assertEquals(2, all.getTotalElements());
        assertEquals(1, afib.getTotalElements());
        assertEquals(2, recordService.statistics(context).getByClassification().size());
    }

    private static IngestRecordCommand command(Classification classification, double confidence) {
        return IngestRecordCommand.builder()
                .fileName("ecg.png")
                .contentType("image/png")
                .data(("waveform-" + classification).getBytes(StandardCharsets.UTF_8))
                .leadLabel("II")
                .analysis(AnalysisSummary.builder()
                        .classification(classification)
                        .confidence(confidence)
                        .heartRate(72)
                        .severity(Severity.NORMAL)
                        .leadCount(1)
                        .build())
                .build();
    }
}
