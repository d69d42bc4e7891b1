package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.AuditEntry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Operational alert channel for audit write failures: the {@code phi.audit.alert}
 * logger and the {@code phi.audit.write.failures} counter.
 */
@Component
public class AuditAlertChannel {

    static final String LOGGER_NAME = "phi.audit.alert";

    private static final Logger ALERT = LoggerFactory.getLogger(LOGGER_NAME);

    private final Counter failures;

    public AuditAlertChannel(MeterRegistry meterRegistry) {
        this.failures = Counter.builder("phi.audit.write.failures")
            .description("Audit entries that could not be persisted")
            .register(meterRegistry);
    }

    public void auditWriteFailed(AuditEntry lost, Throwable cause) {
        failures.increment();
        ALERT.error("AUDIT_WRITE_FAILED entryId={} action={} resource={}/{} actor={} status={} cause={}",
            lost.getId(), lost.getAction(), lost.getResourceKind(), lost.getResourceId(), lost.getActorId(),
            lost.getOutcome() == null ? null : lost.getOutcome().getStatusCode(),
            cause.getClass().getSimpleName(), cause);
    }

    public double failureCount() {
        return failures.count();
    }
}
