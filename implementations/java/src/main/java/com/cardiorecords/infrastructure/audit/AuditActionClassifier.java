package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.AuditAction;

import java.util.Locale;

/**
 * Derives the audit action of a request.
 *
 * <p>Order: explicit action, then path overrides, then the HTTP method.
 */
public final class AuditActionClassifier {

    private AuditActionClassifier() {
    }

    public static AuditAction classify(AuditAction explicit, String method, String path, int status) {
        if (explicit != null) {
            return explicit;
        }
        String p = path == null ? "" : path.toLowerCase(Locale.ROOT);
        if (p.contains("/login")) {
            return status >= 200 && status < 300 ? AuditAction.LOGIN : AuditAction.LOGIN_FAILED;
        }
        if (p.contains("/logout")) {
            return AuditAction.LOGOUT;
        }
        if (p.contains("/analyze")) {
            return AuditAction.ANALYZE;
        }
        if (p.contains("/report")) {
            return AuditAction.VIEW_REPORT;
        }
        if (p.contains("/export") || p.contains("/download")) {
            return AuditAction.EXPORT;
        }
        String m = method == null ? "" : method.toUpperCase(Locale.ROOT);
        switch (m) {
            case "POST":
                return AuditAction.CREATE;
            case "PUT":
            case "PATCH":
                return AuditAction.UPDATE;
            case "DELETE":
                return AuditAction.DELETE;
            default:
                return AuditAction.READ;
        }
    }
}
