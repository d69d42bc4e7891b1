package com.cardiorecords.infrastructure.audit;

import com.cardiorecords.domain.model.AuditAction;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuditActionClassifierTest {

    @ParameterizedTest
    @CsvSource({
        "POST,   /api/auth/login,                 200, LOGIN",
        "POST,   /api/auth/login,                 401, LOGIN_FAILED",
        "POST,   /api/auth/login,                 423, LOGIN_FAILED",
        "POST,   /api/auth/logout,                200, LOGOUT",
        "POST,   /api/ecg/analyze,                201, ANALYZE",
        "GET,    /api/records/42/report,          200, VIEW_REPORT",
        "GET,    /api/records/42/download,        200, EXPORT",
        "GET,    /api/records/export,             200, EXPORT",
        "POST,   /api/records,                    201, CREATE",
        "PUT,    /api/auth/password,              200, UPDATE",
        "PATCH,  /api/admin/principals/1/active,  200, UPDATE",
        "DELETE, /api/records/42,                 204, DELETE",
        "GET,    /api/records,                    200, READ",
        "HEAD,   /api/records,                    200, READ"
    })
    void derives_action_from_path_and_method(String method, String path, int status, AuditAction expected) {
        assertEquals(expected, AuditActionClassifier.classify(null, method, path, status));
    }

    @Test
    void explicit_action_wins_over_path() {
        assertEquals(AuditAction.PERMISSION_CHANGE,
            AuditActionClassifier.classify(AuditAction.PERMISSION_CHANGE, "PUT", "/api/admin/principals/1/role", 200));
    }

    @Test
    void missing_request_details_read_as_read() {
        assertEquals(AuditAction.READ, AuditActionClassifier.classify(null, null, null, 200));
    }
}
