package com.cardiorecords.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Where an audited request came from.
 */
@Embeddable
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RequestMetadata {

    static final int MAX_PATH_LENGTH = 2000;
    static final int MAX_AGENT_LENGTH = 500;

    @Column(name = "request_method", length = 16)
    private String method;

    @Column(name = "request_path", length = MAX_PATH_LENGTH)
    private String path;

    @Column(name = "request_origin", length = 64)
    private String origin;

    @Column(name = "client_agent", length = MAX_AGENT_LENGTH)
    private String clientAgent;

    public static RequestMetadata of(String method, String path, String origin, String clientAgent) {
        return new RequestMetadata(
            truncate(method, 16),
            truncate(path, MAX_PATH_LENGTH),
            truncate(origin, 64),
            truncate(clientAgent, MAX_AGENT_LENGTH));
    }

    public static RequestMetadata none() {
        return new RequestMetadata(null, null, null, null);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
