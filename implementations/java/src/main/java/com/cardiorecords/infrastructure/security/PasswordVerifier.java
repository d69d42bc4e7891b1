package com.cardiorecords.infrastructure.security;

/**
 * One-way salted password hashing.
 */
public interface PasswordVerifier {

    String hash(String rawPassword);

    boolean matches(String rawPassword, String storedHash);

    /**
     * Performs a comparison of the same cost as {@link #matches} against a
     * fixed hash, for callers that have no stored hash to compare against.
     */
    void dummyCompare(String rawPassword);
}
