package com.cardiorecords.application;

import com.cardiorecords.application.exceptions.RequestValidationException;

import java.util.regex.Pattern;

/**
 * Password strength rule for registration and password change.
 */
final class PasswordPolicy {

    static final String SPECIALS = "@$!%*?&";

    private static final Pattern RULE = Pattern.compile(
        "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[A-Za-z\\d@$!%*?&]{8,128}$");

    private PasswordPolicy() {
    }

    static void check(String password) {
        if (password == null || !RULE.matcher(password).matches()) {
            throw new RequestValidationException(
                "Password must be at least 8 characters with uppercase, lowercase, number, and special character ("
                    + SPECIALS + ").");
        }
    }
}
