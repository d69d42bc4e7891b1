package com.cardiorecords.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Security settings bound from {@code phi.security.*}.
 *
 * <p>Secrets come from the environment ({@code PHI_TOKEN_SECRET},
 * {@code PHI_MASTER_SECRET}) and are never logged. The master secret is not
 * validated here: a blank value is reported by the envelope cipher so the
 * failure names the missing key.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "phi.security")
public class PhiSecurityProperties {

    @Valid
    private Token token = new Token();

    @Valid
    private Encryption encryption = new Encryption();

    @Valid
    private Lockout lockout = new Lockout();

    @Valid
    private Password password = new Password();

    @Data
    public static class Token {
        @NotBlank
        private String signingSecret;

        @NotNull
        private Duration expiry = Duration.ofDays(7);

        @NotBlank
        private String issuer = "cardio-records";

        private boolean revocationEnabled = true;

        @Override
        public String toString() {
            return "Token[expiry=" + expiry + ", issuer=" + issuer
                + ", revocationEnabled=" + revocationEnabled + "]";
        }
    }

    @Data
    public static class Encryption {
        private String masterSecret;

        @Min(10_000)
        private int kdfIterations = 210_000;

        @Override
        public String toString() {
            return "Encryption[kdfIterations=" + kdfIterations + "]";
        }
    }

    @Data
    public static class Lockout {
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration duration = Duration.ofMinutes(30);
    }

    @Data
    public static class Password {
        @Min(4)
        @Max(31)
        private int bcryptStrength = 12;
    }
}
