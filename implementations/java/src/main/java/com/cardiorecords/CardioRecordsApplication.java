package com.cardiorecords;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the Cardio Records PHI access core.
 *
 * <p>Security features:
 * <ul>
 *   <li><strong>Authentication</strong>: bcrypt credentials, atomic lockout, signed expiring bearer tokens</li>
 *   <li><strong>Authorization</strong>: role checks at every audited entry point</li>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM envelope with a PBKDF2-derived key</li>
 *   <li><strong>Audit Trail</strong>: one immutable entry per protected call, success or failure</li>
 * </ul>
 *
 * <p><strong>Architecture:</strong> hexagonal (ports and adapters); domain
 * repositories are implemented by Spring Data JPA adapters.
 *
 * <p>Startup fails when the token signing secret or the encryption master
 * secret is missing.
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SecurityScheme(name = "bearerAuth", type = SecuritySchemeType.HTTP, scheme = "bearer", bearerFormat = "JWT")
@Slf4j
public class CardioRecordsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardioRecordsApplication.class, args);

        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  Cardio Records - PHI Access Core                         ║
            ║  Encryption: AES-256-GCM                                  ║
            ║  Audit Trail: ENABLED                                     ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }
}
