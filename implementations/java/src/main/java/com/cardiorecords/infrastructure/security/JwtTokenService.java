package com.cardiorecords.infrastructure.security;

import com.cardiorecords.application.exceptions.AuthException;
import com.cardiorecords.config.PhiSecurityProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * HS256 JWT implementation of {@link TokenService} using Nimbus JOSE.
 *
 * Claims: {@code sub} (principal id), {@code jti}, {@code iat}, {@code exp},
 * {@code iss}. Time comes from the injected {@link Clock} so expiry is
 * testable; JWT times have one-second resolution.
 */
@Service
@Slf4j
public class JwtTokenService implements TokenService {

    static final int MIN_SECRET_BYTES = 32;

    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Duration expiry;
    private final String issuer;
    private final Clock clock;

    @Autowired
    public JwtTokenService(PhiSecurityProperties properties, Clock clock) {
        this(properties.getToken().getSigningSecret(), properties.getToken().getExpiry(),
            properties.getToken().getIssuer(), clock);
    }

    public JwtTokenService(String signingSecret, Duration expiry, String issuer, Clock clock) {
        if (signingSecret == null || signingSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "Token signing secret must be at least " + MIN_SECRET_BYTES + " bytes (phi.security.token.signing-secret)");
        }
        byte[] secret = signingSecret.getBytes(StandardCharsets.UTF_8);
        try {
            this.signer = new MACSigner(secret);
            this.verifier = new MACVerifier(secret);
        } catch (JOSEException e) {
            throw new IllegalStateException("Invalid token signing secret", e);
        }
        this.expiry = expiry;
        this.issuer = issuer;
        this.clock = clock;
    }

    @Override
    public IssuedToken issue(UUID principalId) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(expiry);
        String tokenId = UUID.randomUUID().toString();

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
            .subject(principalId.toString())
            .jwtID(tokenId)
            .issueTime(Date.from(issuedAt))
            .expirationTime(Date.from(expiresAt))
            .issuer(issuer)
            .build();

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Token signing failed", e);
        }
        log.debug("Token issued: principal={}, tokenId={}, expiresAt={}", principalId, tokenId, expiresAt);
        return new IssuedToken(jwt.serialize(), tokenId, issuedAt, expiresAt);
    }

    @Override
    public VerifiedToken verify(String token) {
        if (token == null || token.isBlank()) {
            throw AuthException.tokenInvalid();
        }
        JWTClaimsSet claims;
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm()) || !jwt.verify(verifier)) {
                log.debug("Token rejected: bad signature or algorithm");
                throw AuthException.tokenInvalid();
            }
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException | JOSEException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            throw new AuthException(AuthException.Reason.TOKEN_INVALID, e);
        }

        if (!issuer.equals(claims.getIssuer())
                || claims.getSubject() == null
                || claims.getJWTID() == null
                || claims.getIssueTime() == null
                || claims.getExpirationTime() == null) {
            throw AuthException.tokenInvalid();
        }

        Instant expiresAt = claims.getExpirationTime().toInstant();
        if (clock.instant().isAfter(expiresAt)) {
            throw AuthException.tokenExpired();
        }

        UUID principalId;
        try {
            principalId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException e) {
            throw new AuthException(AuthException.Reason.TOKEN_INVALID, e);
        }
        return new VerifiedToken(principalId, claims.getJWTID(), claims.getIssueTime().toInstant(), expiresAt);
    }
}
