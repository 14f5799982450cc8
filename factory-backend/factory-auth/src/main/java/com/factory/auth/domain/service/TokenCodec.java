package com.factory.auth.domain.service;

import com.factory.auth.domain.constants.AuthConstants;
import com.factory.auth.domain.exception.InvalidTokenException;
import com.factory.auth.domain.exception.InvalidTokenException.Reason;
import com.factory.auth.domain.model.TokenClaims;
import com.factory.auth.domain.utils.CryptoUtils;
import com.nimbusds.jose.Header;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObject;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and parses HS256-signed JWTs.
 * <p>
 * Only HS256 is accepted: the algorithm named in a presented header is checked, never trusted.
 * The signature is recomputed over the raw {@code header.payload} text and compared against the
 * presented signature segment in constant time before the payload is decoded, and expiry is checked
 * last, so a forged token can never reach claim parsing.
 */
@Slf4j
public class TokenCodec {

    private static final JWSHeader HEADER = new JWSHeader.Builder(JWSAlgorithm.HS256)
            .type(JOSEObjectType.JWT)
            .build();

    private final MACSigner signer;
    private final Clock clock;
    private final CryptoUtils cryptoUtils;

    public TokenCodec(byte[] secret, Clock clock, CryptoUtils cryptoUtils) {
        if (secret == null || secret.length < AuthConstants.MIN_SECRET_BYTE_LENGTH) {
            throw new IllegalArgumentException(
                    "Token secret must be at least " + AuthConstants.MIN_SECRET_BYTE_LENGTH + " bytes");
        }
        try {
            this.signer = new MACSigner(secret);
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Unusable token secret", e);
        }
        this.clock = clock;
        this.cryptoUtils = cryptoUtils;
        log.info("[TOKEN_CODEC_INIT] Token codec initialized | algorithm=HS256");
    }

    /**
     * Sign a token for {@code subject} that expires {@code ttl} from now.
     */
    public String issue(String subject, String email, Duration ttl) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        String jti = UUID.randomUUID().toString();

        JWTClaimsSet claimsSet = new JWTClaimsSet.Builder()
                .jwtID(jti)
                .subject(subject)
                .claim(AuthConstants.CLAIM_EMAIL, email)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(ttl)))
                .build();

        try {
            SignedJWT signedJWT = new SignedJWT(HEADER, claimsSet);
            signedJWT.sign(signer);
            log.debug("[TOKEN_ISSUED] Token signed | sub={} | jti={} | expiresIn={}s",
                    subject, jti, ttl.toSeconds());
            return signedJWT.serialize();
        } catch (JOSEException e) {
            log.error("[TOKEN_SIGN_ERROR] Failed to sign token | sub={}", subject, e);
            throw new IllegalStateException("Failed to sign token", e);
        }
    }

    /**
     * Verify {@code token} and recover its claims.
     *
     * @throws InvalidTokenException with reason MALFORMED, SIGNATURE_MISMATCH or EXPIRED
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException(Reason.MALFORMED);
        }

        Base64URL[] parts;
        Header header;
        try {
            parts = JOSEObject.split(token);
            header = parts.length == 3 ? Header.parse(parts[0]) : null;
        } catch (ParseException e) {
            log.debug("[TOKEN_MALFORMED] Token structure rejected | error={}", e.getMessage());
            throw new InvalidTokenException(Reason.MALFORMED, e);
        }
        if (header == null) {
            throw new InvalidTokenException(Reason.MALFORMED);
        }

        if (!(header instanceof JWSHeader) || !JWSAlgorithm.HS256.equals(header.getAlgorithm())) {
            log.warn("[TOKEN_ALG_REJECTED] Token header names an unsupported algorithm | alg={}",
                    header.getAlgorithm());
            throw new InvalidTokenException(Reason.SIGNATURE_MISMATCH);
        }

        byte[] signingInput = (parts[0].toString() + '.' + parts[1].toString())
                .getBytes(StandardCharsets.US_ASCII);
        Base64URL expected;
        try {
            expected = signer.sign(HEADER, signingInput);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to compute token signature", e);
        }
        if (!cryptoUtils.slowEquals(expected.toString(), parts[2].toString())) {
            log.warn("[TOKEN_INVALID_SIGNATURE] Token signature verification failed");
            throw new InvalidTokenException(Reason.SIGNATURE_MISMATCH);
        }

        TokenClaims claims;
        try {
            JWTClaimsSet claimsSet = JWTClaimsSet.parse(parts[1].decodeToString());
            claims = TokenClaims.builder()
                    .subject(claimsSet.getSubject())
                    .email(claimsSet.getStringClaim(AuthConstants.CLAIM_EMAIL))
                    .tokenId(claimsSet.getJWTID())
                    .issuedAt(toInstant(claimsSet.getIssueTime()))
                    .expiresAt(toInstant(claimsSet.getExpirationTime()))
                    .build();
        } catch (ParseException | IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, e);
        }
        if (claims.getSubject() == null || claims.getExpiresAt() == null) {
            throw new InvalidTokenException(Reason.MALFORMED);
        }

        if (clock.instant().isAfter(claims.getExpiresAt())) {
            log.debug("[TOKEN_EXPIRED] Token has expired | sub={} | exp={}",
                    claims.getSubject(), claims.getExpiresAt());
            throw new InvalidTokenException(Reason.EXPIRED);
        }
        return claims;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
