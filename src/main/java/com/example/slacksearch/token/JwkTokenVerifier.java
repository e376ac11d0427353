package com.example.slacksearch.token;

import com.example.slacksearch.auth.AuthFailure;
import com.example.slacksearch.auth.AuthResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link TokenVerifier} backed by a published JWK set.
 *
 * <p>Signature, expiry (with clock skew) and issuer are enforced by the decoder; the audience is
 * checked here so one decoder can serve both audience-restricted and audience-free callers.
 * Unusable tokens fail closed with {@link AuthFailure#INVALID_ASSERTION}. A JWK set that cannot
 * be fetched is not the caller's fault and surfaces as an exception.
 */
public class JwkTokenVerifier implements TokenVerifier {

    private static final Logger logger = LoggerFactory.getLogger(JwkTokenVerifier.class);

    static final String EMAIL_CLAIM = "email";

    private final String name;
    private final NimbusJwtDecoder decoder;

    public JwkTokenVerifier(String name, NimbusJwtDecoder decoder, Duration clockSkew, Collection<String> issuers) {
        this.name = name;
        this.decoder = decoder;
        this.decoder.setJwtValidator(buildValidator(clockSkew, issuers));
    }

    public static JwkTokenVerifier forJwkSetUri(String name, String jwkSetUri, SignatureAlgorithm algorithm,
                                                Duration clockSkew, Collection<String> issuers) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(jwkSetUri)
                .jwsAlgorithm(algorithm)
                .build();
        return new JwkTokenVerifier(name, decoder, clockSkew, issuers);
    }

    private static OAuth2TokenValidator<Jwt> buildValidator(Duration clockSkew, Collection<String> issuers) {
        List<OAuth2TokenValidator<Jwt>> validators = new ArrayList<>();
        validators.add(new JwtTimestampValidator(clockSkew));
        // the timestamp validator skips tokens without exp
        validators.add(new JwtClaimValidator<Instant>(JwtClaimNames.EXP, Objects::nonNull));
        if (issuers != null && !issuers.isEmpty()) {
            Set<String> allowed = Set.copyOf(issuers);
            validators.add(new JwtClaimValidator<Object>(JwtClaimNames.ISS,
                    iss -> iss != null && allowed.contains(iss.toString())));
        }
        return new DelegatingOAuth2TokenValidator<>(validators);
    }

    @Override
    public AuthResult<VerifiedClaims> verify(String assertion, String expectedAudience) {
        if (assertion == null || assertion.isBlank()) {
            return AuthResult.fail(AuthFailure.INVALID_ASSERTION, name + ": empty assertion");
        }

        Jwt jwt;
        try {
            jwt = decoder.decode(assertion);
        } catch (JwtValidationException e) {
            String reasons = e.getErrors().stream()
                    .map(OAuth2Error::getDescription)
                    .collect(Collectors.joining("; "));
            logger.warn("{} assertion failed validation: {}", name, reasons);
            return AuthResult.fail(AuthFailure.INVALID_ASSERTION, name + ": " + reasons);
        } catch (BadJwtException e) {
            logger.warn("{} assertion rejected: {}", name, e.getMessage());
            return AuthResult.fail(AuthFailure.INVALID_ASSERTION, name + ": " + e.getMessage());
        }

        List<String> audience = jwt.getAudience() != null ? jwt.getAudience() : List.of();
        if (expectedAudience != null && !audience.contains(expectedAudience)) {
            logger.warn("{} assertion audience mismatch. Expected: {}", name, expectedAudience);
            return AuthResult.fail(AuthFailure.INVALID_ASSERTION, name + ": audience mismatch");
        }

        String email = jwt.getClaimAsString(EMAIL_CLAIM);
        if (email == null || email.isBlank()) {
            logger.warn("{} assertion carries no email claim (subject {})", name, jwt.getSubject());
            return AuthResult.fail(AuthFailure.MISSING_CLAIM, name + ": email claim missing");
        }

        return AuthResult.ok(VerifiedClaims.builder()
                .subject(jwt.getSubject())
                .email(email)
                .issuer(jwt.getClaimAsString(JwtClaimNames.ISS))
                .audience(List.copyOf(audience))
                .expiresAt(jwt.getExpiresAt())
                .build());
    }
}
