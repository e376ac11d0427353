package com.example.slacksearch.token;

import com.example.slacksearch.auth.AuthFailure;
import com.example.slacksearch.auth.AuthResult;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JwkTokenVerifierTest {

    private static final String ISSUER = "https://cloud.google.com/iap";
    private static final String AUDIENCE = "/projects/123/global/backendServices/456";

    private static KeyPair signingKeys;
    private static KeyPair otherKeys;

    private JwkTokenVerifier verifier;

    @BeforeAll
    static void generateKeys() throws NoSuchAlgorithmException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        signingKeys = generator.generateKeyPair();
        otherKeys = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withPublicKey((RSAPublicKey) signingKeys.getPublic()).build();
        verifier = new JwkTokenVerifier("perimeter", decoder, Duration.ofSeconds(10), List.of(ISSUER));
    }

    private static JWTClaimsSet.Builder claims() {
        Instant now = Instant.now();
        return new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject("accounts.google.com:1234")
                .audience(AUDIENCE)
                .claim("email", "alice@example.com")
                .issueTime(Date.from(now.minusSeconds(30)))
                .expirationTime(Date.from(now.plusSeconds(300)));
    }

    private static String sign(JWTClaimsSet claims, KeyPair keys) throws JOSEException {
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
        jwt.sign(new RSASSASigner(keys.getPrivate()));
        return jwt.serialize();
    }

    @Test
    void testVerify_ValidAssertion() throws Exception {
        // Given
        String token = sign(claims().build(), signingKeys);

        // When
        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        // Then
        assertTrue(result.isOk());
        assertEquals("alice@example.com", result.getValue().getEmail());
        assertEquals("accounts.google.com:1234", result.getValue().getSubject());
        assertEquals(List.of(AUDIENCE), result.getValue().getAudience());
        assertEquals(ISSUER, result.getValue().getIssuer());
    }

    @Test
    void testVerify_AudienceMismatchRejected() throws Exception {
        String token = sign(claims().audience("some-other-audience").build(), signingKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        assertFalse(result.isOk());
        assertEquals(AuthFailure.INVALID_ASSERTION, result.getFailure());
    }

    @Test
    void testVerify_NullAudienceSkipsAudienceCheck() throws Exception {
        String token = sign(claims().audience("client-id-of-someone-else").build(), signingKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, null);

        assertTrue(result.isOk());
        assertEquals("alice@example.com", result.getValue().getEmail());
    }

    @Test
    void testVerify_ExpiredBeyondClockSkewRejected() throws Exception {
        Instant now = Instant.now();
        String token = sign(claims()
                .issueTime(Date.from(now.minusSeconds(600)))
                .expirationTime(Date.from(now.minusSeconds(60)))
                .build(), signingKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        assertEquals(AuthFailure.INVALID_ASSERTION, result.getFailure());
    }

    @Test
    void testVerify_ExpiredWithinClockSkewAccepted() throws Exception {
        Instant now = Instant.now();
        String token = sign(claims()
                .issueTime(Date.from(now.minusSeconds(600)))
                .expirationTime(Date.from(now.minusSeconds(3)))
                .build(), signingKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        assertTrue(result.isOk());
    }

    @Test
    void testVerify_MissingExpiryRejected() throws Exception {
        // Given
        Instant now = Instant.now();
        String token = sign(new JWTClaimsSet.Builder()
                .issuer(ISSUER)
                .subject("accounts.google.com:1234")
                .audience(AUDIENCE)
                .claim("email", "alice@example.com")
                .issueTime(Date.from(now.minusSeconds(30)))
                .build(), signingKeys);

        // When
        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        // Then
        assertFalse(result.isOk());
        assertEquals(AuthFailure.INVALID_ASSERTION, result.getFailure());
    }

    @Test
    void testVerify_UnknownIssuerRejected() throws Exception {
        String token = sign(claims().issuer("https://evil.example.com").build(), signingKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        assertEquals(AuthFailure.INVALID_ASSERTION, result.getFailure());
    }

    @Test
    void testVerify_WrongSignatureRejected() throws Exception {
        String token = sign(claims().build(), otherKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        assertEquals(AuthFailure.INVALID_ASSERTION, result.getFailure());
    }

    @Test
    void testVerify_MissingEmailClaim() throws Exception {
        String token = sign(claims().claim("email", null).build(), signingKeys);

        AuthResult<VerifiedClaims> result = verifier.verify(token, AUDIENCE);

        assertEquals(AuthFailure.MISSING_CLAIM, result.getFailure());
    }

    @Test
    void testVerify_MalformedOrEmptyInputRejected() {
        assertEquals(AuthFailure.INVALID_ASSERTION, verifier.verify("not-a-jwt", AUDIENCE).getFailure());
        assertEquals(AuthFailure.INVALID_ASSERTION, verifier.verify("", AUDIENCE).getFailure());
        assertEquals(AuthFailure.INVALID_ASSERTION, verifier.verify(null, AUDIENCE).getFailure());
    }
}
