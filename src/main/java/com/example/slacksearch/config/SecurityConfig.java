package com.example.slacksearch.config;

import com.example.slacksearch.token.JwkTokenVerifier;
import com.example.slacksearch.token.TokenVerifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;

import java.time.Duration;
import java.util.List;

/**
 * The two assertion verifiers: one for the perimeter proxy's assertion, one for the user ID
 * tokens intermediaries forward on behalf of end users.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public TokenVerifier perimeterTokenVerifier(
            @Value("${app.security.perimeter.jwk-set-uri:https://www.gstatic.com/iap/verify/public_key-jwk}") String jwkSetUri,
            @Value("${app.security.perimeter.issuers:https://cloud.google.com/iap}") List<String> issuers,
            @Value("${app.security.clock-skew-seconds:10}") long clockSkewSeconds) {
        return JwkTokenVerifier.forJwkSetUri("perimeter", jwkSetUri, SignatureAlgorithm.ES256,
                Duration.ofSeconds(clockSkewSeconds), issuers);
    }

    @Bean
    public TokenVerifier userTokenVerifier(
            @Value("${app.security.user-token.jwk-set-uri:https://www.googleapis.com/oauth2/v3/certs}") String jwkSetUri,
            @Value("${app.security.user-token.issuers:https://accounts.google.com,accounts.google.com}") List<String> issuers,
            @Value("${app.security.clock-skew-seconds:10}") long clockSkewSeconds) {
        return JwkTokenVerifier.forJwkSetUri("user-token", jwkSetUri, SignatureAlgorithm.RS256,
                Duration.ofSeconds(clockSkewSeconds), issuers);
    }
}
