package com.example.slacksearch.gateway;

import com.example.slacksearch.auth.AuthFailure;
import com.example.slacksearch.auth.AuthResult;
import com.example.slacksearch.cache.IdentityCache;
import com.example.slacksearch.directory.DirectoryUser;
import com.example.slacksearch.directory.WorkspaceDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps a resolved end user onto workspace membership and checks it against the allow-lists.
 * Fails closed: a directory error, an unknown user or an empty allow-list all deny.
 */
@Component
public class AuthorizationPolicy {

    private static final Logger logger = LoggerFactory.getLogger(AuthorizationPolicy.class);

    private final WorkspaceDirectory directory;
    private final IdentityCache identityCache;
    private final Set<String> allowedTeamIds;
    private final Set<String> allowedEnterpriseIds;
    private final Set<String> allowedEmailDomains;

    public AuthorizationPolicy(WorkspaceDirectory directory, IdentityCache identityCache, GatewayProperties properties) {
        this.directory = directory;
        this.identityCache = identityCache;
        GatewayProperties.Authorization authz = properties.getAuthorization();
        this.allowedTeamIds = Set.copyOf(authz.getAllowedTeamIds());
        this.allowedEnterpriseIds = Set.copyOf(authz.getAllowedEnterpriseIds());
        this.allowedEmailDomains = authz.getAllowedEmailDomains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (allowedTeamIds.isEmpty() && allowedEnterpriseIds.isEmpty()) {
            logger.error("Security risk: no allowed teams or enterprises configured. Every request will be denied.");
        }
    }

    public AuthResult<DirectoryUser> authorize(String email) {
        DirectoryUser user;
        try {
            user = identityCache.usersByEmail().getOrLoad(email, e -> directory.lookupUserByEmail(e).orElse(null));
        } catch (RuntimeException e) {
            logger.error("Directory lookup failed for {}, denying: {}", email, e.getMessage());
            return AuthResult.fail(AuthFailure.USER_NOT_FOUND, "directory lookup failed: " + e.getMessage());
        }
        if (user == null) {
            logger.warn("User {} not found in the workspace directory", email);
            return AuthResult.fail(AuthFailure.USER_NOT_FOUND, "no directory entry for " + email);
        }

        String teamId = user.effectiveTeamId();
        String enterpriseId = user.getEnterpriseId();
        logger.info("Authorizing user {}: directory_id={}, team={}, enterprise={}", email, user.getId(), teamId, enterpriseId);

        if (allowedTeamIds.isEmpty() && allowedEnterpriseIds.isEmpty()) {
            return AuthResult.fail(AuthFailure.UNAUTHORIZED, "no allowed teams or enterprises configured");
        }
        if (!allowedEmailDomains.isEmpty() && !allowedEmailDomains.contains(domainOf(email))) {
            logger.warn("User {} has an email domain outside the allow-list", email);
            return AuthResult.fail(AuthFailure.UNAUTHORIZED, "email domain not allowed");
        }
        boolean teamAllowed = teamId != null && allowedTeamIds.contains(teamId);
        boolean enterpriseAllowed = enterpriseId != null && allowedEnterpriseIds.contains(enterpriseId);
        if (!teamAllowed && !enterpriseAllowed) {
            logger.warn("User {} failed authorization check (team/enterprise: {}/{})", email, teamId, enterpriseId);
            return AuthResult.fail(AuthFailure.UNAUTHORIZED, "team " + teamId + " / enterprise " + enterpriseId + " not allowed");
        }
        return AuthResult.ok(user);
    }

    private static String domainOf(String email) {
        int at = email.lastIndexOf('@');
        return at < 0 ? "" : email.substring(at + 1).toLowerCase(Locale.ROOT);
    }
}
