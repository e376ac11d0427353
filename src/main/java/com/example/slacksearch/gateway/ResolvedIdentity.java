package com.example.slacksearch.gateway;

import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * The identity every component after the gateway treats as "the caller".
 *
 * <p>Only {@link AccessGateway} can construct one. It lives for a single request as an exchange
 * attribute and is handed to the search pipeline by parameter; it is never stored anywhere
 * that outlives the request.
 */
public final class ResolvedIdentity {

    public static final String ATTRIBUTE = ResolvedIdentity.class.getName();

    private final String callerPrincipal;
    private final String actingAsEmail;
    private final String directoryUserId;
    private final String teamId;
    private final String enterpriseId;

    ResolvedIdentity(String callerPrincipal, String actingAsEmail, String directoryUserId,
                     String teamId, String enterpriseId) {
        this.callerPrincipal = callerPrincipal;
        this.actingAsEmail = actingAsEmail;
        this.directoryUserId = directoryUserId;
        this.teamId = teamId;
        this.enterpriseId = enterpriseId;
    }

    public static Optional<ResolvedIdentity> from(ServerWebExchange exchange) {
        return Optional.ofNullable(exchange.getAttribute(ATTRIBUTE));
    }

    public String getCallerPrincipal() { return callerPrincipal; }
    public Optional<String> getActingAsEmail() { return Optional.ofNullable(actingAsEmail); }
    public String getDirectoryUserId() { return directoryUserId; }
    public String getTeamId() { return teamId; }
    public String getEnterpriseId() { return enterpriseId; }

    public String effectiveEmail() {
        return actingAsEmail != null ? actingAsEmail : callerPrincipal;
    }

    @Override
    public String toString() {
        return "ResolvedIdentity{caller=" + callerPrincipal
                + (actingAsEmail != null ? ", actingAs=" + actingAsEmail : "")
                + ", directoryUserId=" + directoryUserId
                + ", team=" + teamId
                + ", enterprise=" + enterpriseId + "}";
    }
}
