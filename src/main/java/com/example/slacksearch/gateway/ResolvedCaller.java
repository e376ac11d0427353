package com.example.slacksearch.gateway;

/**
 * Who is calling and, for trusted intermediaries, whom they act for. Intermediate product of
 * {@link ImpersonationResolver}; the gateway turns it into a {@link ResolvedIdentity} once the
 * directory has been consulted.
 */
public final class ResolvedCaller {

    private final String callerPrincipal;
    private final String actingAsEmail;
    private final String intermediary;

    private ResolvedCaller(String callerPrincipal, String actingAsEmail, String intermediary) {
        this.callerPrincipal = callerPrincipal;
        this.actingAsEmail = actingAsEmail;
        this.intermediary = intermediary;
    }

    static ResolvedCaller direct(String callerPrincipal) {
        return new ResolvedCaller(callerPrincipal, null, null);
    }

    static ResolvedCaller onBehalfOf(String callerPrincipal, String actingAsEmail, String intermediary) {
        return new ResolvedCaller(callerPrincipal, actingAsEmail, intermediary);
    }

    public String getCallerPrincipal() { return callerPrincipal; }
    public String getActingAsEmail() { return actingAsEmail; }
    public String getIntermediary() { return intermediary; }

    public boolean isImpersonated() {
        return actingAsEmail != null;
    }

    /** The end user the rest of the request treats as the caller. */
    public String effectiveEmail() {
        return actingAsEmail != null ? actingAsEmail : callerPrincipal;
    }
}
