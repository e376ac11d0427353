package com.example.slacksearch.ratelimit;

import java.time.Duration;

/**
 * Rate limit on the number of distinct identities seen in a trailing window, shared by every
 * instance that points at the same backing store.
 *
 * <p>Contract:
 * <ol>
 *   <li>every call appends a new record, even for an identity already in the window;</li>
 *   <li>the distinct identities with a timestamp at or after {@code now - window} are counted,
 *       including the one just appended;</li>
 *   <li>the call is allowed iff that count is {@code <= maxUnique}.</li>
 * </ol>
 * The check is approximate: concurrent instances may overshoot the limit by a few records
 * because the append and the count are not one transaction. Records expire on their own, so
 * a rejected caller can succeed once the window has moved on.
 *
 * <p>Store failures propagate as exceptions; callers must not treat them as "allowed".
 */
public interface WindowedCounter {

    boolean recordAndCheck(String actingPrincipal, String targetIdentity, Duration window, int maxUnique);
}
