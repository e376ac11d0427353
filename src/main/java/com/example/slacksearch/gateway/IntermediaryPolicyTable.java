package com.example.slacksearch.gateway;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered table of trusted intermediaries. The first rule whose pattern matches the verified
 * caller principal decides how the on-behalf-of token is checked; no match means the caller is
 * a direct end user.
 */
public final class IntermediaryPolicyTable {

    private final List<Rule> rules;

    private IntermediaryPolicyTable(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    /**
     * @throws IllegalStateException if a rule is incomplete or an audience-restricted rule has
     *                               no audience
     */
    public static IntermediaryPolicyTable from(List<GatewayProperties.Intermediary> entries) {
        List<Rule> rules = new ArrayList<>();
        for (GatewayProperties.Intermediary entry : entries) {
            if (entry.getName() == null || entry.getPrincipalPattern() == null || entry.getMode() == null) {
                throw new IllegalStateException("Intermediary policy needs name, principal-pattern and mode: " + entry);
            }
            if (entry.getMode() == VerificationMode.AUDIENCE_RESTRICTED
                    && (entry.getAudience() == null || entry.getAudience().isBlank())) {
                throw new IllegalStateException("Intermediary '" + entry.getName() + "' is audience-restricted but has no audience");
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(entry.getPrincipalPattern());
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Intermediary '" + entry.getName() + "' has an invalid principal-pattern", e);
            }
            String audience = entry.getMode() == VerificationMode.AUDIENCE_RESTRICTED ? entry.getAudience() : null;
            rules.add(new Rule(entry.getName(), pattern, entry.getMode(), audience));
        }
        return new IntermediaryPolicyTable(rules);
    }

    public Optional<Rule> match(String principal) {
        if (principal == null) {
            return Optional.empty();
        }
        return rules.stream().filter(rule -> rule.pattern.matcher(principal).matches()).findFirst();
    }

    public List<Rule> getRules() {
        return rules;
    }

    public static final class Rule {
        private final String name;
        private final Pattern pattern;
        private final VerificationMode mode;
        private final String audience;

        private Rule(String name, Pattern pattern, VerificationMode mode, String audience) {
            this.name = name;
            this.pattern = pattern;
            this.mode = mode;
            this.audience = audience;
        }

        public String getName() { return name; }
        public VerificationMode getMode() { return mode; }

        /** The audience to verify against; always {@code null} for {@link VerificationMode#AUDIENCE_FREE}. */
        public String getAudience() { return audience; }

        @Override
        public String toString() {
            return name + "(" + mode + ")";
        }
    }
}
