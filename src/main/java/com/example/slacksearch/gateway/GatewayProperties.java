package com.example.slacksearch.gateway;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Gateway configuration bound from {@code app.gateway.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.gateway")
public class GatewayProperties {

    /** Header carrying the perimeter proxy's signed assertion. */
    private String assertionHeader = "X-Goog-IAP-JWT-Assertion";

    /** Header carrying the on-behalf-of user token sent by trusted intermediaries. */
    private String userTokenHeader = "X-User-ID-Token";

    /** Expected {@code aud} of the perimeter assertion. */
    private String assertionAudience;

    private List<String> allowedPaths = new ArrayList<>(List.of("/mcp/sse", "/mcp/messages", "/mcp/messages/", "/mcp/capabilities"));

    private List<String> healthPaths = new ArrayList<>(List.of("/health", "/healthz", "/actuator/health"));

    private List<Intermediary> intermediaries = new ArrayList<>();

    private Authorization authorization = new Authorization();

    @Data
    public static class Intermediary {
        private String name;
        /** Regular expression that must match the caller principal in full. */
        private String principalPattern;
        private VerificationMode mode = VerificationMode.AUDIENCE_RESTRICTED;
        private String audience;
    }

    @Data
    public static class Authorization {
        private List<String> allowedTeamIds = new ArrayList<>();
        private List<String> allowedEnterpriseIds = new ArrayList<>();
        /** Optional; when non-empty the resolved email's domain must be listed. */
        private List<String> allowedEmailDomains = new ArrayList<>();
    }
}
