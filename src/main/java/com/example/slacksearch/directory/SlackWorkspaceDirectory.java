package com.example.slacksearch.directory;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link WorkspaceDirectory} over the Slack Web API.
 *
 * <p>Email lookups use the bot token (directory scope); channel, thread and user reads use the
 * search user token. Calls block on the caller's thread, which is always a worker thread.
 */
@Component
public class SlackWorkspaceDirectory implements WorkspaceDirectory {

    private static final Logger logger = LoggerFactory.getLogger(SlackWorkspaceDirectory.class);

    private static final Set<String> NOT_FOUND_ERRORS = Set.of(
            "users_not_found", "user_not_found", "channel_not_found", "thread_not_found");
    private static final int MEMBERS_PAGE_SIZE = 1000;

    private final WebClient slackWebClient;
    private final String botToken;
    private final String userToken;
    private final Duration timeout;

    public SlackWorkspaceDirectory(WebClient slackWebClient,
                                   @Value("${app.slack.bot-token:}") String botToken,
                                   @Value("${app.slack.user-token:}") String userToken,
                                   @Value("${app.slack.timeout-ms:5000}") long timeoutMs) {
        this.slackWebClient = slackWebClient;
        this.botToken = botToken;
        this.userToken = userToken;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Optional<DirectoryUser> lookupUserByEmail(String email) {
        JsonNode body = call("users.lookupByEmail", botToken, params("email", email));
        return body == null ? Optional.empty() : Optional.of(toUser(body.path("user")));
    }

    @Override
    public Optional<DirectoryUser> lookupUserById(String userId) {
        JsonNode body = call("users.info", userToken, params("user", userId));
        return body == null ? Optional.empty() : Optional.of(toUser(body.path("user")));
    }

    @Override
    public Optional<ChannelAccess> channelAccess(String channelId, String memberUserId) {
        JsonNode body = call("conversations.info", userToken, params("channel", channelId));
        if (body == null) {
            return Optional.empty();
        }
        JsonNode channel = body.path("channel");
        boolean isPrivate = channel.path("is_private").asBoolean(false);
        boolean member = isPrivate && isChannelMember(channelId, memberUserId);
        return Optional.of(ChannelAccess.builder()
                .channelId(channelId)
                .name(textOrNull(channel, "name"))
                .privateChannel(isPrivate)
                .member(member)
                .build());
    }

    private boolean isChannelMember(String channelId, String userId) {
        if (userId == null) {
            return false;
        }
        String cursor = null;
        do {
            MultiValueMap<String, String> params = params("channel", channelId);
            params.add("limit", String.valueOf(MEMBERS_PAGE_SIZE));
            if (cursor != null) {
                params.add("cursor", cursor);
            }
            JsonNode body = call("conversations.members", userToken, params);
            if (body == null) {
                return false;
            }
            for (JsonNode member : body.path("members")) {
                if (userId.equals(member.asText())) {
                    return true;
                }
            }
            cursor = textOrNull(body.path("response_metadata"), "next_cursor");
        } while (cursor != null && !cursor.isEmpty());
        return false;
    }

    @Override
    public List<ThreadMessage> threadReplies(String channelId, String threadTs) {
        MultiValueMap<String, String> params = params("channel", channelId);
        params.add("ts", threadTs);
        params.add("inclusive", "true");
        JsonNode body = call("conversations.replies", userToken, params);
        List<ThreadMessage> messages = new ArrayList<>();
        if (body == null) {
            return messages;
        }
        for (JsonNode msg : body.path("messages")) {
            messages.add(ThreadMessage.builder()
                    .ts(textOrNull(msg, "ts"))
                    .threadTs(textOrNull(msg, "thread_ts"))
                    .userId(textOrNull(msg, "user"))
                    .text(textOrNull(msg, "text"))
                    .build());
        }
        return messages;
    }

    @Override
    public WorkspaceInfo workspaceInfo() {
        JsonNode body = call("team.info", userToken, new LinkedMultiValueMap<>());
        if (body == null) {
            throw new DirectoryException("team.info returned no team");
        }
        JsonNode team = body.path("team");
        return WorkspaceInfo.builder()
                .teamId(textOrNull(team, "id"))
                .domain(textOrNull(team, "domain"))
                .build();
    }

    /**
     * Returns the response body, or {@code null} when the API answered with a not-found error.
     */
    private JsonNode call(String method, String token, MultiValueMap<String, String> params) {
        JsonNode body;
        try {
            body = slackWebClient.get()
                    .uri(uri -> uri.path("/" + method).queryParams(params).build())
                    .headers(h -> h.setBearerAuth(token))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (WebClientException e) {
            throw new DirectoryException("Slack " + method + " call failed", e);
        } catch (IllegalStateException e) {
            // block() timeout
            throw new DirectoryException("Slack " + method + " timed out after " + timeout.toMillis() + "ms", e);
        }
        if (body == null) {
            throw new DirectoryException("Slack " + method + " returned an empty body");
        }
        if (!body.path("ok").asBoolean(false)) {
            String error = body.path("error").asText("unknown_error");
            if (NOT_FOUND_ERRORS.contains(error)) {
                logger.debug("Slack {} answered {}", method, error);
                return null;
            }
            throw new DirectoryException("Slack " + method + " failed: " + error);
        }
        return body;
    }

    private static DirectoryUser toUser(JsonNode user) {
        JsonNode enterpriseUser = user.path("enterprise_user");
        List<String> enterpriseTeams = new ArrayList<>();
        for (JsonNode team : enterpriseUser.path("teams")) {
            enterpriseTeams.add(team.asText());
        }
        String enterpriseId = textOrNull(user, "enterprise_id");
        if (enterpriseId == null) {
            enterpriseId = textOrNull(enterpriseUser, "enterprise_id");
        }
        return DirectoryUser.builder()
                .id(textOrNull(user, "id"))
                .email(textOrNull(user.path("profile"), "email"))
                .teamId(textOrNull(user, "team_id"))
                .enterpriseId(enterpriseId)
                .enterpriseTeamIds(List.copyOf(enterpriseTeams))
                .realName(textOrNull(user, "real_name"))
                .name(textOrNull(user, "name"))
                .build();
    }

    private static MultiValueMap<String, String> params(String name, String value) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add(name, value);
        return params;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
