package com.example.slacksearch.search;

import com.example.slacksearch.cache.IdentityCache;
import com.example.slacksearch.directory.ChannelAccess;
import com.example.slacksearch.directory.DirectoryException;
import com.example.slacksearch.directory.DirectoryUser;
import com.example.slacksearch.directory.ThreadMessage;
import com.example.slacksearch.directory.WorkspaceDirectory;
import com.example.slacksearch.directory.WorkspaceInfo;
import com.example.slacksearch.gateway.ResolvedIdentity;
import com.example.slacksearch.model.AccessDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Permission-reconciling search.
 *
 * <p>The vector index is populated offline and knows nothing about who is asking, so every hit
 * is re-checked against live channel access for the resolved caller before anything is
 * returned. Access checks fail closed: a channel whose access cannot be determined is dropped.
 * Enrichment (thread content, user names) fails soft: a failed lookup degrades only its item.
 */
@Service
public class SearchPipeline {

    private static final Logger logger = LoggerFactory.getLogger(SearchPipeline.class);

    static final String NO_MESSAGES = "No messages found.";
    static final String NO_AUTHORIZED_MESSAGES = "No messages found in your authorized channels.";
    static final String AUTHENTICATION_REQUIRED = "Authentication required";

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final WorkspaceDirectory directory;
    private final IdentityCache identityCache;
    private final FanOut fanOut;
    private final int topK;

    public SearchPipeline(EmbeddingClient embeddingClient,
                          VectorIndex vectorIndex,
                          WorkspaceDirectory directory,
                          IdentityCache identityCache,
                          @Qualifier("searchExecutor") ExecutorService searchExecutor,
                          @Value("${app.search.top-k:15}") int topK,
                          @Value("${app.search.task-timeout-ms:5000}") long taskTimeoutMs) {
        this.embeddingClient = embeddingClient;
        this.vectorIndex = vectorIndex;
        this.directory = directory;
        this.identityCache = identityCache;
        this.fanOut = new FanOut(searchExecutor, Duration.ofMillis(taskTimeoutMs));
        this.topK = topK;
    }

    public SearchResult search(String query, ResolvedIdentity identity) {
        if (identity == null) {
            logger.error("Search invoked without a resolved identity, refusing");
            return SearchResult.error(AUTHENTICATION_REQUIRED);
        }
        if (query == null || query.isBlank()) {
            return SearchResult.error("Query must not be empty");
        }
        logger.info("Search for {}: {}", identity.effectiveEmail(), query);

        try {
            float[] embedding = embeddingClient.embed(query);
            List<SearchHit> hits = dedupe(vectorIndex.nearest(embedding, topK));
            if (hits.isEmpty()) {
                return SearchResult.empty(NO_MESSAGES);
            }

            Set<String> channels = hits.stream()
                    .map(SearchHit::getChannelId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            Map<String, AccessDecision> decisions = fanOut.run("channel access", channels,
                    channelId -> resolveAccess(channelId, identity),
                    AccessDecision::denied);

            List<SearchHit> permitted = hits.stream()
                    .filter(hit -> decisions.get(hit.getChannelId()).isPermitted())
                    .collect(Collectors.toList());
            logger.info("{} of {} hits in {} channels survive access reconciliation for {}",
                    permitted.size(), hits.size(), channels.size(), identity.effectiveEmail());
            if (permitted.isEmpty()) {
                return SearchResult.empty(NO_AUTHORIZED_MESSAGES);
            }

            WorkspaceInfo workspace = identityCache.workspace().getOrLoad(IdentityCache.WORKSPACE_KEY, k -> loadWorkspace());

            Map<SearchHit, Optional<List<ThreadMessage>>> threads = fanOut.run("thread fetch", permitted,
                    hit -> Optional.of(directory.threadReplies(hit.getChannelId(), hit.getTs())),
                    hit -> Optional.empty());

            Set<String> userIds = threads.values().stream()
                    .flatMap(thread -> thread.orElse(List.of()).stream())
                    .map(ThreadMessage::getUserId)
                    .filter(id -> id != null && !id.isBlank())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            Map<String, String> userNames = fanOut.run("user name", userIds, this::resolveUserName, userId -> userId);

            List<SearchMessage> messages = assemble(permitted, decisions, threads, userNames, workspace, identity);
            logger.info("Returning {} messages to agent", messages.size());
            return SearchResult.ok(messages);
        } catch (CancellationException e) {
            logger.info("Search cancelled for {}: {}", identity.effectiveEmail(), e.getMessage());
            return SearchResult.error("Search cancelled");
        } catch (RuntimeException e) {
            logger.error("Error during search for {}", identity.effectiveEmail(), e);
            return SearchResult.error("Error during search: a required service is unavailable");
        }
    }

    private static List<SearchHit> dedupe(List<SearchHit> hits) {
        Map<String, SearchHit> unique = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            unique.putIfAbsent(hit.getChannelId() + "/" + hit.getTs(), hit);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Cache-first access decision for the caller. Definite answers are cached; a directory
     * failure propagates so the fan-out falls back to "denied" without caching it.
     */
    private AccessDecision resolveAccess(String channelId, ResolvedIdentity identity) {
        String key = IdentityCache.channelAccessKey(channelId, identity.getDirectoryUserId());
        return identityCache.channelAccess().getOrLoad(key, k -> {
            Optional<ChannelAccess> access = directory.channelAccess(channelId, identity.getDirectoryUserId());
            if (access.isEmpty()) {
                return AccessDecision.denied(channelId);
            }
            ChannelAccess channel = access.get();
            return AccessDecision.builder()
                    .channelId(channelId)
                    .permitted(!channel.isPrivateChannel() || channel.isMember())
                    .channelName(channel.getName())
                    .build();
        });
    }

    private String resolveUserName(String userId) {
        String name = identityCache.userNames().getOrLoad(userId,
                id -> directory.lookupUserById(id).map(DirectoryUser::displayName).orElse(null));
        return name != null ? name : userId;
    }

    private WorkspaceInfo loadWorkspace() {
        WorkspaceInfo info = directory.workspaceInfo();
        if (info.getDomain() == null || info.getDomain().isBlank()) {
            throw new DirectoryException("Workspace info has no domain");
        }
        return info;
    }

    private List<SearchMessage> assemble(List<SearchHit> permitted,
                                         Map<String, AccessDecision> decisions,
                                         Map<SearchHit, Optional<List<ThreadMessage>>> threads,
                                         Map<String, String> userNames,
                                         WorkspaceInfo workspace,
                                         ResolvedIdentity identity) {
        String teamId = identity.getTeamId() != null ? identity.getTeamId() : workspace.getTeamId();
        Set<String> seen = new LinkedHashSet<>();
        List<SearchMessage> messages = new ArrayList<>();

        for (SearchHit hit : permitted) {
            String channelId = hit.getChannelId();
            String channelName = Optional.ofNullable(decisions.get(channelId).getChannelName()).orElse(channelId);
            Optional<List<ThreadMessage>> thread = threads.get(hit);

            if (thread.isEmpty()) {
                // thread unavailable: keep the hit itself so the caller still gets a link
                if (seen.add(channelId + "/" + hit.getTs())) {
                    messages.add(SearchMessage.builder()
                            .teamId(teamId)
                            .channelId(channelId)
                            .channelName(channelName)
                            .ts(hit.getTs())
                            .url(permalink(workspace.getDomain(), channelId, hit.getTs(), null))
                            .build());
                }
                continue;
            }

            for (ThreadMessage msg : thread.get()) {
                if (msg.getTs() == null || !seen.add(channelId + "/" + msg.getTs())) {
                    continue;
                }
                String userId = msg.getUserId();
                messages.add(SearchMessage.builder()
                        .text(msg.getText())
                        .teamId(teamId)
                        .channelId(channelId)
                        .channelName(channelName)
                        .ts(msg.getTs())
                        .userId(userId)
                        .userName(userId == null ? null : userNames.getOrDefault(userId, userId))
                        .url(permalink(workspace.getDomain(), channelId, msg.getTs(), msg.getThreadTs()))
                        .threadTs(msg.getThreadTs())
                        .build());
            }
        }
        return messages;
    }

    static String permalink(String domain, String channelId, String ts, String threadTs) {
        String url = "https://" + domain + ".slack.com/archives/" + channelId + "/p" + ts.replace(".", "");
        if (threadTs != null && !threadTs.equals(ts)) {
            url += "?thread_ts=" + threadTs + "&cid=" + channelId;
        }
        return url;
    }
}
