package com.example.slacksearch.mcp;

import com.example.slacksearch.gateway.ResolvedIdentity;
import com.example.slacksearch.search.SearchPipeline;
import com.example.slacksearch.search.SearchResult;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

@Service
public class SearchTools {

    /** ToolContext key under which the controller hands over the caller's identity. */
    public static final String IDENTITY_KEY = "identity";

    private final SearchPipeline searchPipeline;

    public SearchTools(SearchPipeline searchPipeline) {
        this.searchPipeline = searchPipeline;
    }

    @Tool(name = "search_slack_messages",
          description = "Semantic search over Slack messages, limited to channels the current user can access. "
                  + "Returns matching messages with their thread replies and deep links.")
    public SearchResult search_slack_messages(
            @ToolParam(description = "Natural-language search query") String query,
            ToolContext toolContext) {
        ResolvedIdentity identity = toolContext == null ? null
                : (ResolvedIdentity) toolContext.getContext().get(IDENTITY_KEY);
        return searchPipeline.search(query, identity);
    }
}
