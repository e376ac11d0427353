package com.example.slacksearch.controller;

import com.example.slacksearch.gateway.ResolvedIdentity;
import com.example.slacksearch.mcp.SearchTools;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * MCP JSON-RPC surface. Every request reaching this controller has already passed the
 * access gateway, which bound the caller's {@link ResolvedIdentity} to the exchange.
 */
@RestController
public class McpServerController {

    private static final Logger logger = LoggerFactory.getLogger(McpServerController.class);

    static final String PROTOCOL_VERSION = "2024-11-05";
    static final String SERVER_NAME = "slack-search";
    static final String SERVER_VERSION = "1.0.0";

    private final ToolCallbackProvider toolCallbacks;
    private final ObjectMapper objectMapper;
    private final Map<String, Sinks.Many<ServerSentEvent<String>>> sseConnections = new ConcurrentHashMap<>();

    public McpServerController(ToolCallbackProvider toolCallbacks, ObjectMapper objectMapper) {
        this.toolCallbacks = toolCallbacks;
        this.objectMapper = objectMapper;
    }

    @GetMapping(value = "/mcp/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> sse(@RequestParam(name = "session_id", required = false) String sessionId) {
        String connectionId = sessionId != null ? sessionId : UUID.randomUUID().toString();

        Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast().onBackpressureBuffer();
        sseConnections.put(connectionId, sink);

        // announce where JSON-RPC messages for this session go
        sink.tryEmitNext(ServerSentEvent.<String>builder()
                .event("endpoint")
                .data("/mcp/messages/?session_id=" + connectionId)
                .build());

        return sink.asFlux()
                .doOnCancel(() -> sseConnections.remove(connectionId))
                .doOnTerminate(() -> sseConnections.remove(connectionId))
                .onErrorResume(throwable -> {
                    sseConnections.remove(connectionId);
                    return Flux.empty();
                });
    }

    @PostMapping(value = {"/mcp/messages", "/mcp/messages/"},
                 consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> handleMcpMessage(@RequestBody Map<String, Object> request,
                                                      ServerWebExchange exchange) {
        Optional<ResolvedIdentity> identity = ResolvedIdentity.from(exchange);
        return Mono.fromCallable(() -> dispatch(request, identity.orElse(null)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    Map<String, Object> dispatch(Map<String, Object> request, ResolvedIdentity identity) {
        Object id = request.get("id");
        try {
            String method = (String) request.get("method");
            if (method == null) {
                return createErrorResponse(id, "Missing method field", -32600);
            }

            switch (method) {
                case "initialize":
                    return createResultResponse(id, handleInitialize());
                case "tools/list":
                    return createResultResponse(id, handleToolsList());
                case "tools/call":
                    return handleToolCall(id, request, identity);
                default:
                    return createErrorResponse(id, "Method not found: " + method, -32601);
            }
        } catch (Exception e) {
            logger.error("Failed to handle MCP message", e);
            return createErrorResponse(id, "Internal error", -32603);
        }
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", PROTOCOL_VERSION,
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false)
                ),
                "serverInfo", Map.of(
                        "name", SERVER_NAME,
                        "version", SERVER_VERSION
                )
        );
    }

    private Map<String, Object> handleToolsList() throws Exception {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolCallback callback : toolCallbacks.getToolCallbacks()) {
            ToolDefinition definition = callback.getToolDefinition();
            Map<String, Object> schema = objectMapper.readValue(definition.inputSchema(),
                    new TypeReference<Map<String, Object>>() {});
            tools.add(Map.of(
                    "name", definition.name(),
                    "description", definition.description(),
                    "inputSchema", schema
            ));
        }
        return Map.of("tools", tools);
    }

    private Map<String, Object> handleToolCall(Object id, Map<String, Object> request, ResolvedIdentity identity) {
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) request.get("params");
        String toolName = params != null ? (String) params.get("name") : null;
        if (toolName == null) {
            return createErrorResponse(id, "Missing tool name", -32602);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = (Map<String, Object>) params.get("arguments");

        Optional<ToolCallback> callback = Arrays.stream(toolCallbacks.getToolCallbacks())
                .filter(cb -> cb.getToolDefinition().name().equals(toolName))
                .findFirst();
        if (callback.isEmpty()) {
            return createErrorResponse(id, "Unknown tool: " + toolName, -32602);
        }
        if (identity == null) {
            // the gateway always binds one, so reaching here means the filter chain is misconfigured
            logger.error("Tool call {} without a resolved identity", toolName);
            return createErrorResponse(id, "Authentication required", -32603);
        }

        try {
            String input = objectMapper.writeValueAsString(arguments != null ? arguments : Map.of());
            String output = callback.get().call(input, new ToolContext(Map.of(SearchTools.IDENTITY_KEY, identity)));
            return createResultResponse(id, Map.of(
                    "content", List.of(Map.of(
                            "type", "text",
                            "text", output
                    )),
                    "isError", false
            ));
        } catch (Exception e) {
            logger.error("Tool {} failed", toolName, e);
            return createErrorResponse(id, "Tool execution failed", -32603);
        }
    }

    private Map<String, Object> createResultResponse(Object id, Map<String, Object> result) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("result", result);
        return response;
    }

    private Map<String, Object> createErrorResponse(Object id, String message, int code) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.put("error", Map.of(
                "code", code,
                "message", message
        ));
        return response;
    }

    @GetMapping("/mcp/capabilities")
    public Map<String, Object> getCapabilities() {
        return Map.of(
                "server", Map.of(
                        "name", SERVER_NAME,
                        "version", SERVER_VERSION
                ),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false,
                        "completion", false
                ),
                "tools", Arrays.stream(toolCallbacks.getToolCallbacks())
                        .map(cb -> Map.of(
                                "name", cb.getToolDefinition().name(),
                                "description", cb.getToolDefinition().description()
                        ))
                        .toList()
        );
    }
}
