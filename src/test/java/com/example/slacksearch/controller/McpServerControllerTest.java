package com.example.slacksearch.controller;

import com.example.slacksearch.gateway.ResolvedIdentity;
import com.example.slacksearch.gateway.TestIdentities;
import com.example.slacksearch.mcp.SearchTools;
import com.example.slacksearch.search.SearchMessage;
import com.example.slacksearch.search.SearchPipeline;
import com.example.slacksearch.search.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class McpServerControllerTest {

    @Mock
    private SearchPipeline searchPipeline;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private McpServerController controller;

    private final ResolvedIdentity alice = TestIdentities.direct("alice@example.com", "U1", "T0ACME");

    @BeforeEach
    void setUp() {
        MethodToolCallbackProvider tools = MethodToolCallbackProvider.builder()
                .toolObjects(new SearchTools(searchPipeline))
                .build();
        controller = new McpServerController(tools, objectMapper);
    }

    private static Map<String, Object> rpc(String method, Map<String, Object> params) {
        return Map.of("jsonrpc", "2.0", "id", 7, "method", method, "params", params);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> result(Map<String, Object> response) {
        assertNull(response.get("error"), () -> "unexpected error " + response.get("error"));
        return (Map<String, Object>) response.get("result");
    }

    @SuppressWarnings("unchecked")
    private static int errorCode(Map<String, Object> response) {
        return (Integer) ((Map<String, Object>) response.get("error")).get("code");
    }

    @Test
    void testInitialize() {
        Map<String, Object> response = controller.dispatch(rpc("initialize", Map.of()), alice);

        assertEquals(7, response.get("id"));
        assertEquals("2024-11-05", result(response).get("protocolVersion"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToolsList_ExposesSearchToolWithoutContextParameter() {
        Map<String, Object> response = controller.dispatch(rpc("tools/list", Map.of()), alice);

        List<Map<String, Object>> tools = (List<Map<String, Object>>) result(response).get("tools");
        assertEquals(1, tools.size());
        assertEquals("search_slack_messages", tools.get(0).get("name"));
        Map<String, Object> properties = (Map<String, Object>) ((Map<String, Object>) tools.get(0).get("inputSchema")).get("properties");
        assertEquals(java.util.Set.of("query"), properties.keySet());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testToolsCall_PassesIdentityToPipeline() throws Exception {
        // Given
        SearchMessage message = SearchMessage.builder()
                .text("Roadmap draft is up").teamId("T0ACME").channelId("CA").channelName("general")
                .ts("1700000000.000100").userId("U7").userName("Grace Hopper")
                .url("https://acme.slack.com/archives/CA/p1700000000000100")
                .build();
        when(searchPipeline.search("roadmap", alice)).thenReturn(SearchResult.ok(List.of(message)));

        // When
        Map<String, Object> response = controller.dispatch(rpc("tools/call",
                Map.of("name", "search_slack_messages", "arguments", Map.of("query", "roadmap"))), alice);

        // Then
        List<Map<String, Object>> content = (List<Map<String, Object>>) result(response).get("content");
        JsonNode payload = objectMapper.readTree((String) content.get(0).get("text"));
        assertEquals("OK", payload.path("status").asText());
        JsonNode first = payload.path("messages").get(0);
        assertEquals("CA", first.path("channel_id").asText());
        assertEquals("general", first.path("channel_name").asText());
        assertEquals("Grace Hopper", first.path("user_name").asText());
        assertEquals("T0ACME", first.path("team_id").asText());
        verify(searchPipeline).search("roadmap", alice);
    }

    @Test
    void testToolsCall_WithoutIdentityRefused() {
        Map<String, Object> response = controller.dispatch(rpc("tools/call",
                Map.of("name", "search_slack_messages", "arguments", Map.of("query", "roadmap"))), null);

        assertEquals(-32603, errorCode(response));
        verifyNoInteractions(searchPipeline);
    }

    @Test
    void testToolsCall_UnknownTool() {
        Map<String, Object> response = controller.dispatch(rpc("tools/call", Map.of("name", "kv_get")), alice);

        assertEquals(-32602, errorCode(response));
    }

    @Test
    void testDispatch_UnknownAndMissingMethod() {
        assertEquals(-32601, errorCode(controller.dispatch(rpc("resources/list", Map.of()), alice)));
        assertEquals(-32600, errorCode(controller.dispatch(Map.of("id", 1), alice)));
    }

    @Test
    void testHandleMcpMessage_ReadsIdentityFromExchange() {
        when(searchPipeline.search(anyString(), any())).thenReturn(SearchResult.empty("No messages found."));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/mcp/messages"));
        exchange.getAttributes().put(ResolvedIdentity.ATTRIBUTE, alice);

        Map<String, Object> response = controller.handleMcpMessage(rpc("tools/call",
                Map.of("name", "search_slack_messages", "arguments", Map.of("query", "roadmap"))), exchange).block();

        assertNotNull(response);
        assertNull(response.get("error"));
        verify(searchPipeline).search("roadmap", alice);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testCapabilities() {
        Map<String, Object> capabilities = controller.getCapabilities();

        List<Map<String, Object>> tools = (List<Map<String, Object>>) capabilities.get("tools");
        assertEquals("search_slack_messages", tools.get(0).get("name"));
    }
}
