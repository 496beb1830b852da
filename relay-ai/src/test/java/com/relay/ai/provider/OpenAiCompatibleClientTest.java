package com.relay.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relay.ai.config.AiModuleConfig;
import com.relay.ai.config.UpstreamProperties;
import com.relay.ai.prompt.PersonaPrompt;
import com.relay.common.exception.UpstreamException;
import com.relay.common.exception.UpstreamProtocolException;
import com.relay.common.exception.UpstreamTimeoutException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;

/**
 * Unit tests for OpenAiCompatibleClient against a local MockWebServer.
 */
@ExtendWith(MockitoExtension.class)
class OpenAiCompatibleClientTest {

    private static final String OK_BODY =
            "{\"id\":\"gen-1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"Hi there\"}}]}";

    @Mock
    private PersonaPrompt personaPrompt;

    private MockWebServer server;
    private UpstreamProperties properties;
    private OpenAiCompatibleClient client;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        properties = new UpstreamProperties();
        properties.setUrl(server.url("/api/v1/chat/completions").toString());
        properties.setApiKey("sk-test");
        properties.setReferer("https://relay.example");
        properties.setTimeoutSeconds(1);

        lenient().when(personaPrompt.getText()).thenReturn("You are Alice.");
        client = new OpenAiCompatibleClient(new AiModuleConfig().upstreamHttpClient(properties),
                properties, personaPrompt);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void complete_Success() throws Exception {
        server.enqueue(new MockResponse().setBody(OK_BODY));

        Completion completion = client.complete("Hello");

        assertEquals("Hi there", completion.getReply());
        assertTrue(completion.getLatencySeconds() >= 0);

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(recorded);
        assertEquals("POST", recorded.getMethod());
        assertEquals("Bearer sk-test", recorded.getHeader("Authorization"));
        assertEquals("https://relay.example", recorded.getHeader("HTTP-Referer"));
        assertEquals("Alice AI API", recorded.getHeader("X-Title"));

        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertEquals("openai/gpt-4o-mini", body.path("model").asText());
        assertEquals(0.7, body.path("temperature").asDouble(), 1e-9);
        assertEquals(2, body.path("messages").size());
        assertEquals("system", body.path("messages").path(0).path("role").asText());
        assertEquals("You are Alice.", body.path("messages").path(0).path("content").asText());
        assertEquals("user", body.path("messages").path(1).path("role").asText());
        assertEquals("Hello", body.path("messages").path(1).path("content").asText());
    }

    @Test
    void complete_NonSuccessStatus() {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"error\":\"rate limited\"}"));

        UpstreamException e = assertThrows(UpstreamException.class, () -> client.complete("Hello"));

        assertEquals(429, e.getStatusCode());
        assertEquals("{\"error\":\"rate limited\"}", e.getDetail());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void complete_Timeout() {
        server.enqueue(new MockResponse().setBody(OK_BODY).setHeadersDelay(3, TimeUnit.SECONDS));

        assertThrows(UpstreamTimeoutException.class, () -> client.complete("Hello"));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void complete_MissingContent() {
        server.enqueue(new MockResponse().setBody("{\"choices\":[]}"));

        assertThrows(UpstreamProtocolException.class, () -> client.complete("Hello"));
    }

    @Test
    void complete_MalformedJson() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        assertThrows(UpstreamProtocolException.class, () -> client.complete("Hello"));
    }

    @Test
    void toSeconds_RoundsToTwoDecimals() {
        assertEquals(1.23, OpenAiCompatibleClient.toSeconds(1_234_000_000L));
        assertEquals(1.24, OpenAiCompatibleClient.toSeconds(1_235_000_000L));
        assertEquals(0.0, OpenAiCompatibleClient.toSeconds(1_000_000L));
    }
}
