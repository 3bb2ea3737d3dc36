package me.go_gradually.voicelive.infrastructure.shared.config;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.resources.ConnectionProvider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebClientConfigTest {

    private final WebClientConfig config = new WebClientConfig();
    private final AppProperties properties = new AppProperties();

    private MockWebServer server;
    private ConnectionProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties.getIntegrations().getOpenai().setBaseUrl(server.url("/openai").toString());
        properties.getIntegrations().getGemini().setBaseUrl(server.url("/gemini").toString());
    }

    @AfterEach
    void tearDown() throws Exception {
        if (provider != null) {
            provider.dispose();
        }
        server.shutdown();
    }

    @Test
    void gatewayConnectionProvider_usesConfiguredPoolSize() {
        properties.getIntegrations().getHttp().setMaxConnections(7);

        provider = config.gatewayConnectionProvider(properties);

        assertEquals("voicelive-http", provider.name());
        assertEquals(7, provider.maxConnections());
    }

    @Test
    void webClients_resolveAgainstTheirOwnBaseUrls() throws Exception {
        provider = config.gatewayConnectionProvider(properties);
        server.enqueue(new MockResponse().setBody("a"));
        server.enqueue(new MockResponse().setBody("b"));

        config.openAiWebClient(properties, provider).get().uri("/models").retrieve().bodyToMono(String.class).block();
        config.geminiWebClient(properties, provider).get().uri("/models").retrieve().bodyToMono(String.class).block();

        assertEquals("/openai/models", server.takeRequest().getPath());
        assertEquals("/gemini/models", server.takeRequest().getPath());
    }

    @Test
    void webClients_rejectBodiesAboveConfiguredBuffer() {
        properties.getIntegrations().getHttp().setMaxInMemoryBytes(16);
        provider = config.gatewayConnectionProvider(properties);
        WebClient client = config.openAiWebClient(properties, provider);
        server.enqueue(new MockResponse().setBody("x".repeat(64)));

        RuntimeException error = assertThrows(RuntimeException.class,
                () -> client.get().uri("/speech").retrieve().bodyToMono(String.class).block());

        assertTrue(hasCause(error, DataBufferLimitException.class));
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }
}
