package me.go_gradually.voicelive.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * WebClients for the pipeline gateways. Both clients draw from one connection pool.
 */
@Configuration
public class WebClientConfig {
    private static final Logger log = Logger.getLogger(WebClientConfig.class.getName());

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider gatewayConnectionProvider(AppProperties properties) {
        AppProperties.Http http = properties.getIntegrations().getHttp();
        log.info(() -> "http.pool.created maxConnections=" + http.getMaxConnections()
                + " responseTimeoutMs=" + http.getResponseTimeoutMs());
        return ConnectionProvider.builder("voicelive-http")
                .maxConnections(http.getMaxConnections())
                .pendingAcquireTimeout(Duration.ofMillis(http.getPendingAcquireTimeoutMs()))
                .build();
    }

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(AppProperties properties, ConnectionProvider gatewayConnectionProvider) {
        return gatewayClient(properties.getIntegrations().getHttp(), gatewayConnectionProvider)
                .baseUrl(properties.getIntegrations().getOpenai().getBaseUrl())
                .build();
    }

    @Bean("geminiWebClient")
    public WebClient geminiWebClient(AppProperties properties, ConnectionProvider gatewayConnectionProvider) {
        return gatewayClient(properties.getIntegrations().getHttp(), gatewayConnectionProvider)
                .baseUrl(properties.getIntegrations().getGemini().getBaseUrl())
                .build();
    }

    // TTS 응답이 수 MB까지 커질 수 있어 기본 버퍼 한도(256KB)를 올린다.
    static WebClient.Builder gatewayClient(AppProperties.Http http, ConnectionProvider provider) {
        HttpClient httpClient = HttpClient.create(provider)
                .responseTimeout(Duration.ofMillis(http.getResponseTimeoutMs()));
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(http.getMaxInMemoryBytes()));
    }
}
