package me.go_gradually.ceddy.infrastructure.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    static final String LIVEKIT_FALLBACK_URL = "http://localhost:7880";

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(AppProperties properties) {
        return createWebClient("ceddy-openai", properties.getIntegrations().getOpenai().getBaseUrl());
    }

    @Bean("elevenLabsWebClient")
    public WebClient elevenLabsWebClient(AppProperties properties) {
        return createWebClient("ceddy-elevenlabs", properties.getIntegrations().getElevenlabs().getBaseUrl());
    }

    @Bean("liveKitWebClient")
    public WebClient liveKitWebClient(AppProperties properties) {
        return createWebClient("ceddy-livekit", toHttpUrl(properties.getIntegrations().getLivekit().getUrl()));
    }

    /**
     * The room server URL is usually configured as the client-facing websocket address.
     */
    static String toHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return LIVEKIT_FALLBACK_URL;
        }
        String trimmed = url.trim();
        if (trimmed.startsWith("wss://")) {
            return "https://" + trimmed.substring("wss://".length());
        }
        if (trimmed.startsWith("ws://")) {
            return "http://" + trimmed.substring("ws://".length());
        }
        return trimmed;
    }

    private WebClient createWebClient(String poolName, String baseUrl) {
        ConnectionProvider provider = createConnectionProvider(poolName);
        HttpClient httpClient = createHttpClient(provider);
        ExchangeStrategies strategies = createExchangeStrategies();
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    private ConnectionProvider createConnectionProvider(String poolName) {
        return ConnectionProvider.builder(poolName)
                .maxConnections(50)
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .build();
    }

    private HttpClient createHttpClient(ConnectionProvider provider) {
        return HttpClient.create(provider).responseTimeout(Duration.ofSeconds(60));
    }

    private ExchangeStrategies createExchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024))
                .build();
    }
}
