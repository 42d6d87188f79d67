package com.aigreentick.services.evolutionapi.client;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One WebClient per named Evolution API connection, created on first use.
 * A null or blank name selects the default connection.
 */
@Component
@Slf4j
public class EvolutionConnectionResolver {

    private final EvolutionApiProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final Map<String, WebClient> clients = new ConcurrentHashMap<>();

    public EvolutionConnectionResolver(EvolutionApiProperties properties, WebClient.Builder webClientBuilder) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
    }

    public WebClient webClient(String connectionName) {
        return clients.computeIfAbsent(normalize(connectionName), this::create);
    }

    public String serverUrl(String connectionName) {
        return properties.resolveConnection(normalize(connectionName)).getServerUrl();
    }

    public static String normalize(String connectionName) {
        return connectionName == null || connectionName.isBlank()
                ? EvolutionConstants.DEFAULT_CONNECTION
                : connectionName;
    }

    private WebClient create(String connectionName) {
        EvolutionApiProperties.Connection connection = properties.resolveConnection(connectionName);
        log.info("Creating Evolution API client: connection={}, server={}", connectionName, connection.getServerUrl());

        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(stripTrailingSlash(connection.getServerUrl()));
        if (connection.getApiKey() != null && !connection.getApiKey().isBlank()) {
            builder.defaultHeader(EvolutionConstants.API_KEY_HEADER, connection.getApiKey());
        }
        return builder.build();
    }

    private String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
