package com.aigreentick.services.evolutionapi.config;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import com.aigreentick.services.evolutionapi.constants.QueueConnection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed config properties for the Evolution API integration.
 *
 * Bound from application.yml under prefix "evolution-api":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  evolution-api:                                                 │
 * │    server-url:        ${EVOLUTION_API_URL}                      │
 * │    api-key:           ${EVOLUTION_API_KEY}                      │
 * │    default-instance:  default                                   │
 * │    webhook:                                                     │
 * │      verify-signature: true                                     │
 * │      secret:           ${EVOLUTION_WEBHOOK_SECRET}              │
 * │      queue:            false                                    │
 * │    queue:                                                       │
 * │      connection:       async                                    │
 * │      backoff:          60s,300s,900s                            │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * Components receive this object through their constructor; nothing reads
 * configuration statically. See EvolutionConfigValidator for startup checks.
 */
@Configuration
@ConfigurationProperties(prefix = "evolution-api")
@Data
public class EvolutionApiProperties {

    /** Base URL of the default Evolution API server */
    private String serverUrl = EvolutionConstants.DEFAULT_SERVER_URL;

    /** Global API key of the default server. Never log or expose */
    private String apiKey;

    /** Instance used when callers do not name one */
    private String defaultInstance = EvolutionConstants.DEFAULT_INSTANCE;

    /**
     * Additional named servers. An entry may omit server-url or api-key,
     * in which case the top-level values apply.
     */
    private Map<String, Connection> connections = new LinkedHashMap<>();

    private Http http = new Http();
    private Webhook webhook = new Webhook();
    private Queue queue = new Queue();
    private Database database = new Database();
    private Sync sync = new Sync();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Connection {
        private String serverUrl;
        private String apiKey;
    }

    @Data
    public static class Http {
        /** Read/write/response timeout */
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Webhook {
        /** Check HMAC signatures on inbound webhooks; ignored while secret is empty */
        private boolean verifySignature = true;
        /** Shared HMAC-SHA256 secret configured on the Evolution API server */
        private String secret;
        /** Hand webhooks to the job queue instead of processing them in the request */
        private boolean queue = false;
        private String path = EvolutionConstants.DEFAULT_WEBHOOK_PATH;
    }

    @Data
    public static class Queue {
        private QueueConnection connection = QueueConnection.ASYNC;
        /** Queue that message send jobs go to */
        private String queue = EvolutionConstants.DEFAULT_MESSAGE_QUEUE;
        /** Queue that webhook processing jobs go to */
        private String webhookQueue = EvolutionConstants.DEFAULT_WEBHOOK_QUEUE;
        /** Wait before retry n is backoff[min(n-1, size-1)] */
        private List<Duration> backoff = new ArrayList<>(List.of(
                Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(900)));
        /** Attempts per send job before it is exhausted */
        private int maxExceptions = 3;
        /** Scheduler threads per queue */
        private int poolSize = 4;
    }

    @Data
    public static class Database {
        private boolean storeMessages = true;
        private boolean storeWebhooks = false;
        private boolean storeInstances = true;
        private int pruneAfterDays = 30;
    }

    @Data
    public static class Sync {
        /** Periodically refresh the connection state of stored instances */
        private boolean enabled = false;
        private Duration instanceStatusInterval = Duration.ofMinutes(5);
    }

    /**
     * Resolve a named connection, falling back to the top-level server.
     * {@code null} or "default" always means the top-level server.
     */
    public Connection resolveConnection(String name) {
        Connection fallback = new Connection(serverUrl, apiKey);
        if (name == null || name.isBlank() || EvolutionConstants.DEFAULT_CONNECTION.equals(name)) {
            Connection configured = connections.get(EvolutionConstants.DEFAULT_CONNECTION);
            return configured == null ? fallback : merge(configured, fallback);
        }
        Connection configured = connections.get(name);
        if (configured == null) {
            throw new IllegalArgumentException("Unknown Evolution API connection: " + name);
        }
        return merge(configured, fallback);
    }

    private Connection merge(Connection configured, Connection fallback) {
        return new Connection(
                configured.getServerUrl() != null ? configured.getServerUrl() : fallback.getServerUrl(),
                configured.getApiKey() != null ? configured.getApiKey() : fallback.getApiKey());
    }
}
