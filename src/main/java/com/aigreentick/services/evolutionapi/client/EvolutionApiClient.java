package com.aigreentick.services.evolutionapi.client;

import com.aigreentick.services.evolutionapi.dto.request.SendAudioRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendLocationRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendMediaRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendTextRequest;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.exception.EvolutionApiException;
import com.aigreentick.services.evolutionapi.exception.EvolutionServiceException;
import com.aigreentick.services.evolutionapi.exception.InstanceNotFoundException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * HTTP client for the Evolution API server.
 *
 * Every call takes the connection name first (null = default connection)
 * and authenticates with the connection's {@code apikey} header.
 *
 * Resilience strategy (outermost → innermost):
 *   RateLimiter → Retry → CircuitBreaker → actual HTTP call
 *
 *   1. RateLimiter    : evolutionApi (60/min); sends use evolutionApiMessages (30/min)
 *   2. Retry          : 3 attempts, 1s base exponential backoff, server errors only
 *   3. CircuitBreaker : opens after 50% failure rate; stays open 30s
 *
 * 4xx (ClientException) are NEVER retried by resilience4j. Send jobs apply
 * their own, much longer, backoff on top of this.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvolutionApiClient {

    private final EvolutionConnectionResolver connectionResolver;

    private static final String CB_NAME = "evolutionApi";
    private static final String MESSAGES_LIMITER = "evolutionApiMessages";

    // ======================================================
    // MESSAGES
    // ======================================================

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = MESSAGES_LIMITER)
    public EvolutionApiResponse sendText(String connection, String instance, SendTextRequest request) {
        log.info("Sending text message: instance={}, to={}", instance, request.getNumber());
        return post(connection, "/message/sendText/{instance}", instance, request);
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = MESSAGES_LIMITER)
    public EvolutionApiResponse sendMedia(String connection, String instance, SendMediaRequest request) {
        log.info("Sending {} message: instance={}, to={}", request.getMediatype(), instance, request.getNumber());
        return post(connection, "/message/sendMedia/{instance}", instance, request);
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = MESSAGES_LIMITER)
    public EvolutionApiResponse sendAudio(String connection, String instance, SendAudioRequest request) {
        log.info("Sending audio message: instance={}, to={}", instance, request.getNumber());
        return post(connection, "/message/sendWhatsAppAudio/{instance}", instance, request);
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = MESSAGES_LIMITER)
    public EvolutionApiResponse sendLocation(String connection, String instance, SendLocationRequest request) {
        log.info("Sending location message: instance={}, to={}", instance, request.getNumber());
        return post(connection, "/message/sendLocation/{instance}", instance, request);
    }

    // ======================================================
    // INSTANCES
    // ======================================================

    /**
     * List every instance on the server. The response is an array; v1
     * servers wrap each entry in {"instance": {...}}, v2 servers do not.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = CB_NAME)
    public EvolutionApiResponse fetchInstances(String connection) {
        log.debug("Fetching instances: connection={}", EvolutionConnectionResolver.normalize(connection));
        return exchange(connection, null, "fetchInstances",
                client -> client.get().uri("/instance/fetchInstances"));
    }

    /**
     * Start (or resume) a session. Returns the QR code as base64 and,
     * on newer servers, a pairing code.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = CB_NAME)
    public EvolutionApiResponse connect(String connection, String instance) {
        log.info("Connecting instance: {}", instance);
        return exchange(connection, instance, "connect",
                client -> client.get().uri("/instance/connect/{instance}", instance));
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = CB_NAME)
    public EvolutionApiResponse connectionState(String connection, String instance) {
        log.debug("Fetching connection state: instance={}", instance);
        return exchange(connection, instance, "connectionState",
                client -> client.get().uri("/instance/connectionState/{instance}", instance));
    }

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "fallbackEvolutionApiResponse")
    @Retry(name = CB_NAME)
    @RateLimiter(name = CB_NAME)
    public EvolutionApiResponse logout(String connection, String instance) {
        log.info("Logging out instance: {}", instance);
        return exchange(connection, instance, "logout",
                client -> client.delete().uri("/instance/logout/{instance}", instance));
    }

    // ======================================================
    // FALLBACK
    // ======================================================

    /**
     * Fallbacks for the @CircuitBreaker methods above, one overload per
     * signature. Triggered when the circuit is OPEN or the call failed.
     * Errors this client raised itself pass through unchanged so callers
     * can still tell a 4xx from an outage.
     */

    // fetchInstances
    private EvolutionApiResponse fallbackEvolutionApiResponse(String connection, Throwable ex) {
        return handleFallback(ex);
    }

    // connect, connectionState, logout
    private EvolutionApiResponse fallbackEvolutionApiResponse(String connection, String instance, Throwable ex) {
        return handleFallback(ex);
    }

    private EvolutionApiResponse fallbackEvolutionApiResponse(String connection, String instance,
                                                              SendTextRequest request, Throwable ex) {
        return handleFallback(ex);
    }

    private EvolutionApiResponse fallbackEvolutionApiResponse(String connection, String instance,
                                                              SendMediaRequest request, Throwable ex) {
        return handleFallback(ex);
    }

    private EvolutionApiResponse fallbackEvolutionApiResponse(String connection, String instance,
                                                              SendAudioRequest request, Throwable ex) {
        return handleFallback(ex);
    }

    private EvolutionApiResponse fallbackEvolutionApiResponse(String connection, String instance,
                                                              SendLocationRequest request, Throwable ex) {
        return handleFallback(ex);
    }

    private EvolutionApiResponse handleFallback(Throwable ex) {
        if (ex instanceof CallNotPermittedException) {
            log.error("Circuit OPEN: Evolution API is unreachable. Calls blocked to protect the system.");
            throw EvolutionApiException.serviceUnavailable();
        }
        if (ex instanceof EvolutionServiceException serviceException) {
            throw serviceException;
        }
        log.error("Evolution API call failed: {}", ex.getMessage());
        throw new EvolutionApiException("Evolution API call failed: " + ex.getMessage(), ex);
    }

    // ======================================================
    // PRIVATE HELPERS
    // ======================================================

    private EvolutionApiResponse post(String connection, String path, String instance, Object body) {
        return exchange(connection, instance, path,
                client -> client.post().uri(path, instance).bodyValue(body));
    }

    private EvolutionApiResponse exchange(String connection, String instance, String operation,
                                          Function<WebClient, WebClient.RequestHeadersSpec<?>> request) {
        try {
            Object response = request.apply(connectionResolver.webClient(connection))
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.NOT_FOUND.value() && instance != null,
                            res -> Mono.error(new InstanceNotFoundException(instance)))
                    .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value()
                                    || status.value() == HttpStatus.FORBIDDEN.value(),
                            res -> Mono.error(EvolutionApiException.unauthorized()))
                    .onStatus(HttpStatusCode::is4xxClientError, res -> clientError(operation, res))
                    .onStatus(HttpStatusCode::is5xxServerError, res -> serverError(operation, res))
                    .bodyToMono(Object.class)
                    .block();

            return EvolutionApiResponse.success(HttpStatus.OK.value(), response);
        } catch (WebClientRequestException ex) {
            throw new EvolutionApiException(
                    "Evolution API unreachable during " + operation + ": " + ex.getMessage(), ex);
        }
    }

    private Mono<? extends Throwable> clientError(String operation, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new EvolutionApiException.ClientException(
                        "Evolution API client error (" + status + ") during " + operation + ": " + body, status));
    }

    private Mono<? extends Throwable> serverError(String operation, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new EvolutionApiException(
                        "Evolution API server error (" + status + ") during " + operation + ": " + body, status));
    }
}
