package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.constants.MessageType;
import com.aigreentick.services.evolutionapi.dto.request.SendAudioRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendLocationRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendMediaRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendTextRequest;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.event.MessageFailedEvent;
import com.aigreentick.services.evolutionapi.event.MessageSentEvent;
import com.aigreentick.services.evolutionapi.exception.EvolutionApiException;
import com.aigreentick.services.evolutionapi.exception.InvalidMessageException;
import com.aigreentick.services.evolutionapi.exception.UnsupportedMessageTypeException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sends one outbound WhatsApp message through the Evolution API.
 *
 * Each attempt:
 *   - resolves the message type; an unknown type fails before any network call
 *   - binds and validates the message body for that type
 *   - calls the matching client method
 *   - success  → MessageSentEvent, state SUCCEEDED
 *   - failure  → MessageFailedEvent (terminal=false), state FAILED, rethrow
 *
 * The queue decides about retries (see JobAttemptRunner). When it gives up,
 * {@link #failed(Throwable)} publishes the terminal MessageFailedEvent.
 *
 * No deduplication: if the server delivered the message but the response
 * was lost, the retry sends it again.
 */
@Slf4j
@Getter
public class SendMessageJob implements QueuedJob {

    /** 4xx codes that are worth retrying */
    private static final Set<Integer> RETRYABLE_CLIENT_STATUSES = Set.of(408, 429);

    private final String instanceName;
    private final String messageType;
    private final Map<String, Object> message;
    private final String connectionName;
    private final String queue;
    private final int maxTries;
    private final BackoffSchedule backoff;

    @Getter(AccessLevel.NONE)
    private final EvolutionApiClient client;
    @Getter(AccessLevel.NONE)
    private final ApplicationEventPublisher eventPublisher;
    @Getter(AccessLevel.NONE)
    private final ObjectMapper objectMapper;
    @Getter(AccessLevel.NONE)
    private final Validator validator;

    private volatile JobState state = JobState.PENDING;
    private volatile int attempts;
    private volatile EvolutionApiResponse lastResponse;

    SendMessageJob(String instanceName, String messageType, Map<String, Object> message, String connectionName,
                   String queue, int maxTries, BackoffSchedule backoff,
                   EvolutionApiClient client, ApplicationEventPublisher eventPublisher,
                   ObjectMapper objectMapper, Validator validator) {
        this.instanceName = instanceName;
        this.messageType = messageType;
        this.message = Collections.unmodifiableMap(new LinkedHashMap<>(message));
        this.connectionName = connectionName;
        this.queue = queue;
        this.maxTries = maxTries;
        this.backoff = backoff;
        this.client = client;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @Override
    public String getName() {
        return "SendMessageJob[" + messageType + " via " + instanceName + " to " + getRecipient() + "]";
    }

    public String getRecipient() {
        Object number = message.get("number");
        return number != null ? String.valueOf(number) : null;
    }

    @Override
    public void handle(int attempt) throws Exception {
        this.attempts = attempt;
        this.state = JobState.SENDING;
        log.debug("Sending {} message: instance={}, attempt={}/{}", messageType, instanceName, attempt, maxTries);

        try {
            EvolutionApiResponse response = dispatch(MessageType.fromValue(messageType));
            if (!response.isSuccess()) {
                throw new EvolutionApiException(
                        "Evolution API reported failure: " + response.getMessage(), response.getStatusCode());
            }

            this.lastResponse = response;
            this.state = JobState.SUCCEEDED;
            log.info("Message sent: instance={}, type={}, to={}, attempt={}",
                    instanceName, messageType, getRecipient(), attempt);
            eventPublisher.publishEvent(new MessageSentEvent(
                    instanceName, messageType, getRecipient(), message, response.getDataAsMap(), false));

        } catch (Exception ex) {
            this.state = JobState.FAILED;
            log.warn("Message send failed: instance={}, type={}, to={}, attempt={}/{}: {}",
                    instanceName, messageType, getRecipient(), attempt, maxTries, ex.getMessage());
            eventPublisher.publishEvent(new MessageFailedEvent(
                    instanceName, messageType, connectionName, getRecipient(), message, ex, attempt, false));
            throw ex;
        }
    }

    @Override
    public boolean shouldRetry(Throwable cause) {
        if (cause instanceof UnsupportedMessageTypeException || cause instanceof InvalidMessageException) {
            return false;
        }
        if (cause instanceof EvolutionApiException.ClientException clientError) {
            return RETRYABLE_CLIENT_STATUSES.contains(clientError.getHttpStatus());
        }
        return true;
    }

    @Override
    public void retryScheduled(int nextAttempt, Duration delay) {
        this.state = JobState.PENDING;
    }

    @Override
    public void failed(Throwable cause) {
        this.state = JobState.EXHAUSTED;
        log.error("Message permanently failed: instance={}, type={}, to={}, attempts={}: {}",
                instanceName, messageType, getRecipient(), attempts, cause.getMessage());
        eventPublisher.publishEvent(new MessageFailedEvent(
                instanceName, messageType, connectionName, getRecipient(), message, cause, attempts, true));
    }

    // ========================
    // DISPATCH BY TYPE
    // ========================

    private EvolutionApiResponse dispatch(MessageType type) {
        return switch (type) {
            case TEXT -> client.sendText(connectionName, instanceName, bind(SendTextRequest.class));
            case MEDIA -> client.sendMedia(connectionName, instanceName, bind(SendMediaRequest.class));
            case AUDIO -> client.sendAudio(connectionName, instanceName, bind(SendAudioRequest.class));
            case LOCATION -> client.sendLocation(connectionName, instanceName, bind(SendLocationRequest.class));
        };
    }

    private <T> T bind(Class<T> requestType) {
        T request;
        try {
            request = objectMapper.convertValue(message, requestType);
        } catch (IllegalArgumentException ex) {
            throw new InvalidMessageException("Malformed " + messageType + " message: " + ex.getMessage());
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidMessageException("Invalid " + messageType + " message: " + details);
        }
        return request;
    }
}
