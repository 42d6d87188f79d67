package com.aigreentick.services.evolutionapi.job;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.dto.request.SendLocationRequest;
import com.aigreentick.services.evolutionapi.dto.request.SendTextRequest;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.event.MessageFailedEvent;
import com.aigreentick.services.evolutionapi.event.MessageSentEvent;
import com.aigreentick.services.evolutionapi.exception.EvolutionApiException;
import com.aigreentick.services.evolutionapi.exception.InvalidMessageException;
import com.aigreentick.services.evolutionapi.exception.UnsupportedMessageTypeException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SendMessageJobTest {

    private static Validator validator;

    @Mock
    private EvolutionApiClient client;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final InlineJobQueue queue = new InlineJobQueue();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    private SendMessageJob job(String type, Map<String, Object> message) {
        return new SendMessageJob("sales", type, message, null, "evolution-api", 3,
                BackoffSchedule.ofSeconds(60, 300, 900), client, eventPublisher, objectMapper, validator);
    }

    private static Map<String, Object> textMessage() {
        return Map.of("number", "5511999999999", "text", "hello");
    }

    private static EvolutionApiResponse accepted() {
        return EvolutionApiResponse.success(200, Map.of("key", Map.of("id", "MSG1")));
    }

    private List<Object> publishedEvents() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues();
    }

    private static long terminalFailures(List<Object> events) {
        return events.stream()
                .filter(e -> e instanceof MessageFailedEvent failed && failed.isTerminal())
                .count();
    }

    @Test
    void testHandle_WhenApiAccepts_SucceedsOnFirstAttempt() {
        when(client.sendText(any(), eq("sales"), any(SendTextRequest.class))).thenReturn(accepted());
        SendMessageJob job = job("text", textMessage());

        queue.push(job);

        assertEquals(JobState.SUCCEEDED, job.getState());
        assertEquals(1, job.getAttempts());
        List<Object> events = publishedEvents();
        assertEquals(1, events.size());
        MessageSentEvent sent = (MessageSentEvent) events.get(0);
        assertEquals("MSG1", sent.getMessageId());
        assertEquals("5511999999999", sent.getRecipient());
        assertFalse(sent.isFromWebhook());
    }

    @Test
    void testHandle_WhenFirstTwoAttemptsFail_SucceedsOnThird() {
        when(client.sendText(any(), eq("sales"), any(SendTextRequest.class)))
                .thenThrow(new EvolutionApiException("server error (500)", 500))
                .thenThrow(new EvolutionApiException("server error (502)", 502))
                .thenReturn(accepted());
        SendMessageJob job = job("text", textMessage());

        queue.push(job);

        assertEquals(JobState.SUCCEEDED, job.getState());
        assertEquals(3, job.getAttempts());
        verify(client, times(3)).sendText(any(), eq("sales"), any(SendTextRequest.class));
        List<Object> events = publishedEvents();
        assertEquals(0, terminalFailures(events));
        assertEquals(2, events.stream().filter(MessageFailedEvent.class::isInstance).count());
        assertEquals(1, events.stream().filter(MessageSentEvent.class::isInstance).count());
    }

    @Test
    void testHandle_WhenEveryAttemptFails_EmitsExactlyOneTerminalFailure() {
        when(client.sendText(any(), eq("sales"), any(SendTextRequest.class)))
                .thenThrow(new EvolutionApiException("Evolution API unreachable"));
        SendMessageJob job = job("text", textMessage());

        queue.push(job);

        assertEquals(JobState.EXHAUSTED, job.getState());
        verify(client, times(3)).sendText(any(), eq("sales"), any(SendTextRequest.class));
        List<Object> events = publishedEvents();
        assertEquals(1, terminalFailures(events));
        assertTrue(events.stream().noneMatch(MessageSentEvent.class::isInstance));
        MessageFailedEvent terminal = (MessageFailedEvent) events.get(events.size() - 1);
        assertTrue(terminal.isTerminal());
        assertEquals(3, terminal.getAttempt());
    }

    @Test
    void testHandle_WhenApiReportsFailure_TreatsAsFailedAttempt() {
        when(client.sendText(any(), eq("sales"), any(SendTextRequest.class)))
                .thenReturn(EvolutionApiResponse.failure(500, "rejected"))
                .thenReturn(accepted());
        SendMessageJob job = job("text", textMessage());

        queue.push(job);

        assertEquals(JobState.SUCCEEDED, job.getState());
        assertEquals(2, job.getAttempts());
    }

    @Test
    void testHandle_WhenTypeUnknown_FailsWithoutNetworkCallOrRetry() {
        SendMessageJob job = job("sticker", textMessage());

        queue.push(job);

        assertEquals(JobState.EXHAUSTED, job.getState());
        assertEquals(1, job.getAttempts());
        verifyNoInteractions(client);
        List<Object> events = publishedEvents();
        assertEquals(1, terminalFailures(events));
        MessageFailedEvent terminal = (MessageFailedEvent) events.get(events.size() - 1);
        assertInstanceOf(UnsupportedMessageTypeException.class, terminal.getError());
    }

    @Test
    void testHandle_WhenBodyInvalid_FailsWithoutRetry() {
        SendMessageJob job = job("text", Map.of("number", "5511999999999"));

        queue.push(job);

        assertEquals(JobState.EXHAUSTED, job.getState());
        verifyNoInteractions(client);
        MessageFailedEvent terminal = (MessageFailedEvent) publishedEvents().stream()
                .filter(e -> e instanceof MessageFailedEvent f && f.isTerminal())
                .findFirst().orElseThrow();
        assertInstanceOf(InvalidMessageException.class, terminal.getError());
    }

    @Test
    void testHandle_WhenClientError_DoesNotRetry() {
        when(client.sendText(any(), eq("sales"), any(SendTextRequest.class)))
                .thenThrow(new EvolutionApiException.ClientException("bad number", 400));
        SendMessageJob job = job("text", textMessage());

        queue.push(job);

        assertEquals(JobState.EXHAUSTED, job.getState());
        verify(client, times(1)).sendText(any(), eq("sales"), any(SendTextRequest.class));
    }

    @Test
    void testShouldRetry_WhenRateLimited_Retries() {
        SendMessageJob job = job("text", textMessage());

        assertTrue(job.shouldRetry(new EvolutionApiException.ClientException("slow down", 429)));
        assertTrue(job.shouldRetry(new EvolutionApiException("boom", 503)));
        assertFalse(job.shouldRetry(new EvolutionApiException.ClientException("forbidden", 403)));
    }

    @Test
    void testHandle_LocationMessage_DispatchesToLocationEndpoint() {
        when(client.sendLocation(any(), eq("sales"), any(SendLocationRequest.class))).thenReturn(accepted());
        SendMessageJob job = job("location", Map.of("number", "5511999999999", "latitude", -23.55, "longitude", -46.63));

        queue.push(job);

        assertEquals(JobState.SUCCEEDED, job.getState());
        ArgumentCaptor<SendLocationRequest> request = ArgumentCaptor.forClass(SendLocationRequest.class);
        verify(client).sendLocation(any(), eq("sales"), request.capture());
        assertEquals(-23.55, request.getValue().getLatitude());
    }
}
