package com.aigreentick.services.evolutionapi.service;

import com.aigreentick.services.evolutionapi.config.EvolutionApiProperties;
import com.aigreentick.services.evolutionapi.exception.UnsupportedMessageTypeException;
import com.aigreentick.services.evolutionapi.job.JobQueue;
import com.aigreentick.services.evolutionapi.job.SendMessageJob;
import com.aigreentick.services.evolutionapi.job.SendMessageJobFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageQueueServiceTest {

    @Mock
    private JobQueue jobQueue;

    @Mock
    private SendMessageJobFactory jobFactory;

    @Mock
    private SendMessageJob job;

    private MessageQueueService service;

    @BeforeEach
    void setUp() {
        EvolutionApiProperties properties = new EvolutionApiProperties();
        properties.setDefaultInstance("main");
        service = new MessageQueueService(jobQueue, jobFactory, properties);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testQueueText_WithoutInstance_UsesDefaultInstance() {
        when(jobFactory.create(eq("main"), eq("text"), anyMap(), isNull())).thenReturn(job);

        SendMessageJob queued = service.queueText(null, "5511999999999", "Hello");

        assertSame(job, queued);
        verify(jobQueue).push(job);
        ArgumentCaptor<Map<String, Object>> message = ArgumentCaptor.forClass(Map.class);
        verify(jobFactory).create(eq("main"), eq("text"), message.capture(), isNull());
        assertEquals("5511999999999", message.getValue().get("number"));
        assertEquals("Hello", message.getValue().get("text"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testQueueMedia_OmitsNullCaption() {
        when(jobFactory.create(eq("sales"), eq("media"), anyMap(), isNull())).thenReturn(job);

        service.queueMedia("sales", "5511999999999", "image", "https://cdn.example.com/a.png", null);

        ArgumentCaptor<Map<String, Object>> message = ArgumentCaptor.forClass(Map.class);
        verify(jobFactory).create(eq("sales"), eq("media"), message.capture(), isNull());
        assertEquals("image", message.getValue().get("mediatype"));
        assertFalse(message.getValue().containsKey("caption"));
    }

    @Test
    void testQueue_WithUnknownType_FailsBeforeQueueing() {
        assertThrows(UnsupportedMessageTypeException.class,
                () -> service.queue("sales", "sticker", Map.of("number", "1"), null));

        verifyNoInteractions(jobFactory, jobQueue);
    }

    @Test
    void testQueue_PassesConnectionName() {
        Map<String, Object> message = Map.of("number", "1", "audio", "https://cdn.example.com/a.ogg");
        when(jobFactory.create("sales", "audio", message, "eu")).thenReturn(job);

        service.queue("sales", "audio", message, "eu");

        verify(jobQueue).push(job);
    }
}
