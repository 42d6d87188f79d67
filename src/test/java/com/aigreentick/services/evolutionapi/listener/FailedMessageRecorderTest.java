package com.aigreentick.services.evolutionapi.listener;

import com.aigreentick.services.evolutionapi.entity.FailedMessage;
import com.aigreentick.services.evolutionapi.event.MessageFailedEvent;
import com.aigreentick.services.evolutionapi.repository.FailedMessageRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FailedMessageRecorderTest {

    @Mock
    private FailedMessageRepository failedMessageRepository;

    @InjectMocks
    private FailedMessageRecorder recorder;

    @Test
    void testOnMessageFailed_StoresPayloadAndError() {
        when(failedMessageRepository.save(any(FailedMessage.class))).thenAnswer(inv -> inv.getArgument(0));
        Map<String, Object> message = Map.of("number", "5511999999999", "text", "hi");

        recorder.onMessageFailed(new MessageFailedEvent("sales", "text", "eu", "5511999999999", message,
                new IllegalStateException("server down"), 3, true));

        ArgumentCaptor<FailedMessage> record = ArgumentCaptor.forClass(FailedMessage.class);
        verify(failedMessageRepository).save(record.capture());
        assertEquals("sales", record.getValue().getInstanceName());
        assertEquals("eu", record.getValue().getConnectionName());
        assertEquals(message, record.getValue().getPayload());
        assertEquals("server down", record.getValue().getLastError());
        assertEquals(0, record.getValue().getRetryCount());
    }

    @Test
    void testDescribe_WhenNoMessage_UsesExceptionName() {
        assertEquals("NullPointerException", FailedMessageRecorder.describe(new NullPointerException()));
    }
}
