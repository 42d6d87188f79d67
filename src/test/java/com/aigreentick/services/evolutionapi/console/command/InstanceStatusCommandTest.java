package com.aigreentick.services.evolutionapi.console.command;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.console.ConsoleCommand;
import com.aigreentick.services.evolutionapi.console.ConsoleTestSupport;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.dto.response.InstanceSummary;
import com.aigreentick.services.evolutionapi.service.InstanceService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.aigreentick.services.evolutionapi.console.ConsoleTestSupport.input;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InstanceStatusCommandTest {

    @Mock
    private InstanceService instanceService;

    @Mock
    private EvolutionApiClient client;

    @InjectMocks
    private InstanceStatusCommand command;

    @Test
    void testExecute_WithUnknownAction_ListsAvailableActions() {
        ConsoleTestSupport console = new ConsoleTestSupport();

        int exit = command.execute(input("instances", "restart"), console.io());

        assertEquals(ConsoleCommand.FAILURE, exit);
        assertTrue(console.output().contains("Invalid action: restart"));
        assertTrue(console.output().contains("Available actions: list, sync, connect, disconnect"));
        verifyNoInteractions(instanceService, client);
    }

    @Test
    void testExecute_DefaultActionIsList() {
        ConsoleTestSupport console = new ConsoleTestSupport();
        when(instanceService.fetchSummaries(null)).thenReturn(List.of(InstanceSummary.builder()
                .name("sales").rawStatus("open").owner("5511999999999@s.whatsapp.net").build()));

        int exit = command.execute(input("instances"), console.io());

        assertEquals(ConsoleCommand.SUCCESS, exit);
        assertTrue(console.output().contains("| sales "));
        assertTrue(console.output().contains("| open "));
        // no profile name reported
        assertTrue(console.output().contains("| -       |"));
    }

    @Test
    void testExecute_ListWithoutInstances_Warns() {
        ConsoleTestSupport console = new ConsoleTestSupport();
        when(instanceService.fetchSummaries("eu")).thenReturn(List.of());

        int exit = command.execute(input("instances", "list", "--connection=eu"), console.io());

        assertEquals(ConsoleCommand.SUCCESS, exit);
        assertTrue(console.output().contains("WARNING: No instances found."));
    }

    @Test
    void testExecute_Sync_ReportsCount() {
        ConsoleTestSupport console = new ConsoleTestSupport();
        when(instanceService.syncInstances(null)).thenReturn(2);

        command.execute(input("instances", "sync"), console.io());

        assertTrue(console.output().contains("Synced 2 instance(s) to database."));
    }

    @Test
    void testExecute_ConnectWithoutInstance_Fails() {
        ConsoleTestSupport console = new ConsoleTestSupport();

        int exit = command.execute(input("instances", "connect"), console.io());

        assertEquals(ConsoleCommand.FAILURE, exit);
        assertTrue(console.output().contains("Instance name is required for connect action."));
    }

    @Test
    void testExecute_Connect_PrintsNestedQrCodeAndPairingCode() {
        ConsoleTestSupport console = new ConsoleTestSupport();
        when(client.connect(null, "sales")).thenReturn(EvolutionApiResponse.success(200,
                Map.of("qrcode", Map.of("base64", "data:image/png;base64,AAA"), "pairingCode", "WZYEH1YY")));

        int exit = command.execute(input("instances", "connect", "sales"), console.io());

        assertEquals(ConsoleCommand.SUCCESS, exit);
        assertTrue(console.output().contains("data:image/png;base64,AAA"));
        assertTrue(console.output().contains("Pairing Code: WZYEH1YY"));
    }

    @Test
    void testExecute_Connect_WithoutQrCode_ReportsConnected() {
        ConsoleTestSupport console = new ConsoleTestSupport();
        when(client.connect(null, "sales")).thenReturn(EvolutionApiResponse.success(200, Map.of("state", "open")));

        command.execute(input("instances", "connect", "sales"), console.io());

        assertTrue(console.output().contains("Instance connected successfully!"));
    }

    @Test
    void testExecute_DisconnectDeclined_DoesNotLogOut() {
        ConsoleTestSupport console = new ConsoleTestSupport("\n");

        int exit = command.execute(input("instances", "disconnect", "sales"), console.io());

        assertEquals(ConsoleCommand.SUCCESS, exit);
        assertTrue(console.output().contains("Operation cancelled."));
        verifyNoInteractions(client);
    }

    @Test
    void testExecute_DisconnectConfirmed_LogsOut() {
        ConsoleTestSupport console = new ConsoleTestSupport("yes\n");

        int exit = command.execute(input("instances", "disconnect", "sales", "--connection=eu"), console.io());

        assertEquals(ConsoleCommand.SUCCESS, exit);
        verify(client).logout("eu", "sales");
        assertTrue(console.output().contains("Instance disconnected successfully!"));
    }

    @Test
    void testExecute_WhenServiceThrows_PrintsErrorAndFails() {
        ConsoleTestSupport console = new ConsoleTestSupport();
        when(instanceService.fetchSummaries(null)).thenThrow(new IllegalStateException("connection refused"));

        int exit = command.execute(input("instances", "list"), console.io());

        assertEquals(ConsoleCommand.FAILURE, exit);
        assertTrue(console.output().contains("ERROR: Error: connection refused"));
    }
}
