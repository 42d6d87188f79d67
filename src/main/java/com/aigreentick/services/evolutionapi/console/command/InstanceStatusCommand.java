package com.aigreentick.services.evolutionapi.console.command;

import com.aigreentick.services.evolutionapi.client.EvolutionApiClient;
import com.aigreentick.services.evolutionapi.console.CommandInput;
import com.aigreentick.services.evolutionapi.console.ConsoleCommand;
import com.aigreentick.services.evolutionapi.console.ConsoleIO;
import com.aigreentick.services.evolutionapi.dto.response.EvolutionApiResponse;
import com.aigreentick.services.evolutionapi.dto.response.InstanceSummary;
import com.aigreentick.services.evolutionapi.service.InstanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.aigreentick.services.evolutionapi.console.command.HealthCheckCommand.nullToDash;

/**
 * instances {list|sync|connect|disconnect} [instance] [--connection=name]
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InstanceStatusCommand implements ConsoleCommand {

    private final InstanceService instanceService;
    private final EvolutionApiClient client;

    @Override
    public String name() {
        return "instances";
    }

    @Override
    public String description() {
        return "Manage and display Evolution API instance statuses";
    }

    @Override
    public int execute(CommandInput input, ConsoleIO io) {
        String action = input.argument(0, "list");
        String instance = input.argument(1);
        String connection = input.option("connection");

        try {
            return switch (action) {
                case "list" -> list(io, connection);
                case "sync" -> sync(io, connection);
                case "connect" -> connect(io, connection, instance);
                case "disconnect" -> disconnect(io, connection, instance);
                default -> invalidAction(io, action);
            };
        } catch (RuntimeException ex) {
            log.debug("instances {} failed", action, ex);
            io.error("Error: " + ex.getMessage());
            return FAILURE;
        }
    }

    private int list(ConsoleIO io, String connection) {
        io.info("Fetching instances from Evolution API...");
        List<InstanceSummary> instances = instanceService.fetchSummaries(connection);
        if (instances.isEmpty()) {
            io.warn("No instances found.");
            return SUCCESS;
        }

        List<List<String>> rows = new ArrayList<>();
        for (InstanceSummary instance : instances) {
            rows.add(List.of(
                    instance.getName(),
                    nullToDash(instance.getRawStatus()),
                    nullToDash(instance.getOwner()),
                    nullToDash(instance.getProfileName())));
        }
        io.newLine();
        io.table(List.of("Instance", "Status", "Owner", "Profile"), rows);
        return SUCCESS;
    }

    private int sync(ConsoleIO io, String connection) {
        io.info("Syncing instances from Evolution API to database...");
        int synced = instanceService.syncInstances(connection);
        io.newLine();
        io.info("Synced " + synced + " instance(s) to database.");
        return SUCCESS;
    }

    private int connect(ConsoleIO io, String connection, String instance) {
        if (instance == null) {
            io.error("Instance name is required for connect action.");
            return FAILURE;
        }
        io.info("Connecting instance: " + instance + "...");

        EvolutionApiResponse response = client.connect(connection, instance);
        Map<String, Object> data = response.getDataAsMap();
        String qrCode = qrCode(data);
        if (qrCode != null) {
            io.newLine();
            io.warn("QR Code generated. Scan to connect:");
            io.line(qrCode);
            Object pairingCode = data.get("pairingCode");
            if (pairingCode != null) {
                io.newLine();
                io.info("Pairing Code: " + pairingCode);
            }
        } else {
            io.info("Instance connected successfully!");
        }
        return SUCCESS;
    }

    private int disconnect(ConsoleIO io, String connection, String instance) {
        if (instance == null) {
            io.error("Instance name is required for disconnect action.");
            return FAILURE;
        }
        if (!io.confirm("Are you sure you want to disconnect instance '" + instance + "'?", false)) {
            io.info("Operation cancelled.");
            return SUCCESS;
        }

        io.info("Disconnecting instance: " + instance + "...");
        client.logout(connection, instance);
        io.info("Instance disconnected successfully!");
        return SUCCESS;
    }

    private int invalidAction(ConsoleIO io, String action) {
        io.error("Invalid action: " + action);
        io.line("Available actions: list, sync, connect, disconnect");
        return FAILURE;
    }

    /** v2 servers answer {"base64": ...}; v1 nests it under "qrcode" */
    private static String qrCode(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        if (data.get("qrcode") instanceof Map<?, ?> qrcode && qrcode.get("base64") != null) {
            return String.valueOf(qrcode.get("base64"));
        }
        Object base64 = data.get("base64");
        return base64 != null ? String.valueOf(base64) : null;
    }
}
