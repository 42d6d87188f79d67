package com.aigreentick.services.evolutionapi.console.command;

import com.aigreentick.services.evolutionapi.client.EvolutionConnectionResolver;
import com.aigreentick.services.evolutionapi.console.CommandInput;
import com.aigreentick.services.evolutionapi.console.ConsoleCommand;
import com.aigreentick.services.evolutionapi.console.ConsoleIO;
import com.aigreentick.services.evolutionapi.dto.response.InstanceSummary;
import com.aigreentick.services.evolutionapi.service.InstanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * health [--connection=name]
 *
 * Times a fetchInstances call and lists what the server reports.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HealthCheckCommand implements ConsoleCommand {

    private final InstanceService instanceService;
    private final EvolutionConnectionResolver connectionResolver;

    @Override
    public String name() {
        return "health";
    }

    @Override
    public String description() {
        return "Check Evolution API server health and connectivity";
    }

    @Override
    public int execute(CommandInput input, ConsoleIO io) {
        io.info("Checking Evolution API health...");
        io.newLine();

        String connection = input.option("connection");
        try {
            if (connection != null) {
                io.comment("Using connection: " + connection);
            }
            io.line("  Server URL: " + connectionResolver.serverUrl(connection));

            long start = System.nanoTime();
            List<InstanceSummary> instances = instanceService.fetchSummaries(connection);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            io.line("  Status: Connected");
            io.line("  Response time: " + elapsedMs + "ms");
            io.newLine();

            if (instances.isEmpty()) {
                io.line("  No instances found.");
            } else {
                io.info("Instances:");
                List<List<String>> rows = new ArrayList<>();
                for (InstanceSummary instance : instances) {
                    rows.add(List.of(instance.getName(), nullToDash(instance.getRawStatus()), nullToDash(instance.getOwner())));
                }
                io.table(List.of("Instance", "Status", "Owner"), rows);
            }

            io.newLine();
            io.info("Health check completed successfully!");
            return SUCCESS;
        } catch (RuntimeException ex) {
            log.debug("Health check failed", ex);
            io.newLine();
            io.error("Health check failed: " + ex.getMessage());
            return FAILURE;
        }
    }

    static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
