package com.aigreentick.services.evolutionapi.console.command;

import com.aigreentick.services.evolutionapi.console.CommandInput;
import com.aigreentick.services.evolutionapi.console.ConsoleCommand;
import com.aigreentick.services.evolutionapi.console.ConsoleIO;
import com.aigreentick.services.evolutionapi.console.SchemaInstaller;
import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * install [--force]
 *
 * Writes config/evolution-api.yml (picked up through spring.config.import),
 * optionally creates the tables, and prints the next steps.
 */
@Component
@Slf4j
public class InstallCommand implements ConsoleCommand {

    static final String CONFIG_FILE = "config/evolution-api.yml";

    private final SchemaInstaller schemaInstaller;
    private final Path configFile;

    @Autowired
    public InstallCommand(SchemaInstaller schemaInstaller) {
        this(schemaInstaller, Path.of(CONFIG_FILE));
    }

    InstallCommand(SchemaInstaller schemaInstaller, Path configFile) {
        this.schemaInstaller = schemaInstaller;
        this.configFile = configFile;
    }

    @Override
    public String name() {
        return "install";
    }

    @Override
    public String description() {
        return "Install and configure the Evolution API integration";
    }

    @Override
    public int execute(CommandInput input, ConsoleIO io) {
        io.info("Installing Evolution API integration...");
        io.newLine();

        writeConfiguration(io, input.hasFlag("force"));

        if (io.confirm("Would you like to create the database tables now?", true)) {
            io.comment("Running " + SchemaInstaller.SCHEMA_SCRIPT + "...");
            try {
                schemaInstaller.install();
                io.comment("Tables created.");
            } catch (DataAccessException ex) {
                io.error("Could not create tables: " + ex.getMostSpecificCause().getMessage());
                return FAILURE;
            }
        }

        io.newLine();
        io.info("Evolution API integration installed successfully!");
        io.newLine();
        printNextSteps(io);
        return SUCCESS;
    }

    private void writeConfiguration(ConsoleIO io, boolean force) {
        if (Files.exists(configFile) && !force) {
            io.warn("Configuration already exists at " + configFile + ". Use --force to overwrite it.");
            return;
        }

        io.comment("Configuring connection...");
        String serverUrl = io.ask("Enter your Evolution API server URL", EvolutionConstants.DEFAULT_SERVER_URL);
        String apiKey = io.secret("Enter your Evolution API key (leave blank to skip)");
        String defaultInstance = io.ask("Enter your default instance name", EvolutionConstants.DEFAULT_INSTANCE);

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("server-url", serverUrl);
        if (apiKey != null && !apiKey.isBlank()) {
            settings.put("api-key", apiKey);
        }
        settings.put("default-instance", defaultInstance);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("evolution-api", settings);

        try {
            Path parent = configFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(configFile, yaml().dump(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not write " + configFile, ex);
        }
        log.info("Configuration written: {}", configFile);
        io.comment("Configuration written to " + configFile);
    }

    private static Yaml yaml() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        return new Yaml(options);
    }

    private void printNextSteps(ConsoleIO io) {
        io.info("Next steps:");
        io.line("1. Review " + CONFIG_FILE + " and application.yml");
        io.line("2. Set EVOLUTION_WEBHOOK_SECRET to the secret configured on the Evolution API server");
        io.line("3. Point the Evolution API webhooks to:");
        io.line("   http://<this-host>" + EvolutionConstants.DEFAULT_WEBHOOK_PATH);
        io.line("4. Test the connection with: java -jar evolution-api-service.jar health");
    }
}
