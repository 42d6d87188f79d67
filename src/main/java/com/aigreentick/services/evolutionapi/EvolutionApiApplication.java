package com.aigreentick.services.evolutionapi;

import com.aigreentick.services.evolutionapi.console.ConsoleCommandRunner;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Evolution API integration service
 *
 * This service handles:
 * - Inbound Evolution API webhooks (signature check, queue or inline processing)
 * - Queued outbound WhatsApp messages with retry and backoff
 * - Instance status tracking and synchronisation
 * - Operational commands (install, health, instances, prune, retry)
 *
 * Started with a command argument ({@code java -jar app.jar health}) the
 * application runs without a web server and exits with the command's code.
 *
 * @author AiGreenTick Team
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Evolution API Integration Service",
                version = "1.0.0",
                description = "WhatsApp messaging through an Evolution API server for the AiGreenTick Platform.",
                contact = @Contact(
                        name = "AiGreenTick Support",
                        email = "support@aigreentick.com"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8082", description = "Local Development")
        }
)
public class EvolutionApiApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(EvolutionApiApplication.class);
        if (ConsoleCommandRunner.isCommandInvocation(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
