package com.aigreentick.services.evolutionapi.console;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ConsoleConfig {

    @Bean
    public ConsoleIO consoleIO() {
        return ConsoleIO.system();
    }
}
