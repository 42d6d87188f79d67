package com.aigreentick.services.evolutionapi.console;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates the evolution_* tables from db/evolution-schema.sql.
 * The script uses IF NOT EXISTS, so running it twice is harmless.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaInstaller {

    public static final String SCHEMA_SCRIPT = "db/evolution-schema.sql";

    private final DataSource dataSource;

    public void install() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("Schema script applied: {}", SCHEMA_SCRIPT);
    }
}
