package com.rightsparser.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC connection.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Initialize database schema on startup.
     * Every statement in the schema script is idempotent.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(
            ConnectionFactory connectionFactory,
            @Value("${rights-parser.database.schema-location:classpath:schema.sql}") Resource schema) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(schema);
        initializer.setDatabasePopulator(populator);

        return initializer;
    }
}
