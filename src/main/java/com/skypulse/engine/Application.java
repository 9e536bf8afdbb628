package com.skypulse.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * -@SpringBootApplication: Configuration, auto-configuration and component
 * scanning for the engine.
 * --Picks up the [@Service] components under service/, the Mongo adapters
 * under repository/ and the language-model client under client/
 * --WithoutIT: no bean would be discovered; the ingest consumers would never
 * register on the event bus.
 * =========
 * -@ConfigurationPropertiesScan: Registers EngineProperties and
 * MongoDbProperties.
 * --WithoutIT: skypulse.engine.* would not be bound and the weight/threshold
 * validation would never run at startup.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
