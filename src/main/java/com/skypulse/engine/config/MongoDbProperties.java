package com.skypulse.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * MongoDB Configuration Properties
 *
 * WHY: Binds 'skypulse.mongodb.*' to the settings of the shared Vert.x
 * MongoClient used by the persistence and subscription adapters.
 *
 * PROPERTIES:
 * - host / port / database: connection target
 * - connectTimeoutMS / socketTimeoutMS / serverSelectionTimeoutMS: every store
 * call is bounded, none blocks indefinitely
 *
 * =========
 * -@Data: Lombok getters/setters for Spring binding.
 * =========
 * -@ConfigurationProperties: Binds properties with prefix "skypulse.mongodb".
 * --It only reads values at startup; it is plain synchronous binding.
 * --WithoutIT: the MongoClient would always connect to the defaults below.
 */
@Data
@ConfigurationProperties(prefix = "skypulse.mongodb")
public class MongoDbProperties {

    private String host = "localhost";
    private int port = 27017;
    private String database = "skypulse";
    private int connectTimeoutMS = 5000;
    private int socketTimeoutMS = 5000;
    private int serverSelectionTimeoutMS = 5000;
}
