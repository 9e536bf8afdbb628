package com.skypulse.engine.config;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.mongo.MongoClient;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * -@Configuration: Marks this class as a source of [@Bean] definitions.
 * --Vert.x is used as a library inside the Spring context: Spring owns the
 * lifecycle, Vert.x provides futures, the event bus and non-blocking clients
 * --WithoutIT: none of the Vert.x beans below would exist and every
 * [@Autowired] Vertx/MongoClient/WebClient field would fail at startup.
 */
@Configuration
public class VertxConfig {

    @Value("${vertx.worker-pool-size:20}")
    private int workerPoolSize;

    @Value("${vertx.event-loop-pool-size:4}")
    private int eventLoopPoolSize;

    @Autowired
    private MongoDbProperties mongoDbProperties;

    @Autowired
    private EngineProperties engineProperties;

    /**
     * -@Bean: The single Vert.x instance of the process.
     * --Ingest consumers, alert notifications and the language-model client all
     * run on it
     */
    @Bean(destroyMethod = "close")
    public Vertx vertx() {
        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(workerPoolSize)
                .setEventLoopPoolSize(eventLoopPoolSize);
        return Vertx.vertx(options);
    }

    /**
     * -@Bean: Event bus carrying deal.ingested, price.observed and
     * price.alert.triggered.
     */
    @Bean
    public EventBus eventBus(Vertx vertx) {
        return vertx.eventBus();
    }

    /**
     * -@Bean: Shared non-blocking MongoDB client for the persistence
     * collaborator and the subscription store.
     * --WithoutIT: match records, price points and alerts could not be written.
     */
    @Bean
    public MongoClient mongoClient(Vertx vertx) {
        JsonObject config = new JsonObject()
                .put("host", mongoDbProperties.getHost())
                .put("port", mongoDbProperties.getPort())
                .put("db_name", mongoDbProperties.getDatabase())
                .put("connectTimeoutMS", mongoDbProperties.getConnectTimeoutMS())
                .put("socketTimeoutMS", mongoDbProperties.getSocketTimeoutMS())
                .put("serverSelectionTimeoutMS", mongoDbProperties.getServerSelectionTimeoutMS());

        return MongoClient.createShared(vertx, config);
    }

    /**
     * -@Bean: HTTP client for the language-model endpoint.
     * --Connect timeout follows skypulse.engine.summary.timeout; the per-request
     * timeout is applied by OllamaSummaryClient
     */
    @Bean
    public WebClient summaryWebClient(Vertx vertx) {
        WebClientOptions options = new WebClientOptions()
                .setConnectTimeout((int) engineProperties.getSummary().getTimeout().toMillis())
                .setUserAgent("skypulse-deal-engine");
        return WebClient.create(vertx, options);
    }
}
