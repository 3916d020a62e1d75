package com.govsandbox.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * MongoDB client and template for the durable stores. Only active with {@code sandbox.store.type=mongo};
 * Spring Boot's own Mongo auto-configuration is excluded so the in-memory default opens no connection.
 */
@Configuration
@ConditionalOnProperty(name = "sandbox.store.type", havingValue = "mongo")
@Slf4j
public class MongoStoreConfig {

    @Bean(destroyMethod = "close")
    public MongoClient sandboxMongoClient(StoreProperties properties) {
        log.info("Audit stores backed by MongoDB database {}", properties.getDatabase());
        return MongoClients.create(properties.getMongoUri());
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient sandboxMongoClient, StoreProperties properties) {
        return new MongoTemplate(sandboxMongoClient, properties.getDatabase());
    }
}
