package com.govsandbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Governance sandbox core. Runs without a web server; Mongo wiring comes from MongoStoreConfig only when
 * {@code sandbox.store.type=mongo}.
 */
@SpringBootApplication(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class,
        MongoRepositoriesAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class GovernanceSandboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernanceSandboxApplication.class, args);
    }
}
