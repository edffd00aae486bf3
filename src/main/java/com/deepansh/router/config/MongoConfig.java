package com.deepansh.router.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate is populated on route traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.deepansh.router.observability")
public class MongoConfig {
}
