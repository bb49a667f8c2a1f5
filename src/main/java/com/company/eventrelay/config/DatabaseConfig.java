package com.company.eventrelay.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA settings for the relay. The data source and entity manager come from Spring Boot
 * auto-configuration; this class only switches on auditing so that the creation and
 * modification timestamps of subscriptions and notifications are filled in.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.company.eventrelay.domain.repository")
@EnableJpaAuditing
public class DatabaseConfig {
}
