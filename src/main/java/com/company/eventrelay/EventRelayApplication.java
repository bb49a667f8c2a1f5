package com.company.eventrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the host event relay.
 * Records in-app notifications for hosts, streams them to connected dashboards
 * and relays domain events to external subscribers through signed webhooks.
 */
@SpringBootApplication
@EnableScheduling
@EnableTransactionManagement
public class EventRelayApplication {

    /**
     * Main entry point for the application.
     *
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(EventRelayApplication.class, args);
    }
}
