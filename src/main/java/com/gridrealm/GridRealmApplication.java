package com.gridrealm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the GridRealm world server.
 *
 * Features:
 * - Authoritative world state shared by every connected player
 * - Raw WebSocket protocol with JSON envelopes
 * - Fixed-rate tick with full snapshot broadcast
 * - Ephemeral state, nothing survives a restart
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class GridRealmApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridRealmApplication.class, args);
    }
}
