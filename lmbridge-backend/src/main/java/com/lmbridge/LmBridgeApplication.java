package com.lmbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Entry point for the LM-Bridge backend.
 *
 * DataSource auto-configuration is disabled: connection pools are owned by the
 * MusicBrainz provider and the pool router.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class LmBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LmBridgeApplication.class, args);
    }
}
