package dev.talentmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the TalentMatch ranking service.
 *
 * <p>Exposes the ranking REST API on port 8080 and runs the periodic session sweep.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
@EnableScheduling
public class TalentMatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(TalentMatchApplication.class, args);
    }
}
