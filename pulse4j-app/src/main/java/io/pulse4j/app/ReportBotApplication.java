package io.pulse4j.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Runs the configured report jobs until the process is stopped.
 */
@SpringBootApplication
public class ReportBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportBotApplication.class, args);
    }
}
