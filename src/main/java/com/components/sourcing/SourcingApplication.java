package com.components.sourcing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Rare Source application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>aggregated part search across distributors, brokers and deep links,</li>
 *   <li>procurement lock confirmations,</li>
 *   <li>the market dashboard and cache maintenance.</li>
 * </ul>
 * It wires the source connectors, the aggregation engine and the
 * search-result cache behind Spring MVC controllers.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/rare-source-0.1.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application listens on the configured port (default
 * 8080). Credentials for the connectors are read from the environment or a
 * {@code .env} file in the working directory.</p>
 */
@SpringBootApplication
@EnableScheduling
public class SourcingApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(SourcingApplication.class, args);
    }
}
