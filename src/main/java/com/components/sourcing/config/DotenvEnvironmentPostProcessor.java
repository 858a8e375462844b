package com.components.sourcing.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Makes connector credentials kept in a {@code .env} file visible to Spring,
 * so {@code ${MOUSER_API_KEY:}} and the like in {@code application.yml}
 * resolve without exporting anything.
 * <p>
 * The file is looked up in {@code sourcing.dotenv.directory} (default: the
 * working directory) under the name {@code sourcing.dotenv.filename}
 * (default {@code .env}); both may come from system properties or the OS
 * environment. A missing or malformed file is ignored. Entries win over every
 * other property source, blank values excepted.
 * </p>
 */
public class DotenvEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    static final String DIRECTORY_PROPERTY = "sourcing.dotenv.directory";

    static final String FILENAME_PROPERTY = "sourcing.dotenv.filename";

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Map<String, Object> credentials = readEntries(
                env.getProperty(DIRECTORY_PROPERTY, "."),
                env.getProperty(FILENAME_PROPERTY, ".env"));
        if (!credentials.isEmpty()) {
            env.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, credentials));
        }
    }

    static Map<String, Object> readEntries(final String directory, final String filename) {
        Dotenv dotenv = Dotenv.configure()
                .directory(directory)
                .filename(filename)
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> entries = new LinkedHashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            if (entry.getValue() != null && !entry.getValue().isBlank()) {
                entries.put(entry.getKey(), entry.getValue());
            }
        }
        return entries;
    }
}
