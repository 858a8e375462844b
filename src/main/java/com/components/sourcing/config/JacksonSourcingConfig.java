package com.components.sourcing.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonSourcingConfig {

    /**
     * A dedicated {@link ObjectMapper} for upstream payloads and cached result sets.
     * <p>
     * • Has its own qualifier (<b>sourcingObjectMapper</b>) so it never clashes with
     * the default mapper that Spring Boot auto‑configures for MVC.<br>
     * • Tolerates unknown properties: distributor APIs add fields without notice.
     *
     * @return ObjectMapper for connectors and the cache
     */
    @Bean
    @Qualifier("sourcingObjectMapper")
    public ObjectMapper sourcingObjectMapper() {
        return newMapper();
    }

    /**
     * Builds a mapper with the sourcing settings; also used directly by tests.
     *
     * @return new, independently configured mapper
     */
    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
