package com.components.sourcing.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.SpringApplication;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DotenvEnvironmentPostProcessorTest {

    @TempDir
    Path dir;

    private final DotenvEnvironmentPostProcessor processor = new DotenvEnvironmentPostProcessor();

    @Test
    void shouldExposeEnvFileEntriesAheadOfApplicationProperties() throws Exception {
        // Given
        Files.writeString(dir.resolve("test.env"), "MOUSER_API_KEY=abc-123\nOPENAI_API_KEY=\n");
        MockEnvironment env = new MockEnvironment()
                .withProperty(DotenvEnvironmentPostProcessor.DIRECTORY_PROPERTY, dir.toString())
                .withProperty(DotenvEnvironmentPostProcessor.FILENAME_PROPERTY, "test.env")
                .withProperty("MOUSER_API_KEY", "from-yml");

        // When
        processor.postProcessEnvironment(env, new SpringApplication());

        // Then
        assertThat(env.getProperty("MOUSER_API_KEY")).isEqualTo("abc-123");
        assertThat(env.getPropertySources().contains(DotenvEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isTrue();
    }

    @Test
    void shouldSkipBlankValues() throws Exception {
        // Given
        Files.writeString(dir.resolve(".env"), "OPENAI_API_KEY=\nDIGIKEY_CLIENT_ID=dk-1\n");

        // When
        Map<String, Object> entries = DotenvEnvironmentPostProcessor.readEntries(dir.toString(), ".env");

        // Then
        assertThat(entries).containsOnlyKeys("DIGIKEY_CLIENT_ID");
    }

    @Test
    void shouldLeaveEnvironmentAloneWithoutFile() {
        // Given
        MockEnvironment env = new MockEnvironment()
                .withProperty(DotenvEnvironmentPostProcessor.DIRECTORY_PROPERTY, dir.toString());

        // When
        processor.postProcessEnvironment(env, new SpringApplication());

        // Then
        assertThat(env.getPropertySources().contains(DotenvEnvironmentPostProcessor.PROPERTY_SOURCE_NAME)).isFalse();
    }
}
