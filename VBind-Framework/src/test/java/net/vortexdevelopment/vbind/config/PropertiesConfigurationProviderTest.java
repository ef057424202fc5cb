package net.vortexdevelopment.vbind.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesConfigurationProviderTest {

    @Test
    void propertyKeysAreConverted() {
        assertThat(PropertiesConfigurationProvider.toConfigurationKey("feature.tags[0]")).isEqualTo("feature:tags:0");
        assertThat(PropertiesConfigurationProvider.toConfigurationKey("retry.timeout")).isEqualTo("retry:timeout");
    }

    @Test
    void loadsFromClasspath() {
        // Act
        PropertiesConfigurationProvider provider = PropertiesConfigurationProvider.load("vbind-test.properties");

        // Assert
        assertThat(provider.get("Retry:MaxAttempts")).isEqualTo("5");
        assertThat(provider.getChildren("Feature:Tags"))
                .extracting(ConfigurationEntry::getValue)
                .containsExactly("a", "b", "c");
    }

    @Test
    void missingFileGivesEmptyProvider() {
        PropertiesConfigurationProvider provider = PropertiesConfigurationProvider.load("does-not-exist.properties");

        assertThat(provider.get("anything")).isNull();
        assertThat(provider.getChildren("")).isEmpty();
    }

    @Test
    void readsFileInOrder(@TempDir Path directory) throws Exception {
        // Arrange
        Path file = directory.resolve("app.properties");
        Files.writeString(file, "z.last=3\nz.first=1\nz.middle=2\n");

        // Act
        PropertiesConfigurationProvider provider = PropertiesConfigurationProvider.fromFile(file);

        // Assert
        assertThat(provider.getChildren("z")).extracting(ConfigurationEntry::getKey)
                .containsExactly("last", "first", "middle");
    }

    @Test
    void readsStream() {
        byte[] content = "server.name=café\n".getBytes(StandardCharsets.UTF_8);

        PropertiesConfigurationProvider provider = PropertiesConfigurationProvider.fromStream(new ByteArrayInputStream(content));

        assertThat(provider.get("server:name")).isEqualTo("café");
    }
}
