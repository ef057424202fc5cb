package net.vortexdevelopment.vbind.config;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration provider reading a {@code .properties} file.
 *
 * <p>Property keys use dots between path segments and {@code [n]} for indexed entries,
 * so {@code feature.tags[0]=a} is stored under {@code feature:tags:0}. Entries keep the file order.
 *
 * <p>{@link #load()} looks for application.properties in the following order:
 * <ol>
 *   <li>Current working directory (where the application is run from)</li>
 *   <li>Classpath resource (src/main/resources/application.properties)</li>
 * </ol>
 */
public class PropertiesConfigurationProvider extends MapConfigurationProvider {

    public static final String DEFAULT_FILE_NAME = "application.properties";

    private PropertiesConfigurationProvider(Map<String, String> values) {
        super(values);
    }

    /**
     * Load application.properties from the working directory or the classpath.
     *
     * @return The provider, empty if no file was found
     */
    public static PropertiesConfigurationProvider load() {
        return load(DEFAULT_FILE_NAME);
    }

    /**
     * Load a properties file from the working directory, falling back to the classpath.
     *
     * @param fileName The file name, e.g. "application.properties"
     * @return The provider, empty if no file was found
     */
    public static PropertiesConfigurationProvider load(@NotNull String fileName) {
        Path workingDirFile = Path.of(System.getProperty("user.dir"), fileName);
        if (Files.isRegularFile(workingDirFile)) {
            return fromFile(workingDirFile);
        }

        try (InputStream inputStream = PropertiesConfigurationProvider.class.getClassLoader()
                .getResourceAsStream(fileName)) {
            if (inputStream == null) {
                return new PropertiesConfigurationProvider(Collections.emptyMap());
            }
            return new PropertiesConfigurationProvider(read(inputStream));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read classpath resource: " + fileName, e);
        }
    }

    public static PropertiesConfigurationProvider fromFile(@NotNull Path file) {
        try (InputStream inputStream = Files.newInputStream(file)) {
            return new PropertiesConfigurationProvider(read(inputStream));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read properties file: " + file, e);
        }
    }

    /**
     * Read properties from a stream. The stream is not closed.
     */
    public static PropertiesConfigurationProvider fromStream(@NotNull InputStream inputStream) {
        try {
            return new PropertiesConfigurationProvider(read(inputStream));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read properties", e);
        }
    }

    /**
     * Convert a property key to a configuration key.
     * Example: "feature.tags[0]" -> "feature:tags:0"
     */
    public static String toConfigurationKey(@NotNull String propertyKey) {
        return propertyKey.replaceAll("\\[(\\d+)]", ".$1").replace(".", ConfigurationPath.KEY_DELIMITER);
    }

    private static Map<String, String> read(InputStream inputStream) throws IOException {
        // Properties is hash based, so record the entries in file order as load() puts them
        Map<String, String> values = new LinkedHashMap<>();
        Properties properties = new Properties() {
            @Override
            public synchronized Object put(Object key, Object value) {
                values.put(toConfigurationKey(key.toString()), value.toString());
                return super.put(key, value);
            }
        };
        properties.load(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        return values;
    }
}
