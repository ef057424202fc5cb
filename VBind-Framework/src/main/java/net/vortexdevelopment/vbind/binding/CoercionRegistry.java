package net.vortexdevelopment.vbind.binding;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Registry of {@link ValueParser}s keyed by target class.
 *
 * <p>Only registered types can be converted; there is no lookup of parse methods by name.
 * Register application types at startup:
 * <pre>
 * {@code
 * CoercionRegistry registry = CoercionRegistry.defaults()
 *         .register(HostAndPort.class, HostAndPort::parse);
 * }
 * </pre>
 */
public class CoercionRegistry {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private final Map<Class<?>, ValueParser<?>> parsers = new ConcurrentHashMap<>();

    /**
     * Create a registry with the built-in parsers: primitives and their wrappers, BigDecimal, BigInteger,
     * Duration, UUID, URI, java.time types, Path, Locale and Charset.
     */
    public static CoercionRegistry defaults() {
        CoercionRegistry registry = new CoercionRegistry();
        registerPrimitive(registry, boolean.class, Boolean.class, CoercionRegistry::parseBoolean);
        registerPrimitive(registry, char.class, Character.class, CoercionRegistry::parseCharacter);
        registerPrimitive(registry, byte.class, Byte.class, raw -> Byte.parseByte(raw.trim()));
        registerPrimitive(registry, short.class, Short.class, raw -> Short.parseShort(raw.trim()));
        registerPrimitive(registry, int.class, Integer.class, raw -> Integer.parseInt(raw.trim()));
        registerPrimitive(registry, long.class, Long.class, raw -> Long.parseLong(raw.trim()));
        registerPrimitive(registry, float.class, Float.class, raw -> Float.parseFloat(raw.trim()));
        registerPrimitive(registry, double.class, Double.class, raw -> Double.parseDouble(raw.trim()));
        registry.register(BigDecimal.class, raw -> new BigDecimal(raw.trim()));
        registry.register(BigInteger.class, raw -> new BigInteger(raw.trim()));

        registry.register(Duration.class, DurationParser::parse);
        registry.register(UUID.class, CoercionRegistry::parseUuid);
        registry.register(URI.class, URI::new);

        registry.register(Instant.class, raw -> Instant.parse(raw.trim()));
        registry.register(LocalDate.class, raw -> LocalDate.parse(raw.trim()));
        registry.register(LocalTime.class, raw -> LocalTime.parse(raw.trim()));
        registry.register(LocalDateTime.class, raw -> LocalDateTime.parse(raw.trim()));
        registry.register(OffsetDateTime.class, raw -> OffsetDateTime.parse(raw.trim()));
        registry.register(ZonedDateTime.class, raw -> ZonedDateTime.parse(raw.trim()));
        registry.register(Period.class, raw -> Period.parse(raw.trim()));

        registry.register(Path.class, raw -> Path.of(raw));
        registry.register(Locale.class, raw -> Locale.forLanguageTag(raw.trim()));
        registry.register(Charset.class, raw -> Charset.forName(raw.trim()));
        return registry;
    }

    /**
     * Register or replace the parser for a type.
     *
     * @return this registry
     */
    public <T> CoercionRegistry register(@NotNull Class<T> type, @NotNull ValueParser<? extends T> parser) {
        parsers.put(type, parser);
        return this;
    }

    @Nullable
    public ValueParser<?> find(@NotNull Class<?> type) {
        return parsers.get(type);
    }

    public boolean hasParser(@NotNull Class<?> type) {
        return parsers.containsKey(type);
    }

    private static <T> void registerPrimitive(CoercionRegistry registry, Class<T> primitive, Class<T> wrapper, ValueParser<T> parser) {
        registry.register(primitive, parser);
        registry.register(wrapper, parser);
    }

    private static Boolean parseBoolean(String raw) {
        String text = raw.trim();
        if (text.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (text.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: '" + raw + "'");
    }

    private static Character parseCharacter(String raw) {
        if (raw.length() != 1) {
            throw new IllegalArgumentException("Expected exactly one character but got " + raw.length());
        }
        return raw.charAt(0);
    }

    /**
     * Accepts the hyphenated form, 32 hex digits without hyphens, and either form in braces or parentheses.
     */
    private static UUID parseUuid(String raw) {
        String text = raw.trim();
        if (text.length() > 2 && ((text.startsWith("{") && text.endsWith("}")) || (text.startsWith("(") && text.endsWith(")")))) {
            text = text.substring(1, text.length() - 1);
        }
        if (text.length() == 32 && text.indexOf('-') < 0) {
            text = text.substring(0, 8) + "-" + text.substring(8, 12) + "-" + text.substring(12, 16)
                    + "-" + text.substring(16, 20) + "-" + text.substring(20);
        }
        if (!UUID_PATTERN.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid UUID string: " + raw);
        }
        return UUID.fromString(text);
    }
}
