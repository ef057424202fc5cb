package net.vortexdevelopment.vbind.binding;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoercionRegistryTest {

    private final CoercionRegistry registry = CoercionRegistry.defaults();

    @Test
    void primitivesAndWrappersShareParsers() throws Exception {
        assertThat(registry.find(int.class).parse("12")).isEqualTo(12);
        assertThat(registry.find(Integer.class).parse("12")).isEqualTo(12);
        assertThat(registry.find(char.class).parse("x")).isEqualTo('x');
    }

    @Test
    void booleanAcceptsOnlyTrueOrFalse() throws Exception {
        assertThat(registry.find(boolean.class).parse(" False ")).isEqualTo(false);
        assertThatThrownBy(() -> registry.find(boolean.class).parse("yes")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void characterRequiresSingleCharacter() {
        assertThatThrownBy(() -> registry.find(char.class).parse("ab")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void uuidAcceptsCommonForms() throws Exception {
        UUID expected = UUID.fromString("6f9619ff-8b86-d011-b42d-00cf4fc964ff");
        ValueParser<?> parser = registry.find(UUID.class);

        assertThat(parser.parse("6f9619ff-8b86-d011-b42d-00cf4fc964ff")).isEqualTo(expected);
        assertThat(parser.parse("6F9619FF8B86D011B42D00CF4FC964FF")).isEqualTo(expected);
        assertThat(parser.parse("{6f9619ff-8b86-d011-b42d-00cf4fc964ff}")).isEqualTo(expected);
        assertThat(parser.parse("(6f9619ff-8b86-d011-b42d-00cf4fc964ff)")).isEqualTo(expected);
        assertThatThrownBy(() -> parser.parse("1-2-3-4-5")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesOtherBuiltInTypes() throws Exception {
        assertThat(registry.find(URI.class).parse("https://example.com/a")).isEqualTo(URI.create("https://example.com/a"));
        assertThat(registry.find(LocalDate.class).parse("2024-02-29")).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(registry.find(Locale.class).parse("en-US")).isEqualTo(Locale.US);
    }

    @Test
    void stringHasNoParser() {
        assertThat(registry.hasParser(String.class)).isFalse();
        assertThat(registry.find(Object.class)).isNull();
    }

    @Test
    void registerReplacesParser() throws Exception {
        CoercionRegistry custom = CoercionRegistry.defaults().register(Integer.class, raw -> -1);

        assertThat(custom.find(Integer.class).parse("5")).isEqualTo(-1);
        assertThat(custom.find(int.class).parse("5")).isEqualTo(5);
    }
}
