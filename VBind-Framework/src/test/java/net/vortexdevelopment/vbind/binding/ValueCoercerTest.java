package net.vortexdevelopment.vbind.binding;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueCoercerTest {

    private final ValueCoercer lenient = new ValueCoercer(CoercionRegistry.defaults(), BindingOptions.builder().build());
    private final ValueCoercer strict = new ValueCoercer(CoercionRegistry.defaults(),
            BindingOptions.builder().policy(CoercionPolicy.STRICT).build());

    enum Level {
        LOW,
        HIGH,
        high
    }

    static class Unregistered {
    }

    @Test
    void convertsRegisteredTypes() {
        assertThat(lenient.coerce(TargetType.scalar(int.class), " 42 ")).isEqualTo(42);
        assertThat(lenient.coerce(TargetType.scalar(Boolean.class), "TRUE")).isEqualTo(true);
        assertThat(lenient.coerce(TargetType.scalar(BigDecimal.class), "1.50")).isEqualTo(new BigDecimal("1.50"));
    }

    @Test
    void stringKeepsWhitespace() {
        assertThat(lenient.coerce(TargetType.scalar(String.class), "  padded ")).isEqualTo("  padded ");
    }

    @Test
    void exactEnumMatchWinsOverCaseInsensitiveMatch() {
        assertThat(lenient.coerce(TargetType.scalar(Level.class), "high")).isEqualTo(Level.high);
        assertThat(lenient.coerce(TargetType.scalar(Level.class), "Low")).isEqualTo(Level.LOW);
    }

    @Test
    void caseSensitiveEnumsRejectOtherCase() {
        // Arrange
        ValueCoercer coercer = new ValueCoercer(CoercionRegistry.defaults(),
                BindingOptions.builder().caseSensitiveEnums(true).build());

        // Act
        CoercionResult<Object> result = coercer.tryCoerce(TargetType.scalar(Level.class), "Low");

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getReason()).isEqualTo(CoercionError.Reason.UNPARSEABLE);
    }

    @Test
    void optionalWrapsConvertedValue() {
        assertThat(lenient.coerce(TargetType.nullable(int.class), "7")).isEqualTo(Optional.of(7));
        assertThat(lenient.coerce(TargetType.nullable(int.class), null)).isEqualTo(Optional.empty());
    }

    @Test
    void failuresAreReportedWithReason() {
        assertThat(lenient.tryCoerce(TargetType.scalar(int.class), null).getError().getReason())
                .isEqualTo(CoercionError.Reason.MISSING_VALUE);
        assertThat(lenient.tryCoerce(TargetType.scalar(int.class), "abc").getError().getReason())
                .isEqualTo(CoercionError.Reason.UNPARSEABLE);
        assertThat(lenient.tryCoerce(TargetType.scalar(Unregistered.class), "abc").getError().getReason())
                .isEqualTo(CoercionError.Reason.NO_PARSER);
    }

    @Test
    void lenientPolicyReturnsDefaultValue() {
        assertThat(lenient.coerce(TargetType.scalar(int.class), "abc")).isEqualTo(0);
        assertThat(lenient.coerce(TargetType.scalar(double.class), null)).isEqualTo(0d);
        assertThat(lenient.coerce(TargetType.scalar(Integer.class), "abc")).isNull();
        assertThat(lenient.coerce(TargetType.scalar(Level.class), "medium")).isNull();
        assertThat(lenient.coerce(TargetType.nullable(int.class), "abc")).isEqualTo(Optional.empty());
    }

    @Test
    void strictPolicyThrowsWithKeyAndCause() {
        assertThatThrownBy(() -> strict.coerce("Server:Port", TargetType.scalar(int.class), "eighty"))
                .isInstanceOf(ConfigurationBindingException.class)
                .hasMessageContaining("'eighty'")
                .hasMessageContaining("Server:Port")
                .satisfies(e -> assertThat(((ConfigurationBindingException) e).getError().getReason())
                        .isEqualTo(CoercionError.Reason.UNPARSEABLE));
    }

    @Test
    void strictPolicyRejectsMissingValue() {
        assertThatThrownBy(() -> strict.coerce("Server:Port", TargetType.scalar(int.class), null))
                .isInstanceOf(ConfigurationBindingException.class)
                .hasMessageContaining("No value");
    }

    @Test
    void customParserIsUsed() {
        // Arrange
        CoercionRegistry registry = CoercionRegistry.defaults()
                .register(Unregistered.class, raw -> new Unregistered());
        ValueCoercer coercer = new ValueCoercer(registry, BindingOptions.builder().build());

        // Act
        Object value = coercer.coerce(TargetType.scalar(Unregistered.class), "anything");

        // Assert
        assertThat(value).isInstanceOf(Unregistered.class);
    }

    @Test
    void failedResultFallsBackToGivenValue() {
        CoercionResult<Object> failed = lenient.tryCoerce(TargetType.scalar(int.class), "abc");
        CoercionResult<Object> converted = lenient.tryCoerce(TargetType.scalar(int.class), "3");

        assertThat(failed.orElse(-1)).isEqualTo(-1);
        assertThat(converted.orElse(-1)).isEqualTo(3);
        assertThatThrownBy(failed::getValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void defaultsUseBuiltInParsersAndLenientPolicy() {
        // Arrange
        System.clearProperty(BindingOptions.STRICT_PROPERTY);

        // Act
        ValueCoercer coercer = ValueCoercer.defaults();

        // Assert
        assertThat(coercer.getRegistry().hasParser(int.class)).isTrue();
        assertThat(coercer.getOptions().getPolicy()).isEqualTo(CoercionPolicy.LENIENT);
        assertThat(coercer.getOptions().isCaseSensitiveEnums()).isFalse();
    }

    @Test
    void collectionTargetIsRejected() {
        assertThatThrownBy(() -> lenient.tryCoerce(TargetType.arrayOf(int.class), "1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
