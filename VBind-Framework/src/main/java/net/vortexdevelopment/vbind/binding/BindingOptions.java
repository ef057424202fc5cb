package net.vortexdevelopment.vbind.binding;

import lombok.Builder;
import lombok.Getter;

/**
 * Settings of a {@link ValueCoercer}.
 *
 * <p>{@link #defaults()} reads the system properties {@value #STRICT_PROPERTY} and
 * {@value #CASE_SENSITIVE_ENUMS_PROPERTY}.
 */
@Getter
@Builder(toBuilder = true)
public class BindingOptions {

    public static final String STRICT_PROPERTY = "vbind.binding.strict";
    public static final String CASE_SENSITIVE_ENUMS_PROPERTY = "vbind.binding.case-sensitive-enums";

    @Builder.Default
    private final CoercionPolicy policy = CoercionPolicy.LENIENT;

    /**
     * When false, an enum name that has no exact match may match ignoring case.
     */
    private final boolean caseSensitiveEnums;

    public static BindingOptions defaults() {
        return BindingOptions.builder()
                .policy(Boolean.getBoolean(STRICT_PROPERTY) ? CoercionPolicy.STRICT : CoercionPolicy.LENIENT)
                .caseSensitiveEnums(Boolean.getBoolean(CASE_SENSITIVE_ENUMS_PROPERTY))
                .build();
    }
}
