package com.safety.aralia;

import com.safety.aralia.api.ConversionListener;
import com.safety.aralia.util.LoggingConversionListener;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Options of one conversion.
 *
 * <pre>{@code
 * ConverterConfig config = ConverterConfig.builder()
 *         .multiTop(true)
 *         .nestingDepth(1)
 *         .build();
 * }</pre>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class ConverterConfig {

    /** Accept more than one top gate. */
    @Builder.Default
    private final boolean multiTop = false;

    /** Levels of child gate formulas inlined into their parent's definition. */
    @Builder.Default
    private final int nestingDepth = 0;

    /** Receives warnings and phase callbacks. Logs through Log4j 2 by default; never null. */
    @NonNull
    @Builder.Default
    @ToString.Exclude
    private final ConversionListener listener = new LoggingConversionListener();

    public static ConverterConfig defaults() {
        return builder().build();
    }
}
