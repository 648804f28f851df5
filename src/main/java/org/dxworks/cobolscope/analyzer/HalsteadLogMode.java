package org.dxworks.cobolscope.analyzer;

import java.util.Locale;

/**
 * How {@code log2(vocabulary)} is computed for Halstead volume.
 */
public enum HalsteadLogMode {
    /** True base-2 logarithm. */
    LOG2,
    /** Integer bit length of the vocabulary, kept for reports produced by the legacy tooling. */
    BIT_LENGTH;

    public double log2(int vocabulary) {
        if (vocabulary <= 0) {
            return 0.0;
        }
        return switch (this) {
            case LOG2 -> Math.log(vocabulary) / Math.log(2);
            case BIT_LENGTH -> Integer.SIZE - Integer.numberOfLeadingZeros(vocabulary);
        };
    }

    public static HalsteadLogMode fromName(String name) {
        if (name == null || name.isBlank()) {
            return LOG2;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
