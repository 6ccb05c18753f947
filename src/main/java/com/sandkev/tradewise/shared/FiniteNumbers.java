package com.sandkev.tradewise.shared;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

/**
 * Boundary between floating-point text coming from outside (provider payloads, CSV exports)
 * and the {@link BigDecimal} arithmetic used everywhere else. {@code NaN}, infinities and
 * unparsable values never get past here.
 */
public final class FiniteNumbers {

    private FiniteNumbers() {}

    /** Parses a decimal; empty for blank, unparsable or non-finite input. */
    public static Optional<BigDecimal> parse(String s) {
        if (s == null) return Optional.empty();
        String t = s.trim().replace(",", "");
        if (t.isEmpty() || t.equals("-")) return Optional.empty();

        String lower = t.toLowerCase(Locale.ROOT);
        if (lower.contains("nan") || lower.contains("inf")) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(t));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Rounds {@code x} half-up to {@code scale} places for a {@code decimal(integerDigits + scale, scale)}
     * column. Empty when the value has more than {@code integerDigits} digits before the point.
     */
    public static Optional<BigDecimal> fitTo(BigDecimal x, int integerDigits, int scale) {
        if (x == null) return Optional.empty();
        BigDecimal s = x.stripTrailingZeros();
        if (s.precision() - s.scale() > integerDigits) return Optional.empty();

        // rounds to zero; also avoids rescaling inputs like 1e-999999999
        BigDecimal half = BigDecimal.valueOf(5, scale + 1);
        if (s.abs().compareTo(half) < 0) return Optional.of(BigDecimal.ZERO.setScale(scale));

        BigDecimal rounded = s.setScale(scale, RoundingMode.HALF_UP);
        if (rounded.precision() - rounded.scale() > integerDigits) return Optional.empty();
        return Optional.of(rounded);
    }

    public static boolean isPositive(BigDecimal x) {
        return x != null && x.signum() > 0;
    }

    public static boolean isNonNegative(BigDecimal x) {
        return x != null && x.signum() >= 0;
    }
}
