package de.bsommerfeld.coversync.core.util;

import java.util.Locale;

/**
 * Renders byte counts for log output, e.g. the space reclaimed by a merge.
 */
public final class ByteFormatter {

    private static final String[] UNITS = {"B", "KiB", "MiB", "GiB", "TiB"};

    private ByteFormatter() {
    }

    /**
     * Formats {@code bytes} with one decimal in the largest binary unit that
     * keeps the value at or above 1 (e.g. {@code 488.3 KiB}). Plain bytes are
     * printed without decimals. Negative input yields {@code "? B"}.
     */
    public static String format(long bytes) {
        if (bytes < 0) {
            return "? B";
        }
        if (bytes < 1024) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }
}
