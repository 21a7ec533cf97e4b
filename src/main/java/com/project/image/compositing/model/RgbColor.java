package com.project.image.compositing.model;

import com.project.image.compositing.exceptions.ColorFormatException;

import java.util.regex.Pattern;

/**
 * Opaque 8-bit colour.
 */
public record RgbColor(int red, int green, int blue) {
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);
    public static final RgbColor BLACK = new RgbColor(0, 0, 0);

    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9A-Fa-f]{6}");

    public RgbColor {
        if (!inRange(red) || !inRange(green) || !inRange(blue)) {
            throw new IllegalArgumentException("Channel out of range: " + red + "," + green + "," + blue);
        }
    }

    /**
     * Parses {@code RRGGBB}. One leading {@code #} is tolerated since the photo editor sends it.
     */
    public static RgbColor parseHex(String hex) {
        if (hex == null) {
            throw new ColorFormatException("Background colour is missing");
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            throw new ColorFormatException("Background colour must have 6 hex digits: '" + hex + "'");
        }
        if (!HEX_DIGITS.matcher(digits).matches()) {
            throw new ColorFormatException("Background colour contains a non-hex character: '" + hex + "'");
        }
        return new RgbColor(
                Integer.parseInt(digits.substring(0, 2), 16),
                Integer.parseInt(digits.substring(2, 4), 16),
                Integer.parseInt(digits.substring(4, 6), 16));
    }

    public String toHex() {
        return String.format("%02X%02X%02X", red, green, blue);
    }

    private static boolean inRange(int v) {
        return v >= 0 && v <= 255;
    }
}
