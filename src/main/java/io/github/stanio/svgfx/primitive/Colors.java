/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgfx.primitive;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code flood-color} and {@code lighting-color} values:
 * {@code #rgb}, {@code #rrggbb}, {@code rgb(r, g, b)}, and basic color
 * keywords.
 */
final class Colors {

    private static final Pattern RGB_FUNCTION = Pattern.compile(
            "rgb\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*\\)");

    private static final Map<String, Integer> keywords = new HashMap<>();
    static {
        keywords.put("black", 0x000000);
        keywords.put("white", 0xFFFFFF);
        keywords.put("red", 0xFF0000);
        keywords.put("lime", 0x00FF00);
        keywords.put("green", 0x008000);
        keywords.put("blue", 0x0000FF);
        keywords.put("yellow", 0xFFFF00);
        keywords.put("cyan", 0x00FFFF);
        keywords.put("aqua", 0x00FFFF);
        keywords.put("magenta", 0xFF00FF);
        keywords.put("fuchsia", 0xFF00FF);
        keywords.put("gray", 0x808080);
        keywords.put("grey", 0x808080);
        keywords.put("silver", 0xC0C0C0);
        keywords.put("maroon", 0x800000);
        keywords.put("navy", 0x000080);
        keywords.put("olive", 0x808000);
        keywords.put("purple", 0x800080);
        keywords.put("teal", 0x008080);
        keywords.put("orange", 0xFFA500);
    }

    private Colors() {}

    static int parse(String value) {
        String color = value.trim().toLowerCase(Locale.ROOT);
        if (color.startsWith("#")) {
            String digits = color.substring(1);
            if (digits.length() == 3) {
                StringBuilder expanded = new StringBuilder(6);
                for (char ch : digits.toCharArray()) {
                    expanded.append(ch).append(ch);
                }
                digits = expanded.toString();
            }
            if (digits.length() == 6) {
                try {
                    return Integer.parseInt(digits, 16);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid color: " + value, e);
                }
            }
            throw new IllegalArgumentException("Invalid color: " + value);
        }

        Matcher rgb = RGB_FUNCTION.matcher(color);
        if (rgb.matches()) {
            int r = Math.min(255, Integer.parseInt(rgb.group(1)));
            int g = Math.min(255, Integer.parseInt(rgb.group(2)));
            int b = Math.min(255, Integer.parseInt(rgb.group(3)));
            return (r << 16) | (g << 8) | b;
        }

        Integer named = keywords.get(color);
        if (named == null)
            throw new IllegalArgumentException("Unsupported color: " + value);

        return named;
    }

}
