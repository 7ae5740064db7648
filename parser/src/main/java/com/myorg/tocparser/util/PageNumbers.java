package com.myorg.tocparser.util;

import java.util.regex.Pattern;

public final class PageNumbers {

    private static final Pattern BARE_INTEGER = Pattern.compile("^\\d{1,6}$");

    private PageNumbers() {}

    /** True when the trimmed text is nothing but a page-sized integer. */
    public static boolean isBareInteger(String text) {
        return text != null && BARE_INTEGER.matcher(text.trim()).matches();
    }

    /** Parses a page number, returning 0 for null or unparsable input. */
    public static int safeParseInt(String raw) {
        if (raw == null) return 0;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
