package com.myorg.tocparser.util;

import java.text.Normalizer;

public final class TextNormalizer {

    private TextNormalizer() {}

    /**
     * NFC-normalizes extracted text, turns non-breaking spaces into plain spaces, drops
     * zero-width spaces and trims. Interior runs of spaces are kept: they are part of the
     * dot-leader filler.
     */
    public static String normalize(String s) {
        if (s == null) return "";
        return Normalizer.normalize(s, Normalizer.Form.NFC)
                .replace('\u00A0', ' ')
                .replace("\u200B", "")
                .replaceAll("[\\t\\x0B\\f\\r]+", " ")
                .trim();
    }
}
