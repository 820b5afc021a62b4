package com.radarsync.core.fingerprint;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reduces a track title to a comparable form: lower case, no featured-artist credit,
 * no edition suffix, single spaces.
 */
public final class TitleNormalizer {

    private static final Pattern FEATURING =
            Pattern.compile("\\s*[(\\[]?\\s*(feat\\.|featuring)[^)\\]]*[)\\]]?");
    private static final Pattern DASH_EDITION =
            Pattern.compile("\\s+-\\s+(radio edit|remastered(\\s+\\d{4})?|\\d{4}\\s+remaster(ed)?)\\s*$");
    private static final Pattern BRACKETED_EDITION =
            Pattern.compile("\\s*[(\\[](remastered(\\s+\\d{4})?|\\d{4}\\s+remaster(ed)?|radio edit)[)\\]]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TitleNormalizer() {
    }

    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        String normalized = title.toLowerCase(Locale.ROOT);
        normalized = FEATURING.matcher(normalized).replaceAll("");
        normalized = BRACKETED_EDITION.matcher(normalized).replaceAll("");
        normalized = DASH_EDITION.matcher(normalized).replaceAll("");
        return WHITESPACE.matcher(normalized.trim()).replaceAll(" ");
    }
}
