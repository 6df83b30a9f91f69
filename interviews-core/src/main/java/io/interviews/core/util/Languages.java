package io.interviews.core.util;

import java.util.Locale;
import java.util.MissingResourceException;

/// ISO 639 language code helpers.
///
/// Languages are identified by their ISO 639-1 code (`"en"`, `"fr"`) throughout the
/// engine. Text functions additionally receive the ISO 639-2 code.
public final class Languages {

    private Languages() {}

    /// Checks that a code names a known ISO 639-1 language.
    ///
    /// @param language two letter code, may be null
    /// @return true if known
    public static boolean isValid(String language) {
        if (language == null || language.length() != 2) {
            return false;
        }
        for (String known : Locale.getISOLanguages()) {
            if (known.equals(language)) {
                return true;
            }
        }
        return false;
    }

    /// Converts an ISO 639-1 code to ISO 639-2.
    ///
    /// @param language two letter code, not null
    /// @return three letter code, or the input if no mapping exists
    public static String toIso3(String language) {
        try {
            String iso3 = Locale.forLanguageTag(language).getISO3Language();
            return iso3.isEmpty() ? language : iso3;
        } catch (MissingResourceException e) {
            return language;
        }
    }
}
