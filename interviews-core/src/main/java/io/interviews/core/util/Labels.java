package io.interviews.core.util;

import java.util.Set;
import java.util.regex.Pattern;

/// Label syntax shared by question labels and loop variable names.
///
/// A label starts with a letter or `$` and continues with letters, digits, `_` or `$`.
/// The names under which the respondent's language is injected into text functions are
/// reserved.
public final class Labels {

    /// Name of the ISO 639-2 language code injected into text functions.
    public static final String LANGUAGE = "language";

    /// Name of the ISO 639-1 language code injected into text functions.
    public static final String LANGUAGE_STR2 = "language_str2";

    private static final Pattern LABEL = Pattern.compile("[a-zA-Z$][0-9a-zA-Z_$]*");
    private static final Set<String> RESERVED = Set.of(LANGUAGE, LANGUAGE_STR2);

    private Labels() {}

    /// Checks label syntax without the reserved-name rule.
    ///
    /// @param label candidate, may be null
    /// @return true if syntactically valid
    public static boolean isIdentifier(String label) {
        return label != null && LABEL.matcher(label).matches();
    }

    /// Checks that a label is a valid identifier and not reserved.
    ///
    /// @param label candidate, may be null
    /// @return true if usable as a question label
    public static boolean isValidLabel(String label) {
        return isIdentifier(label) && !RESERVED.contains(label);
    }
}
