package org.pragmatica.translator.plural;

import org.pragmatica.translator.error.PluralFormCountMismatchException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Picks the plural form of a number out of a {@code |}-delimited list of alternatives.
 *
 * <p>Example:
 * <pre>{@code
 * PluralResolver.selectForm("нет файлов|%n% файл|%n% файла|%n% файлов", 22, PluralLocale.RU, "files.count");
 * // "%n% файла"
 * }</pre>
 *
 * <p>The list must hold exactly {@link PluralLocale#formCount()} alternatives, index 0 being the form for zero.
 */
public final class PluralResolver {
    private static final Pattern DELIMITER = Pattern.compile("\\|");

    private PluralResolver() {}

    public static int formCount(PluralLocale locale) {
        return locale.formCount();
    }

    /**
     * Index of the form used for {@code n}, in {@code [0, formCount(locale))}.
     */
    public static int formIndex(PluralLocale locale, long n) {
        return locale.formIndex(n);
    }

    /**
     * Select the trimmed form for {@code n}.
     *
     * @param pluralString alternatives separated by {@code |}
     * @param key          translation key, reported on failure
     * @throws PluralFormCountMismatchException if the number of alternatives does not match the locale
     */
    public static String selectForm(String pluralString, long n, PluralLocale locale, String key) {
        var forms = checkForms(pluralString, locale, key);
        return forms.get(formIndex(locale, n)).trim();
    }

    /**
     * Split a plural string into its alternatives, checking their number.
     *
     * @throws PluralFormCountMismatchException if the number of alternatives does not match the locale
     */
    public static List<String> checkForms(String pluralString, PluralLocale locale, String key) {
        var forms = split(pluralString);
        if (forms.size() != locale.formCount()) {
            throw new PluralFormCountMismatchException(pluralString, locale.code(), key, forms.size(), locale.formCount());
        }
        return forms;
    }

    /**
     * Non-throwing form of {@link #checkForms(String, PluralLocale, String)}.
     */
    public static boolean hasValidForms(String pluralString, PluralLocale locale) {
        return split(pluralString).size() == locale.formCount();
    }

    /**
     * Untrimmed alternatives of a plural string. Empty alternatives are kept: {@code "a|"} has two.
     */
    public static List<String> split(String pluralString) {
        return List.of(DELIMITER.split(pluralString, -1));
    }
}
