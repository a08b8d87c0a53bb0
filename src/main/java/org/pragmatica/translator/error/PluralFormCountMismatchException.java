package org.pragmatica.translator.error;

/**
 * A pipe-delimited plural string has a different number of forms than its locale requires.
 */
public final class PluralFormCountMismatchException extends TranslationException {
    private final String pluralString;
    private final String locale;
    private final String key;
    private final int given;
    private final int expected;

    public PluralFormCountMismatchException(String pluralString, String locale, String key, int given, int expected) {
        super("Invalid plural string \"" + key + "\" for locale " + locale + ": " + given + " given; need: " + expected
              + " (\"" + pluralString + "\")");
        this.pluralString = pluralString;
        this.locale = locale;
        this.key = key;
        this.given = given;
        this.expected = expected;
    }

    public String pluralString() {
        return pluralString;
    }

    public String locale() {
        return locale;
    }

    /**
     * Translation key of the plural string, as passed by the caller.
     */
    public String key() {
        return key;
    }

    public int given() {
        return given;
    }

    public int expected() {
        return expected;
    }
}
