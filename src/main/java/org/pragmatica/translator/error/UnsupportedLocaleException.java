package org.pragmatica.translator.error;

/**
 * Locale code not present in the plural rule table.
 */
public final class UnsupportedLocaleException extends TranslationException {
    private final String code;

    public UnsupportedLocaleException(String code) {
        super("Unsupported locale: " + code);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
