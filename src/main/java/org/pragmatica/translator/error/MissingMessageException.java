package org.pragmatica.translator.error;

/**
 * Translation key present neither in the requested catalog nor in its fallback.
 */
public final class MissingMessageException extends TranslationException {
    private final String key;

    public MissingMessageException(String key) {
        super("Message \"" + key + "\" not found");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
