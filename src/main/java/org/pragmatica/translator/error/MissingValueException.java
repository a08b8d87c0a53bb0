package org.pragmatica.translator.error;

/**
 * A tag, void tag or placeholder has no entry in the value map passed to the formatter.
 */
public final class MissingValueException extends TranslationException {
    private final String name;

    public MissingValueException(String name) {
        super("Value for node \"" + name + "\" is missing");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
