package org.pragmatica.translator.error;

/**
 * An opening tag was never closed, or a closing tag has no matching opener.
 */
public final class UnbalancedTagsException extends TranslationException {
    private final String input;

    public UnbalancedTagsException(String input) {
        super("String has unbalanced tags: " + input);
        this.input = input;
    }

    /**
     * The message source that failed to parse.
     */
    public String input() {
        return input;
    }
}
