package org.pragmatica.translator.error;

/**
 * Base of all failures raised by the translation engine.
 * Every failure is a content or integration defect: it is reported to the immediate caller and never retried.
 */
public abstract sealed class TranslationException extends RuntimeException
        permits UnbalancedTagsException,
                MissingValueException,
                PluralFormCountMismatchException,
                UnsupportedLocaleException,
                MissingMessageException {

    protected TranslationException(String message) {
        super(message);
    }
}
