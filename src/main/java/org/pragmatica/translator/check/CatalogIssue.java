package org.pragmatica.translator.check;

import java.util.List;

/**
 * Problem found in a translated catalog.
 */
public sealed interface CatalogIssue {
    String key();

    String message();

    /**
     * Key of the base catalog absent from the translation.
     */
    record MissingTranslation(String key) implements CatalogIssue {
        @Override
        public String message() {
            return "Translation \"" + key + "\" not found";
        }
    }

    /**
     * Translated key not used by the application.
     */
    record UnusedTranslation(String key) implements CatalogIssue {
        @Override
        public String message() {
            return "Translation \"" + key + "\" is not used";
        }
    }

    /**
     * Message that fails to parse.
     */
    record MalformedMessage(String key, String reason) implements CatalogIssue {
        @Override
        public String message() {
            return "Translation \"" + key + "\" is malformed: " + reason;
        }
    }

    /**
     * Message whose tags or placeholders differ from the base message.
     */
    record StructureMismatch(String key, List<String> differences) implements CatalogIssue {
        public StructureMismatch {
            differences = List.copyOf(differences);
        }

        @Override
        public String message() {
            return "Translation \"" + key + "\" does not match base message: " + String.join(", ", differences);
        }
    }

    /**
     * Plural message with a wrong number of forms for the catalog locale.
     */
    record InvalidPluralForms(String key, int given, int expected) implements CatalogIssue {
        @Override
        public String message() {
            return "Translation \"" + key + "\" has wrong number of plural forms: " + given + " given; need: " + expected;
        }
    }
}
