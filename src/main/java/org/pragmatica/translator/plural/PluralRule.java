package org.pragmatica.translator.plural;

/**
 * Plural category rule of a language: maps a non-zero cardinal number to the index of its form.
 */
@FunctionalInterface
public interface PluralRule {
    int formIndex(long n);
}
