package org.pragmatica.translator.plural;

/**
 * Plural rules shared by language families.
 * Index 0 is the form for zero in every family; rules are only consulted for non-zero numbers.
 *
 * @see <a href="https://localization-guide.readthedocs.io/en/latest/l10n/pluralforms.html">Plural forms</a>
 */
public final class PluralRules {
    private PluralRules() {}

    // zero | other
    public static final PluralRule NO_DISTINCTION = n -> 1;

    // zero | one | other
    public static final PluralRule ONE_OTHER = n -> n == 1 ? 1 : 2;

    // zero or one | other
    public static final PluralRule ZERO_OR_ONE = n -> n == 0 || n == 1 ? 0 : 1;

    // zero | 1, 21, 31... | 2-4, 22-24... | other
    public static final PluralRule SLAVIC = n -> {
        if (n % 10 == 1 && n % 100 != 11) {
            return 1;
        }
        if (n % 10 >= 2 && n % 10 <= 4 && (n % 100 < 10 || n % 100 >= 20)) {
            return 2;
        }
        return 3;
    };

    // zero | 1 | 2-4 | other
    public static final PluralRule CZECH = n -> n == 1 ? 1 : n >= 2 && n <= 4 ? 2 : 3;

    // zero | 1 | 2 | other
    public static final PluralRule IRISH = n -> n == 1 ? 1 : n == 2 ? 2 : 3;

    public static final PluralRule LITHUANIAN = n -> {
        if (n % 10 == 1 && n % 100 != 11) {
            return 1;
        }
        if (n % 10 >= 2 && (n % 100 < 10 || n % 100 >= 20)) {
            return 2;
        }
        return 3;
    };

    public static final PluralRule SLOVENIAN = n -> {
        var mod100 = n % 100;
        if (mod100 == 1) {
            return 1;
        }
        if (mod100 == 2) {
            return 2;
        }
        return mod100 == 3 || mod100 == 4 ? 3 : 4;
    };

    public static final PluralRule MACEDONIAN = n -> n % 10 == 1 ? 1 : 2;

    public static final PluralRule MALTESE = n -> {
        var mod100 = n % 100;
        if (n == 1) {
            return 1;
        }
        if (n == 0 || (mod100 > 1 && mod100 < 11)) {
            return 2;
        }
        return mod100 > 10 && mod100 < 20 ? 3 : 4;
    };

    public static final PluralRule LATVIAN = n -> {
        if (n == 0) {
            return 0;
        }
        return n % 10 == 1 && n % 100 != 11 ? 1 : 2;
    };

    public static final PluralRule POLISH = n -> {
        if (n == 1) {
            return 1;
        }
        if (n % 10 >= 2 && n % 10 <= 4 && (n % 100 < 12 || n % 100 > 14)) {
            return 2;
        }
        return 3;
    };

    // one | two | eight and eleven | other
    public static final PluralRule WELSH = n -> n == 1 ? 0 : n == 2 ? 1 : n == 8 || n == 11 ? 2 : 3;

    public static final PluralRule ROMANIAN = n -> {
        if (n == 1) {
            return 1;
        }
        return n % 100 > 0 && n % 100 < 20 ? 2 : 3;
    };

    // zero | one | two | few (3-10) | many (11-99) | other
    public static final PluralRule ARABIC = n -> {
        if (n == 0) {
            return 0;
        }
        if (n == 1) {
            return 1;
        }
        if (n == 2) {
            return 2;
        }
        var mod100 = n % 100;
        if (mod100 >= 3 && mod100 <= 10) {
            return 3;
        }
        return mod100 >= 11 && mod100 <= 99 ? 4 : 5;
    };
}
