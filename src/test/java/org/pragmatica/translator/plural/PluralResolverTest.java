package org.pragmatica.translator.plural;

import org.junit.jupiter.api.Test;
import org.pragmatica.translator.error.PluralFormCountMismatchException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PluralResolverTest {

    private static void assertForms(PluralLocale locale, long[] numbers, int[] expected) {
        for (int i = 0; i < numbers.length; i++) {
            assertEquals(expected[i], PluralResolver.formIndex(locale, numbers[i]),
                         locale.code() + " form for " + numbers[i]);
        }
    }

    // === Form indices ===

    @Test
    void formIndex_slavic_distinguishesFinalDigitClasses() {
        assertForms(PluralLocale.RU,
                    new long[]{0, 1, 2, 5, 11, 12, 21, 22, 25, 111, 1001},
                    new int[]{0, 1, 2, 3, 3, 3, 1, 2, 3, 3, 1});
        assertEquals(4, PluralResolver.formCount(PluralLocale.UK));
    }

    @Test
    void formIndex_arabic_usesSixCategories() {
        assertForms(PluralLocale.AR,
                    new long[]{0, 1, 2, 3, 10, 11, 99, 100, 102, 103, 111},
                    new int[]{0, 1, 2, 3, 3, 4, 4, 5, 5, 3, 4});
        assertEquals(6, PluralResolver.formCount(PluralLocale.AR));
    }

    @Test
    void formIndex_english_zeroOneOther() {
        assertForms(PluralLocale.EN, new long[]{0, 1, 2, 21}, new int[]{0, 1, 2, 2});
        assertEquals(3, PluralResolver.formCount(PluralLocale.EN));
    }

    @Test
    void formIndex_french_zeroAndOneShareForm() {
        assertForms(PluralLocale.FR, new long[]{0, 1, 2, 100}, new int[]{0, 0, 1, 1});
        assertEquals(2, PluralResolver.formCount(PluralLocale.FR));
    }

    @Test
    void formIndex_asian_onlyZeroDiffers() {
        assertForms(PluralLocale.JA, new long[]{0, 1, 2, 100}, new int[]{0, 1, 1, 1});
        assertForms(PluralLocale.ZH, new long[]{0, 7}, new int[]{0, 1});
        assertEquals(2, PluralResolver.formCount(PluralLocale.KO));
    }

    @Test
    void formIndex_czech_oneFewOther() {
        assertForms(PluralLocale.CS, new long[]{1, 3, 5, 22}, new int[]{1, 2, 3, 3});
        assertForms(PluralLocale.SK, new long[]{1, 4}, new int[]{1, 2});
    }

    @Test
    void formIndex_polish_teensAreOther() {
        assertForms(PluralLocale.PL,
                    new long[]{1, 2, 5, 12, 14, 21, 22, 112},
                    new int[]{1, 2, 3, 3, 3, 3, 2, 3});
    }

    @Test
    void formIndex_irish_oneTwoOther() {
        assertForms(PluralLocale.GA, new long[]{1, 2, 3}, new int[]{1, 2, 3});
    }

    @Test
    void formIndex_lithuanian() {
        assertForms(PluralLocale.LT, new long[]{1, 2, 10, 11, 12, 21}, new int[]{1, 2, 3, 3, 3, 1});
    }

    @Test
    void formIndex_slovenian_usesHundredsRemainder() {
        assertForms(PluralLocale.SL, new long[]{1, 101, 102, 103, 104, 5}, new int[]{1, 1, 2, 3, 3, 4});
        assertEquals(5, PluralResolver.formCount(PluralLocale.SL));
    }

    @Test
    void formIndex_macedonian() {
        assertForms(PluralLocale.MK, new long[]{1, 11, 2}, new int[]{1, 1, 2});
    }

    @Test
    void formIndex_maltese() {
        assertForms(PluralLocale.MT, new long[]{1, 2, 10, 11, 19, 20, 102}, new int[]{1, 2, 2, 3, 3, 4, 2});
    }

    @Test
    void formIndex_latvian() {
        assertForms(PluralLocale.LV, new long[]{0, 1, 11, 21, 5}, new int[]{0, 1, 2, 1, 2});
    }

    @Test
    void formIndex_welsh() {
        assertForms(PluralLocale.CY, new long[]{1, 2, 8, 11, 3}, new int[]{0, 1, 2, 2, 3});
    }

    @Test
    void formIndex_romanian() {
        assertForms(PluralLocale.RO, new long[]{1, 2, 19, 20, 101}, new int[]{1, 2, 2, 3, 2});
    }

    @Test
    void formIndex_everyLocale_staysWithinFormCount() {
        for (var locale : PluralLocale.values()) {
            assertThat(locale.formCount()).isBetween(1, 6);
            for (long n = -200; n <= 1_000; n++) {
                assertThat(locale.formIndex(n))
                    .as("%s form for %d", locale.code(), n)
                    .isBetween(0, locale.formCount() - 1);
            }
        }
    }

    // === Form selection ===

    @Test
    void selectForm_picksTrimmedForm() {
        var forms = " no files | %n% file | %n% files ";

        assertEquals("no files", PluralResolver.selectForm(forms, 0, PluralLocale.EN, "files"));
        assertEquals("%n% file", PluralResolver.selectForm(forms, 1, PluralLocale.EN, "files"));
        assertEquals("%n% files", PluralResolver.selectForm(forms, 5, PluralLocale.EN, "files"));
    }

    @Test
    void selectForm_russian() {
        var forms = "нет файлов|%n% файл|%n% файла|%n% файлов";

        assertEquals("%n% файла", PluralResolver.selectForm(forms, 22, PluralLocale.RU, "files"));
        assertEquals("%n% файлов", PluralResolver.selectForm(forms, 11, PluralLocale.RU, "files"));
    }

    @Test
    void selectForm_keepsEmptyTrailingForm() {
        assertEquals("", PluralResolver.selectForm("a|b|", 5, PluralLocale.EN, "k"));
        assertEquals(List.of("a", "b", ""), PluralResolver.split("a|b|"));
    }

    @Test
    void selectForm_wrongFormCount_throws() {
        var error = assertThrows(PluralFormCountMismatchException.class,
                                 () -> PluralResolver.selectForm("файл|файла|файлов", 5, PluralLocale.RU, "files.count"));

        assertEquals("файл|файла|файлов", error.pluralString());
        assertEquals("ru", error.locale());
        assertEquals("files.count", error.key());
        assertEquals(3, error.given());
        assertEquals(4, error.expected());
        assertTrue(error.getMessage().contains("files.count"));
    }

    @Test
    void hasValidForms_checksCountOnly() {
        assertTrue(PluralResolver.hasValidForms("a|b", PluralLocale.FR));
        assertFalse(PluralResolver.hasValidForms("a|b|c", PluralLocale.FR));
        assertFalse(PluralResolver.hasValidForms("a", PluralLocale.EN));
    }
}
