package org.pragmatica.translator.plural;

import org.pragmatica.translator.error.UnsupportedLocaleException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Languages with known plural rules: number of forms and the rule picking one of them.
 */
public enum PluralLocale {
    AZ("az", 2, PluralRules.NO_DISTINCTION),
    BO("bo", 2, PluralRules.NO_DISTINCTION),
    DZ("dz", 2, PluralRules.NO_DISTINCTION),
    ID("id", 2, PluralRules.NO_DISTINCTION),
    JA("ja", 2, PluralRules.NO_DISTINCTION),
    JV("jv", 2, PluralRules.NO_DISTINCTION),
    KA("ka", 2, PluralRules.NO_DISTINCTION),
    KM("km", 2, PluralRules.NO_DISTINCTION),
    KN("kn", 2, PluralRules.NO_DISTINCTION),
    KO("ko", 2, PluralRules.NO_DISTINCTION),
    MS("ms", 2, PluralRules.NO_DISTINCTION),
    TH("th", 2, PluralRules.NO_DISTINCTION),
    TR("tr", 2, PluralRules.NO_DISTINCTION),
    VI("vi", 2, PluralRules.NO_DISTINCTION),
    ZH("zh", 2, PluralRules.NO_DISTINCTION),

    AF("af", 3, PluralRules.ONE_OTHER),
    BN("bn", 3, PluralRules.ONE_OTHER),
    BG("bg", 3, PluralRules.ONE_OTHER),
    CA("ca", 3, PluralRules.ONE_OTHER),
    DA("da", 3, PluralRules.ONE_OTHER),
    DE("de", 3, PluralRules.ONE_OTHER),
    EL("el", 3, PluralRules.ONE_OTHER),
    EN("en", 3, PluralRules.ONE_OTHER),
    EO("eo", 3, PluralRules.ONE_OTHER),
    ES("es", 3, PluralRules.ONE_OTHER),
    ET("et", 3, PluralRules.ONE_OTHER),
    EU("eu", 3, PluralRules.ONE_OTHER),
    FA("fa", 3, PluralRules.ONE_OTHER),
    FI("fi", 3, PluralRules.ONE_OTHER),
    FO("fo", 3, PluralRules.ONE_OTHER),
    FUR("fur", 3, PluralRules.ONE_OTHER),
    FY("fy", 3, PluralRules.ONE_OTHER),
    GL("gl", 3, PluralRules.ONE_OTHER),
    GU("gu", 3, PluralRules.ONE_OTHER),
    HA("ha", 3, PluralRules.ONE_OTHER),
    HE("he", 3, PluralRules.ONE_OTHER),
    HU("hu", 3, PluralRules.ONE_OTHER),
    IS("is", 3, PluralRules.ONE_OTHER),
    IT("it", 3, PluralRules.ONE_OTHER),
    KU("ku", 3, PluralRules.ONE_OTHER),
    LB("lb", 3, PluralRules.ONE_OTHER),
    ML("ml", 3, PluralRules.ONE_OTHER),
    MN("mn", 3, PluralRules.ONE_OTHER),
    MR("mr", 3, PluralRules.ONE_OTHER),
    NAH("nah", 3, PluralRules.ONE_OTHER),
    NB("nb", 3, PluralRules.ONE_OTHER),
    NE("ne", 3, PluralRules.ONE_OTHER),
    NL("nl", 3, PluralRules.ONE_OTHER),
    NN("nn", 3, PluralRules.ONE_OTHER),
    NO("no", 3, PluralRules.ONE_OTHER),
    OC("oc", 3, PluralRules.ONE_OTHER),
    OM("om", 3, PluralRules.ONE_OTHER),
    OR("or", 3, PluralRules.ONE_OTHER),
    PA("pa", 3, PluralRules.ONE_OTHER),
    PAP("pap", 3, PluralRules.ONE_OTHER),
    PS("ps", 3, PluralRules.ONE_OTHER),
    PT("pt", 3, PluralRules.ONE_OTHER),
    SO("so", 3, PluralRules.ONE_OTHER),
    SQ("sq", 3, PluralRules.ONE_OTHER),
    SV("sv", 3, PluralRules.ONE_OTHER),
    SW("sw", 3, PluralRules.ONE_OTHER),
    TA("ta", 3, PluralRules.ONE_OTHER),
    TE("te", 3, PluralRules.ONE_OTHER),
    TK("tk", 3, PluralRules.ONE_OTHER),
    UR("ur", 3, PluralRules.ONE_OTHER),
    ZU("zu", 3, PluralRules.ONE_OTHER),

    AM("am", 2, PluralRules.ZERO_OR_ONE),
    BH("bh", 2, PluralRules.ZERO_OR_ONE),
    FIL("fil", 2, PluralRules.ZERO_OR_ONE),
    FR("fr", 2, PluralRules.ZERO_OR_ONE),
    GUN("gun", 2, PluralRules.ZERO_OR_ONE),
    HI("hi", 2, PluralRules.ZERO_OR_ONE),
    HY("hy", 2, PluralRules.ZERO_OR_ONE),
    LN("ln", 2, PluralRules.ZERO_OR_ONE),
    MG("mg", 2, PluralRules.ZERO_OR_ONE),
    NSO("nso", 2, PluralRules.ZERO_OR_ONE),
    XBR("xbr", 2, PluralRules.ZERO_OR_ONE),
    TI("ti", 2, PluralRules.ZERO_OR_ONE),
    WA("wa", 2, PluralRules.ZERO_OR_ONE),

    BE("be", 4, PluralRules.SLAVIC),
    BS("bs", 4, PluralRules.SLAVIC),
    HR("hr", 4, PluralRules.SLAVIC),
    RU("ru", 4, PluralRules.SLAVIC),
    SR("sr", 4, PluralRules.SLAVIC),
    UK("uk", 4, PluralRules.SLAVIC),

    CS("cs", 4, PluralRules.CZECH),
    SK("sk", 4, PluralRules.CZECH),
    GA("ga", 4, PluralRules.IRISH),
    LT("lt", 4, PluralRules.LITHUANIAN),
    SL("sl", 5, PluralRules.SLOVENIAN),
    MK("mk", 3, PluralRules.MACEDONIAN),
    MT("mt", 5, PluralRules.MALTESE),
    LV("lv", 3, PluralRules.LATVIAN),
    PL("pl", 4, PluralRules.POLISH),
    CY("cy", 4, PluralRules.WELSH),
    RO("ro", 4, PluralRules.ROMANIAN),
    AR("ar", 6, PluralRules.ARABIC);

    private static final Map<String, PluralLocale> BY_CODE = Arrays.stream(values())
                                                                   .collect(Collectors.toUnmodifiableMap(PluralLocale::code,
                                                                                                         Function.identity()));

    private final String code;
    private final int formCount;
    private final PluralRule rule;

    PluralLocale(String code, int formCount, PluralRule rule) {
        this.code = code;
        this.formCount = formCount;
        this.rule = rule;
    }

    /**
     * Language code, e.g. {@code "ru"} or {@code "fil"}.
     */
    public String code() {
        return code;
    }

    /**
     * Number of plural forms the language distinguishes.
     */
    public int formCount() {
        return formCount;
    }

    /**
     * Index of the form used for {@code n}; zero always takes the first form.
     */
    public int formIndex(long n) {
        if (n == 0) {
            return 0;
        }
        return rule.formIndex(n);
    }

    /**
     * Look up a locale by language tag. Region and script parts are ignored,
     * so {@code "pt-BR"}, {@code "pt_PT"} and {@code "PT"} all give {@link #PT}.
     */
    public static Optional<PluralLocale> find(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        var language = tag.trim().split("[-_]", 2)[0].toLowerCase(Locale.ROOT);
        return Optional.ofNullable(BY_CODE.get(language));
    }

    /**
     * Same as {@link #find(String)}, failing for unknown languages.
     *
     * @throws UnsupportedLocaleException if the language has no plural rule
     */
    public static PluralLocale forCode(String tag) {
        return find(tag).orElseThrow(() -> new UnsupportedLocaleException(tag));
    }

    public static PluralLocale forLocale(Locale locale) {
        return forCode(locale.toLanguageTag());
    }
}
