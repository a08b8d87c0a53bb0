package org.pragmatica.translator.check;

import org.pragmatica.translator.catalog.MessageSource;
import org.pragmatica.translator.error.UnbalancedTagsException;
import org.pragmatica.translator.parser.MessageParser;
import org.pragmatica.translator.plural.PluralResolver;
import org.pragmatica.translator.tree.Node;
import org.pragmatica.translator.validate.StructureValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Translation QA: compares a translated catalog with the base catalog it was translated from.
 *
 * <p>Reports keys missing from the translation, keys no longer used by the application, messages with
 * unbalanced tags, messages that lost or gained tags and placeholders, and plural messages with a wrong
 * number of forms.
 */
public final class CatalogChecker {
    private static final Logger log = LoggerFactory.getLogger(CatalogChecker.class);

    private final MessageSource base;
    private final Set<String> pluralKeys;
    private final Set<String> usedKeys;

    private CatalogChecker(MessageSource base, Set<String> pluralKeys, Set<String> usedKeys) {
        this.base = base;
        this.pluralKeys = pluralKeys;
        this.usedKeys = usedKeys;
    }

    /**
     * Checker against {@code base}.
     *
     * @param pluralKeys keys holding {@code |}-delimited plural forms
     * @param usedKeys   keys referenced by the application; empty to skip the unused key check
     */
    public static CatalogChecker against(MessageSource base, Set<String> pluralKeys, Set<String> usedKeys) {
        return new CatalogChecker(base, Set.copyOf(pluralKeys), Set.copyOf(usedKeys));
    }

    public static CatalogChecker against(MessageSource base, Set<String> pluralKeys) {
        return against(base, pluralKeys, Set.of());
    }

    public CatalogReport check(MessageSource target) {
        var issues = new ArrayList<CatalogIssue>();
        for (var key : new TreeSet<>(base.keys())) {
            var translated = target.message(key);
            if (translated.isEmpty()) {
                issues.add(new CatalogIssue.MissingTranslation(key));
                continue;
            }
            checkMessage(key, translated.get(), target, issues);
        }
        if (!usedKeys.isEmpty()) {
            for (var key : new TreeSet<>(usedKeys)) {
                // base keys were already reported above
                if (!base.keys().contains(key) && target.message(key).isEmpty()) {
                    issues.add(new CatalogIssue.MissingTranslation(key));
                }
            }
            for (var key : new TreeSet<>(target.keys())) {
                if (!usedKeys.contains(key)) {
                    issues.add(new CatalogIssue.UnusedTranslation(key));
                }
            }
        }
        var report = new CatalogReport(target.locale().code(), issues);
        issues.forEach(issue -> log.warn("[{}] {}", report.locale(), issue.message()));
        log.info("Checked {} messages of catalog {}: {} issue(s)", base.keys().size(), report.locale(), issues.size());
        return report;
    }

    private void checkMessage(String key, String translated, MessageSource target, List<CatalogIssue> issues) {
        if (pluralKeys.contains(key)) {
            var forms = PluralResolver.split(translated);
            if (forms.size() != target.locale().formCount()) {
                issues.add(new CatalogIssue.InvalidPluralForms(key, forms.size(), target.locale().formCount()));
                return;
            }
            for (var form : forms) {
                if (parse(key, form, issues).isEmpty()) {
                    break;
                }
            }
            return;
        }
        var nodes = parse(key, translated, issues);
        if (nodes.isEmpty()) {
            return;
        }
        var baseNodes = parseBase(key);
        if (baseNodes.isEmpty()) {
            return;
        }
        var differences = StructureValidator.differences(baseNodes.get(), nodes.get());
        if (!differences.isEmpty()) {
            issues.add(new CatalogIssue.StructureMismatch(key, differences));
        }
    }

    private static Optional<List<Node>> parse(String key, String message, List<CatalogIssue> issues) {
        try {
            return Optional.of(MessageParser.parse(message));
        } catch (UnbalancedTagsException e) {
            issues.add(new CatalogIssue.MalformedMessage(key, e.getMessage()));
            return Optional.empty();
        }
    }

    private Optional<List<Node>> parseBase(String key) {
        try {
            return base.message(key).map(MessageParser::parse);
        } catch (UnbalancedTagsException e) {
            log.warn("Base message \"{}\" is malformed, structure not checked: {}", key, e.getMessage());
            return Optional.empty();
        }
    }
}
