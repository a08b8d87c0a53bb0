package org.pragmatica.translator.check;

import java.util.List;

/**
 * Result of checking a translated catalog against its base catalog.
 */
public record CatalogReport(String locale, List<CatalogIssue> issues) {
    public CatalogReport {
        issues = List.copyOf(issues);
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    public <T extends CatalogIssue> List<T> issuesOf(Class<T> type) {
        return issues.stream()
                     .filter(type::isInstance)
                     .map(type::cast)
                     .toList();
    }

    public String summary() {
        if (isClean()) {
            return "Catalog " + locale + ": no issues";
        }
        var sb = new StringBuilder();
        sb.append("Catalog ").append(locale).append(": ").append(issues.size()).append(" issue(s)");
        for (var issue : issues) {
            sb.append("\n  ").append(issue.message());
        }
        return sb.toString();
    }
}
