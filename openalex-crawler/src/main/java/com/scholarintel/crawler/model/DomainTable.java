package com.scholarintel.crawler.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable domain configuration loaded once at startup.
 * Insertion order is the configured order and drives task enumeration order.
 */
public final class DomainTable {

    private final Map<String, DomainSpec> domains;

    private DomainTable(Map<String, DomainSpec> domains) {
        this.domains = Collections.unmodifiableMap(domains);
    }

    public static DomainTable of(List<DomainSpec> specs) {
        Map<String, DomainSpec> byName = new LinkedHashMap<>();
        for (DomainSpec spec : specs) {
            validate(spec);
            if (byName.putIfAbsent(spec.name(), spec) != null) {
                throw new IllegalStateException("Duplicate domain name: " + spec.name());
            }
        }
        return new DomainTable(byName);
    }

    private static void validate(DomainSpec spec) {
        if (spec.name() == null || spec.name().isBlank()) {
            throw new IllegalStateException("Domain name must not be blank");
        }
        if (spec.weight() <= 0) {
            throw new IllegalStateException("Domain " + spec.name() + " must have a positive weight");
        }
        if (spec.maxPapers() <= 0) {
            throw new IllegalStateException("Domain " + spec.name() + " must have a positive max-papers");
        }
        if (spec.keywords().isEmpty() || spec.keywords().stream().anyMatch(k -> k == null || k.isBlank())) {
            throw new IllegalStateException("Domain " + spec.name() + " needs at least one non-blank keyword");
        }
        if (spec.yearRanges().isEmpty()) {
            throw new IllegalStateException("Domain " + spec.name() + " needs at least one year range");
        }
    }

    public Optional<DomainSpec> find(String name) {
        return Optional.ofNullable(domains.get(name));
    }

    public Collection<DomainSpec> all() {
        return domains.values();
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    /**
     * Cross product domain x keyword x year range, keyed by task id, every task at the
     * start cursor. Pure function of the table.
     */
    public Map<String, CrawlTask> enumerateTasks() {
        Map<String, CrawlTask> tasks = new LinkedHashMap<>();
        for (DomainSpec domain : domains.values()) {
            for (String keyword : domain.keywords()) {
                for (YearRange range : domain.yearRanges()) {
                    CrawlTask task = CrawlTask.builder()
                            .domain(domain.name())
                            .keyword(keyword)
                            .fromYear(range.from())
                            .toYear(range.to())
                            .build();
                    tasks.putIfAbsent(task.getId(), task);
                }
            }
        }
        return tasks;
    }
}
