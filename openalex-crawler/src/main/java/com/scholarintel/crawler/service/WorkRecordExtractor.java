package com.scholarintel.crawler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholarintel.crawler.model.Author;
import com.scholarintel.crawler.model.Relation;
import com.scholarintel.crawler.model.RelationType;
import com.scholarintel.crawler.model.WorkRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps one raw OpenAlex work to the normalised WorkRecord.
 *
 * Only the id is mandatory. Every other field degrades to null or an empty list when
 * it is missing or has an unexpected type; extraction never throws on payload shape.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WorkRecordExtractor {

    private final Clock clock;

    /**
     * @param raw    one element of a /works results array, or a single /works/{id} body
     * @param domain owning domain label stored with the record
     * @return empty only when the item has no usable id
     */
    public Optional<WorkRecord> extract(JsonNode raw, String domain) {
        String id = text(raw, "id");
        if (id == null || shortId(id) == null) {
            log.warn("Skipping work without id in domain {}", domain);
            return Optional.empty();
        }
        Instant now = clock.instant();

        // ── Authorship ───────────────────────────────────────────────────────
        List<Author> authors = new ArrayList<>();
        List<String> institutions = new ArrayList<>();
        List<String> countries = new ArrayList<>();
        for (JsonNode authorship : elements(field(raw, "authorships"))) {
            JsonNode author = field(authorship, "author");
            if (author != null) {
                authors.add(new Author(
                        shortId(text(author, "id")),
                        text(author, "display_name"),
                        text(author, "orcid")));
            }
            for (JsonNode institution : elements(field(authorship, "institutions"))) {
                addIfPresent(institutions, text(institution, "display_name"));
            }
            for (JsonNode country : elements(field(authorship, "countries"))) {
                // plain country codes, or objects with a display name in older payloads
                addIfPresent(countries, country.isObject() ? text(country, "display_name") : scalarText(country));
            }
        }

        // ── Venue ────────────────────────────────────────────────────────────
        JsonNode primaryLocation = field(raw, "primary_location");
        JsonNode source = field(primaryLocation, "source");
        List<String> issns = new ArrayList<>();
        for (JsonNode issn : elements(field(source, "issn"))) {
            addIfPresent(issns, scalarText(issn));
        }
        String url = firstNonNull(
                text(primaryLocation, "landing_page_url"),
                text(field(raw, "best_oa_location"), "landing_page_url"),
                id);

        // ── Funding ──────────────────────────────────────────────────────────
        List<String> funders = new ArrayList<>();
        for (JsonNode grant : elements(field(raw, "grants"))) {
            JsonNode funder = field(grant, "funder");
            if (funder != null && funder.isObject()) {
                addIfPresent(funders, text(funder, "display_name"));
            } else {
                addIfPresent(funders, firstNonNull(text(grant, "funder_display_name"), scalarText(funder)));
            }
        }

        List<String> references = new ArrayList<>();
        for (JsonNode ref : elements(field(raw, "referenced_works"))) {
            addIfPresent(references, shortId(scalarText(ref)));
        }

        WorkRecord record = WorkRecord.builder()
                .id(id)
                .shortId(shortId(id))
                .title(text(raw, "display_name") != null ? text(raw, "display_name") : text(raw, "title"))
                .doi(text(raw, "doi"))
                .url(url)
                .authors(authors)
                .authorInstitutions(institutions)
                .authorCountries(countries)
                .year(integer(field(raw, "publication_year")))
                .publicationDate(text(raw, "publication_date"))
                .venue(text(source, "display_name"))
                .venueIssns(issns)
                .hostOrganization(text(source, "host_organization_name"))
                .abstractText(flattenAbstract(field(raw, "abstract_inverted_index")))
                .concepts(displayNames(field(raw, "concepts")))
                .topics(displayNames(field(raw, "topics")))
                .primaryTopic(text(field(raw, "primary_topic"), "display_name"))
                .keywords(displayNames(field(raw, "keywords")))
                .funders(funders)
                .citationCount(integer(field(raw, "cited_by_count")))
                .fwci(decimal(field(raw, "fwci")))
                .citationPercentile(decimal(field(field(raw, "citation_normalized_percentile"), "value")))
                .referenceIds(references)
                .domain(domain)
                .crawledAt(now)
                .build();
        return Optional.of(record);
    }

    /**
     * One "references" edge per referenced work, from the record's short id.
     */
    public List<Relation> referenceRelations(WorkRecord record) {
        return record.getReferenceIds().stream()
                .map(ref -> new Relation(record.getShortId(), ref, RelationType.REFERENCES))
                .toList();
    }

    /**
     * Rebuild the abstract from an inverted index {word: [positions]}. Words are joined
     * in position order; gaps are skipped. Any malformed entry yields null.
     */
    static String flattenAbstract(JsonNode invertedIndex) {
        if (invertedIndex == null || !invertedIndex.isObject() || invertedIndex.isEmpty()) {
            return null;
        }
        TreeMap<Integer, String> byPosition = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> words = invertedIndex.fields();
        while (words.hasNext()) {
            Map.Entry<String, JsonNode> entry = words.next();
            JsonNode positions = entry.getValue();
            if (positions == null || !positions.isArray()) {
                return null;
            }
            for (JsonNode position : positions) {
                if (!position.isIntegralNumber() || !position.canConvertToInt() || position.intValue() < 0) {
                    return null;
                }
                byPosition.put(position.intValue(), entry.getKey());
            }
        }
        if (byPosition.isEmpty()) return null;
        return String.join(" ", byPosition.values());
    }

    /** Last path segment of an OpenAlex URL; plain ids pass through */
    static String shortId(String fullId) {
        if (fullId == null) return null;
        String trimmed = fullId.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        String shortId = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        return shortId.isEmpty() ? null : shortId;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private List<String> displayNames(JsonNode list) {
        List<String> names = new ArrayList<>();
        for (JsonNode item : elements(list)) {
            addIfPresent(names, text(item, "display_name"));
        }
        return names;
    }

    private static JsonNode field(JsonNode node, String name) {
        if (node == null || !node.isObject()) return null;
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private static Iterable<JsonNode> elements(JsonNode node) {
        return node != null && node.isArray() ? node : List.<JsonNode>of();
    }

    private static String text(JsonNode node, String name) {
        return scalarText(field(node, name));
    }

    private static String scalarText(JsonNode node) {
        if (node == null || !node.isValueNode() || node.isNull()) return null;
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static Integer integer(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToInt() ? node.intValue() : null;
    }

    private static Double decimal(JsonNode node) {
        return node != null && node.isNumber() ? node.doubleValue() : null;
    }

    private static void addIfPresent(List<String> target, String value) {
        if (value != null) target.add(value);
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) return value;
        }
        return null;
    }
}
