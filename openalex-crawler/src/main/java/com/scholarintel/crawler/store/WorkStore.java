package com.scholarintel.crawler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.Author;
import com.scholarintel.crawler.model.Relation;
import com.scholarintel.crawler.model.RelationType;
import com.scholarintel.crawler.model.WorkRecord;
import com.scholarintel.crawler.service.StorageWriteException;
import com.scholarintel.crawler.service.StoreCorruptedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Relational store for normalised works and their citation relations.
 *
 * Every batch is one transaction: a single multi-row upsert into works plus the
 * relations of that batch. Either all of it commits or none of it does.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WorkStore {

    private static final String[] COLUMNS = {
            "id", "short_id", "title", "doi", "url",
            "authors", "author_names", "author_orcids", "author_institutions", "author_countries",
            "year", "publication_date", "journal", "journal_issn", "host_organization_name",
            "abstract", "keywords", "topics", "primary_topic", "keywords_display", "funding",
            "citation_count", "fwci", "citation_percentile", "reference_ids",
            "domain", "crawl_timestamp"
    };

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Author>> AUTHOR_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;

    public void ensureSchema() {
        log.info("Ensuring SQLite schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS works
            (
                id                      TEXT PRIMARY KEY,
                short_id                TEXT NOT NULL UNIQUE,
                title                   TEXT,
                doi                     TEXT,
                url                     TEXT,
                authors                 TEXT,
                author_names            TEXT,
                author_orcids           TEXT,
                author_institutions     TEXT,
                author_countries        TEXT,
                year                    INTEGER,
                publication_date        TEXT,
                journal                 TEXT,
                journal_issn            TEXT,
                host_organization_name  TEXT,
                abstract                TEXT,
                keywords                TEXT,
                topics                  TEXT,
                primary_topic           TEXT,
                keywords_display        TEXT,
                funding                 TEXT,
                citation_count          INTEGER,
                fwci                    REAL,
                citation_percentile     REAL,
                reference_ids           TEXT,
                domain                  TEXT,
                crawl_timestamp         TEXT
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_works_domain ON works(domain)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_works_year ON works(year)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_works_citation_count ON works(citation_count)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS relations
            (
                from_short_id   TEXT NOT NULL,
                to_short_id     TEXT NOT NULL,
                relation_type   TEXT NOT NULL CHECK (relation_type IN ('references', 'cited_by')),
                PRIMARY KEY (from_short_id, to_short_id, relation_type)
            )
        """);

        log.info("SQLite schema ready.");
    }

    // ── Writes ────────────────────────────────────────────────────────────────

    public void upsertBatch(List<WorkRecord> records) {
        upsertBatch(records, List.of());
    }

    /**
     * Insert or fully replace every record by id, and insert the relations if absent,
     * in one transaction. Last write wins; columns are never merged.
     *
     * @throws StorageWriteException  the batch was rolled back
     * @throws StoreCorruptedException the database file is damaged
     */
    public void upsertBatch(List<WorkRecord> records, List<Relation> relations) {
        write(records, relations, false);
    }

    /**
     * Same as {@link #upsertBatch(List, List)} for works found outside a domain task:
     * a row that already has a domain label keeps it.
     */
    public void upsertUnlabelled(List<WorkRecord> records, List<Relation> relations) {
        write(records, relations, true);
    }

    public void upsertRelations(List<Relation> relations) {
        upsertBatch(List.of(), relations);
    }

    private void write(List<WorkRecord> records, List<Relation> relations, boolean keepDomain) {
        if (records.isEmpty() && relations.isEmpty()) return;

        List<Object> args = new ArrayList<>(records.size() * COLUMNS.length);
        records.forEach(r -> args.addAll(toRow(r)));

        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!records.isEmpty()) {
                    jdbcTemplate.update(upsertSql(records.size(), keepDomain), args.toArray());
                }
                insertRelations(relations);
            });
            log.debug("Committed batch of {} works and {} relations", records.size(), relations.size());
        } catch (DataAccessException e) {
            throw translate("Batch of " + records.size() + " works rolled back", e);
        }
    }

    /**
     * Empty both tables and give the space back to the file system.
     */
    public void truncate() {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                jdbcTemplate.update("DELETE FROM works");
                jdbcTemplate.update("DELETE FROM relations");
            });
            jdbcTemplate.execute("VACUUM");
        } catch (DataAccessException e) {
            throw translate("Could not clear store", e);
        }
    }

    private void insertRelations(List<Relation> relations) {
        if (relations.isEmpty()) return;
        jdbcTemplate.batchUpdate(
                "INSERT OR IGNORE INTO relations (from_short_id, to_short_id, relation_type) VALUES (?, ?, ?)",
                relations.stream()
                        .map(rel -> new Object[]{rel.fromId(), rel.toId(), rel.type().column()})
                        .toList());
    }

    /**
     * One INSERT ... VALUES statement with a placeholder row per record.
     */
    private String upsertSql(int rows, boolean keepDomain) {
        String placeholders = "(" + String.join(",", Collections.nCopies(COLUMNS.length, "?")) + ")";
        String updates = List.of(COLUMNS).subList(1, COLUMNS.length).stream()
                .map(c -> keepDomain && c.equals("domain")
                        ? "domain=COALESCE(excluded.domain, works.domain)"
                        : c + "=excluded." + c)
                .collect(Collectors.joining(", "));

        return "INSERT INTO works (" + String.join(", ", COLUMNS) + ") VALUES "
                + String.join(",", Collections.nCopies(rows, placeholders))
                + " ON CONFLICT(id) DO UPDATE SET " + updates;
    }

    private List<Object> toRow(WorkRecord r) {
        List<Object> row = new ArrayList<>(COLUMNS.length);
        row.add(r.getId());
        row.add(r.getShortId());
        row.add(r.getTitle());
        row.add(r.getDoi());
        row.add(r.getUrl());
        row.add(json(r.getAuthors()));
        row.add(r.getAuthors().isEmpty() ? null : r.authorNames().stream()
                .filter(n -> n != null && !n.isBlank())
                .collect(Collectors.joining("; ")));
        row.add(json(r.getAuthors().stream().map(Author::orcid).filter(o -> o != null).toList()));
        row.add(json(r.getAuthorInstitutions()));
        row.add(json(r.getAuthorCountries()));
        row.add(r.getYear());
        row.add(r.getPublicationDate());
        row.add(r.getVenue());
        row.add(json(r.getVenueIssns()));
        row.add(r.getHostOrganization());
        row.add(r.getAbstractText());
        row.add(json(r.getConcepts()));
        row.add(json(r.getTopics()));
        row.add(r.getPrimaryTopic());
        row.add(json(r.getKeywords()));
        row.add(json(r.getFunders()));
        row.add(r.getCitationCount());
        row.add(r.getFwci());
        row.add(r.getCitationPercentile());
        row.add(json(r.getReferenceIds()));
        row.add(r.getDomain());
        row.add(r.getCrawledAt() != null ? r.getCrawledAt().toString() : null);
        return row;
    }

    /** Empty lists are stored as NULL */
    private String json(List<?> values) {
        if (values == null || values.isEmpty()) return null;
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise column value", e);
        }
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    public long recordCount() {
        return count("SELECT COUNT(*) FROM works");
    }

    public long recordCount(String domain) {
        return count("SELECT COUNT(*) FROM works WHERE domain = ?", domain);
    }

    public long relationCount() {
        return count("SELECT COUNT(*) FROM relations");
    }

    public Optional<WorkRecord> findById(String id) {
        try {
            List<WorkRecord> rows = jdbcTemplate.query(
                    "SELECT * FROM works WHERE id = ?", workRowMapper(), id);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw translate("Lookup of " + id + " failed", e);
        }
    }

    public List<Relation> relationsFrom(String shortId) {
        try {
            return jdbcTemplate.query(
                    "SELECT from_short_id, to_short_id, relation_type FROM relations WHERE from_short_id = ? "
                            + "ORDER BY relation_type, to_short_id",
                    (rs, rowNum) -> new Relation(
                            rs.getString("from_short_id"),
                            rs.getString("to_short_id"),
                            RelationType.fromColumn(rs.getString("relation_type"))),
                    shortId);
        } catch (DataAccessException e) {
            throw translate("Relation lookup for " + shortId + " failed", e);
        }
    }

    /**
     * Stream every work of a domain, ordered by citation count, without loading them all.
     */
    public void forEachInDomain(String domain, Consumer<WorkRecord> consumer) {
        RowMapper<WorkRecord> mapper = workRowMapper();
        try {
            jdbcTemplate.query(
                    "SELECT * FROM works WHERE domain = ? ORDER BY citation_count DESC, id",
                    rs -> {
                        consumer.accept(mapper.mapRow(rs, rs.getRow()));
                    },
                    domain);
        } catch (DataAccessException e) {
            throw translate("Reading domain " + domain + " failed", e);
        }
    }

    /**
     * On-disk size of the database including its write-ahead log.
     */
    public long footprintBytes() {
        Path db = Paths.get(properties.getStorage().getPath()).toAbsolutePath();
        return sizeOf(db) + sizeOf(Paths.get(db + "-wal"));
    }

    private long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            log.warn("Could not stat {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    private long count(String sql, Object... args) {
        try {
            Long count = jdbcTemplate.queryForObject(sql, Long.class, args);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw translate("Count query failed", e);
        }
    }

    private RowMapper<WorkRecord> workRowMapper() {
        return (rs, rowNum) -> WorkRecord.builder()
                .id(rs.getString("id"))
                .shortId(rs.getString("short_id"))
                .title(rs.getString("title"))
                .doi(rs.getString("doi"))
                .url(rs.getString("url"))
                .authors(readList(rs, "authors", AUTHOR_LIST))
                .authorInstitutions(readList(rs, "author_institutions", STRING_LIST))
                .authorCountries(readList(rs, "author_countries", STRING_LIST))
                .year(getInteger(rs, "year"))
                .publicationDate(rs.getString("publication_date"))
                .venue(rs.getString("journal"))
                .venueIssns(readList(rs, "journal_issn", STRING_LIST))
                .hostOrganization(rs.getString("host_organization_name"))
                .abstractText(rs.getString("abstract"))
                .concepts(readList(rs, "keywords", STRING_LIST))
                .topics(readList(rs, "topics", STRING_LIST))
                .primaryTopic(rs.getString("primary_topic"))
                .keywords(readList(rs, "keywords_display", STRING_LIST))
                .funders(readList(rs, "funding", STRING_LIST))
                .citationCount(getInteger(rs, "citation_count"))
                .fwci(getDouble(rs, "fwci"))
                .citationPercentile(getDouble(rs, "citation_percentile"))
                .referenceIds(readList(rs, "reference_ids", STRING_LIST))
                .domain(rs.getString("domain"))
                .crawledAt(parseInstant(rs.getString("crawl_timestamp")))
                .build();
    }

    private <T> List<T> readList(ResultSet rs, String column, TypeReference<List<T>> type) throws SQLException {
        String raw = rs.getString(column);
        if (raw == null || raw.isBlank()) return List.of();
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON in column {}: {}", column, e.getOriginalMessage());
            return List.of();
        }
    }

    private Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Instant parseInstant(String value) {
        return value == null ? null : Instant.parse(value);
    }

    // ── Error translation ─────────────────────────────────────────────────────

    private RuntimeException translate(String message, DataAccessException e) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(e);
        if (root instanceof SQLiteException sqlite && isCorruption(sqlite.getResultCode())) {
            log.error("{}: store is corrupted ({})", message, sqlite.getResultCode());
            return new StoreCorruptedException(message + ": database file is corrupted", e);
        }
        log.warn("{}: {}", message, root.getMessage());
        return new StorageWriteException(message + ": " + root.getMessage(), e);
    }

    private boolean isCorruption(SQLiteErrorCode code) {
        return code == SQLiteErrorCode.SQLITE_CORRUPT || code == SQLiteErrorCode.SQLITE_NOTADB;
    }
}
