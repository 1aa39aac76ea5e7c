package com.scholarintel.crawler.output;

import com.opencsv.CSVWriter;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.WorkRecord;
import com.scholarintel.crawler.store.WorkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Exports the works of one domain to CSV, most cited first.
 *
 * Output path pattern: {outputDir}/works_{domain}.csv, e.g. data/export/works_Mathematics.csv.
 * List columns are joined with "; ".
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvExporter {

    private final WorkStore store;
    private final CrawlerProperties properties;

    private static final String[] HEADERS = {
            "id", "short_id", "title", "doi", "url",
            "author_names", "author_institutions", "author_countries",
            "year", "publication_date", "journal", "journal_issn", "host_organization_name",
            "abstract", "concepts", "topics", "primary_topic", "keywords", "funders",
            "citation_count", "fwci", "citation_percentile", "reference_count",
            "domain", "crawl_timestamp"
    };

    /**
     * @return the written file and its row count
     */
    public Export export(String domain) {
        Path outputDir = Paths.get(properties.getExport().getOutputDir());
        ensureDirectory(outputDir);

        Path outputPath = outputDir.resolve("works_" + safeFileName(domain) + ".csv");
        AtomicLong rows = new AtomicLong();

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(
                     out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getExport().isIncludeHeader()) {
                writer.writeNext(HEADERS);
            }

            store.forEachInDomain(domain, r -> {
                writer.writeNext(toRow(r));
                rows.incrementAndGet();
            });

            log.info("Exported {} works of {} to CSV: {}", rows.get(), domain, outputPath);

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV export failed for " + domain, e);
        }
        return new Export(outputPath, rows.get());
    }

    private String[] toRow(WorkRecord r) {
        return new String[]{
                str(r.getId()),
                str(r.getShortId()),
                str(r.getTitle()),
                str(r.getDoi()),
                str(r.getUrl()),
                join(r.authorNames()),
                join(r.getAuthorInstitutions()),
                join(r.getAuthorCountries()),
                str(r.getYear()),
                str(r.getPublicationDate()),
                str(r.getVenue()),
                join(r.getVenueIssns()),
                str(r.getHostOrganization()),
                str(r.getAbstractText()),
                join(r.getConcepts()),
                join(r.getTopics()),
                str(r.getPrimaryTopic()),
                join(r.getKeywords()),
                join(r.getFunders()),
                str(r.getCitationCount()),
                str(r.getFwci()),
                str(r.getCitationPercentile()),
                String.valueOf(r.getReferenceIds().size()),
                str(r.getDomain()),
                str(r.getCrawledAt())
        };
    }

    private String join(List<String> values) {
        return values == null ? "" : String.join("; ", values.stream().map(this::str).toList());
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    /** Domains like "Artificial Intelligence" become Artificial_Intelligence */
    static String safeFileName(String domain) {
        return domain.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }

    public record Export(Path path, long rows) {
    }
}
