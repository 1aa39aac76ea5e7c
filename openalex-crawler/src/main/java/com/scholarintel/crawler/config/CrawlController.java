package com.scholarintel.crawler.config;

import com.scholarintel.crawler.model.CrawlStatus;
import com.scholarintel.crawler.output.CsvExporter;
import com.scholarintel.crawler.service.CrawlOperationsService;
import com.scholarintel.crawler.service.FilteredCrawlOptions;
import com.scholarintel.crawler.service.GraphCrawlOptions;
import com.scholarintel.crawler.service.RunOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CrawlController {

    private final CrawlOperationsService operations;
    private final CrawlerProperties properties;

    // ── Run controls ──────────────────────────────────────────────────────────

    /**
     * Start an ingestion run.
     *
     * POST /crawl/start?concurrency=3&maxStorageMb=20000
     */
    @PostMapping("/crawl/start")
    public ResponseEntity<Map<String, String>> start(
            @RequestParam(required = false) Integer concurrency,
            @RequestParam(required = false) Long maxStorageMb) {
        RunOptions options = new RunOptions(
                concurrency != null ? concurrency : properties.getFetch().getConcurrency(),
                maxStorageMb);
        operations.startIngestion(options);

        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "accepted");
        body.put("run", "ingestion");
        body.put("concurrency", String.valueOf(options.concurrency()));
        body.put("maxStorageMb", maxStorageMb != null
                ? String.valueOf(maxStorageMb)
                : String.valueOf(properties.getStorage().getMaxStorageMb()));
        return ResponseEntity.accepted().body(body);
    }

    /**
     * Crawl the citation graph around one work.
     *
     * POST /crawl/graph?seed=W2755950973&depth=2&maxNodes=500&timeLimitSeconds=300
     */
    @PostMapping("/crawl/graph")
    public ResponseEntity<Map<String, String>> graph(
            @RequestParam String seed,
            @RequestParam(defaultValue = "1") int depth,
            @RequestParam(defaultValue = "1000") int maxNodes,
            @RequestParam(required = false) Long timeLimitSeconds) {
        GraphCrawlOptions options = new GraphCrawlOptions(seed, depth, maxNodes, seconds(timeLimitSeconds));
        operations.startGraphCrawl(options);
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "run", "graph", "seed", seed));
    }

    /**
     * Store every work of one author.
     *
     * POST /crawl/author?id=A5023888391&maxWorks=500
     */
    @PostMapping("/crawl/author")
    public ResponseEntity<Map<String, String>> author(
            @RequestParam String id,
            @RequestParam(defaultValue = "1000") int maxWorks,
            @RequestParam(required = false) Long timeLimitSeconds) {
        FilteredCrawlOptions options = FilteredCrawlOptions.byAuthor(id, maxWorks, seconds(timeLimitSeconds));
        operations.startFilteredCrawl(options);
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "run", options.label()));
    }

    /**
     * Store the most cited works published in a year window, with no search term.
     *
     * POST /crawl/years?from=2019&to=2020&maxWorks=5000
     */
    @PostMapping("/crawl/years")
    public ResponseEntity<Map<String, String>> years(
            @RequestParam int from,
            @RequestParam int to,
            @RequestParam(defaultValue = "1000") int maxWorks,
            @RequestParam(required = false) Long timeLimitSeconds) {
        FilteredCrawlOptions options = FilteredCrawlOptions.publishedIn(from, to, maxWorks, seconds(timeLimitSeconds));
        operations.startFilteredCrawl(options);
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "run", options.label()));
    }

    @PostMapping("/crawl/stop")
    public ResponseEntity<Map<String, String>> stop() {
        boolean stopping = operations.requestStop();
        return ResponseEntity.accepted().body(Map.of("status", stopping ? "stopping" : "idle"));
    }

    @GetMapping("/crawl/status")
    public ResponseEntity<CrawlStatus> status() {
        return ResponseEntity.ok(operations.status());
    }

    // ── Maintenance ───────────────────────────────────────────────────────────

    @PostMapping("/crawl/export/{domain}")
    public ResponseEntity<Map<String, Object>> export(@PathVariable String domain) {
        CsvExporter.Export export = operations.export(domain);
        return ResponseEntity.ok(Map.of(
                "domain", domain,
                "file", export.path().toString(),
                "rows", export.rows()));
    }

    @PostMapping("/crawl/reset")
    public ResponseEntity<Map<String, String>> reset() {
        operations.reset();
        return ResponseEntity.ok(Map.of("status", "reset"));
    }

    private static Duration seconds(Long value) {
        return value != null ? Duration.ofSeconds(value) : null;
    }

    // ── Errors ────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.debug("Rejected crawl request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
