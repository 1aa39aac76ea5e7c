package com.scholarintel.crawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "crawler")
@Data
public class CrawlerProperties {

    private Api api = new Api();
    private Fetch fetch = new Fetch();
    private Ingest ingest = new Ingest();
    private Storage storage = new Storage();
    private Checkpoint checkpoint = new Checkpoint();
    private Export export = new Export();
    private Scheduling scheduling = new Scheduling();
    private List<Domain> domains = new ArrayList<>();

    @Data
    public static class Api {
        private String baseUrl = "https://api.openalex.org";
        /** Sent as the mailto parameter so requests land in the OpenAlex polite pool */
        private String mailto;
        private String userAgent = "scholar-intel-crawler/1.0";
        private int perPage = 200;
        private int connectTimeoutMs = 10_000;
        private int requestTimeoutMs = 30_000;
        /** Fixed pause before every page request, taken while holding a bulkhead permit */
        private long rateLimitDelayMs = 1_000;
    }

    @Data
    public static class Fetch {
        private int concurrency = 2;
        private int maxAttempts = 6;
        private long initialBackoffMs = 1_000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 60_000;
    }

    @Data
    public static class Ingest {
        private int batchSize = 50;
        /** Records one scheduling of a task may advance before it yields to the scheduler */
        private int maxRecordsPerSession = 1_000;
        private long progressIntervalMs = 30_000;
        /** Also write "references" relations for every ingested record */
        private boolean recordRelations = false;
    }

    @Data
    public static class Storage {
        private String path = "data/openalex.db";
        private long maxStorageMb = 50_000;
        private long safetyMarginMb = 2_000;
    }

    @Data
    public static class Checkpoint {
        private String path = "data/crawl_progress.json";
    }

    @Data
    public static class Export {
        private String outputDir = "data/export";
        private boolean includeHeader = true;
    }

    @Data
    public static class Scheduling {
        /** "-" disables the cron trigger */
        private String cron = "-";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Domain {
        private String name;
        private double weight = 1.0;
        private long maxPapers = 100_000;
        /** 0 means no per-task cap */
        private long maxRecordsPerTask = 0;
        private List<String> keywords = new ArrayList<>();
        private List<YearRangeSpec> yearRanges = new ArrayList<>();
    }

    @Data
    public static class YearRangeSpec {
        private int from;
        private int to;
    }
}
