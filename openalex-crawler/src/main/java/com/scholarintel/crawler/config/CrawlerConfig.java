package com.scholarintel.crawler.config;

import com.scholarintel.crawler.model.DomainSpec;
import com.scholarintel.crawler.model.DomainTable;
import com.scholarintel.crawler.model.YearRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
@Slf4j
public class CrawlerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Immutable domain table built from crawler.domains. Invalid rows fail startup.
     */
    @Bean
    public DomainTable domainTable(CrawlerProperties properties) {
        List<DomainSpec> specs = properties.getDomains().stream()
                .map(CrawlerConfig::toSpec)
                .toList();
        DomainTable table = DomainTable.of(specs);
        log.info("Loaded {} crawl domains", specs.size());
        return table;
    }

    static DomainSpec toSpec(CrawlerProperties.Domain domain) {
        List<YearRange> ranges;
        try {
            ranges = domain.getYearRanges().stream()
                    .map(r -> new YearRange(r.getFrom(), r.getTo()))
                    .toList();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Domain " + domain.getName() + ": " + e.getMessage(), e);
        }
        return new DomainSpec(
                domain.getName(),
                domain.getWeight(),
                domain.getMaxPapers(),
                domain.getMaxRecordsPerTask(),
                domain.getKeywords(),
                ranges);
    }

    /**
     * Every request carries the connect and read bounds; a read timeout surfaces as an
     * I/O failure and goes through the same retry path as a dropped connection.
     */
    @Bean
    public RestTemplate openAlexRestTemplate(RestTemplateBuilder builder, CrawlerProperties properties) {
        CrawlerProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(Duration.ofMillis(api.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(api.getRequestTimeoutMs()))
                .defaultHeader(HttpHeaders.USER_AGENT, api.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }
}
