package com.scholarintel.crawler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholarintel.crawler.config.CrawlerProperties;
import com.scholarintel.crawler.model.PageResult;
import com.scholarintel.crawler.model.WorksPage;
import com.scholarintel.crawler.model.WorksQuery;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.exception.AcquirePermissionCancelledException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bounded client over the OpenAlex /works API.
 *
 * Every attempt runs inside a Resilience4j bulkhead of N concurrent calls, sleeps the
 * fixed rate-limit delay and then goes out with the configured timeouts. Timeouts, I/O
 * errors, 5xx and 429 are retried through Resilience4j with exponential backoff (a
 * Retry-After header overrides the computed wait, up to max-backoff-ms) until
 * max-attempts; after that the page is abandoned. Abandoning never throws and never
 * advances a cursor.
 */
@Service
@Slf4j
public class OpenAlexClient {

    static final int MAX_PER_PAGE = 200;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CrawlerProperties properties;
    private final Retry retry;

    private volatile Bulkhead bulkhead;

    public OpenAlexClient(@Qualifier("openAlexRestTemplate") RestTemplate restTemplate,
                          ObjectMapper objectMapper,
                          CrawlerProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.bulkhead = buildBulkhead(Math.max(1, properties.getFetch().getConcurrency()));
        this.retry = buildRetry(properties.getFetch());
    }

    /**
     * Rebuild the bulkhead for the next run. Must not be called while fetches are in flight.
     */
    public void setConcurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.bulkhead = buildBulkhead(concurrency);
        log.info("Fetch concurrency set to {}", concurrency);
    }

    int maxConcurrentCalls() {
        return bulkhead.getBulkheadConfig().getMaxConcurrentCalls();
    }

    /**
     * Fetch one page of a works listing.
     *
     * @param query  search term and filter
     * @param cursor opaque cursor, "*" for the first page
     * @return OK with items and next cursor, or ABANDONED / MALFORMED with no items
     */
    public PageResult fetchPage(WorksQuery query, String cursor) {
        URI uri = pageUri(query, cursor);
        Optional<String> body = execute(uri);
        if (body.isEmpty()) {
            return PageResult.abandoned(cursor);
        }

        WorksPage page;
        try {
            page = objectMapper.readValue(body.get(), WorksPage.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed page body for {}: {}", uri, e.getOriginalMessage());
            return PageResult.malformed(cursor);
        }
        if (page == null || page.getResults() == null) {
            log.warn("Page for {} has no results array", uri);
            return PageResult.malformed(cursor);
        }

        List<JsonNode> items = page.getResults().stream()
                .filter(Objects::nonNull)
                .toList();
        String nextCursor = page.getMeta() != null ? page.getMeta().getNextCursor() : null;
        log.debug("Fetched {} items for cursor {} (next: {})", items.size(), cursor, nextCursor);
        return PageResult.ok(cursor, items, nextCursor);
    }

    /**
     * Fetch a single work by short id (W123...). Empty when the work does not exist,
     * the request was abandoned or the body is not a JSON object.
     */
    public Optional<JsonNode> fetchWork(String shortId) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getApi().getBaseUrl())
                .pathSegment("works", shortId)
                .queryParamIfPresent("mailto", Optional.ofNullable(blankToNull(properties.getApi().getMailto())))
                .encode()
                .build()
                .toUri();

        return execute(uri).flatMap(body -> {
            try {
                JsonNode node = objectMapper.readTree(body);
                if (node == null || !node.isObject()) {
                    log.warn("Work {} returned a non-object body", shortId);
                    return Optional.empty();
                }
                return Optional.of(node);
            } catch (JsonProcessingException e) {
                log.warn("Malformed body for work {}: {}", shortId, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    URI pageUri(WorksQuery query, String cursor) {
        CrawlerProperties.Api api = properties.getApi();
        int perPage = Math.max(1, Math.min(MAX_PER_PAGE, api.getPerPage()));

        return UriComponentsBuilder.fromHttpUrl(api.getBaseUrl())
                .path("/works")
                .queryParamIfPresent("search", Optional.ofNullable(blankToNull(query.search())))
                .queryParamIfPresent("filter", Optional.ofNullable(blankToNull(query.filter())))
                .queryParam("per_page", perPage)
                .queryParam("cursor", cursor)
                .queryParam("sort", "cited_by_count:desc")
                .queryParamIfPresent("mailto", Optional.ofNullable(blankToNull(api.getMailto())))
                .encode()
                .build()
                .toUri();
    }

    /**
     * Body of a successful response, or empty once the request has been given up on.
     */
    private Optional<String> execute(URI uri) {
        Bulkhead current = bulkhead;
        Supplier<String> attempt = Bulkhead.decorateSupplier(current, () -> callApi(uri));
        try {
            return Optional.ofNullable(retry.executeSupplier(attempt));
        } catch (TransientFetchException | RateLimitedException | BulkheadFullException e) {
            log.warn("Abandoning {} after {} attempts: {}",
                    uri, properties.getFetch().getMaxAttempts(), e.getMessage());
            return Optional.empty();
        } catch (HttpClientErrorException e) {
            log.warn("Request refused with {} for {}", e.getStatusCode(), uri);
            return Optional.empty();
        } catch (InterruptedFetchException | AcquirePermissionCancelledException e) {
            log.info("Fetch interrupted for {}", uri);
            return Optional.empty();
        }
    }

    private String callApi(URI uri) {
        try {
            applyRateLimit();
            log.debug("Calling OpenAlex: {}", uri);
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            // an empty body is reported as malformed, not abandoned
            return response.getBody() != null ? response.getBody() : "";

        } catch (HttpClientErrorException.TooManyRequests e) {
            Duration hint = parseRetryAfter(e.getResponseHeaders() != null
                    ? e.getResponseHeaders().getFirst("Retry-After") : null);
            log.warn("Rate limited (429) by OpenAlex{}",
                    hint != null ? ", server asks to wait " + hint.toSeconds() + "s" : "");
            throw new RateLimitedException("429 from " + uri.getPath(), hint, e);

        } catch (HttpServerErrorException e) {
            throw new TransientFetchException(e.getStatusCode() + " from " + uri.getPath(), e);

        } catch (ResourceAccessException e) {
            // connect/read timeouts and dropped connections
            throw new TransientFetchException("I/O failure: " + e.getMessage(), e);
        }
    }

    /**
     * A waiting call gives up after one full request could have completed; a full
     * bulkhead is retried like any other transient failure.
     */
    private Bulkhead buildBulkhead(int concurrency) {
        CrawlerProperties.Api api = properties.getApi();
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(concurrency)
                .maxWaitDuration(Duration.ofMillis(
                        api.getRateLimitDelayMs() + api.getConnectTimeoutMs() + api.getRequestTimeoutMs()))
                .fairCallHandlingStrategyEnabled(true)
                .build();

        Bulkhead b = Bulkhead.of("openAlex", config);
        b.getEventPublisher().onCallRejected(event -> log.debug("OpenAlex bulkhead full, call rejected"));
        return b;
    }

    private Retry buildRetry(CrawlerProperties.Fetch fetch) {
        IntervalBiFunction<Object> interval = (attempt, either) ->
                retryInterval(fetch, attempt, either.isLeft() ? either.getLeft() : null);

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, fetch.getMaxAttempts()))
                .intervalBiFunction(interval)
                .retryExceptions(TransientFetchException.class, RateLimitedException.class,
                        BulkheadFullException.class)
                .build();

        Retry r = Retry.of("openAlex", config);
        r.getEventPublisher().onRetry(event -> log.warn("Retry {} of {} in {}ms: {}",
                event.getNumberOfRetryAttempts(),
                fetch.getMaxAttempts() - 1,
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return r;
    }

    /**
     * Wait before the next attempt. A server Retry-After hint replaces the computed
     * backoff but never exceeds max-backoff-ms.
     */
    static long retryInterval(CrawlerProperties.Fetch fetch, int attempt, Throwable failure) {
        if (failure instanceof RateLimitedException rl && rl.getRetryAfter().isPresent()) {
            return Math.min(rl.getRetryAfter().get().toMillis(), fetch.getMaxBackoffMs());
        }
        return backoffMillis(fetch, attempt);
    }

    /** initial * multiplier^(attempt-1), capped */
    static long backoffMillis(CrawlerProperties.Fetch fetch, int attempt) {
        double raw = fetch.getInitialBackoffMs() * Math.pow(fetch.getBackoffMultiplier(), Math.max(0, attempt - 1));
        return (long) Math.min(raw, (double) fetch.getMaxBackoffMs());
    }

    /** Retry-After in delta-seconds form; HTTP-date hints fall back to backoff */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) return null;
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After: {}", header);
            return null;
        }
    }

    private void applyRateLimit() {
        sleepMs(properties.getApi().getRateLimitDelayMs());
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedFetchException();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /** Thread was interrupted during the rate-limit delay; never retried */
    private static final class InterruptedFetchException extends RuntimeException {
        InterruptedFetchException() {
            super("interrupted", null, false, false);
        }
    }
}
