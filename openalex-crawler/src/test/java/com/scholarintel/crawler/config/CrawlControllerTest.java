package com.scholarintel.crawler.config;

import com.scholarintel.crawler.model.CrawlStatus;
import com.scholarintel.crawler.model.RunStats;
import com.scholarintel.crawler.output.CsvExporter;
import com.scholarintel.crawler.service.CrawlOperationsService;
import com.scholarintel.crawler.service.FilteredCrawlOptions;
import com.scholarintel.crawler.service.GraphCrawlOptions;
import com.scholarintel.crawler.service.RunOptions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CrawlController.class)
@Import(CrawlerProperties.class)
@ActiveProfiles("test")
class CrawlControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CrawlOperationsService operations;

    @Test
    void startAcceptsRunWithOverrides() throws Exception {
        mockMvc.perform(post("/crawl/start").param("concurrency", "3").param("maxStorageMb", "20000"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.concurrency").value("3"))
                .andExpect(jsonPath("$.maxStorageMb").value("20000"));

        verify(operations).startIngestion(new RunOptions(3, 20_000L));
    }

    @Test
    void startWhileRunningConflicts() throws Exception {
        doThrow(new IllegalStateException("A ingestion run is already active"))
                .when(operations).startIngestion(any());

        mockMvc.perform(post("/crawl/start"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("A ingestion run is already active"));
    }

    @Test
    void invalidConcurrencyIsBadRequest() throws Exception {
        mockMvc.perform(post("/crawl/start").param("concurrency", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/crawl/start").param("concurrency", "many"))
                .andExpect(status().isBadRequest());

        verify(operations, never()).startIngestion(any());
    }

    @Test
    void graphCrawlPassesBounds() throws Exception {
        mockMvc.perform(post("/crawl/graph")
                        .param("seed", "W2741809807")
                        .param("depth", "2")
                        .param("maxNodes", "500")
                        .param("timeLimitSeconds", "300"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.seed").value("W2741809807"));

        verify(operations).startGraphCrawl(new GraphCrawlOptions("W2741809807", 2, 500, Duration.ofSeconds(300)));
    }

    @Test
    void authorCrawlAcceptsFullOpenAlexId() throws Exception {
        mockMvc.perform(post("/crawl/author")
                        .param("id", "https://openalex.org/A5023888391")
                        .param("maxWorks", "500"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run").value("author:A5023888391"));

        verify(operations).startFilteredCrawl(FilteredCrawlOptions.byAuthor("A5023888391", 500, null));
    }

    @Test
    void yearCrawlPassesWindow() throws Exception {
        mockMvc.perform(post("/crawl/years").param("from", "2019").param("to", "2020"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.run").value("years:2019-2020"));

        verify(operations).startFilteredCrawl(FilteredCrawlOptions.publishedIn(2019, 2020, 1000, null));
    }

    @Test
    void invertedYearWindowIsBadRequest() throws Exception {
        mockMvc.perform(post("/crawl/years").param("from", "2021").param("to", "2019"))
                .andExpect(status().isBadRequest());

        verify(operations, never()).startFilteredCrawl(any());
    }

    @Test
    void stopReportsIdleWhenNothingRuns() throws Exception {
        when(operations.requestStop()).thenReturn(false);

        mockMvc.perform(post("/crawl/stop"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("idle"));
    }

    @Test
    void statusIsServedAsJson() throws Exception {
        when(operations.status()).thenReturn(new CrawlStatus(
                true, "ingestion", "FETCHING", null, null, 120, 4096, 1_000_000,
                RunStats.builder().totalRecords(120).build(),
                List.of(new CrawlStatus.DomainProgress("X", 120, 200, 60.0, 0, 1)),
                List.of(new CrawlStatus.TaskProgress("X|k|2020-2024", "c4", 120, false))));

        mockMvc.perform(get("/crawl/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.state").value("FETCHING"))
                .andExpect(jsonPath("$.domains[0].percent").value(60.0))
                .andExpect(jsonPath("$.tasks[0].cursor").value("c4"));
    }

    @Test
    void exportOfUnknownDomainIsBadRequest() throws Exception {
        when(operations.export("Astrology")).thenThrow(new IllegalArgumentException("Unknown domain: Astrology"));

        mockMvc.perform(post("/crawl/export/Astrology"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void exportReportsFileAndRows() throws Exception {
        when(operations.export("X")).thenReturn(new CsvExporter.Export(Path.of("data/export/works_X.csv"), 7));

        mockMvc.perform(post("/crawl/export/X"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows").value(7));
    }

    @Test
    void resetWhileRunningConflicts() throws Exception {
        doThrow(new IllegalStateException("Cannot reset")).when(operations).reset();

        mockMvc.perform(post("/crawl/reset"))
                .andExpect(status().isConflict());
    }
}
