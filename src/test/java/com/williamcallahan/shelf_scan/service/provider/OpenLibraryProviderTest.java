package com.williamcallahan.shelf_scan.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.testutil.WebClientStubs;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OpenLibraryProviderTest {

    private static final BookQuery HOBBIT = new BookQuery("The Hobbit", "J.R.R. Tolkien");

    private static final String SEARCH_JSON = """
        {
          "numFound": 1,
          "docs": [{
            "key": "/works/OL27482W",
            "title": "The Hobbit",
            "author_name": ["J.R.R. Tolkien"],
            "first_publish_year": 1937,
            "cover_i": 14627509,
            "isbn": ["9780261102217", "0261102214"],
            "first_sentence": ["In a hole in the ground there lived a hobbit."]
          }]
        }
        """;

    private final List<ClientRequest> seen = new CopyOnWriteArrayList<>();

    private OpenLibraryProvider provider(Function<ClientRequest, Mono<ClientResponse>> handler) {
        return new OpenLibraryProvider(WebClientStubs.builder(seen, handler), "http://openlibrary.test",
            "http://covers.test", CircuitBreakerRegistry.ofDefaults(), new ResolutionProperties(),
            new MetricsService(new SimpleMeterRegistry()));
    }

    private static Mono<ClientResponse> route(ClientRequest request, String ratingsBody) {
        if (request.url().getPath().endsWith("/ratings.json")) {
            return ratingsBody == null
                ? WebClientStubs.json(HttpStatus.SERVICE_UNAVAILABLE, "{}")
                : WebClientStubs.json(ratingsBody);
        }
        return WebClientStubs.json(SEARCH_JSON);
    }

    @Test
    void fetch_mapsDocAndWorkRatings() {
        OpenLibraryProvider provider = provider(request ->
            route(request, "{\"summary\": {\"average\": 4.27, \"count\": 512}}"));

        StepVerifier.create(provider.fetch(HOBBIT))
            .assertNext(record -> {
                assertEquals(ProviderSource.BIB_B, record.source());
                assertEquals("The Hobbit", record.title());
                assertEquals("J.R.R. Tolkien", record.author());
                assertEquals(4.27, record.rating());
                assertEquals(512, record.ratingsCount());
                assertEquals("In a hole in the ground there lived a hobbit.", record.description());
                assertEquals("http://covers.test/b/id/14627509-M.jpg", record.thumbnail());
                assertEquals("9780261102217", record.isbn());
                assertEquals(1937, record.publishYear());
                assertThat(record.infoLink()).isNull();
            })
            .verifyComplete();

        assertEquals(2, seen.size());
        assertThat(seen.get(0).url().toString()).startsWith("http://openlibrary.test/search.json?q=The");
        assertThat(seen.get(0).url().getQuery()).contains("limit=1");
        assertEquals("/works/OL27482W/ratings.json", seen.get(1).url().getPath());
    }

    @Test
    void fetch_ratingsFailureKeepsRecordUnrated() {
        OpenLibraryProvider provider = provider(request -> route(request, null));

        StepVerifier.create(provider.fetch(HOBBIT))
            .assertNext(record -> {
                assertEquals("The Hobbit", record.title());
                assertEquals(0, record.rating());
                assertEquals(0, record.ratingsCount());
            })
            .verifyComplete();
    }

    @Test
    void fetch_emptyRatingSummaryKeepsRecordUnrated() {
        OpenLibraryProvider provider = provider(request -> route(request, "{\"summary\": {}}"));

        StepVerifier.create(provider.fetch(HOBBIT))
            .assertNext(record -> assertEquals(0, record.rating()))
            .verifyComplete();
    }

    @Test
    void fetch_noDocsIsEmpty() {
        OpenLibraryProvider provider = provider(request -> WebClientStubs.json("{\"numFound\": 0, \"docs\": []}"));

        StepVerifier.create(provider.fetch(HOBBIT)).verifyComplete();
        assertEquals(1, seen.size());
    }

    @Test
    void fetch_searchFailureIsEmpty() {
        OpenLibraryProvider provider = provider(request -> WebClientStubs.json(HttpStatus.BAD_GATEWAY, "oops"));

        StepVerifier.create(provider.fetch(HOBBIT)).verifyComplete();
    }

    @Test
    void parseSearchDoc_handlesSparseDocs() throws Exception {
        OpenLibraryProvider provider = provider(request -> Mono.empty());
        ProviderRecord record = provider.parseSearchDoc(new ObjectMapper().readTree(
            "{\"title\": \"Beowulf\", \"first_sentence\": {\"type\": \"/type/text\", \"value\": \"Lo!\"}}"));

        assertEquals("Beowulf", record.title());
        assertEquals("Lo!", record.description());
        assertThat(record.author()).isNull();
        assertThat(record.thumbnail()).isNull();
        assertThat(record.isbn()).isNull();
        assertThat(record.publishYear()).isNull();
    }
}
