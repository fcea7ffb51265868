/**
 * Open Library search adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Single-result search.json query on "title author"
 * - Cover thumbnail built from cover_i on the covers host
 * - Follow-up ratings.json call on the work key; a failed follow-up keeps the
 *   record with rating 0
 */

package com.williamcallahan.shelf_scan.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.util.IsbnUtils;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Service
public class OpenLibraryProvider extends AbstractHttpBookProvider {

    private final WebClient webClient;
    private final String coversBaseUrl;

    public OpenLibraryProvider(WebClient.Builder webClientBuilder,
                               @Value("${OPENLIBRARY_API_URL:https://openlibrary.org}") String openLibraryApiUrl,
                               @Value("${OPENLIBRARY_COVERS_URL:https://covers.openlibrary.org}") String coversBaseUrl,
                               CircuitBreakerRegistry circuitBreakerRegistry,
                               ResolutionProperties properties,
                               MetricsService metricsService) {
        super("openLibrary", circuitBreakerRegistry, properties.getTimeout().getProvider(), metricsService);
        this.webClient = webClientBuilder.baseUrl(openLibraryApiUrl).build();
        this.coversBaseUrl = coversBaseUrl;
    }

    @Override
    public ProviderSource source() {
        return ProviderSource.BIB_B;
    }

    @Override
    protected Mono<ProviderRecord> doFetch(BookQuery query) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/search.json")
                .queryParam("q", query.searchText())
                .queryParam("limit", 1)
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMap(response -> {
                JsonNode docs = response.path("docs");
                if (!docs.isArray() || docs.isEmpty() || !docs.get(0).isObject()) {
                    return Mono.empty();
                }
                JsonNode doc = docs.get(0);
                ProviderRecord record = parseSearchDoc(doc);
                String workKey = textOrNull(doc, "key");
                return workKey == null ? Mono.just(record) : withRatings(record, workKey);
            });
    }

    ProviderRecord parseSearchDoc(JsonNode doc) {
        Integer publishYear = doc.path("first_publish_year").isInt() ? doc.path("first_publish_year").asInt() : null;
        String thumbnail = doc.path("cover_i").canConvertToLong()
            ? coversBaseUrl + "/b/id/" + doc.path("cover_i").asLong() + "-M.jpg"
            : null;

        return new ProviderRecord(
            ProviderSource.BIB_B,
            textOrNull(doc, "title"),
            firstText(doc.path("author_name")),
            0,
            0,
            firstSentence(doc.path("first_sentence")),
            thumbnail,
            IsbnUtils.sanitize(firstText(doc.path("isbn"))),
            null,
            publishYear
        );
    }

    /**
     * Adds the work's rating summary. Any failure keeps the record as-is.
     */
    private Mono<ProviderRecord> withRatings(ProviderRecord record, String workKey) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder.path(workKey + "/ratings.json").build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(ratings -> {
                JsonNode summary = ratings.path("summary");
                double average = summary.path("average").asDouble(0);
                if (average <= 0) {
                    return record;
                }
                return new ProviderRecord(record.source(), record.title(), record.author(),
                    average, summary.path("count").asInt(0), record.description(), record.thumbnail(),
                    record.isbn(), record.infoLink(), record.publishYear());
            })
            .defaultIfEmpty(record)
            .onErrorResume(e -> {
                logger.debug("Could not fetch Open Library ratings for {}: {}", workKey, e.getMessage());
                return Mono.just(record);
            });
    }

    private static String firstText(JsonNode array) {
        if (!array.isArray() || array.isEmpty()) {
            return null;
        }
        String text = array.get(0).asText(null);
        return text == null || text.isBlank() ? null : text;
    }

    private static String firstSentence(JsonNode node) {
        // Usually an array of strings, occasionally a {"value": ...} object
        if (node.isArray()) {
            return firstText(node);
        }
        if (node.isObject()) {
            return textOrNull(node, "value");
        }
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
