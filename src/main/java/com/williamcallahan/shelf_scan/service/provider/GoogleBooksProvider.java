/**
 * Google Books volume search adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Single-result volume search on "title author"
 * - Optional API key; unauthenticated calls work at a lower quota
 * - Maps the first volume's volumeInfo, preferring ISBN-13 over ISBN-10
 */

package com.williamcallahan.shelf_scan.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.util.IsbnUtils;
import com.williamcallahan.shelf_scan.util.ValidationUtils;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Service
public class GoogleBooksProvider extends AbstractHttpBookProvider {

    private final WebClient webClient;
    private final String apiKey;

    public GoogleBooksProvider(WebClient.Builder webClientBuilder,
                               @Value("${google.books.api.base-url:https://www.googleapis.com/books/v1}") String baseUrl,
                               @Value("${google.books.api.key:#{null}}") String apiKey,
                               CircuitBreakerRegistry circuitBreakerRegistry,
                               ResolutionProperties properties,
                               MetricsService metricsService) {
        super("googleBooks", circuitBreakerRegistry, properties.getTimeout().getProvider(), metricsService);
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
    }

    @Override
    public ProviderSource source() {
        return ProviderSource.BIB_A;
    }

    @Override
    protected Mono<ProviderRecord> doFetch(BookQuery query) {
        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path("/volumes")
                    .queryParam("q", query.searchText())
                    .queryParam("maxResults", 1);
                if (ValidationUtils.hasText(apiKey)) {
                    uriBuilder.queryParam("key", apiKey);
                }
                return uriBuilder.build();
            })
            .retrieve()
            .bodyToMono(JsonNode.class)
            .flatMap(response -> Mono.justOrEmpty(parseFirstVolume(response)));
    }

    ProviderRecord parseFirstVolume(JsonNode response) {
        JsonNode items = response.path("items");
        if (!items.isArray() || items.isEmpty()) {
            return null;
        }
        JsonNode volumeInfo = items.get(0).path("volumeInfo");
        if (volumeInfo.isMissingNode() || !volumeInfo.isObject()) {
            logger.debug("First Google Books item has no volumeInfo");
            return null;
        }

        JsonNode authors = volumeInfo.path("authors");
        String author = authors.isArray() && !authors.isEmpty() ? authors.get(0).asText(null) : null;

        return new ProviderRecord(
            ProviderSource.BIB_A,
            textOrNull(volumeInfo, "title"),
            author,
            volumeInfo.path("averageRating").asDouble(0),
            volumeInfo.path("ratingsCount").asInt(0),
            textOrNull(volumeInfo, "description"),
            textOrNull(volumeInfo.path("imageLinks"), "thumbnail"),
            extractIsbn(volumeInfo.path("industryIdentifiers")),
            textOrNull(volumeInfo, "infoLink"),
            parseYear(textOrNull(volumeInfo, "publishedDate"))
        );
    }

    private static String extractIsbn(JsonNode identifiers) {
        if (!identifiers.isArray()) {
            return null;
        }
        String isbn10 = null;
        for (JsonNode identifier : identifiers) {
            String type = identifier.path("type").asText("");
            String value = IsbnUtils.sanitize(identifier.path("identifier").asText(null));
            if ("ISBN_13".equals(type) && value != null) {
                return value;
            }
            if ("ISBN_10".equals(type) && isbn10 == null) {
                isbn10 = value;
            }
        }
        return isbn10;
    }

    private static Integer parseYear(String publishedDate) {
        if (publishedDate == null || publishedDate.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(publishedDate.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
