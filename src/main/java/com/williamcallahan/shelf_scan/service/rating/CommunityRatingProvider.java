package com.williamcallahan.shelf_scan.service.rating;

import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.model.RatingSnapshot;
import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import com.williamcallahan.shelf_scan.util.ExternalApiLogger;
import com.williamcallahan.shelf_scan.util.IsbnUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Identifier-keyed community rating adapter: rating cache first, then the rating store.
 *
 * <p>Free-text queries are never sent here. Without an identifier there is no lookup at all.
 * Rows without a rating are treated as no data.</p>
 */
@Slf4j
@Service
public class CommunityRatingProvider {

    private final ResolutionCacheService cacheService;
    private final RatingStoreConnector connector;

    public CommunityRatingProvider(ResolutionCacheService cacheService, RatingStoreConnector connector) {
        this.cacheService = cacheService;
        this.connector = connector;
    }

    public ProviderSource source() {
        return ProviderSource.RATINGS;
    }

    public Mono<ProviderRecord> fetch(String identifier) {
        String cleaned = IsbnUtils.sanitize(identifier);
        if (cleaned == null) {
            return Mono.empty();
        }
        String apiName = source().getDisplayName();
        return cacheService.getRating(cleaned)
            .switchIfEmpty(Mono.defer(() -> {
                ExternalApiLogger.logApiCallAttempt(log, apiName, "rating-store", cleaned);
                return connector.lookup(cleaned)
                    .doOnNext(snapshot -> ExternalApiLogger.logApiCallSuccess(log, apiName, "rating-store", cleaned, 1));
            }))
            .map(RatingSnapshot::toProviderRecord)
            .filter(ProviderRecord::hasRating)
            .onErrorResume(e -> {
                ExternalApiLogger.logApiCallFailure(log, apiName, "rating", cleaned, e.getMessage());
                return Mono.empty();
            });
    }
}
