package com.williamcallahan.shelf_scan.service.rating;

import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import com.williamcallahan.shelf_scan.model.RatingSnapshot;
import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CommunityRatingProviderTest {

    @Mock
    private ResolutionCacheService cacheService;

    @Mock
    private RatingStoreConnector connector;

    @InjectMocks
    private CommunityRatingProvider ratingProvider;

    @Test
    void cachedRating_skipsStore() {
        when(cacheService.getRating("9780306406157")).thenReturn(Mono.just(new RatingSnapshot(4.5, 900)));
        when(connector.lookup(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(ratingProvider.fetch("978-0306406157"))
            .expectNext(ProviderRecord.ratingOnly(ProviderSource.RATINGS, 4.5, 900))
            .verifyComplete();
        verify(connector, never()).lookup(anyString());
    }

    @Test
    void cacheMiss_fallsBackToStore() {
        when(cacheService.getRating("0306406152")).thenReturn(Mono.empty());
        when(connector.lookup("0306406152")).thenReturn(Mono.just(new RatingSnapshot(3.7, 12)));

        StepVerifier.create(ratingProvider.fetch("0306406152"))
            .expectNext(ProviderRecord.ratingOnly(ProviderSource.RATINGS, 3.7, 12))
            .verifyComplete();
    }

    @Test
    void zeroRating_isNoData() {
        when(cacheService.getRating("0306406152")).thenReturn(Mono.empty());
        when(connector.lookup("0306406152")).thenReturn(Mono.just(new RatingSnapshot(0, 0)));

        StepVerifier.create(ratingProvider.fetch("0306406152")).verifyComplete();
    }

    @Test
    void missingIdentifier_makesNoLookup() {
        StepVerifier.create(ratingProvider.fetch(null)).verifyComplete();
        StepVerifier.create(ratingProvider.fetch("  ")).verifyComplete();
        verifyNoInteractions(cacheService, connector);
    }

    @Test
    void storeError_completesEmpty() {
        when(cacheService.getRating("0306406152")).thenReturn(Mono.empty());
        when(connector.lookup("0306406152")).thenReturn(Mono.error(new IllegalStateException("boom")));

        StepVerifier.create(ratingProvider.fetch("0306406152")).verifyComplete();
    }
}
