/**
 * Resolves book candidates into merged, cached, reading-list-aware books
 *
 * @author William Callahan
 *
 * Features:
 * - Merged-book cache first; a hit skips every provider
 * - Google Books and Open Library queried concurrently, each with its own timeout
 * - Community rating looked up by the first ISBN found (Google Books before Open Library)
 * - Explicit not-found outcome when no provider has data; nothing is cached then
 * - Batch resolution with bounded concurrency, an overall deadline and rating ranking
 */

package com.williamcallahan.shelf_scan.service;

import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import com.williamcallahan.shelf_scan.model.BatchResolution;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.MergedBook;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ReadingListEntry;
import com.williamcallahan.shelf_scan.model.ResolutionOutcome;
import com.williamcallahan.shelf_scan.monitoring.MetricsService;
import com.williamcallahan.shelf_scan.repository.ReadingListStore;
import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import com.williamcallahan.shelf_scan.service.provider.BookMetadataProvider;
import com.williamcallahan.shelf_scan.service.rating.CommunityRatingProvider;
import com.williamcallahan.shelf_scan.service.readinglist.ReadingListMatcher;
import com.williamcallahan.shelf_scan.util.ExternalApiLogger;
import com.williamcallahan.shelf_scan.util.ValidationUtils;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class BookResolutionService {

    static final Comparator<MergedBook> BY_RATING = Comparator
        .comparingDouble(MergedBook::rating).reversed()
        .thenComparing(Comparator.comparingInt(MergedBook::ratingsCount).reversed());

    private final BookMetadataProvider googleBooks;
    private final BookMetadataProvider openLibrary;
    private final CommunityRatingProvider ratingProvider;
    private final ResolutionCacheService cacheService;
    private final BookMergePolicy mergePolicy;
    private final ReadingListMatcher readingListMatcher;
    private final ReadingListStore readingListStore;
    private final ResolutionProperties properties;
    private final MetricsService metricsService;

    public BookResolutionService(@Qualifier("googleBooksProvider") BookMetadataProvider googleBooks,
                                 @Qualifier("openLibraryProvider") BookMetadataProvider openLibrary,
                                 CommunityRatingProvider ratingProvider,
                                 ResolutionCacheService cacheService,
                                 BookMergePolicy mergePolicy,
                                 ReadingListMatcher readingListMatcher,
                                 ReadingListStore readingListStore,
                                 ResolutionProperties properties,
                                 MetricsService metricsService) {
        this.googleBooks = googleBooks;
        this.openLibrary = openLibrary;
        this.ratingProvider = ratingProvider;
        this.cacheService = cacheService;
        this.mergePolicy = mergePolicy;
        this.readingListMatcher = readingListMatcher;
        this.readingListStore = readingListStore;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    /**
     * Resolves one candidate. Never errors: provider and cache failures degrade to
     * missing data, and a candidate nobody knows resolves to {@link ResolutionOutcome#notFound}.
     */
    public Mono<ResolutionOutcome> resolve(BookQuery query) {
        return Mono.defer(() -> {
            Timer.Sample sample = metricsService.startResolutionTimer();
            ExternalApiLogger.logResolutionStart(log, query.title(), query.author());
            return cacheService.getMergedBook(query)
                .map(book -> ResolutionOutcome.found(query, book))
                .switchIfEmpty(Mono.defer(() -> resolveFromProviders(query)))
                .doOnNext(outcome -> {
                    if (!outcome.isFound()) {
                        metricsService.incrementNotFound();
                    }
                    ExternalApiLogger.logResolutionComplete(log, query.title(), outcome.isFound(),
                        outcome.asOptional().map(book -> String.join(", ", book.sources())).orElse("none"));
                })
                .doFinally(signal -> metricsService.stopResolutionTimer(sample));
        });
    }

    /**
     * Resolves candidates in parallel and ranks the found books by rating, then by
     * rating count. Candidates still pending when the batch deadline passes are dropped.
     *
     * @param userId reading-list owner; when blank the books are not annotated
     * @throws IllegalArgumentException when more candidates are submitted than allowed
     */
    public Mono<BatchResolution> resolveBatch(List<BookQuery> queries, String userId) {
        if (ValidationUtils.isEmpty(queries)) {
            return Mono.just(new BatchResolution(List.of(), 0, 0));
        }
        int maxCandidates = properties.getBatch().getMaxCandidates();
        if (queries.size() > maxCandidates) {
            throw new IllegalArgumentException("At most " + maxCandidates + " candidates per batch, got " + queries.size());
        }

        boolean annotate = ValidationUtils.hasText(userId);
        Mono<List<ReadingListEntry>> readingList = annotate ? loadReadingList(userId) : Mono.just(List.of());

        Mono<List<MergedBook>> resolved = Flux.fromIterable(queries)
            .flatMap(this::resolve, Math.max(1, properties.getBatch().getConcurrency()))
            .filter(ResolutionOutcome::isFound)
            .map(ResolutionOutcome::book)
            .takeUntilOther(Mono.delay(properties.getTimeout().getBatch())
                .doOnNext(tick -> log.warn("Batch deadline of {} reached; returning books resolved so far",
                    properties.getTimeout().getBatch())))
            .collectList();

        return Mono.zip(resolved, readingList)
            .map(tuple -> {
                List<MergedBook> books = new ArrayList<>(tuple.getT1().size());
                for (MergedBook book : tuple.getT1()) {
                    books.add(annotate ? readingListMatcher.annotate(book, tuple.getT2()) : book);
                }
                books.sort(BY_RATING);
                log.info("Batch resolved {} of {} candidate(s)", books.size(), queries.size());
                return new BatchResolution(books, queries.size(), books.size());
            });
    }

    private Mono<ResolutionOutcome> resolveFromProviders(BookQuery query) {
        return Mono.zip(optional(googleBooks.fetch(query)), optional(openLibrary.fetch(query)))
            .flatMap(tuple -> {
                ProviderRecord bibA = tuple.getT1().orElse(null);
                ProviderRecord bibB = tuple.getT2().orElse(null);
                if (bibA == null && bibB == null) {
                    return Mono.just(ResolutionOutcome.notFound(query));
                }

                String identifier = ValidationUtils.firstNonBlank(
                    bibA == null ? null : bibA.isbn(),
                    bibB == null ? null : bibB.isbn());
                Mono<Optional<ProviderRecord>> ratings = identifier == null
                    ? Mono.just(Optional.empty())
                    : optional(ratingProvider.fetch(identifier));

                return ratings.flatMap(rating -> {
                    MergedBook merged = mergePolicy.merge(query, bibA, bibB, rating.orElse(null));
                    return cacheService.putMergedBook(query, merged)
                        .thenReturn(ResolutionOutcome.found(query, merged));
                });
            });
    }

    private Mono<List<ReadingListEntry>> loadReadingList(String userId) {
        return Mono.fromCallable(() -> readingListStore.findByUserId(userId))
            .subscribeOn(Schedulers.boundedElastic())
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Could not load reading list for user {}; books will not be annotated: {}",
                    userId, e.getMessage());
                return Mono.just(List.of());
            });
    }

    private static Mono<Optional<ProviderRecord>> optional(Mono<ProviderRecord> source) {
        return source.map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorReturn(Optional.empty());
    }
}
