package com.williamcallahan.shelf_scan.service;

import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.MergedBook;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.util.ValidationUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Deterministic reconciliation of provider records into one {@link MergedBook}.
 *
 * <ul>
 *   <li>Rating: community ratings, then Google Books, then Open Library; first positive rating wins.</li>
 *   <li>Bibliographic fields: Google Books is primary when present, Open Library fills gaps,
 *       the query itself is the last resort for title and author.</li>
 *   <li>Description: the longer of the two.</li>
 *   <li>Info link: Google Books only.</li>
 * </ul>
 *
 * The result does not depend on which provider answered first.
 */
@Component
public class BookMergePolicy {

    static final String NO_RATINGS = "No ratings available";
    static final String NO_DESCRIPTION = "No description available";

    private final BookLinkService linkService;

    public BookMergePolicy(BookLinkService linkService) {
        this.linkService = linkService;
    }

    /**
     * @param query      the original candidate
     * @param bibA       Google Books record, or {@code null}
     * @param bibB       Open Library record, or {@code null}
     * @param ratings    community rating record, or {@code null}
     * @return the merged book, or {@code null} when every source is empty
     */
    public MergedBook merge(BookQuery query, ProviderRecord bibA, ProviderRecord bibB, ProviderRecord ratings) {
        if (bibA == null && bibB == null && ratings == null) {
            return null;
        }

        ProviderRecord primary = bibA != null ? bibA : bibB;
        ProviderRecord secondary = bibA != null ? bibB : null;

        MergedBook.MergedBookBuilder builder = MergedBook.builder();
        applyRating(builder, ratings, bibA, bibB);

        String title = ValidationUtils.firstNonBlank(field(primary, ProviderRecord::title),
            field(secondary, ProviderRecord::title), query.title());
        String author = ValidationUtils.firstNonBlank(field(primary, ProviderRecord::author),
            field(secondary, ProviderRecord::author), query.author());
        String isbn = ValidationUtils.firstNonBlank(field(primary, ProviderRecord::isbn),
            field(secondary, ProviderRecord::isbn));
        Integer publishYear = field(primary, ProviderRecord::publishYear) != null
            ? field(primary, ProviderRecord::publishYear)
            : field(secondary, ProviderRecord::publishYear);

        return builder
            .title(title)
            .author(author)
            .description(chooseDescription(field(primary, ProviderRecord::description),
                field(secondary, ProviderRecord::description)))
            .thumbnail(ValidationUtils.firstNonBlank(field(primary, ProviderRecord::thumbnail),
                field(secondary, ProviderRecord::thumbnail)))
            .isbn(isbn)
            .publishYear(publishYear)
            .infoLink(field(bibA, ProviderRecord::infoLink))
            .goodreadsUrl(linkService.buildGoodreadsLink(isbn, query.title(), query.author()))
            .amazonUrl(linkService.buildAmazonLink(isbn, query.title(), query.author()))
            .sources(sourcesOf(bibA, bibB, ratings))
            .build();
    }

    /**
     * Label naming the rating source, e.g. {@code "Goodreads (1,234 ratings)"}.
     */
    static String ratingLabel(ProviderRecord record) {
        return String.format(Locale.US, "%s (%,d %s)", record.source().getDisplayName(),
            record.ratingsCount(), record.source().getCountNoun());
    }

    private static void applyRating(MergedBook.MergedBookBuilder builder, ProviderRecord... candidates) {
        for (ProviderRecord candidate : candidates) {
            if (candidate != null && candidate.hasRating()) {
                builder.rating(candidate.rating())
                    .ratingsCount(candidate.ratingsCount())
                    .ratingSource(ratingLabel(candidate));
                return;
            }
        }
        builder.rating(0).ratingsCount(0).ratingSource(NO_RATINGS);
    }

    private static String chooseDescription(String primary, String secondary) {
        int primaryLength = primary == null ? 0 : primary.length();
        int secondaryLength = secondary == null ? 0 : secondary.length();
        if (primaryLength > secondaryLength) {
            return primary;
        }
        String chosen = ValidationUtils.firstNonBlank(secondary, primary);
        return chosen != null ? chosen : NO_DESCRIPTION;
    }

    private static List<String> sourcesOf(ProviderRecord... records) {
        List<String> sources = new ArrayList<>();
        for (ProviderRecord record : records) {
            if (record != null) {
                sources.add(record.source().getDisplayName());
            }
        }
        return sources;
    }

    private static <T> T field(ProviderRecord record, Function<ProviderRecord, T> getter) {
        return record == null ? null : getter.apply(record);
    }
}
