package com.williamcallahan.shelf_scan.service.provider;

import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.ProviderRecord;
import com.williamcallahan.shelf_scan.model.ProviderSource;
import reactor.core.publisher.Mono;

/**
 * A bibliographic source searched by title and author.
 *
 * <p>{@link #fetch} completes empty when the provider has no match or could not be reached.
 * It never signals an error.</p>
 */
public interface BookMetadataProvider {

    ProviderSource source();

    Mono<ProviderRecord> fetch(BookQuery query);
}
