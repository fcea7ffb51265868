/**
 * Basic application context load test for Shelf Scan
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies that the Spring application context loads without Redis or a rating store
 * - Confirms the no-op cache backend and empty reading-list store are wired in
 */

package com.williamcallahan.shelf_scan;

import com.williamcallahan.shelf_scan.repository.EmptyReadingListStore;
import com.williamcallahan.shelf_scan.repository.ReadingListStore;
import com.williamcallahan.shelf_scan.service.BookResolutionService;
import com.williamcallahan.shelf_scan.service.cache.ResolutionCacheService;
import com.williamcallahan.shelf_scan.service.rating.RatingStoreConnector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
@ActiveProfiles("test")
class ShelfScanApplicationTests {

    @Autowired
    private BookResolutionService resolutionService;

    @Autowired
    private ResolutionCacheService cacheService;

    @Autowired
    private RatingStoreConnector ratingStoreConnector;

    @Autowired
    private ReadingListStore readingListStore;

    @Test
    void contextLoads() {
        assertNotNull(resolutionService);
        assertFalse(cacheService.isBackendConfigured());
        assertFalse(ratingStoreConnector.isConfigured());
        assertThat(readingListStore).isInstanceOf(EmptyReadingListStore.class);
    }
}
