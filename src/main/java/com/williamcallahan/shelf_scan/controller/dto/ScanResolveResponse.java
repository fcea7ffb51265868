package com.williamcallahan.shelf_scan.controller.dto;

import com.williamcallahan.shelf_scan.model.BatchResolution;
import com.williamcallahan.shelf_scan.model.MergedBook;

import java.util.List;

/**
 * Ranked scan result.
 *
 * @param totalFound     candidates submitted
 * @param totalProcessed candidates that resolved to a book
 */
public record ScanResolveResponse(boolean success, List<MergedBook> books, int totalFound, int totalProcessed) {

    public static ScanResolveResponse from(BatchResolution resolution) {
        return new ScanResolveResponse(true, resolution.books(), resolution.totalRequested(), resolution.totalResolved());
    }
}
