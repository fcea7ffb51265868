package com.williamcallahan.shelf_scan.controller.dto;

import java.util.List;

/**
 * Body of {@code POST /api/scan/resolve}.
 *
 * @param books  candidates to resolve
 * @param userId optional reading-list owner
 */
public record ScanResolveRequest(List<BookCandidateDto> books, String userId) {
}
