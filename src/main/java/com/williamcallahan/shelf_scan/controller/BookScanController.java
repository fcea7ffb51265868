/**
 * REST controller resolving scanned book candidates.
 */
package com.williamcallahan.shelf_scan.controller;

import com.williamcallahan.shelf_scan.controller.dto.BookCandidateDto;
import com.williamcallahan.shelf_scan.controller.dto.ScanResolveRequest;
import com.williamcallahan.shelf_scan.controller.dto.ScanResolveResponse;
import com.williamcallahan.shelf_scan.controller.support.ErrorResponseUtils;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.service.BookResolutionService;
import com.williamcallahan.shelf_scan.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/scan")
@Slf4j
public class BookScanController {

    private final BookResolutionService resolutionService;

    public BookScanController(BookResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    /**
     * Resolves every candidate and returns the found books ranked by rating.
     * 400 for an empty or invalid candidate list, 404 with the candidates when none resolved.
     */
    @PostMapping("/resolve")
    public Mono<ResponseEntity<Object>> resolve(@RequestBody(required = false) ScanResolveRequest request) {
        if (request == null || ValidationUtils.isEmpty(request.books())) {
            return Mono.just(badRequest(ErrorResponseUtils.errorBody("No books provided")));
        }

        List<BookQuery> queries;
        try {
            queries = toQueries(request.books());
        } catch (IllegalArgumentException e) {
            return Mono.just(badRequest(ErrorResponseUtils.errorBody("Invalid book candidate", e.getMessage())));
        }

        log.info("Resolving {} scanned candidate(s)", queries.size());
        return Mono.defer(() -> resolutionService.resolveBatch(queries, request.userId()))
            .map(resolution -> {
                if (resolution.isEmpty()) {
                    Map<String, Object> body = ErrorResponseUtils.errorBody("Could not find rating information for any books");
                    body.put("extractedBooks", request.books());
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).<Object>body(body);
                }
                return ResponseEntity.<Object>ok(ScanResolveResponse.from(resolution));
            })
            .onErrorResume(IllegalArgumentException.class,
                e -> Mono.just(badRequest(ErrorResponseUtils.errorBody("Invalid book candidate", e.getMessage()))))
            .onErrorResume(e -> {
                log.error("Failed to resolve scanned candidates: {}", e.getMessage(), e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .<Object>body(ErrorResponseUtils.errorBody("An unexpected error occurred")));
            });
    }

    private static ResponseEntity<Object> badRequest(Map<String, Object> body) {
        return ResponseEntity.badRequest().body(body);
    }

    private static List<BookQuery> toQueries(List<BookCandidateDto> candidates) {
        List<BookQuery> queries = new ArrayList<>(candidates.size());
        for (BookCandidateDto candidate : candidates) {
            if (candidate == null) {
                throw new IllegalArgumentException("Book candidate must not be null");
            }
            queries.add(new BookQuery(candidate.title(), candidate.author()));
        }
        return queries;
    }
}
