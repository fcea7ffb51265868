package com.williamcallahan.shelf_scan.controller.dto;

/**
 * One spine read by the upstream extractor.
 */
public record BookCandidateDto(String title, String author) {
}
