package com.williamcallahan.shelf_scan.controller;

import com.williamcallahan.shelf_scan.model.BatchResolution;
import com.williamcallahan.shelf_scan.model.BookQuery;
import com.williamcallahan.shelf_scan.model.MergedBook;
import com.williamcallahan.shelf_scan.service.BookResolutionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.williamcallahan.shelf_scan.testutil.BookFixtures.mergedBook;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BookScanControllerTest {

    private static final String TWO_BOOKS = """
        {"books": [{"title": "Dune", "author": "Frank Herbert"},
                   {"title": "Emma", "author": "Jane Austen"}],
         "userId": "user-42"}
        """;

    @Mock
    private BookResolutionService resolutionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BookScanController(resolutionService)).build();
    }

    @Test
    @DisplayName("POST /api/scan/resolve returns ranked books")
    void resolve_returnsRankedBooks() throws Exception {
        List<MergedBook> books = List.of(mergedBook("Dune", 4.5, 900), mergedBook("Emma", 4.0, 300));
        when(resolutionService.resolveBatch(eq(List.of(new BookQuery("Dune", "Frank Herbert"),
            new BookQuery("Emma", "Jane Austen"))), eq("user-42")))
            .thenReturn(Mono.just(new BatchResolution(books, 2, 2)));

        performAsync(post("/api/scan/resolve").contentType(MediaType.APPLICATION_JSON).content(TWO_BOOKS))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.success", equalTo(true)))
            .andExpect(jsonPath("$.books", hasSize(2)))
            .andExpect(jsonPath("$.books[0].title", equalTo("Dune")))
            .andExpect(jsonPath("$.books[0].ratingSource", equalTo("Google Books (900 reviews)")))
            .andExpect(jsonPath("$.totalFound", equalTo(2)))
            .andExpect(jsonPath("$.totalProcessed", equalTo(2)));
    }

    @Test
    void resolve_noneFoundIs404WithCandidates() throws Exception {
        when(resolutionService.resolveBatch(anyList(), any()))
            .thenReturn(Mono.just(new BatchResolution(List.of(), 2, 0)));

        performAsync(post("/api/scan/resolve").contentType(MediaType.APPLICATION_JSON).content(TWO_BOOKS))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error", equalTo("Could not find rating information for any books")))
            .andExpect(jsonPath("$.extractedBooks", hasSize(2)))
            .andExpect(jsonPath("$.extractedBooks[1].title", equalTo("Emma")));
    }

    @Test
    void resolve_emptyListIs400() throws Exception {
        performAsync(post("/api/scan/resolve").contentType(MediaType.APPLICATION_JSON).content("{\"books\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", equalTo("No books provided")));

        verify(resolutionService, never()).resolveBatch(anyList(), any());
    }

    @Test
    void resolve_blankCandidateIs400() throws Exception {
        String body = "{\"books\": [{\"title\": \"Dune\", \"author\": \" \"}]}";

        performAsync(post("/api/scan/resolve").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", equalTo("Invalid book candidate")));

        verify(resolutionService, never()).resolveBatch(anyList(), any());
    }

    @Test
    void resolve_oversizedBatchIs400() throws Exception {
        when(resolutionService.resolveBatch(anyList(), any()))
            .thenThrow(new IllegalArgumentException("At most 1 candidates per batch, got 2"));

        performAsync(post("/api/scan/resolve").contentType(MediaType.APPLICATION_JSON).content(TWO_BOOKS))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error", equalTo("Invalid book candidate")));
    }

    @Test
    void resolve_unexpectedFailureIs500() throws Exception {
        when(resolutionService.resolveBatch(anyList(), any()))
            .thenReturn(Mono.error(new IllegalStateException("boom")));

        performAsync(post("/api/scan/resolve").contentType(MediaType.APPLICATION_JSON).content(TWO_BOOKS))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error", equalTo("An unexpected error occurred")));
    }

    private ResultActions performAsync(MockHttpServletRequestBuilder builder) throws Exception {
        MvcResult result = mockMvc.perform(builder)
            .andExpect(request().asyncStarted())
            .andReturn();
        return mockMvc.perform(asyncDispatch(result));
    }
}
