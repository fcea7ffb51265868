package com.williamcallahan.shelf_scan.service;

import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Test class for {@link BookLinkService}
 */
class BookLinkServiceTest {

    private BookLinkService linkService;

    @BeforeEach
    void setUp() {
        ResolutionProperties properties = new ResolutionProperties();
        properties.getAffiliate().setAmazonTag("testtag-20");
        linkService = new BookLinkService(properties);
    }

    @Test
    void goodreads_usesIsbnPageWhenKnown() {
        assertEquals("https://www.goodreads.com/book/isbn/9780306406157",
            linkService.buildGoodreadsLink("9780306406157", "Dune", "Frank Herbert"));
    }

    @Test
    void goodreads_fallsBackToSearch() {
        assertEquals("https://www.goodreads.com/search?q=Dune%20Frank%20Herbert",
            linkService.buildGoodreadsLink(null, "Dune", "Frank Herbert"));
    }

    @Test
    void amazon_convertsIsbn13ToProductPage() {
        assertEquals("https://www.amazon.com/dp/0306406152?tag=testtag-20",
            linkService.buildAmazonLink("9780306406157", "Dune", "Frank Herbert"));
    }

    @Test
    void amazon_usesIsbn10Directly() {
        assertEquals("https://www.amazon.com/dp/080442957X?tag=testtag-20",
            linkService.buildAmazonLink("080442957X", "Dune", "Frank Herbert"));
    }

    @Test
    void amazon_searchesWhenNoIsbn10FormExists() {
        assertEquals("https://www.amazon.com/s?k=Dune%20Frank%20Herbert%209791234567896&tag=testtag-20",
            linkService.buildAmazonLink("9791234567896", "Dune", "Frank Herbert"));
    }

    @Test
    void amazon_searchesByTitleAndAuthorWithoutIsbn() {
        assertEquals("https://www.amazon.com/s?k=The%20Hobbit%20J.R.R.%20Tolkien&tag=testtag-20",
            linkService.buildAmazonLink(null, "The Hobbit", "J.R.R. Tolkien"));
    }
}
