package com.williamcallahan.shelf_scan.service;

import com.williamcallahan.shelf_scan.config.ResolutionProperties;
import com.williamcallahan.shelf_scan.exception.InvalidIsbnFormatException;
import com.williamcallahan.shelf_scan.util.IsbnUtils;
import com.williamcallahan.shelf_scan.util.ValidationUtils;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds outbound Goodreads and Amazon links for a merged book.
 * Links are plain URLs; nothing is fetched.
 */
@Service
public class BookLinkService {

    private final ResolutionProperties properties;

    public BookLinkService(ResolutionProperties properties) {
        this.properties = properties;
    }

    /**
     * Goodreads book page by ISBN, or a Goodreads search when no ISBN is known.
     */
    public String buildGoodreadsLink(String isbn, String title, String author) {
        if (ValidationUtils.hasText(isbn)) {
            return "https://www.goodreads.com/book/isbn/" + isbn;
        }
        return "https://www.goodreads.com/search?q=" + encode(title + " " + author);
    }

    /**
     * Amazon product page by ISBN-10 when the identifier has one, otherwise an Amazon search.
     * The associate tag is always appended.
     */
    public String buildAmazonLink(String isbn, String title, String author) {
        String tag = encode(properties.getAffiliate().getAmazonTag());
        if (!ValidationUtils.hasText(isbn)) {
            return String.format("https://www.amazon.com/s?k=%s&tag=%s", encode(title + " " + author), tag);
        }
        try {
            return String.format("https://www.amazon.com/dp/%s?tag=%s", IsbnUtils.toIsbn10(isbn), tag);
        } catch (InvalidIsbnFormatException e) {
            // 979-prefixed and malformed identifiers have no /dp/ page
            return String.format("https://www.amazon.com/s?k=%s&tag=%s",
                encode(title + " " + author + " " + isbn), tag);
        }
    }

    private static String encode(String value) {
        // encodeURIComponent style: spaces as %20
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
