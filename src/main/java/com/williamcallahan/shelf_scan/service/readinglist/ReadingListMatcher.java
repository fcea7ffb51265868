package com.williamcallahan.shelf_scan.service.readinglist;

import com.williamcallahan.shelf_scan.model.MergedBook;
import com.williamcallahan.shelf_scan.model.ReadingListEntry;
import com.williamcallahan.shelf_scan.model.ReadingListMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a resolved book is already on a user's reading list.
 *
 * <p>Identifier matches win over title/author matches across the whole list: a later
 * entry with the same ISBN beats an earlier entry that only matches by title.</p>
 */
@Component
public class ReadingListMatcher {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]");

    public Optional<ReadingListMatch> match(MergedBook book, List<ReadingListEntry> entries) {
        if (book == null || entries == null || entries.isEmpty()) {
            return Optional.empty();
        }

        String bookDigits = digitsOnly(book.isbn());
        if (!bookDigits.isEmpty()) {
            for (ReadingListEntry entry : entries) {
                if (bookDigits.equals(digitsOnly(entry.isbn())) || bookDigits.equals(digitsOnly(entry.isbn13()))) {
                    return Optional.of(ReadingListMatch.from(entry));
                }
            }
        }

        String title = normalize(book.title());
        String author = normalize(book.author());
        if (title.isEmpty()) {
            return Optional.empty();
        }
        for (ReadingListEntry entry : entries) {
            if (title.equals(normalize(entry.title())) && authorsMatch(author, normalize(entry.author()))) {
                return Optional.of(ReadingListMatch.from(entry));
            }
        }
        return Optional.empty();
    }

    /**
     * Copy of the book with {@code inReadingList} and {@code readingListInfo} set.
     */
    public MergedBook annotate(MergedBook book, List<ReadingListEntry> entries) {
        return book.withReadingList(match(book, entries).orElse(null));
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return PUNCTUATION.matcher(value.toLowerCase(Locale.ROOT).trim()).replaceAll("");
    }

    private static boolean authorsMatch(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        return a.contains(b) || b.contains(a);
    }

    private static String digitsOnly(String value) {
        return value == null ? "" : NON_DIGITS.matcher(value).replaceAll("");
    }
}
