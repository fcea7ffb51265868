package com.williamcallahan.shelf_scan.util;

import com.williamcallahan.shelf_scan.exception.InvalidIsbnFormatException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared helpers for normalizing ISBN input and converting between the ISBN-10 and ISBN-13 forms.
 * All methods are pure; converters throw {@link InvalidIsbnFormatException} rather than guessing.
 */
public final class IsbnUtils {

    private static final Pattern NON_ISBN_CHARACTERS = Pattern.compile("[^0-9Xx]");
    private static final Pattern ISBN_13 = Pattern.compile("\\d{13}");
    private static final Pattern ISBN_10 = Pattern.compile("\\d{9}[\\dX]");
    private static final String BOOKLAND_PREFIX = "978";

    private IsbnUtils() {
    }

    /**
     * Normalizes an ISBN by removing non-numeric characters (except the X check digit) and
     * uppercasing the result.
     *
     * @param raw user-provided ISBN input
     * @return cleaned ISBN string, or {@code null} if nothing usable remains
     */
    public static String sanitize(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = NON_ISBN_CHARACTERS.matcher(raw).replaceAll("");
        if (cleaned.isBlank()) {
            return null;
        }
        return cleaned.toUpperCase(Locale.ROOT);
    }

    /**
     * Validate if a string is a valid ISBN-13.
     */
    public static boolean isValidIsbn13(String isbn) {
        String cleaned = sanitize(isbn);
        return cleaned != null && ISBN_13.matcher(cleaned).matches();
    }

    /**
     * Validate if a string is a valid ISBN-10.
     */
    public static boolean isValidIsbn10(String isbn) {
        String cleaned = sanitize(isbn);
        return cleaned != null && ISBN_10.matcher(cleaned).matches();
    }

    /**
     * Converts a 978-prefixed ISBN-13 to its ISBN-10 form.
     *
     * @param isbn13 ISBN-13, hyphens and spaces allowed
     * @return the ISBN-10, check digit {@code X} when the checksum is 10
     * @throws InvalidIsbnFormatException when the input is not 13 digits or not 978-prefixed
     */
    public static String isbn13To10(String isbn13) {
        String cleaned = sanitize(isbn13);
        if (cleaned == null || !ISBN_13.matcher(cleaned).matches()) {
            throw new InvalidIsbnFormatException(isbn13, "expected 13 digits");
        }
        if (!cleaned.startsWith(BOOKLAND_PREFIX)) {
            throw new InvalidIsbnFormatException(isbn13, "only 978-prefixed ISBN-13 values have an ISBN-10 form");
        }

        String base = cleaned.substring(3, 12);
        int sum = 0;
        for (int i = 0; i < 9; i++) {
            sum += Character.digit(base.charAt(i), 10) * (10 - i);
        }
        int checksum = (11 - (sum % 11)) % 11;
        return base + (checksum == 10 ? "X" : String.valueOf(checksum));
    }

    /**
     * Converts an ISBN-10 to its 978-prefixed ISBN-13 form.
     *
     * @param isbn10 ISBN-10, hyphens and spaces allowed
     * @return the ISBN-13
     * @throws InvalidIsbnFormatException when the input is not 9 digits followed by a digit or X
     */
    public static String isbn10To13(String isbn10) {
        String cleaned = sanitize(isbn10);
        if (cleaned == null || !ISBN_10.matcher(cleaned).matches()) {
            throw new InvalidIsbnFormatException(isbn10, "expected 9 digits followed by a digit or X");
        }

        String base = BOOKLAND_PREFIX + cleaned.substring(0, 9);
        int sum = 0;
        for (int i = 0; i < 12; i++) {
            int digit = Character.digit(base.charAt(i), 10);
            sum += (i % 2 == 0) ? digit : digit * 3;
        }
        int checksum = (10 - (sum % 10)) % 10;
        return base + checksum;
    }

    /**
     * Produces the lookup variants of an identifier: ISBN-13 form first, then ISBN-10 form.
     * Conversions that are not possible (e.g. 979 prefixes) are omitted.
     *
     * @param identifier an ISBN-10 or ISBN-13
     * @return ordered set of one or two identifiers, empty when the input is not an ISBN
     */
    public static Set<String> variantsOf(String identifier) {
        String cleaned = sanitize(identifier);
        if (cleaned == null) {
            return Collections.emptySet();
        }

        Set<String> variants = new LinkedHashSet<>();
        if (ISBN_13.matcher(cleaned).matches()) {
            variants.add(cleaned);
            if (cleaned.startsWith(BOOKLAND_PREFIX)) {
                variants.add(isbn13To10(cleaned));
            }
        } else if (ISBN_10.matcher(cleaned).matches()) {
            variants.add(isbn10To13(cleaned));
            variants.add(cleaned);
        }
        return Collections.unmodifiableSet(variants);
    }

    /**
     * Returns the ISBN-10 form of an identifier if it has one.
     *
     * @throws InvalidIsbnFormatException when no ISBN-10 form exists
     */
    public static String toIsbn10(String identifier) {
        String cleaned = sanitize(identifier);
        if (cleaned != null && ISBN_10.matcher(cleaned).matches()) {
            return cleaned;
        }
        return isbn13To10(identifier);
    }
}
