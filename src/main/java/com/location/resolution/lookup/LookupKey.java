package com.location.resolution.lookup;

import java.util.Locale;

/**
 * Cache key of a lookup: trimmed, lowercased query plus ISO country code.
 */
record LookupKey(String query, String countryCode) {

    static LookupKey of(String query, String countryCode) {
        return new LookupKey(query.trim().toLowerCase(Locale.ROOT), countryCode);
    }
}
