package com.location.resolution.country;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Single table of supported countries: ISO-3166 alpha-2 code, English name and
 * postal code format. Every component resolves countries through this class.
 */
public final class CountryRegistry {

    private static final Map<String, Country> BY_CODE;
    private static final Map<String, Country> BY_NAME;

    static {
        Map<String, Country> byCode = new LinkedHashMap<>();
        register(byCode, "DE", "Germany", "^[0-9]{5}$");
        register(byCode, "IT", "Italy", "^[0-9]{5}$");
        register(byCode, "ES", "Spain", "^[0-9]{5}$");
        register(byCode, "FR", "France", "^[0-9]{5}$");
        register(byCode, "AT", "Austria", "^[0-9]{4}$");
        register(byCode, "CH", "Switzerland", "^[0-9]{4}$");
        register(byCode, "NL", "Netherlands", "^[0-9]{4}\\s?[A-Z]{2}$");
        register(byCode, "BE", "Belgium", "^[0-9]{4}$");
        register(byCode, "US", "United States", "^[0-9]{5}(-[0-9]{4})?$");
        register(byCode, "GB", "United Kingdom", "^[A-Z]{1,2}[0-9R][0-9A-Z]?\\s?[0-9][A-Z]{2}$");
        BY_CODE = Collections.unmodifiableMap(byCode);

        Map<String, Country> byName = new LinkedHashMap<>();
        byCode.values().forEach(c -> byName.put(c.name().toLowerCase(Locale.ROOT), c));
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private CountryRegistry() {
    }

    private static void register(Map<String, Country> table, String code, String name, String postalRegex) {
        table.put(code, new Country(code, name, Pattern.compile(postalRegex, Pattern.CASE_INSENSITIVE)));
    }

    /**
     * Returns the English name for an ISO code, or the code itself when unknown.
     */
    public static String nameOf(String countryCode) {
        if (countryCode == null) {
            return "";
        }
        Country country = BY_CODE.get(countryCode.trim().toUpperCase(Locale.ROOT));
        return country != null ? country.name() : countryCode;
    }

    /**
     * Returns the ISO code for an English country name.
     */
    public static Optional<String> codeOf(String countryName) {
        if (countryName == null) {
            return Optional.empty();
        }
        Country country = BY_NAME.get(countryName.trim().toLowerCase(Locale.ROOT));
        return country != null ? Optional.of(country.code()) : Optional.empty();
    }

    /**
     * Accepts either an ISO code or a country name and returns the ISO code.
     */
    public static Optional<String> resolveCode(String nameOrCode) {
        if (nameOrCode == null || nameOrCode.isBlank()) {
            return Optional.empty();
        }
        String upper = nameOrCode.trim().toUpperCase(Locale.ROOT);
        if (BY_CODE.containsKey(upper)) {
            return Optional.of(upper);
        }
        return codeOf(nameOrCode);
    }

    /**
     * Returns the postal code pattern of a country, if the country has a known format.
     */
    public static Optional<Pattern> postalPattern(String countryCode) {
        if (countryCode == null) {
            return Optional.empty();
        }
        Country country = BY_CODE.get(countryCode.trim().toUpperCase(Locale.ROOT));
        return country != null ? Optional.of(country.postalPattern()) : Optional.empty();
    }

    public static boolean isKnown(String countryCode) {
        return countryCode != null && BY_CODE.containsKey(countryCode.trim().toUpperCase(Locale.ROOT));
    }

    public static Set<String> codes() {
        return BY_CODE.keySet();
    }

    record Country(String code, String name, Pattern postalPattern) {}
}
