package com.location.resolution.country;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Country-specific postal code validation and formatting.
 */
public final class PostalCodes {

    private PostalCodes() {
    }

    /**
     * Validates the format of a postal code. Countries without a known format are
     * accepted so unsupported markets are never blocked.
     */
    public static boolean validate(String postalCode, String countryCode) {
        if (postalCode == null) {
            return false;
        }
        Optional<Pattern> pattern = CountryRegistry.postalPattern(countryCode);
        return pattern.map(p -> p.matcher(postalCode.trim()).matches()).orElse(true);
    }

    /**
     * Normalizes a postal code to the country's written convention.
     */
    public static String format(String postalCode, String countryCode) {
        if (postalCode == null) {
            return "";
        }
        String cleaned = postalCode.replaceAll("\\s+", "").toUpperCase(Locale.ROOT);
        String country = countryCode != null ? countryCode.toUpperCase(Locale.ROOT) : "";

        switch (country) {
            case "NL" -> {
                if (cleaned.length() == 6) {
                    return cleaned.substring(0, 4) + " " + cleaned.substring(4);
                }
            }
            case "GB" -> {
                if (cleaned.length() >= 5) {
                    return cleaned.substring(0, cleaned.length() - 3) + " " + cleaned.substring(cleaned.length() - 3);
                }
            }
            case "US" -> {
                if (cleaned.length() == 9) {
                    return cleaned.substring(0, 5) + "-" + cleaned.substring(5);
                }
            }
            default -> {
                // no convention beyond cleanup
            }
        }
        return cleaned;
    }
}
