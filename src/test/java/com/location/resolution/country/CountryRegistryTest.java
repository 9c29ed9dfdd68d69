package com.location.resolution.country;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CountryRegistryTest {

    @Nested
    @DisplayName("CountryRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Maps codes to names and back")
        void roundTrip() {
            assertEquals("Germany", CountryRegistry.nameOf("DE"));
            assertEquals("United Kingdom", CountryRegistry.nameOf("gb"));
            assertEquals(Optional.of("NL"), CountryRegistry.codeOf("netherlands"));
        }

        @Test
        @DisplayName("Unknown code is returned as-is; unknown name is empty")
        void unknown() {
            assertEquals("XX", CountryRegistry.nameOf("XX"));
            assertEquals("", CountryRegistry.nameOf(null));
            assertTrue(CountryRegistry.codeOf("Atlantis").isEmpty());
        }

        @Test
        @DisplayName("resolveCode accepts either code or name")
        void resolveCode() {
            assertEquals(Optional.of("IT"), CountryRegistry.resolveCode("it"));
            assertEquals(Optional.of("ES"), CountryRegistry.resolveCode("Spain"));
            assertTrue(CountryRegistry.resolveCode(" ").isEmpty());
            assertTrue(CountryRegistry.resolveCode(null).isEmpty());
        }

        @Test
        @DisplayName("Covers the ten supported countries")
        void codes() {
            assertEquals(10, CountryRegistry.codes().size());
            assertTrue(CountryRegistry.isKnown("BE"));
            assertFalse(CountryRegistry.isKnown("PL"));
        }
    }

    @Nested
    @DisplayName("PostalCodes")
    class PostalCodesTests {

        @Test
        @DisplayName("Validates the fixed formats")
        void validate() {
            assertTrue(PostalCodes.validate("72654", "DE"));
            assertFalse(PostalCodes.validate("ABCDE", "DE"));
            assertFalse(PostalCodes.validate("7265", "DE"));
            assertTrue(PostalCodes.validate("1010", "AT"));
            assertFalse(PostalCodes.validate("10100", "AT"));
            assertTrue(PostalCodes.validate("1012AB", "NL"));
            assertTrue(PostalCodes.validate("12345-6789", "US"));
            assertFalse(PostalCodes.validate("12345-67", "US"));
            assertTrue(PostalCodes.validate("SW1A 1AA", "GB"));
            assertTrue(PostalCodes.validate("m1 1ae", "GB"));
        }

        @Test
        @DisplayName("Unknown countries accept any code; null code is invalid")
        void unknownCountry() {
            assertTrue(PostalCodes.validate("anything", "XX"));
            assertFalse(PostalCodes.validate(null, "DE"));
        }

        @Test
        @DisplayName("Formats leave codes without a convention cleaned and uppercased")
        void format() {
            assertEquals("1012 AB", PostalCodes.format("1012 ab", "NL"));
            assertEquals("M1 1AE", PostalCodes.format("m11ae", "GB"));
            assertEquals("12345", PostalCodes.format("12345", "US"));
            assertEquals("A-1010", PostalCodes.format("a-1010", "AT"));
            assertEquals("", PostalCodes.format(null, "DE"));
        }
    }
}
