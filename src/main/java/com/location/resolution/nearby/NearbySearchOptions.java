package com.location.resolution.nearby;

import com.location.resolution.core.model.GeographicCoordinates;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parameters of a radius search.
 */
public class NearbySearchOptions {

    public static final List<String> DEFAULT_COUNTRIES = List.of("DE", "IT", "ES", "FR");
    private static final double DEFAULT_RADIUS_KM = 25.0;
    private static final int DEFAULT_MAX_RESULTS = 50;

    private final GeographicCoordinates center;
    private final double radiusKm;
    private final List<String> countries;
    private final int maxResults;
    private final boolean includeDistance;

    private NearbySearchOptions(Builder builder) {
        this.center = builder.center;
        this.radiusKm = builder.radiusKm;
        this.countries = builder.countries;
        this.maxResults = builder.maxResults;
        this.includeDistance = builder.includeDistance;
    }

    public GeographicCoordinates getCenter() {
        return center;
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public List<String> getCountries() {
        return countries;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public boolean isIncludeDistance() {
        return includeDistance;
    }

    /**
     * Number of candidates requested from each country's index.
     */
    public int perCountryLimit() {
        return (int) Math.ceil((double) maxResults / countries.size());
    }

    public static NearbySearchOptions around(GeographicCoordinates center, double radiusKm) {
        return builder().center(center).radiusKm(radiusKm).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GeographicCoordinates center;
        private double radiusKm = DEFAULT_RADIUS_KM;
        private List<String> countries = DEFAULT_COUNTRIES;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private boolean includeDistance = true;

        public Builder center(GeographicCoordinates center) {
            this.center = center;
            return this;
        }

        public Builder radiusKm(double radiusKm) {
            if (!(radiusKm > 0) || !Double.isFinite(radiusKm)) {
                throw new IllegalArgumentException("radiusKm must be a positive number");
            }
            this.radiusKm = radiusKm;
            return this;
        }

        public Builder countries(List<String> countries) {
            Objects.requireNonNull(countries, "countries is required");
            this.countries = countries;
            return this;
        }

        public Builder countries(String... countries) {
            return countries(List.of(countries));
        }

        public Builder maxResults(int maxResults) {
            if (maxResults <= 0) {
                throw new IllegalArgumentException("maxResults must be positive");
            }
            this.maxResults = maxResults;
            return this;
        }

        public Builder includeDistance(boolean includeDistance) {
            this.includeDistance = includeDistance;
            return this;
        }

        public NearbySearchOptions build() {
            Objects.requireNonNull(center, "center is required");
            List<String> normalized = countries.stream()
                    .filter(Objects::nonNull)
                    .map(c -> c.trim().toUpperCase(Locale.ROOT))
                    .filter(c -> !c.isEmpty())
                    .distinct()
                    .toList();
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("at least one country is required");
            }
            this.countries = normalized;
            return new NearbySearchOptions(this);
        }
    }

    @Override
    public String toString() {
        return "NearbySearchOptions{" +
                "center=" + center +
                ", radiusKm=" + radiusKm +
                ", countries=" + countries +
                ", maxResults=" + maxResults +
                ", includeDistance=" + includeDistance +
                '}';
    }
}
