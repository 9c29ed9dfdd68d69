package com.location.resolution.geocoding;

/**
 * Per-call options for geocoding.
 */
public class GeocodingOptions {

    private static final int DEFAULT_MAX_RESULTS = 10;

    private final boolean useCache;
    private final String preferredCountry;
    private final int maxResults;

    private GeocodingOptions(Builder builder) {
        this.useCache = builder.useCache;
        this.preferredCountry = builder.preferredCountry;
        this.maxResults = builder.maxResults;
    }

    public boolean isUseCache() {
        return useCache;
    }

    /**
     * ISO code or English name of the country to restrict external lookups to, or null.
     */
    public String getPreferredCountry() {
        return preferredCountry;
    }

    public int getMaxResults() {
        return maxResults;
    }

    /**
     * Creates default options: cache on, no country preference.
     */
    public static GeocodingOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that neither read nor write the cache.
     */
    public static GeocodingOptions noCache() {
        return builder().useCache(false).build();
    }

    public static GeocodingOptions preferCountry(String country) {
        return builder().preferredCountry(country).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean useCache = true;
        private String preferredCountry;
        private int maxResults = DEFAULT_MAX_RESULTS;

        public Builder useCache(boolean useCache) {
            this.useCache = useCache;
            return this;
        }

        public Builder preferredCountry(String preferredCountry) {
            this.preferredCountry = preferredCountry;
            return this;
        }

        public Builder maxResults(int maxResults) {
            if (maxResults <= 0) {
                throw new IllegalArgumentException("maxResults must be positive");
            }
            this.maxResults = maxResults;
            return this;
        }

        public GeocodingOptions build() {
            return new GeocodingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "GeocodingOptions{" +
                "useCache=" + useCache +
                ", preferredCountry='" + preferredCountry + '\'' +
                ", maxResults=" + maxResults +
                '}';
    }
}
