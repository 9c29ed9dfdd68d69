package com.location.resolution.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.LocationRecord;
import com.location.resolution.core.model.LocationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a {@link LocationStore} from a JSON array of location entries.
 *
 * <pre>
 * [
 *   {"name": "Munich", "nameVariants": ["München"], "lat": 48.1351, "lng": 11.5820,
 *    "country": "Germany", "countryCode": "DE", "region": "Bayern", "district": "München",
 *    "population": 1488202, "locationType": "city", "postalCodes": ["80331"]}
 * ]
 * </pre>
 *
 * Entries with out-of-range coordinates or no name are skipped with a warning.
 */
public class JsonLocationStoreLoader {
    private static final Logger log = LoggerFactory.getLogger(JsonLocationStoreLoader.class);

    /** Classpath location of the bundled German reference table. */
    public static final String DEFAULT_RESOURCE = "/locations/de-locations.json";

    private final ObjectMapper objectMapper;

    public JsonLocationStoreLoader() {
        this(new ObjectMapper());
    }

    public JsonLocationStoreLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the bundled reference table.
     */
    public static LocationStore loadDefault() {
        return new JsonLocationStoreLoader().loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a store from a classpath resource.
     *
     * @throws IllegalStateException if the resource does not exist
     */
    public LocationStore loadResource(String resource) {
        try (InputStream in = JsonLocationStoreLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Location resource not found: " + resource);
            }
            LocationStore store = load(in);
            log.info("Location store loaded from {}: {} records", resource, store.size());
            return store;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read location resource " + resource, e);
        }
    }

    /**
     * Loads a store from a JSON stream. The stream is not closed.
     */
    public LocationStore load(InputStream input) throws IOException {
        List<StoreEntry> entries = objectMapper.readValue(input, new TypeReference<List<StoreEntry>>() {});
        List<LocationRecord> records = new ArrayList<>(entries.size());
        for (StoreEntry entry : entries) {
            if (entry.name() == null || entry.name().isBlank()
                    || entry.lat() == null || entry.lng() == null
                    || !GeographicCoordinates.isValid(entry.lat(), entry.lng())) {
                log.warn("Skipping invalid location entry: {}", entry);
                continue;
            }
            records.add(entry.toRecord());
        }
        return new InMemoryLocationStore(records);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoreEntry(
            String name,
            List<String> nameVariants,
            Double lat,
            Double lng,
            String country,
            String countryCode,
            String region,
            String district,
            Long population,
            String locationType,
            List<String> postalCodes
    ) {
        LocationRecord toRecord() {
            return new LocationRecord(
                    name,
                    nameVariants,
                    new GeographicCoordinates(lat, lng),
                    country,
                    countryCode != null ? countryCode : "XX",
                    region,
                    district,
                    population,
                    LocationType.fromWireName(locationType),
                    postalCodes
            );
        }
    }
}
