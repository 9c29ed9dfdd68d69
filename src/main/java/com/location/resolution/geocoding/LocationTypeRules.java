package com.location.resolution.geocoding;

import com.location.resolution.core.model.LocationType;

import java.util.List;

/**
 * Infers the granularity of a geocoder hit from which address components it
 * carries. The first rule whose keys are present decides.
 */
public final class LocationTypeRules {

    private static final List<TypeRule> RULES = List.of(
            new TypeRule(LocationType.CITY, "city"),
            new TypeRule(LocationType.TOWN, "town"),
            new TypeRule(LocationType.VILLAGE, "village"),
            new TypeRule(LocationType.SUBURB, "suburb", "neighbourhood"),
            new TypeRule(LocationType.DISTRICT, "county", "district"),
            new TypeRule(LocationType.REGION, "state", "region"),
            new TypeRule(LocationType.COUNTRY, "country")
    );

    private LocationTypeRules() {
    }

    public static LocationType infer(NominatimPlace place) {
        for (TypeRule rule : RULES) {
            if (place.hasAnyAddress(rule.addressKeys())) {
                return rule.type();
            }
        }
        return LocationType.CITY;
    }

    public static List<TypeRule> rules() {
        return RULES;
    }

    public record TypeRule(LocationType type, String... addressKeys) {}
}
