package com.location.resolution.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A geocoded main location together with the places around it.
 */
public record NearbyWithMain(Optional<MapLocation> main, List<MapLocation> nearby, MapBounds bounds) {

    public NearbyWithMain {
        main = main != null ? main : Optional.empty();
        nearby = nearby != null ? List.copyOf(nearby) : List.of();
        bounds = bounds != null ? bounds : MapBounds.EMPTY;
    }

    public static NearbyWithMain empty() {
        return new NearbyWithMain(Optional.empty(), List.of(), MapBounds.EMPTY);
    }
}
