package com.location.resolution.core.model;

/**
 * Role of a location shown on a map.
 */
public enum MapLocationType {
    SEARCH,
    NEARBY,
    LISTING,
    USER
}
