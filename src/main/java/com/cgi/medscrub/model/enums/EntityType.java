package com.cgi.medscrub.model.enums;

/**
 * Enumeration of the entity categories the engine redacts.
 * Each category carries the prefix used inside its placeholder token.
 */
public enum EntityType {
    // Identity
    PERSON("NAME"),
    ORGANIZATION("ORG"),
    NATIONAL_ID("NATIONAL_ID"),
    MEDICAL_RECORD_NUMBER("MRN"),

    // Contact
    EMAIL("EMAIL"),
    PHONE("PHONE"),

    // Location
    LOCATION("LOCATION"),
    ADDRESS("ADDRESS"),
    CITY_STATE("CITY_STATE"),
    ZIP("ZIP"),
    PO_BOX("PO_BOX"),

    // Other
    DATE("DATE"),
    CREDIT_CARD("CREDIT_CARD");

    private final String placeholderPrefix;

    EntityType(String placeholderPrefix) {
        this.placeholderPrefix = placeholderPrefix;
    }

    public String getPlaceholderPrefix() {
        return placeholderPrefix;
    }
}
