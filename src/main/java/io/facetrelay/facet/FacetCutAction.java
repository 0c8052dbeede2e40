package io.facetrelay.facet;

public enum FacetCutAction {
    ADD,
    REPLACE,
    REMOVE;

    public static FacetCutAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ADD;
        }
        for (FacetCutAction value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown facet cut action: " + raw);
    }
}
