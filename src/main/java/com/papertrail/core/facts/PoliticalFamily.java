package com.papertrail.core.facts;

import java.util.Objects;

/**
 * A political clan, identified independently of entity resolution.
 */
public record PoliticalFamily(String id, String surname, String province) {

    public PoliticalFamily {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(surname, "surname is required");
    }
}
