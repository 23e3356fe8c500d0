package io.nebula.identity.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for users and organizations.
 *
 * IDs are stored and transmitted as typed IDs with 3-character prefixes.
 * Format: "{prefix}_{tsid}" (e.g., "org_0HZXEQ5Y8JY5Z")
 *
 * Time-sorted, so creation order is preserved in indexes and listings.
 */
public class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new typed ID for the given entity type.
     *
     * @param type the entity type
     * @return the typed ID (e.g., "usr_0HZXEQ5Y8JY5Z")
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Extract the prefix from a typed ID.
     *
     * @param typedId the typed ID (e.g., "usr_0HZXEQ5Y8JY5Z")
     * @return the prefix (e.g., "usr")
     * @throws IllegalArgumentException if the ID format is invalid
     */
    public static String extractPrefix(String typedId) {
        if (typedId == null || typedId.isBlank()) {
            throw new IllegalArgumentException("Typed ID cannot be null or blank");
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1) {
            throw new IllegalArgumentException("Invalid typed ID format: missing separator");
        }
        return typedId.substring(0, separatorIndex);
    }

    private TsidGenerator() {
        // Utility class
    }
}
