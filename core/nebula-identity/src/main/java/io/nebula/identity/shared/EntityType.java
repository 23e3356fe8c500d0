package io.nebula.identity.shared;

/**
 * Entity types with their 3-character ID prefixes.
 *
 * IDs are stored WITH the prefix in the database:
 * - Format: "{prefix}_{tsid}" (e.g., "usr_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Usage:
 * <pre>
 * String id = TsidGenerator.generate(EntityType.USER);  // "usr_0HZXEQ5Y8JY5Z"
 * </pre>
 */
public enum EntityType {

    USER("usr"),
    ORGANIZATION("org"),
    ACCOUNT_TOKEN("tok");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
