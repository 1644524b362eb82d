package tech.acecontext.platform.shared;

/**
 * Entity types that carry generated ids, with their 3-character prefixes.
 *
 * Format: "{prefix}_{tsid}" (e.g., "oac_0HZXEQ5Y8JY5Z").
 * Tenants are not listed here: their id is the federated provider's subject.
 */
public enum EntityType {

    // Authentication
    OAUTH_CLIENT("oac");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
