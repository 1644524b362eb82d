package tech.acecontext.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for generated identifiers.
 *
 * IDs are typed with a 3-character prefix.
 * Format: "{prefix}_{tsid}" (e.g., "oac_0HZXEQ5Y8JY5Z")
 * Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
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
     * @return the ID, e.g. "oac_0HZXEQ5Y8JY5Z"
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    private TsidGenerator() {
        // Utility class
    }
}
