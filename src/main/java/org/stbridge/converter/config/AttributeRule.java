package org.stbridge.converter.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An attribute table entry with inheritance already resolved.
 *
 * @param name            element kind, e.g. {@code StbColumn}
 * @param path            tag path from the document root
 * @param attributes      attribute names to remove
 * @param defaults        attribute defaults to add
 * @param specialHandling attributes that need custom logic
 */
public record AttributeRule(String name, List<String> path, List<String> attributes,
                            Map<String, String> defaults, List<String> specialHandling) {

    public AttributeRule {
        if (path == null) {
            path = List.of();
        }
        if (attributes == null) {
            attributes = List.of();
        }
        if (defaults == null) {
            defaults = Map.of();
        }
        if (specialHandling == null) {
            specialHandling = List.of();
        }
        path = List.copyOf(path);
        attributes = List.copyOf(attributes);
        defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        specialHandling = List.copyOf(specialHandling);
    }
}
