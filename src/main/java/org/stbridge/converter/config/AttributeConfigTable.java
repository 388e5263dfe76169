package org.stbridge.converter.config;

import org.stbridge.converter.config.models.AttributeConfigFile;
import org.stbridge.converter.config.models.AttributeEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Attribute removals and defaults between v2.0.2 and v2.1.0, with {@code inherit} references resolved.
 * <p>
 * Inheritance is a single hop: an entry may reuse another entry's attribute list or defaults, but the
 * target must not inherit itself. Chains and unknown targets are rejected when the table is built.
 */
public class AttributeConfigTable {

    public enum Kind {
        REMOVED_IN_210,
        ADDED_IN_210,
        RESTORED_IN_202
    }

    private final Map<Kind, Map<String, AttributeRule>> rules = new EnumMap<>(Kind.class);
    private final Set<String> guidNotAllowed;

    public AttributeConfigTable(AttributeConfigFile file) {
        if (file == null) {
            throw new IllegalArgumentException("Attribute config is missing");
        }
        rules.put(Kind.REMOVED_IN_210, resolve(Kind.REMOVED_IN_210, file.removedIn210));
        rules.put(Kind.ADDED_IN_210, resolve(Kind.ADDED_IN_210, file.addedIn210));
        rules.put(Kind.RESTORED_IN_202, resolve(Kind.RESTORED_IN_202, file.restoredIn202));
        guidNotAllowed = file.guidNotAllowed == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(file.guidNotAllowed));
    }

    public static AttributeConfigTable defaults() {
        return Holder.INSTANCE;
    }

    /**
     * All entries of a table in declaration order.
     */
    public List<AttributeRule> rules(Kind kind) {
        return List.copyOf(rules.get(kind).values());
    }

    public Optional<AttributeRule> rule(Kind kind, String name) {
        return Optional.ofNullable(rules.get(kind).get(name));
    }

    /**
     * Attributes v2.1.0 removed from an element kind, or an empty list when the kind is not listed.
     */
    public List<String> removedAttributes(String name) {
        return rule(Kind.REMOVED_IN_210, name).map(AttributeRule::attributes).orElse(List.of());
    }

    public Set<String> guidNotAllowed() {
        return guidNotAllowed;
    }

    private static Map<String, AttributeRule> resolve(Kind kind, List<AttributeEntry> entries) {
        Map<String, AttributeEntry> byName = new LinkedHashMap<>();
        if (entries != null) {
            for (AttributeEntry entry : entries) {
                if (byName.putIfAbsent(entry.name, entry) != null) {
                    throw new IllegalStateException("Duplicate " + kind + " entry: " + entry.name);
                }
            }
        }

        Map<String, AttributeRule> resolved = new LinkedHashMap<>();
        for (AttributeEntry entry : byName.values()) {
            AttributeEntry source = entry;
            if (entry.inherit != null) {
                source = byName.get(entry.inherit);
                if (source == null) {
                    throw new IllegalStateException(kind + " entry " + entry.name
                            + " inherits unknown entry " + entry.inherit);
                }
                if (source.inherit != null) {
                    throw new IllegalStateException(kind + " entry " + entry.name
                            + " inherits " + entry.inherit + " which itself inherits " + source.inherit);
                }
            }
            List<String> special = new ArrayList<>();
            if (source.specialHandling != null) {
                special.addAll(source.specialHandling);
            }
            resolved.put(entry.name, new AttributeRule(entry.name, entry.path, source.attributes,
                    source.defaults, special));
        }
        return Collections.unmodifiableMap(resolved);
    }

    private static final class Holder {
        private static final AttributeConfigTable INSTANCE =
                new AttributeConfigTable(ConverterConfigHelper.loadAttributeConfig());
    }
}
