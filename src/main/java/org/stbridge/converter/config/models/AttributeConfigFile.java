package org.stbridge.converter.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root structure of {@code stb/attribute-config.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttributeConfigFile {
    /**
     * Attributes present in v2.0.2 that v2.1.0 no longer allows.
     */
    public List<AttributeEntry> removedIn210;

    /**
     * Attributes v2.1.0 introduces, with the defaults written when upgrading.
     */
    public List<AttributeEntry> addedIn210;

    /**
     * Attributes written back with defaults when downgrading.
     */
    public List<AttributeEntry> restoredIn202;

    /**
     * Element kinds whose {@code guid} attribute is rejected by v2.1.0.
     */
    public List<String> guidNotAllowed;
}
