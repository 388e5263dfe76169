package org.stbridge.converter.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * One element kind in an attribute table.
 * Example: {"name": "StbPost", "path": ["StbModel", "StbMembers", "StbPosts", "StbPost"], "inherit": "StbColumn"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttributeEntry {
    public String name;

    /**
     * Tag path from the document root to the element.
     */
    public List<String> path;

    /**
     * In a removal table, the attributes to strip. In the addition table, attributes that only exist
     * in v2.1.0 and have no default; they are dropped when downgrading.
     */
    public List<String> attributes;
    public LinkedHashMap<String, String> defaults;
    public List<String> specialHandling;

    /**
     * Name of another entry in the same table whose attributes or defaults are reused.
     */
    public String inherit;
}
