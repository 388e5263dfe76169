package org.stbridge.converter.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;

/**
 * A named group of v2.0.2 to v2.1.0 tag renames that apply inside one kind of parent element.
 * Example: {"name": "rcBeamBar", "renames": {"StbSecBarBeam_RC_Same": "StbSecBarBeamSimple"}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RenameScope {
    public String name;

    /**
     * Scopes that are not reversible are only applied when upgrading.
     */
    public boolean reversible = true;

    /**
     * Legacy tag to new tag, in declaration order.
     */
    public LinkedHashMap<String, String> renames;
}
