package org.stbridge.converter.config.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Root structure of {@code stb/element-renames.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ElementRenameFile {
    public List<RenameScope> scopes;
}
