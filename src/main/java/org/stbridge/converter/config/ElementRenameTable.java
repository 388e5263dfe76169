package org.stbridge.converter.config;

import org.stbridge.converter.config.models.ElementRenameFile;
import org.stbridge.converter.config.models.RenameScope;
import org.stbridge.converter.tree.StbNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped tag renames between v2.0.2 and v2.1.0.
 * <p>
 * Several legacy tags may map onto the same new tag (for example {@code StbSecBarColumn_SRC_RectSame} and
 * {@code StbSecBarColumn_SSRC_RectSame}). The reverse direction keeps the first legacy tag declared for a
 * new tag, so downgrading is deterministic.
 */
public class ElementRenameTable {

    private final Map<String, Map<String, String>> forward = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> reverse = new LinkedHashMap<>();

    public ElementRenameTable(ElementRenameFile file) {
        if (file == null || file.scopes == null) {
            throw new IllegalArgumentException("Element rename table has no scopes");
        }
        for (RenameScope scope : file.scopes) {
            if (forward.containsKey(scope.name)) {
                throw new IllegalStateException("Duplicate rename scope: " + scope.name);
            }
            Map<String, String> renames = new LinkedHashMap<>(scope.renames);
            forward.put(scope.name, Collections.unmodifiableMap(renames));

            Map<String, String> inverted = new LinkedHashMap<>();
            if (scope.reversible) {
                renames.forEach((legacy, current) -> inverted.putIfAbsent(current, legacy));
            }
            reverse.put(scope.name, Collections.unmodifiableMap(inverted));
        }
    }

    /**
     * The table bundled on the classpath, loaded once.
     */
    public static ElementRenameTable defaults() {
        return Holder.INSTANCE;
    }

    /**
     * Legacy to new tag map for a scope.
     *
     * @throws IllegalArgumentException for an unknown scope
     */
    public Map<String, String> forward(String scope) {
        return lookup(forward, scope);
    }

    /**
     * New to legacy tag map for a scope. Empty for scopes that only apply when upgrading.
     */
    public Map<String, String> reverse(String scope) {
        return lookup(reverse, scope);
    }

    /**
     * Renames the child sequences of {@code parent} using one scope.
     *
     * @param parent element whose children are renamed, may be null
     * @param scope  scope name
     * @param toV210 true for v2.0.2 to v2.1.0, false for the reverse
     * @return number of child sequences renamed
     */
    public int apply(StbNode parent, String scope, boolean toV210) {
        if (parent == null) {
            return 0;
        }
        Map<String, String> renames = toV210 ? forward(scope) : reverse(scope);
        int count = 0;
        for (Map.Entry<String, String> entry : renames.entrySet()) {
            if (parent.renameChildTag(entry.getKey(), entry.getValue())) {
                count++;
            }
        }
        return count;
    }

    private static Map<String, String> lookup(Map<String, Map<String, String>> tables, String scope) {
        Map<String, String> renames = tables.get(scope);
        if (renames == null) {
            throw new IllegalArgumentException("Unknown rename scope: " + scope);
        }
        return renames;
    }

    private static final class Holder {
        private static final ElementRenameTable INSTANCE =
                new ElementRenameTable(ConverterConfigHelper.loadElementRenames());
    }
}
