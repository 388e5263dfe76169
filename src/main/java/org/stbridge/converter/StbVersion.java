package org.stbridge.converter;

import java.util.Locale;
import java.util.Optional;

/**
 * The two ST-Bridge schema generations the converter handles.
 */
public enum StbVersion {
    V202("2.0.2"),
    V210("2.1.0");

    private final String label;

    StbVersion(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts the loose spellings found in real documents and on the command line:
     * {@code 202}, {@code 2.0}, {@code 2.0.x} map to 2.0.2 and {@code 210}, {@code 2.1}, {@code 2.1.x} to 2.1.0.
     * Case is ignored and a leading {@code v} is dropped.
     *
     * @param version version text, may be null
     * @return the matching version, or empty when unsupported
     */
    public static Optional<StbVersion> normalize(String version) {
        if (version == null) {
            return Optional.empty();
        }
        String v = version.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("v")) {
            v = v.substring(1);
        }
        if (v.equals("202") || v.equals("2.0") || v.startsWith("2.0.")) {
            return Optional.of(V202);
        }
        if (v.equals("210") || v.equals("2.1") || v.startsWith("2.1.")) {
            return Optional.of(V210);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
