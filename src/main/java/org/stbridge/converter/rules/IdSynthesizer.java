package org.stbridge.converter.rules;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hands out numeric identifiers that do not collide with ids already present in a document.
 * <p>
 * {@link #reserve(Iterable)} moves the counter past the largest numeric id found in the document.
 * Ids taken verbatim are recorded with {@link #claim(String)}. {@link #next()} then returns the counter
 * value, skipping ids consumed earlier in the same run.
 */
public class IdSynthesizer {

    private static final Pattern NUMERIC = Pattern.compile("\\d{1,18}");

    private final Set<String> used = new HashSet<>();
    private long counter = 1;

    public void reserve(Iterable<String> existingIds) {
        for (String id : existingIds) {
            if (id == null) {
                continue;
            }
            String trimmed = id.trim();
            if (NUMERIC.matcher(trimmed).matches()) {
                long numeric = Long.parseLong(trimmed);
                if (numeric >= counter) {
                    counter = numeric + 1;
                }
            }
        }
    }

    public boolean isUsed(String id) {
        return used.contains(id);
    }

    /**
     * Records an id taken verbatim from the document.
     *
     * @return false when the id was already taken
     */
    public boolean claim(String id) {
        return used.add(id);
    }

    public String next() {
        while (used.contains(String.valueOf(counter))) {
            counter++;
        }
        String id = String.valueOf(counter++);
        used.add(id);
        return id;
    }
}
