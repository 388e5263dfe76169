package org.stbridge.converter.tree;

import java.util.List;
import java.util.Objects;

/**
 * A parsed ST-Bridge document: the root element node together with the tag it was read under.
 * Both {@code ST-Bridge} and {@code ST_BRIDGE} are accepted as the root tag; converters always
 * produce the canonical {@code ST-Bridge} spelling.
 */
public final class StbDocument {

    public static final String CANONICAL_ROOT_TAG = "ST-Bridge";
    public static final String LEGACY_ROOT_TAG = "ST_BRIDGE";
    public static final List<String> ROOT_TAGS = List.of(CANONICAL_ROOT_TAG, LEGACY_ROOT_TAG);

    private String rootTag;
    private final StbNode root;

    public StbDocument(String rootTag, StbNode root) {
        this.rootTag = Objects.requireNonNull(rootTag, "rootTag");
        this.root = root;
    }

    /**
     * Creates a document with the canonical root tag.
     */
    public static StbDocument of(StbNode root) {
        return new StbDocument(CANONICAL_ROOT_TAG, root);
    }

    public String getRootTag() {
        return rootTag;
    }

    /**
     * Root node as stored, regardless of whether the tag is a recognized ST-Bridge spelling.
     * Use {@link XmlHelper#getRoot(StbDocument)} for the checked lookup.
     */
    public StbNode getRootNode() {
        return root;
    }

    public boolean hasRecognizedRoot() {
        return root != null && ROOT_TAGS.contains(rootTag);
    }

    public void canonicalizeRootTag() {
        if (hasRecognizedRoot()) {
            rootTag = CANONICAL_ROOT_TAG;
        }
    }

    public StbDocument deepCopy() {
        return new StbDocument(rootTag, root == null ? null : root.deepCopy());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StbDocument other)) {
            return false;
        }
        return rootTag.equals(other.rootTag) && Objects.equals(root, other.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootTag, root);
    }
}
