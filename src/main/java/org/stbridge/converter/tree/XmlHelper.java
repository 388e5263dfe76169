package org.stbridge.converter.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Absence-tolerant navigation over {@link StbNode} trees.
 */
public class XmlHelper {

    public static final String MODEL = "StbModel";
    public static final String COMMON = "StbCommon";
    public static final String SECTIONS = "StbSections";
    public static final String MEMBERS = "StbMembers";

    private XmlHelper() {
    }

    /**
     * Returns the root element when the document carries one of the accepted ST-Bridge root tags.
     *
     * @param document the document, may be null
     * @return the root node, or empty when the document is null or its root tag is not recognized
     */
    public static Optional<StbNode> getRoot(StbDocument document) {
        if (document == null || !document.hasRecognizedRoot()) {
            return Optional.empty();
        }
        return Optional.of(document.getRootNode());
    }

    public static Optional<StbNode> getModel(StbDocument document) {
        return getRoot(document).map(root -> root.child(MODEL));
    }

    public static Optional<StbNode> getSections(StbDocument document) {
        return getModel(document).map(model -> model.child(SECTIONS));
    }

    public static Optional<StbNode> getMembers(StbDocument document) {
        return getModel(document).map(model -> model.child(MEMBERS));
    }

    /**
     * The document-level {@code StbCommon}, a direct child of the root.
     */
    public static Optional<StbNode> getCommon(StbDocument document) {
        return getRoot(document).map(root -> root.child(COMMON));
    }

    /**
     * Descends from {@code start} through the first node of every intermediate segment and returns
     * the full sequence stored under the last segment.
     *
     * @param start node to start from, may be null
     * @param path  tag names, at least one
     * @return the live sequence at the last segment, or empty when any hop is absent
     */
    public static Optional<List<StbNode>> navigate(StbNode start, String... path) {
        if (start == null || path == null || path.length == 0) {
            return Optional.empty();
        }
        StbNode current = start;
        for (int i = 0; i < path.length - 1; i++) {
            current = current.child(path[i]);
            if (current == null) {
                return Optional.empty();
            }
        }
        List<StbNode> result = current.children(path[path.length - 1]);
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    /**
     * Same as {@link #navigate(StbNode, String...)} starting at the document root.
     */
    public static Optional<List<StbNode>> navigate(StbDocument document, String... path) {
        return getRoot(document).flatMap(root -> navigate(root, path));
    }

    /**
     * Sequence at the path, or an empty list when anything along the way is absent.
     */
    public static List<StbNode> all(StbNode start, String... path) {
        return navigate(start, path).orElse(List.of());
    }

    /**
     * First node of the sequence at the path.
     */
    public static Optional<StbNode> first(StbNode start, String... path) {
        return navigate(start, path).map(list -> list.get(0));
    }

    /**
     * Fans out along the path: every node of every intermediate sequence is descended into.
     *
     * @param start node to start from, may be null
     * @param path  tag names
     * @return all nodes reached at the last segment, in document order
     */
    public static List<StbNode> collect(StbNode start, String... path) {
        List<StbNode> current = start == null ? List.of() : List.of(start);
        for (String tag : path) {
            List<StbNode> next = new ArrayList<>();
            current.forEach(node -> next.addAll(node.children(tag)));
            current = next;
        }
        return current;
    }

    /**
     * Visits every node below {@code start}, depth first. The start node itself is not visited.
     * The visitor may change attributes but must not add or remove children.
     */
    public static void forEachDescendant(StbNode start, Consumer<StbNode> visitor) {
        if (start == null) {
            return;
        }
        for (List<StbNode> list : start.childMap().values()) {
            for (StbNode child : list) {
                visitor.accept(child);
                forEachDescendant(child, visitor);
            }
        }
    }

    /**
     * Drops the children under {@code tag} that match the predicate. The key goes away when nothing is left.
     *
     * @return number of children removed
     */
    public static int removeChildrenIf(StbNode parent, String tag, Predicate<StbNode> predicate) {
        if (parent == null || !parent.hasChild(tag)) {
            return 0;
        }
        List<StbNode> kept = new ArrayList<>();
        int removed = 0;
        for (StbNode child : parent.children(tag)) {
            if (predicate.test(child)) {
                removed++;
            } else {
                kept.add(child);
            }
        }
        if (removed > 0) {
            parent.setChildren(tag, kept);
        }
        return removed;
    }

    /**
     * Removes every listed attribute present on the node.
     *
     * @return number of attributes removed
     */
    public static int removeAttrs(StbNode node, Iterable<String> names) {
        int count = 0;
        for (String name : names) {
            if (node.removeAttr(name) != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Moves a child sequence to a new tag. No-op when the node or the old tag is absent.
     *
     * @return true when a sequence was moved
     */
    public static boolean renameChildTag(StbNode node, String oldTag, String newTag) {
        return node != null && node.renameChildTag(oldTag, newTag);
    }

    /**
     * Produces a fully independent copy of the document.
     */
    public static StbDocument cloneDocument(StbDocument document) {
        return document == null ? null : document.deepCopy();
    }

    /**
     * Parses a numeric attribute value.
     *
     * @return the value, or NaN when missing or not a number
     */
    public static double number(String value) {
        if (value == null || value.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    /**
     * True when the attribute value is numerically zero ("0", "0.0", ...).
     */
    public static boolean isZero(String value) {
        return number(value) == 0.0;
    }
}
