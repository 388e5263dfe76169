package org.stbridge.converter.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One ST-Bridge element: an attribute bag, named child sequences and optional text.
 * <p>
 * A node does not know its own tag. The tag is the key under which the parent stores it,
 * the same way the attribute-centric XML object model does. Siblings sharing a tag form one
 * ordered sequence.
 */
public final class StbNode {

    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, List<StbNode>> children = new LinkedHashMap<>();
    private String text;

    public StbNode() {
    }

    public StbNode(Map<String, String> attributes) {
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    // ------- attributes

    public String attr(String name) {
        return attributes.get(name);
    }

    public boolean hasAttr(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Sets an attribute. A null value removes it.
     */
    public StbNode setAttr(String name, String value) {
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        return this;
    }

    /**
     * Sets the attribute only when it is absent or empty.
     *
     * @return true when the value was written
     */
    public boolean setAttrIfAbsent(String name, String value) {
        String current = attributes.get(name);
        if (current == null || current.isEmpty()) {
            attributes.put(name, value);
            return true;
        }
        return false;
    }

    public String removeAttr(String name) {
        return attributes.remove(name);
    }

    /**
     * Live view of the attribute bag.
     */
    public Map<String, String> attributes() {
        return attributes;
    }

    // ------- children

    /**
     * Returns the live child sequence for a tag, or an empty immutable list when absent.
     */
    public List<StbNode> children(String tag) {
        List<StbNode> list = children.get(tag);
        return list == null ? List.of() : list;
    }

    /**
     * First child with the given tag, or null.
     */
    public StbNode child(String tag) {
        List<StbNode> list = children.get(tag);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    public boolean hasChild(String tag) {
        List<StbNode> list = children.get(tag);
        return list != null && !list.isEmpty();
    }

    public StbNode addChild(String tag, StbNode child) {
        children.computeIfAbsent(tag, k -> new ArrayList<>()).add(child);
        return child;
    }

    /**
     * Returns the first child with the tag, creating an empty one when absent.
     */
    public StbNode getOrCreateChild(String tag) {
        StbNode existing = child(tag);
        return existing != null ? existing : addChild(tag, new StbNode());
    }

    /**
     * Replaces the whole sequence for a tag. An empty or null list removes the key.
     */
    public void setChildren(String tag, List<StbNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            children.remove(tag);
        } else {
            children.put(tag, new ArrayList<>(nodes));
        }
    }

    /**
     * Removes a child sequence.
     *
     * @return the removed nodes, empty if the tag was absent
     */
    public List<StbNode> removeChildren(String tag) {
        List<StbNode> removed = children.remove(tag);
        return removed == null ? List.of() : removed;
    }

    public Set<String> childTags() {
        return Collections.unmodifiableSet(children.keySet());
    }

    /**
     * Live view of the tag to sequence mapping, in document order of first appearance.
     */
    public Map<String, List<StbNode>> childMap() {
        return children;
    }

    public boolean hasChildren() {
        return children.values().stream().anyMatch(list -> !list.isEmpty());
    }

    /**
     * Moves the sequence stored under {@code oldTag} to {@code newTag}, keeping its position among the
     * other child sequences. When {@code newTag} already exists the moved nodes are appended to it.
     *
     * @return true when something was moved
     */
    public boolean renameChildTag(String oldTag, String newTag) {
        if (oldTag.equals(newTag) || !children.containsKey(oldTag)) {
            return false;
        }
        List<StbNode> moved = children.get(oldTag);
        if (children.containsKey(newTag)) {
            children.get(newTag).addAll(moved);
            children.remove(oldTag);
            return true;
        }
        Map<String, List<StbNode>> reordered = new LinkedHashMap<>();
        children.forEach((tag, list) -> reordered.put(tag.equals(oldTag) ? newTag : tag, list));
        children.clear();
        children.putAll(reordered);
        return true;
    }

    // ------- text

    public String text() {
        return text;
    }

    public StbNode setText(String text) {
        this.text = text;
        return this;
    }

    /**
     * Fully independent copy: no list, map or node is shared with this node.
     */
    public StbNode deepCopy() {
        StbNode copy = new StbNode(attributes);
        copy.text = text;
        children.forEach((tag, list) -> {
            List<StbNode> copied = new ArrayList<>(list.size());
            list.forEach(node -> copied.add(node.deepCopy()));
            copy.children.put(tag, copied);
        });
        return copy;
    }

    /**
     * Structural equality: same attributes (order ignored), same text, same child sequences per tag
     * (sequence order significant, tag order ignored). Empty sequences count as absent.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StbNode other)) {
            return false;
        }
        return attributes.equals(other.attributes)
                && Objects.equals(text, other.text)
                && nonEmptyChildren().equals(other.nonEmptyChildren());
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, text, nonEmptyChildren());
    }

    private Map<String, List<StbNode>> nonEmptyChildren() {
        Map<String, List<StbNode>> result = new LinkedHashMap<>();
        children.forEach((tag, list) -> {
            if (!list.isEmpty()) {
                result.put(tag, list);
            }
        });
        return result;
    }

    @Override
    public String toString() {
        return "StbNode{attributes=" + attributes + ", children=" + children.keySet() + "}";
    }
}
