/*
 * VM-Optimize - Performance Tuning for libvirt Domain Configurations
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.vm.optimize.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * An element of a domain document: a tag, attributes in authored order, ordered children and
 * optional inline text.
 *
 * <p>Attribute keys are unique; setting an existing attribute replaces its value in place, so the
 * attribute keeps its original position. New attributes are appended.
 */
public final class Node {
    private final String tag;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();
    private String text;
    private Node parent;

    public Node(String tag) {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Node tag must not be empty");
        }
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean hasTag(String name) {
        return tag.equals(name);
    }

    /** Returns the parent node, or null for the document root and detached nodes. */
    public Node parent() {
        return parent;
    }

    // == Attributes ===================================================

    /** Returns the attribute value, or null if the attribute is absent. */
    public String attribute(String name) {
        return attributes.get(name);
    }

    /** Returns the attribute value, or {@code fallback} if the attribute is absent. */
    public String attribute(String name, String fallback) {
        String value = attributes.get(name);
        return value != null ? value : fallback;
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    public Node setAttribute(String name, String value) {
        Objects.requireNonNull(name, "attribute name");
        Objects.requireNonNull(value, "attribute value");
        attributes.put(name, value);
        return this;
    }

    public String removeAttribute(String name) {
        return attributes.remove(name);
    }

    /** Read-only view of the attributes in authored order. */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    // == Text =========================================================

    /** Returns the inline text, or null if the element has none. */
    public String text() {
        return text;
    }

    public Node setText(String text) {
        this.text = text;
        return this;
    }

    // == Children =====================================================

    /** Read-only view of the children in document order. */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /** Returns the first direct child with the given tag, or null if there is none. */
    public Node findChild(String childTag) {
        for (Node child : children) {
            if (child.hasTag(childTag)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Returns all descendants matching the predicate, depth-first in document order. The node
     * itself is not considered.
     */
    public List<Node> findDescendants(Predicate<Node> predicate) {
        List<Node> found = new ArrayList<>();
        collectDescendants(predicate, found);
        return found;
    }

    private void collectDescendants(Predicate<Node> predicate, List<Node> found) {
        for (Node child : children) {
            if (predicate.test(child)) {
                found.add(child);
            }
            child.collectDescendants(predicate, found);
        }
    }

    /** Appends the child as the last child of this node and returns it. */
    public Node appendChild(Node child) {
        adopt(child);
        children.add(child);
        return child;
    }

    /** Inserts {@code child} directly after {@code reference}, a child of this node. */
    public Node insertChildAfter(Node reference, Node child) {
        int index = indexOf(reference);
        if (index < 0) {
            throw new IllegalArgumentException(
                    "<" + reference.tag() + "> is not a child of <" + tag + ">");
        }
        adopt(child);
        children.add(index + 1, child);
        return child;
    }

    /** Detaches this node from its parent. Returns false if it had no parent. */
    public boolean remove() {
        if (parent == null) {
            return false;
        }
        parent.children.remove(parent.indexOf(this));
        parent = null;
        return true;
    }

    /** Returns a detached copy of this node and its subtree. */
    public Node deepCopy() {
        Node copy = new Node(tag);
        copy.attributes.putAll(attributes);
        copy.text = text;
        for (Node child : children) {
            copy.appendChild(child.deepCopy());
        }
        return copy;
    }

    private void adopt(Node child) {
        Objects.requireNonNull(child, "child");
        if (child.parent != null) {
            throw new IllegalArgumentException("<" + child.tag() + "> already has a parent");
        }
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new IllegalArgumentException("Cannot make a node its own descendant");
            }
        }
        child.parent = this;
    }

    private int indexOf(Node node) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /** Returns a tag-and-attributes summary such as {@code <target dev="hda" bus="ide">}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<").append(tag);
        attributes.forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(v).append('"'));
        return sb.append('>').toString();
    }
}
