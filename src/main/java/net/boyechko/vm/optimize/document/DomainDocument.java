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
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * In-memory form of a libvirt domain descriptor. The tree is mutated in place by the
 * transformation engine and discarded after canonicalization.
 */
public final class DomainDocument {
    private final Node root;

    public DomainDocument(Node root) {
        this.root = Objects.requireNonNull(root, "root");
        if (root.parent() != null) {
            throw new IllegalArgumentException("Document root must not have a parent");
        }
    }

    /**
     * Parses well-formed XML text.
     *
     * @throws DocumentParseException if the text is not well-formed XML
     */
    public static DomainDocument parse(String text) throws DocumentParseException {
        return DomainXmlParser.parse(text);
    }

    public Node root() {
        return root;
    }

    /** Returns every element with the given tag, the root included, in document order. */
    public List<Node> findAll(String tag) {
        return findAll(node -> node.hasTag(tag));
    }

    /** Returns every element matching the predicate, the root included, in document order. */
    public List<Node> findAll(Predicate<Node> predicate) {
        List<Node> found = new ArrayList<>();
        if (predicate.test(root)) {
            found.add(root);
        }
        found.addAll(root.findDescendants(predicate));
        return found;
    }

    /** Returns the first direct child of the root with the given tag, or null. */
    public Node findTopLevel(String tag) {
        return root.findChild(tag);
    }

    public String serialize(boolean pretty) {
        return DomainXmlWriter.write(this, pretty);
    }

    /** Returns an independent copy of the whole tree. */
    public DomainDocument copy() {
        return new DomainDocument(root.deepCopy());
    }

    @Override
    public String toString() {
        return "DomainDocument" + root;
    }
}
