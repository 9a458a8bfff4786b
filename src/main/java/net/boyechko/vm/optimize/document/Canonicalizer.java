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

/**
 * Produces the canonical text of a domain document: one declaration line, two-space indentation,
 * attributes in authored order. The same document always yields byte-identical text, so diffs
 * between two canonical forms show only genuine changes.
 */
public final class Canonicalizer {

    private Canonicalizer() {}

    public static String canonicalize(DomainDocument doc) {
        return DomainXmlWriter.write(doc, true);
    }

    /** Parses the text and returns its canonical form. */
    public static String canonicalize(String text) throws DocumentParseException {
        return canonicalize(DomainDocument.parse(text));
    }
}
