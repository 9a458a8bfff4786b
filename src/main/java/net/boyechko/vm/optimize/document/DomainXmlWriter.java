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

import java.util.Map;

/** Serializes a {@link DomainDocument} back to XML text. */
public final class DomainXmlWriter {
    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private static final String INDENT = "  ";

    private DomainXmlWriter() {}

    /**
     * Writes the document as XML.
     *
     * @param pretty if true, one element per line with two-space indentation and a trailing
     *     newline; otherwise no whitespace is added between elements
     */
    public static String write(DomainDocument doc, boolean pretty) {
        StringBuilder out = new StringBuilder();
        out.append(DECLARATION);
        if (pretty) {
            out.append('\n');
        }
        writeNode(doc.root(), 0, pretty, out);
        return out.toString();
    }

    private static void writeNode(Node node, int depth, boolean pretty, StringBuilder out) {
        if (pretty) {
            out.append(INDENT.repeat(depth));
        }
        out.append('<').append(node.tag());
        for (Map.Entry<String, String> attr : node.attributes().entrySet()) {
            out.append(' ')
                    .append(attr.getKey())
                    .append("=\"")
                    .append(escapeAttribute(attr.getValue()))
                    .append('"');
        }

        boolean hasText = node.text() != null;
        if (node.children().isEmpty()) {
            if (hasText) {
                out.append('>').append(escapeText(node.text()));
                out.append("</").append(node.tag()).append('>');
            } else {
                out.append("/>");
            }
            if (pretty) {
                out.append('\n');
            }
            return;
        }

        out.append('>');
        if (pretty) {
            out.append('\n');
        }
        if (hasText) {
            if (pretty) {
                out.append(INDENT.repeat(depth + 1));
            }
            out.append(escapeText(node.text()));
            if (pretty) {
                out.append('\n');
            }
        }
        for (Node child : node.children()) {
            writeNode(child, depth + 1, pretty, out);
        }
        if (pretty) {
            out.append(INDENT.repeat(depth));
        }
        out.append("</").append(node.tag()).append('>');
        if (pretty) {
            out.append('\n');
        }
    }

    static String escapeText(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '\r' -> sb.append("&#13;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeAttribute(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                // Attribute-value normalization would turn raw whitespace into spaces
                case '\n' -> sb.append("&#10;");
                case '\r' -> sb.append("&#13;");
                case '\t' -> sb.append("&#9;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
