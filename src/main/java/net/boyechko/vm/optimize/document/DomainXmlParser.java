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

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Builds a {@link DomainDocument} from XML text using a SAX parser.
 *
 * <p>SAX reports attributes in the order they were written, which DOM does not guarantee; that
 * order is what the canonical form preserves. Namespace processing is off, so prefixed tags and
 * {@code xmlns:*} declarations are kept verbatim. Comments are dropped, and text interleaved
 * with child elements is joined and kept ahead of the children, so mixed content does not
 * round-trip.
 */
final class DomainXmlParser {
    private static final Logger logger = LoggerFactory.getLogger(DomainXmlParser.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private DomainXmlParser() {}

    static DomainDocument parse(String text) throws DocumentParseException {
        if (text == null) {
            throw new DocumentParseException("No document text supplied");
        }
        String source =
                !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;

        TreeBuilder builder = new TreeBuilder();
        try {
            newParser().parse(new InputSource(new StringReader(source)), builder);
        } catch (SAXParseException e) {
            throw new DocumentParseException(
                    "Malformed domain XML: " + e.getMessage(),
                    e.getLineNumber(),
                    e.getColumnNumber(),
                    e);
        } catch (SAXException | IOException e) {
            throw new DocumentParseException("Malformed domain XML: " + e.getMessage(), e);
        }

        if (builder.root == null) {
            throw new DocumentParseException("Domain XML has no root element");
        }
        logger.debug("Parsed <{}> document", builder.root.tag());
        return new DomainDocument(builder.root);
    }

    private static SAXParser newParser() {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            return factory.newSAXParser();
        } catch (ParserConfigurationException | SAXException e) {
            throw new IllegalStateException(
                    "XML parser cannot be configured: " + e.getMessage(), e);
        }
    }

    /** Assembles nodes from SAX events. */
    private static final class TreeBuilder extends DefaultHandler {
        private final Deque<Node> open = new ArrayDeque<>();
        private final Deque<StringBuilder> openText = new ArrayDeque<>();
        private Node root;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attrs) {
            Node node = new Node(qName);
            for (int i = 0; i < attrs.getLength(); i++) {
                node.setAttribute(attrs.getQName(i), attrs.getValue(i));
            }
            if (open.isEmpty()) {
                root = node;
            } else {
                open.peek().appendChild(node);
            }
            open.push(node);
            openText.push(new StringBuilder());
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (!openText.isEmpty()) {
                openText.peek().append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            Node node = open.pop();
            String raw = openText.pop().toString();
            if (raw.isBlank()) {
                return;
            }
            // Text around child elements is layout; only leaf text is kept verbatim.
            node.setText(node.children().isEmpty() ? raw : raw.strip());
        }
    }
}
