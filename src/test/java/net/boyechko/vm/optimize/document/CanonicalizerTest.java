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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.vm.optimize.DomainTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class CanonicalizerTest extends DomainTestBase {

    static List<String> fixtures() {
        return WELL_FORMED_FIXTURES;
    }

    @ParameterizedTest
    @MethodSource("fixtures")
    void canonicalFormIsFixedPoint(String fixture) throws DocumentParseException {
        String once = Canonicalizer.canonicalize(loadFixture(fixture));
        String twice = Canonicalizer.canonicalize(once);

        assertEquals(once, twice);
    }

    @Test
    void writesDeclarationIndentationAndSelfClosingTags() throws DocumentParseException {
        String input =
                "<domain type=\"kvm\"><name>a&amp;b</name>"
                        + "<devices><disk device=\"disk\" type=\"file\"></disk></devices></domain>";

        String expected =
                "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                        + "<domain type=\"kvm\">\n"
                        + "  <name>a&amp;b</name>\n"
                        + "  <devices>\n"
                        + "    <disk device=\"disk\" type=\"file\"/>\n"
                        + "  </devices>\n"
                        + "</domain>\n";
        assertEquals(expected, Canonicalizer.canonicalize(input));
    }

    @Test
    void formattingDifferencesCanonicalizeIdentically() throws DocumentParseException {
        String tight = "<?xml version=\"1.0\"?><domain><name>x</name><vcpu>2</vcpu></domain>";
        String loose = "<domain>\n\n    <name>x</name>\n\t<vcpu>2</vcpu>\n</domain>\n";

        assertEquals(Canonicalizer.canonicalize(tight), Canonicalizer.canonicalize(loose));
    }

    @Test
    void escapesAttributeValues() throws DocumentParseException {
        String canonical =
                Canonicalizer.canonicalize("<domain note=\"a &quot;b&quot; &lt;c&gt; &amp;\"/>");

        assertTrue(
                canonical.contains("note=\"a &quot;b&quot; &lt;c&gt; &amp;\""),
                "Unexpected attribute escaping: " + canonical);
    }

    @Test
    void neverSortsAttributes() throws DocumentParseException {
        String canonical = Canonicalizer.canonicalize("<domain z=\"1\" a=\"2\" m=\"3\"/>");

        assertTrue(canonical.contains("<domain z=\"1\" a=\"2\" m=\"3\"/>"));
    }

    @Test
    void dropsComments() throws DocumentParseException {
        String canonical =
                Canonicalizer.canonicalize(
                        "<domain><!-- managed by boxes --><name>x</name></domain>");

        assertFalse(canonical.contains("managed by boxes"));
    }
}
