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
package net.boyechko.vm.optimize.engine;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DocumentParseException;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.rules.OptimizationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an ordered rule set to a domain document in a single deterministic pass.
 *
 * <p>Each rule runs exactly once, in list order, against the same mutable document; later rules
 * see the mutations of earlier ones. Running the engine again on its own output yields no
 * changes.
 */
public class TransformationEngine {
    private static final Logger logger = LoggerFactory.getLogger(TransformationEngine.class);

    private final List<OptimizationRule> rules;

    public TransformationEngine(List<OptimizationRule> rules) {
        this.rules = List.copyOf(rules);
        validateUniqueKeys();
    }

    private void validateUniqueKeys() {
        Set<RuleKey> seen = new HashSet<>();
        for (OptimizationRule rule : rules) {
            if (!seen.add(rule.key())) {
                throw new IllegalArgumentException(
                        rule.name()
                                + " uses key "
                                + rule.key().key()
                                + ", which an earlier rule in the list already uses");
            }
        }
    }

    public List<OptimizationRule> getRules() {
        return rules;
    }

    /** Transforms the document in place and returns it with the ordered changes. */
    public TransformResult transform(DomainDocument doc) {
        ChangeList all = new ChangeList();
        for (OptimizationRule rule : rules) {
            ChangeList found = rule.apply(doc);
            logger.debug("{}: {} change(s)", rule.name(), found.size());
            all.addAll(found);
        }
        logger.info("Transformation applied {} change(s)", all.size());
        return new TransformResult(doc, all);
    }

    /**
     * Parses the text and transforms the resulting document.
     *
     * @throws DocumentParseException if the text is not well-formed; no rule runs in that case
     */
    public TransformResult transform(String text) throws DocumentParseException {
        return transform(DomainDocument.parse(text));
    }
}
