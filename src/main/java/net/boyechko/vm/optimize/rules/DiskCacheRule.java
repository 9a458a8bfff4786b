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
package net.boyechko.vm.optimize.rules;

import net.boyechko.vm.optimize.change.ChangeList;
import net.boyechko.vm.optimize.change.RuleKey;
import net.boyechko.vm.optimize.document.DomainDocument;
import net.boyechko.vm.optimize.document.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sets disk drivers to {@code cache=writeback discard=unmap io=threads}. */
public class DiskCacheRule implements OptimizationRule {
    private static final Logger logger = LoggerFactory.getLogger(DiskCacheRule.class);

    static final String CACHE = "writeback";
    static final String DISCARD = "unmap";
    static final String IO = "threads";

    @Override
    public RuleKey key() {
        return RuleKey.DISK_CACHE;
    }

    @Override
    public ChangeList apply(DomainDocument doc) {
        ChangeList changes = new ChangeList();
        for (Node disk : DomainQueries.hardDisks(doc)) {
            Node driver = disk.findChild("driver");
            if (driver == null) {
                logger.debug("Skipping {}: no <driver>", disk);
                continue;
            }

            String oldCache = driver.attribute("cache", "default");
            String oldDiscard = driver.attribute("discard", "none");
            String oldIo = driver.attribute("io", "default");
            if (CACHE.equals(oldCache) && DISCARD.equals(oldDiscard) && IO.equals(oldIo)) {
                continue;
            }

            driver.setAttribute("cache", CACHE);
            driver.setAttribute("discard", DISCARD);
            driver.setAttribute("io", IO);
            changes.record(
                    key(),
                    describe(oldCache, oldDiscard, oldIo),
                    describe(CACHE, DISCARD, IO));
        }
        return changes;
    }

    private static String describe(String cache, String discard, String io) {
        return "cache=" + cache + ", discard=" + discard + ", io=" + io;
    }
}
