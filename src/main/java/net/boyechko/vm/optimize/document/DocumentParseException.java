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

/** Thrown when domain XML is not well-formed. No partial document is produced. */
public class DocumentParseException extends Exception {
    private final int line;
    private final int column;

    public DocumentParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    public DocumentParseException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    public DocumentParseException(String message) {
        this(message, -1, -1, null);
    }

    /** Line of the malformed region, or -1 if unknown. */
    public int line() {
        return line;
    }

    /** Column of the malformed region, or -1 if unknown. */
    public int column() {
        return column;
    }

    @Override
    public String getMessage() {
        if (line < 0) {
            return super.getMessage();
        }
        return super.getMessage() + " (line " + line + ", column " + column + ")";
    }
}
