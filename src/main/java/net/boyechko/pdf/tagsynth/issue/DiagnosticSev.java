/*
 * PDF-TagSynth - Accessibility Structure-Tree Synthesis
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
package net.boyechko.pdf.tagsynth.issue;

/** Severity of a diagnostic, from least to most serious. */
public enum DiagnosticSev {
    /** Informational; nothing went wrong. */
    INFO,
    /** One unit of work (a page, a node) was skipped; the session continues. */
    WARNING,
    /** An operation failed; the caller decides whether the partial result is usable. */
    ERROR,
    /** The session cannot continue. */
    FATAL;

    public boolean isAtLeast(DiagnosticSev other) {
        return this.ordinal() >= other.ordinal();
    }
}
