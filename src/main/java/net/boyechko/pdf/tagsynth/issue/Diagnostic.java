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

/** Something worth reporting that happened during synthesis. */
public record Diagnostic(
        DiagnosticType type, DiagnosticSev severity, DiagnosticLoc where, String message) {

    public Diagnostic {
        if (type == null || severity == null) {
            throw new IllegalArgumentException("Diagnostic type and severity are required");
        }
        where = where != null ? where : DiagnosticLoc.none();
    }

    public Diagnostic(DiagnosticType type, DiagnosticSev severity, String message) {
        this(type, severity, DiagnosticLoc.none(), message);
    }

    public boolean isFatal() {
        return severity == DiagnosticSev.FATAL;
    }

    @Override
    public String toString() {
        return severity + " " + type + ": " + message + where.describe();
    }
}
