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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/** List of diagnostics collected by one operation or one session. */
public class DiagnosticList extends ArrayList<Diagnostic> {

    public DiagnosticList() {
        super();
    }

    public DiagnosticList(Collection<Diagnostic> diagnostics) {
        super(diagnostics != null ? diagnostics : new ArrayList<>());
    }

    public DiagnosticList(Diagnostic diagnostic) {
        super();
        if (diagnostic != null) {
            add(diagnostic);
        }
    }

    /** Convenience for building a diagnostic in place. */
    public DiagnosticList report(
            DiagnosticType type, DiagnosticSev sev, DiagnosticLoc where, String message) {
        add(new Diagnostic(type, sev, where, message));
        return this;
    }

    /** Returns true if any diagnostic has FATAL severity, meaning the session cannot continue. */
    public boolean hasFatal() {
        return stream().anyMatch(Diagnostic::isFatal);
    }

    /** Returns the diagnostics whose severity is at least {@code sev}. */
    public DiagnosticList atLeast(DiagnosticSev sev) {
        return stream()
                .filter(d -> d.severity().isAtLeast(sev))
                .collect(Collectors.toCollection(DiagnosticList::new));
    }

    /** Returns the diagnostics located on the given 0-based page. */
    public DiagnosticList forPage(int page) {
        return stream()
                .filter(d -> Objects.equals(d.where().pageIndex(), page))
                .collect(Collectors.toCollection(DiagnosticList::new));
    }

    public DiagnosticList ofType(DiagnosticType type) {
        return stream()
                .filter(d -> d.type() == type)
                .collect(Collectors.toCollection(DiagnosticList::new));
    }
}
