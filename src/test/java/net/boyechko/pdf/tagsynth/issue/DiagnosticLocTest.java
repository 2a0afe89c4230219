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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class DiagnosticLocTest {

    @Test
    void pageIndexIsReportedForPageScopedLocations() {
        assertEquals(Integer.valueOf(2), DiagnosticLoc.atPage(2).pageIndex());
        assertEquals(Integer.valueOf(0), DiagnosticLoc.atElement(0, "text_0_1").pageIndex());
        assertEquals(Integer.valueOf(3), DiagnosticLoc.atMcid(3, 7).pageIndex());
        assertNull(DiagnosticLoc.atNode(4, "P").pageIndex());
        assertNull(DiagnosticLoc.none().pageIndex());
    }

    @Test
    void describeUsesOneBasedPages() {
        assertEquals(" (page 3, MCID 7)", DiagnosticLoc.atMcid(2, 7).describe());
        assertEquals(" (page 1, text_0_1)", DiagnosticLoc.atElement(0, "text_0_1").describe());
        assertEquals(" (node #4 P)", DiagnosticLoc.atNode(4, "P").describe());
        assertEquals("", DiagnosticLoc.none().describe());
    }

    @Test
    void forPageFiltersOnPageIndex() {
        DiagnosticList diagnostics = new DiagnosticList();
        diagnostics.add(
                new Diagnostic(
                        DiagnosticType.ROOT_INIT_FAILED,
                        DiagnosticSev.WARNING,
                        DiagnosticLoc.atPage(1),
                        "on page two"));
        diagnostics.add(
                new Diagnostic(
                        DiagnosticType.ROOT_INIT_FAILED,
                        DiagnosticSev.WARNING,
                        DiagnosticLoc.atNode(1, "P"),
                        "no page"));

        assertEquals(1, diagnostics.forPage(1).size());
        assertEquals("on page two", diagnostics.forPage(1).get(0).message());
        assertTrue(diagnostics.forPage(0).isEmpty());
    }
}
