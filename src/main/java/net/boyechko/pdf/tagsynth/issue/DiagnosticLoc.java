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

/** Where a diagnostic applies. Page indices are 0-based. */
public sealed interface DiagnosticLoc {
    record None() implements DiagnosticLoc {}

    record AtPage(int page) implements DiagnosticLoc {}

    record AtElement(int page, String elementId) implements DiagnosticLoc {}

    record AtNode(int nodeId, String type) implements DiagnosticLoc {}

    record AtMcid(int page, int mcid) implements DiagnosticLoc {}

    static DiagnosticLoc none() {
        return new None();
    }

    static DiagnosticLoc atPage(int page) {
        return new AtPage(page);
    }

    static DiagnosticLoc atElement(int page, String elementId) {
        return new AtElement(page, elementId);
    }

    static DiagnosticLoc atNode(int nodeId, String type) {
        return new AtNode(nodeId, type);
    }

    static DiagnosticLoc atMcid(int page, int mcid) {
        return new AtMcid(page, mcid);
    }

    /** Returns the page index if available, null otherwise. */
    default Integer pageIndex() {
        if (this instanceof AtPage p) {
            return p.page();
        } else if (this instanceof AtElement e) {
            return e.page();
        } else if (this instanceof AtMcid m) {
            return m.page();
        }
        return null;
    }

    /** Short human-readable suffix, e.g. {@code " (page 2, text_1_0)"}; empty for none. */
    default String describe() {
        if (this instanceof AtPage p) {
            return " (page " + (p.page() + 1) + ")";
        } else if (this instanceof AtElement e) {
            return " (page " + (e.page() + 1) + ", " + e.elementId() + ")";
        } else if (this instanceof AtNode n) {
            return " (node #" + n.nodeId() + " " + n.type() + ")";
        } else if (this instanceof AtMcid m) {
            return " (page " + (m.page() + 1) + ", MCID " + m.mcid() + ")";
        }
        return "";
    }
}
