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

/** Kind of a diagnostic raised while synthesizing a structure tree. */
public enum DiagnosticType {
    // Session-level (usually fatal)
    ROOT_INIT_FAILED("structure root initialisation failures"),
    UNRECOGNIZED_ROOT("existing structure roots in an unrecognized shape"),
    ROOT_NOT_INITIALIZED("operations attempted before root initialisation"),
    SESSION_CANCELLED("cancelled sessions"),

    // Tree building
    ROLE_MAP_EXTENDED("standard role mappings added to an existing role map"),
    UNKNOWN_ROLE("nodes with unknown roles"),
    INVALID_ATTACH("rejected attach operations"),
    UNKNOWN_PARENT("batch entries with unknown parent ids"),
    NODE_CREATION_FAILED("nodes that could not be created"),
    ROLE_FALLBACK("elements tagged with a fallback role"),

    // Elements and sidecar
    BLANK_ELEMENT_SKIPPED("blank text elements skipped"),
    ELEMENT_EXTRACTION_FAILED("pages whose elements could not be extracted"),
    SIDECAR_ENTRY_IGNORED("sidecar entries that could not be read"),

    // Correlation and output
    CONTENT_STREAM_UNREADABLE("pages with unreadable content streams"),
    CORRELATION_MISS("text runs with no matching element"),
    REFERENCE_NOT_MARKED("content references that could not be marked in the page content"),
    METADATA_UPDATED("document metadata updates");

    private final String groupLabel;

    DiagnosticType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
