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
package net.boyechko.pdf.tagsynth.composite;

import java.util.List;

/** Declarative description of a table subtree. */
public record TableSpec(
        String title, int rows, int cols, List<String> headers, boolean hasHeaderRow) {

    public TableSpec {
        headers = headers != null ? List.copyOf(headers) : List.of();
    }

    public static TableSpec withHeaders(int rows, int cols, List<String> headers) {
        return new TableSpec("Table", rows, cols, headers, true);
    }
}
