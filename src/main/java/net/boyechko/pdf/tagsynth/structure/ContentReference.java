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
package net.boyechko.pdf.tagsynth.structure;

/**
 * Points from a structure node into a page's content stream.
 *
 * @param page 0-based page index
 * @param mcid marked-content id, unique within one synthesis session
 */
public record ContentReference(int page, int mcid) implements StructureChild {
    public ContentReference {
        if (page < 0 || mcid < 0) {
            throw new IllegalArgumentException(
                    "Invalid content reference: page " + page + ", MCID " + mcid);
        }
    }
}
