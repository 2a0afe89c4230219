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

/** Optional attributes of a structure node; every field may be null. */
public record NodeAttributes(String title, String altText, String actualText, String language) {
    public static final NodeAttributes NONE = new NodeAttributes(null, null, null, null);

    public static NodeAttributes titled(String title) {
        return new NodeAttributes(title, null, null, null);
    }

    public NodeAttributes withActualText(String text) {
        return new NodeAttributes(title, altText, text, language);
    }

    public boolean isEmpty() {
        return title == null && altText == null && actualText == null && language == null;
    }
}
