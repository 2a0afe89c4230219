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
package net.boyechko.pdf.tagsynth.core;

import java.io.IOException;
import java.util.List;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import net.boyechko.pdf.tagsynth.structure.ExistingRoot;

/**
 * What a synthesis session needs from a document. Page indices are 0-based. The session never
 * reads or writes document bytes itself.
 */
public interface DocumentSource {
    int pageCount();

    /** The structure root the document already has, or null if it has none. */
    ExistingRoot existingRoot();

    /** Content elements of {@code page}, in a stable extraction order. */
    List<Element> extractElements(int page) throws IOException;

    /** Text positions of {@code page} for correlation. */
    List<TextPosition> extractPositions(int page) throws IOException;
}
