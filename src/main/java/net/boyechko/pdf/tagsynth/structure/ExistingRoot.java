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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** What a document source found where a structure tree root would be. */
public sealed interface ExistingRoot {

    /**
     * A dictionary-shaped root.
     *
     * @param roleMap its role map entries, empty if it has none
     * @param kidCount number of children already under the root
     */
    record Keyed(Map<String, String> roleMap, int kidCount) implements ExistingRoot {
        public Keyed {
            roleMap =
                    roleMap != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(roleMap))
                            : Map.of();
        }
    }

    /** A root object of some other shape, which cannot be extended safely. */
    record Unrecognized(String description) implements ExistingRoot {}

    static ExistingRoot keyed(Map<String, String> roleMap, int kidCount) {
        return new Keyed(roleMap, kidCount);
    }

    static ExistingRoot unrecognized(String description) {
        return new Unrecognized(description);
    }
}
