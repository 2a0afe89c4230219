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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Root of a synthesized structure tree, owned by one synthesis session. */
public final class StructureRoot {
    private final RoleMap roleMap;
    private final List<StructureNode> kids = new ArrayList<>();
    private final List<String> addedMappings;
    private final boolean preexisting;
    private final int preexistingKidCount;

    StructureRoot(
            RoleMap roleMap,
            List<String> addedMappings,
            boolean preexisting,
            int preexistingKidCount) {
        this.roleMap = roleMap;
        this.addedMappings = List.copyOf(addedMappings);
        this.preexisting = preexisting;
        this.preexistingKidCount = preexistingKidCount;
    }

    public RoleMap roleMap() {
        return roleMap;
    }

    /** Root-level nodes created in this session, in order. */
    public List<StructureNode> kids() {
        return Collections.unmodifiableList(kids);
    }

    /** Role map keys added by this session; every key for a fresh root. */
    public List<String> addedMappings() {
        return addedMappings;
    }

    /** True if the root extends a tree the document already had. */
    public boolean isPreexisting() {
        return preexisting;
    }

    public int preexistingKidCount() {
        return preexistingKidCount;
    }

    void appendKid(StructureNode node) {
        kids.add(node);
    }

    boolean removeKid(StructureNode node) {
        return kids.remove(node);
    }
}
