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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RoleMapTest {

    @Test
    void standardTableMapsNumberedHeadingsOntoH() {
        RoleMap map = RoleMap.standard();

        assertEquals(RoleMap.STANDARD_TYPES.size(), map.size());
        assertEquals("H", map.get("H1"));
        assertEquals("H", map.get("H6"));
        assertEquals("Table", map.get("Table"));
        assertEquals("LBody", map.get("LBody"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"H1", "H2", "H3", "H4", "H5", "H6", "H"})
    void headingsResolveToH(String heading) {
        assertEquals("H", RoleMap.standard().resolve(heading));
        assertTrue(RoleMap.isStandard(heading));
    }

    @Test
    void resolveFollowsCustomChains() {
        RoleMap map = RoleMap.standard();
        map.addIfAbsent("Heading", "Title");
        map.addIfAbsent("Title", "H1");

        assertEquals("H", map.resolve("Heading"));
        assertEquals("P", map.resolve("P"));
    }

    @Test
    void resolveRejectsUnknownAndLoopingRoles() {
        RoleMap map = RoleMap.of(Map.of("A", "B", "B", "A"));

        assertNull(map.resolve("Banner"));
        assertNull(map.resolve("A"));
        assertNull(map.resolve(" "));
        assertNull(map.resolve(null));
    }

    @Test
    void standardTypeRemappedToUnknownStillResolves() {
        RoleMap map = RoleMap.of(Map.of("P", "Para"));

        assertEquals("P", map.resolve("P"));
    }

    @Test
    void addMissingStandardKeepsExistingMappings() {
        RoleMap map = RoleMap.of(Map.of("H1", "Heading1Custom", "Chapter", "Sect"));

        List<String> added = map.addMissingStandard();

        assertFalse(added.contains("H1"));
        assertTrue(added.contains("H2"));
        assertEquals("Heading1Custom", map.get("H1"));
        assertEquals("Sect", map.get("Chapter"));
        assertEquals(RoleMap.STANDARD_TYPES.size() - 1, added.size());
    }

    @Test
    void addIfAbsentNeverOverwrites() {
        RoleMap map = RoleMap.standard();

        assertFalse(map.addIfAbsent("P", "Span"));
        assertEquals("P", map.get("P"));
        assertTrue(map.addIfAbsent("Sidebar", "Aside"));
    }
}
