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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role map translating custom role names onto the standard structure types.
 *
 * <p>The standard table maps H1 through H6 onto H and every other standard type onto itself.
 * Changes are additive only: an existing mapping is never overwritten or removed.
 */
public final class RoleMap {
    /** The closed set of standard structure types, in table order. */
    public static final List<String> STANDARD_TYPES =
            List.of(
                    "P", "H1", "H2", "H3", "H4", "H5", "H6", "H", "L", "LI", "Lbl", "LBody",
                    "Table", "TR", "TH", "TD", "Span", "Quote", "Note", "Reference", "BibEntry",
                    "Code", "Figure", "Formula", "Form", "Document", "Part", "Div", "Sect", "Art",
                    "BlockQuote", "Caption", "TOC", "TOCI", "Index", "NonStruct", "Private",
                    "Link", "Annot");

    private static final Set<String> STANDARD_SET = Set.copyOf(STANDARD_TYPES);

    private final LinkedHashMap<String, String> mappings = new LinkedHashMap<>();

    private RoleMap() {}

    /** A role map holding the full standard table. */
    public static RoleMap standard() {
        RoleMap map = new RoleMap();
        map.addMissingStandard();
        return map;
    }

    /** A role map seeded with existing mappings, without any standard entries added. */
    public static RoleMap of(Map<String, String> existing) {
        RoleMap map = new RoleMap();
        if (existing != null) {
            map.mappings.putAll(existing);
        }
        return map;
    }

    public static boolean isStandard(String type) {
        return type != null && STANDARD_SET.contains(type);
    }

    /** Standard target of a standard type: H for numbered headings, else the type itself. */
    public static String standardTarget(String type) {
        return type.length() == 2 && type.charAt(0) == 'H' && Character.isDigit(type.charAt(1))
                ? "H"
                : type;
    }

    /**
     * Adds every standard entry the map does not already have.
     *
     * @return the keys that were added, in table order
     */
    public List<String> addMissingStandard() {
        List<String> added = new ArrayList<>();
        for (String type : STANDARD_TYPES) {
            if (!mappings.containsKey(type)) {
                mappings.put(type, standardTarget(type));
                added.add(type);
            }
        }
        return added;
    }

    /** Adds a custom mapping unless {@code role} is already mapped. Returns true if added. */
    public boolean addIfAbsent(String role, String target) {
        return mappings.putIfAbsent(role, target) == null;
    }

    /**
     * Follows mappings from {@code type} until a standard type is reached.
     *
     * @return the standard type, or null if {@code type} is unknown or its chain loops
     */
    public String resolve(String type) {
        if (type == null || type.isBlank()) return null;
        Set<String> visited = new HashSet<>();
        String current = type;
        while (true) {
            if (!visited.add(current)) {
                return isStandard(type) ? type : null;
            }
            String target = mappings.get(current);
            if (target == null || target.equals(current)) {
                break;
            }
            current = target;
        }
        if (isStandard(current)) return current;
        // a standard type remapped onto something unknown still stands on its own
        return isStandard(type) ? type : null;
    }

    public boolean contains(String role) {
        return mappings.containsKey(role);
    }

    public String get(String role) {
        return mappings.get(role);
    }

    public Map<String, String> entries() {
        return Collections.unmodifiableMap(mappings);
    }

    public int size() {
        return mappings.size();
    }
}
