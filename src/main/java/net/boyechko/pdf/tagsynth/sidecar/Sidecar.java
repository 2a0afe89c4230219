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
package net.boyechko.pdf.tagsynth.sidecar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import net.boyechko.pdf.tagsynth.composite.ListSpec;
import net.boyechko.pdf.tagsynth.composite.TableSpec;
import net.boyechko.pdf.tagsynth.model.SidecarOverride;

/**
 * In-memory form of the sidecar: document metadata plus, per 0-based page, the user's overrides
 * keyed by element id (in insertion order) and any declared tables and lists.
 */
public final class Sidecar {
    public static final String DEFAULT_LANGUAGE = "en-US";

    /** Document-level metadata. Any field may be null when the sidecar does not set it. */
    public record DocumentMeta(String title, String language, boolean tagged) {
        public static DocumentMeta initial() {
            return new DocumentMeta("", DEFAULT_LANGUAGE, false);
        }

        public DocumentMeta withTagged(boolean isTagged) {
            return new DocumentMeta(title, language, isTagged);
        }
    }

    /** Everything the sidecar records for one page. */
    static final class PageEntry {
        final LinkedHashMap<String, SidecarOverride> overrides = new LinkedHashMap<>();
        final List<TableSpec> tables = new ArrayList<>();
        final List<ListSpec> lists = new ArrayList<>();

        boolean isEmpty() {
            return overrides.isEmpty() && tables.isEmpty() && lists.isEmpty();
        }
    }

    private DocumentMeta document;
    private final TreeMap<Integer, PageEntry> pages = new TreeMap<>();

    public Sidecar(DocumentMeta document) {
        this.document = document != null ? document : DocumentMeta.initial();
    }

    public Sidecar() {
        this(DocumentMeta.initial());
    }

    /** The skeleton written for a document that has never been edited. */
    public static Sidecar initial(int pageCount) {
        Sidecar sidecar = new Sidecar(DocumentMeta.initial());
        for (int page = 0; page < pageCount; page++) {
            sidecar.page(page);
        }
        return sidecar;
    }

    public DocumentMeta document() {
        return document;
    }

    public void setDocument(DocumentMeta document) {
        this.document = document != null ? document : DocumentMeta.initial();
    }

    /** Page indices present in the sidecar, ascending. */
    public Set<Integer> pageIndices() {
        return Collections.unmodifiableSet(pages.keySet());
    }

    /** Overrides for {@code page} keyed by element id, in insertion order; empty if none. */
    public Map<String, SidecarOverride> overridesFor(int page) {
        PageEntry entry = pages.get(page);
        return entry != null ? Collections.unmodifiableMap(entry.overrides) : Map.of();
    }

    public List<TableSpec> tablesFor(int page) {
        PageEntry entry = pages.get(page);
        return entry != null ? List.copyOf(entry.tables) : List.of();
    }

    public List<ListSpec> listsFor(int page) {
        PageEntry entry = pages.get(page);
        return entry != null ? List.copyOf(entry.lists) : List.of();
    }

    /** Total number of overrides across all pages. */
    public int overrideCount() {
        return pages.values().stream().mapToInt(p -> p.overrides.size()).sum();
    }

    /**
     * Records a user edit. An existing override for the same id is merged field by field;
     * otherwise the edit is appended as a new override.
     */
    public void recordEdit(int page, SidecarOverride edit) {
        PageEntry entry = page(page);
        SidecarOverride existing = entry.overrides.get(edit.id());
        entry.overrides.put(edit.id(), existing != null ? existing.mergedWith(edit) : edit);
    }

    /** Replaces any override for the same id without merging. */
    public void putOverride(int page, SidecarOverride override) {
        page(page).overrides.put(override.id(), override);
    }

    public void addTable(int page, TableSpec table) {
        page(page).tables.add(table);
    }

    public void addList(int page, ListSpec list) {
        page(page).lists.add(list);
    }

    PageEntry page(int page) {
        if (page < 0) {
            throw new IllegalArgumentException("Page index must be >= 0: " + page);
        }
        return pages.computeIfAbsent(page, p -> new PageEntry());
    }

    PageEntry existingPage(int page) {
        return pages.get(page);
    }
}
