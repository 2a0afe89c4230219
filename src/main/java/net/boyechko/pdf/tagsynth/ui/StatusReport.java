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
package net.boyechko.pdf.tagsynth.ui;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.core.SynthesisResult;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.structure.NodeAttributes;
import net.boyechko.pdf.tagsynth.structure.StructureNode;

/**
 * Human-readable state of a document's structure tree root.
 *
 * @param hasStructTree whether the catalog has a /StructTreeRoot
 * @param hasRoleMap whether the root has a /RoleMap
 * @param roleMappings role map entries in document order
 * @param childElements number of entries in the root's /K
 */
public record StatusReport(
        boolean hasStructTree,
        boolean hasRoleMap,
        Map<String, String> roleMappings,
        int childElements) {

    public StatusReport {
        roleMappings =
                roleMappings != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(roleMappings))
                        : Map.of();
    }

    public static StatusReport of(PdfDocument doc) {
        PdfObject raw = doc.getCatalog().getPdfObject().get(PdfName.StructTreeRoot);
        if (!(raw instanceof PdfDictionary root)) {
            return new StatusReport(raw != null, false, Map.of(), 0);
        }

        Map<String, String> mappings = new LinkedHashMap<>();
        PdfDictionary roleMap = root.getAsDictionary(PdfName.RoleMap);
        if (roleMap != null) {
            for (PdfName key : roleMap.keySet()) {
                PdfObject target = roleMap.get(key);
                mappings.put(
                        key.getValue(),
                        target instanceof PdfName name ? name.getValue() : String.valueOf(target));
            }
        }

        PdfObject kids = root.get(PdfName.K);
        int childCount = 0;
        if (kids instanceof PdfArray array) {
            childCount = array.size();
        } else if (kids != null) {
            childCount = 1;
        }
        return new StatusReport(true, roleMap != null, mappings, childCount);
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Structure Tree Status:\n");
        sb.append("  Structure Tree: ").append(hasStructTree ? "present" : "missing").append('\n');
        sb.append("  Role Map: ").append(hasRoleMap ? "present" : "missing").append('\n');
        sb.append("  Role Mappings: ").append(roleMappings.size()).append('\n');
        sb.append("  Child Elements: ").append(childElements).append('\n');
        if (!roleMappings.isEmpty()) {
            sb.append("\n  Role Mappings:\n");
            roleMappings.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(
                            e ->
                                    sb.append("    ")
                                            .append(e.getKey())
                                            .append(" → ")
                                            .append(e.getValue())
                                            .append('\n'));
        }
        return sb.toString();
    }

    /** One line per element node, e.g. {@code text_0_1. H1 - Introduction (Alt: ...)}. */
    public static List<String> elementSummary(SynthesisResult result) {
        List<String> lines = new ArrayList<>();
        for (List<Element> elements : result.elementsByPage().values()) {
            for (Element element : elements) {
                StructureNode node = result.nodeByElementId().get(element.id());
                if (node == null) {
                    continue;
                }
                NodeAttributes attrs = node.attributes();
                StringBuilder line = new StringBuilder();
                line.append(element.id()).append(". ").append(node.type());
                if (attrs.title() != null && !attrs.title().isBlank()) {
                    line.append(" - ").append(attrs.title());
                }
                if (attrs.altText() != null && !attrs.altText().isBlank()) {
                    line.append(" (Alt: ").append(attrs.altText()).append(')');
                }
                lines.add(line.toString());
            }
        }
        return lines;
    }
}
