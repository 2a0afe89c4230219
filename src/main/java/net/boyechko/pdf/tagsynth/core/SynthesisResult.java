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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import net.boyechko.pdf.tagsynth.structure.StructureRoot;

/**
 * Everything one synthesis session produced. None of it outlives the session or goes back into
 * the sidecar.
 *
 * @param cancelled true if the session stopped at a checkpoint; the tree is then partial
 * @param pagesProcessed pages whose correlation finished
 * @param root the synthesized tree
 * @param nodes every node, in creation order
 * @param nodeByElementId node created for each effective element
 * @param mcidsByElementId MCIDs assigned per element id
 * @param anchorsByMcid text position each MCID was assigned for
 * @param elementsByPage effective elements per 0-based page
 */
public record SynthesisResult(
        boolean cancelled,
        int pagesProcessed,
        StructureRoot root,
        List<StructureNode> nodes,
        Map<String, StructureNode> nodeByElementId,
        Map<String, List<Integer>> mcidsByElementId,
        Map<Integer, TextPosition> anchorsByMcid,
        Map<Integer, List<Element>> elementsByPage) {

    public SynthesisResult {
        nodes = List.copyOf(nodes);
        nodeByElementId = Map.copyOf(nodeByElementId);
        mcidsByElementId = Map.copyOf(mcidsByElementId);
        anchorsByMcid = Collections.unmodifiableMap(new TreeMap<>(anchorsByMcid));
        elementsByPage = Collections.unmodifiableMap(new TreeMap<>(elementsByPage));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int referenceCount() {
        return anchorsByMcid.size();
    }

    public int elementCount() {
        return elementsByPage.values().stream().mapToInt(List::size).sum();
    }
}
