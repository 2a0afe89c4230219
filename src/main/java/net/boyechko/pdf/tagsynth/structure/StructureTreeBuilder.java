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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.core.OperationResult;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the structure tree of one synthesis session: the root, its role map, and a registry of
 * every node created, keyed by node id.
 *
 * <p>The builder starts {@link State#UNINITIALIZED}. Until {@link #initRoot} succeeds, every node
 * operation returns a failed result and the registry stays empty. No method throws for bad input;
 * failures come back as diagnostics.
 */
public final class StructureTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(StructureTreeBuilder.class);

    public enum State {
        UNINITIALIZED,
        ROOT_READY
    }

    private State state = State.UNINITIALIZED;
    private StructureRoot root;
    private final Map<Integer, StructureNode> registry = new LinkedHashMap<>();
    private int nextNodeId = 1;

    public State state() {
        return state;
    }

    public boolean isRootReady() {
        return state == State.ROOT_READY;
    }

    /** The session root, or null before {@link #initRoot}. */
    public StructureRoot root() {
        return root;
    }

    public RoleMap roleMap() {
        return root != null ? root.roleMap() : null;
    }

    /** Drops the tree and all counters so the builder can serve a new session. */
    public void reset() {
        state = State.UNINITIALIZED;
        root = null;
        registry.clear();
        nextNodeId = 1;
    }

    // ── Root ────────────────────────────────────────────────────────────

    /**
     * Prepares the root. With no existing root a fresh one gets the full standard role map. A
     * keyed existing root keeps every mapping it has and gains only the standard entries it
     * lacks. Any other shape is fatal and leaves the builder uninitialized.
     */
    public OperationResult<StructureRoot> initRoot(ExistingRoot existing) {
        if (state == State.ROOT_READY) {
            return OperationResult.failed(
                    DiagnosticType.ROOT_INIT_FAILED, "Structure root is already initialized");
        }

        if (existing == null) {
            RoleMap roleMap = RoleMap.standard();
            root =
                    new StructureRoot(
                            roleMap, new ArrayList<>(roleMap.entries().keySet()), false, 0);
            state = State.ROOT_READY;
            logger.debug("Created structure root with {} role mappings", roleMap.size());
            return OperationResult.ok(root);
        }

        if (existing instanceof ExistingRoot.Unrecognized unrecognized) {
            logger.error(
                    "Existing structure root is not a dictionary: {}", unrecognized.description());
            return OperationResult.failed(
                    DiagnosticType.UNRECOGNIZED_ROOT,
                    DiagnosticSev.FATAL,
                    DiagnosticLoc.none(),
                    "Existing structure root has an unrecognized shape: "
                            + unrecognized.description());
        }

        ExistingRoot.Keyed keyed = (ExistingRoot.Keyed) existing;
        RoleMap roleMap = RoleMap.of(keyed.roleMap());
        List<String> added = roleMap.addMissingStandard();
        root = new StructureRoot(roleMap, added, true, keyed.kidCount());
        state = State.ROOT_READY;

        DiagnosticList diagnostics = new DiagnosticList();
        if (!added.isEmpty()) {
            diagnostics.report(
                    DiagnosticType.ROLE_MAP_EXTENDED,
                    DiagnosticSev.INFO,
                    DiagnosticLoc.none(),
                    "Added " + added.size() + " standard role mapping(s) to the existing role map");
        }
        logger.debug(
                "Extending existing structure root ({} kids, {} mappings added)",
                keyed.kidCount(),
                added.size());
        return OperationResult.ok(root, diagnostics);
    }

    // ── Nodes ───────────────────────────────────────────────────────────

    public OperationResult<StructureNode> createNode(String type) {
        return createNode(type, NodeAttributes.NONE);
    }

    /** Creates a node of {@code type} and appends it to the root. */
    public OperationResult<StructureNode> createNode(String type, NodeAttributes attributes) {
        OperationResult<StructureNode> guard = requireRoot("create a node");
        if (guard != null) return guard;

        if (root.roleMap().resolve(type) == null) {
            logger.debug("Rejecting node with unknown role '{}'", type);
            return OperationResult.failed(
                    DiagnosticType.UNKNOWN_ROLE,
                    DiagnosticSev.ERROR,
                    DiagnosticLoc.none(),
                    "Role '" + type + "' is neither standard nor mapped to a standard role");
        }

        StructureNode node = new StructureNode(nextNodeId++, type, attributes);
        registry.put(node.nodeId(), node);
        root.appendKid(node);
        logger.debug("Created node {}", node);
        return OperationResult.ok(node);
    }

    /**
     * Moves {@code child} under {@code parent}, detaching it from its current owner. The child is
     * appended after the parent's existing children.
     */
    public OperationResult<StructureNode> attach(StructureNode parent, StructureNode child) {
        OperationResult<StructureNode> guard = requireRoot("attach a node");
        if (guard != null) return guard;

        if (parent == null || child == null) {
            return invalidAttach(child, "parent and child are required");
        }
        if (registry.get(parent.nodeId()) != parent || registry.get(child.nodeId()) != child) {
            return invalidAttach(child, "node does not belong to this session");
        }
        if (parent.isSelfOrDescendantOf(child)) {
            return invalidAttach(
                    child, "attaching " + child + " under " + parent + " would create a cycle");
        }

        if (child.parent() != null) {
            child.parent().removeChild(child);
        } else {
            root.removeKid(child);
        }
        parent.appendChild(child);
        logger.debug("Attached {} under {}", child, parent);
        return OperationResult.ok(child);
    }

    /**
     * Creates every spec independently. A failed entry yields null in its slot and a diagnostic;
     * the rest of the batch continues. Entries with a {@code parentId} are moved under that node
     * once all entries exist; an unknown parent leaves the node at root level.
     */
    public OperationResult<List<StructureNode>> createBatch(List<NodeSpec> specs) {
        OperationResult<List<StructureNode>> guard = requireRoot("create a batch");
        if (guard != null) return guard;

        if (specs == null) {
            specs = List.of();
        }
        DiagnosticList diagnostics = new DiagnosticList();
        List<StructureNode> created = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            NodeSpec spec = specs.get(i) != null ? specs.get(i) : NodeSpec.of(null, null);
            String type = spec.type() != null && !spec.type().isBlank() ? spec.type() : "P";
            String title = spec.title() != null ? spec.title() : "Element " + (i + 1);
            OperationResult<StructureNode> result =
                    createNode(
                            type,
                            new NodeAttributes(
                                    title, spec.altText(), spec.actualText(), spec.language()));
            diagnostics.addAll(result.diagnostics());
            created.add(result.isSuccess() ? result.value() : null);
        }

        for (int i = 0; i < specs.size(); i++) {
            StructureNode node = created.get(i);
            if (node == null || specs.get(i) == null || specs.get(i).parentId() == null) continue;
            int parentId = specs.get(i).parentId();

            StructureNode parent = registry.get(parentId);
            if (parent == null) {
                diagnostics.report(
                        DiagnosticType.UNKNOWN_PARENT,
                        DiagnosticSev.WARNING,
                        DiagnosticLoc.atNode(node.nodeId(), node.type()),
                        "Parent #" + parentId + " not found; node left at root level");
                continue;
            }
            diagnostics.addAll(attach(parent, node).diagnostics());
        }

        long failures = created.stream().filter(n -> n == null).count();
        logger.debug("Batch of {} created with {} failure(s)", specs.size(), failures);
        return OperationResult.ok(created, diagnostics);
    }

    // ── Lookups ─────────────────────────────────────────────────────────

    public StructureNode nodeById(int nodeId) {
        return registry.get(nodeId);
    }

    /** All nodes in creation order. */
    public List<StructureNode> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(registry.values()));
    }

    public List<StructureNode> findByType(String type) {
        List<StructureNode> out = new ArrayList<>();
        for (StructureNode node : registry.values()) {
            if (node.type().equals(type)) {
                out.add(node);
            }
        }
        return out;
    }

    public int nodeCount() {
        return registry.size();
    }

    private <T> OperationResult<T> requireRoot(String action) {
        if (state == State.ROOT_READY) {
            return null;
        }
        return OperationResult.failed(
                DiagnosticType.ROOT_NOT_INITIALIZED,
                DiagnosticSev.ERROR,
                DiagnosticLoc.none(),
                "Cannot " + action + " before the structure root is initialized");
    }

    private OperationResult<StructureNode> invalidAttach(StructureNode child, String reason) {
        DiagnosticLoc where =
                child != null
                        ? DiagnosticLoc.atNode(child.nodeId(), child.type())
                        : DiagnosticLoc.none();
        return OperationResult.failed(
                DiagnosticType.INVALID_ATTACH,
                DiagnosticSev.ERROR,
                where,
                "Attach refused: " + reason);
    }
}
