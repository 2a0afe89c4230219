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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import net.boyechko.pdf.tagsynth.composite.CompositeExpander;
import net.boyechko.pdf.tagsynth.composite.ListSpec;
import net.boyechko.pdf.tagsynth.composite.TableSpec;
import net.boyechko.pdf.tagsynth.correlate.ContentCorrelator;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticLoc;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import net.boyechko.pdf.tagsynth.issue.DiagnosticType;
import net.boyechko.pdf.tagsynth.model.Element;
import net.boyechko.pdf.tagsynth.reconcile.Reconciler;
import net.boyechko.pdf.tagsynth.sidecar.Sidecar;
import net.boyechko.pdf.tagsynth.structure.ExistingRoot;
import net.boyechko.pdf.tagsynth.structure.NodeAttributes;
import net.boyechko.pdf.tagsynth.structure.StructureNode;
import net.boyechko.pdf.tagsynth.structure.StructureRoot;
import net.boyechko.pdf.tagsynth.structure.StructureTreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one synthesis session: initialises the root once, then for each page reconciles
 * elements, creates nodes (plus any sidecar tables and lists), and correlates content.
 *
 * <p>An engine holds the session state (node registry, node id and MCID counters) and is reset at
 * the start of every session. It is not reentrant: a second {@link #synthesize} call while one is
 * running throws {@link IllegalStateException}. Everything else is reported through the returned
 * diagnostics. Cancellation is checked at each checkpoint; a cancelled session keeps whatever it
 * built so far.
 */
public final class SynthesisEngine {
    private static final Logger logger = LoggerFactory.getLogger(SynthesisEngine.class);

    private static final String ELLIPSIS = "...";

    private final EngineConfig config;
    private final ProcessingListener listener;
    private final StructureTreeBuilder builder = new StructureTreeBuilder();
    private final CompositeExpander expander = new CompositeExpander(builder);
    private final ContentCorrelator correlator;
    private final Reconciler reconciler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SynthesisEngine(EngineConfig config, ProcessingListener listener) {
        this.config = config != null ? config : EngineConfig.defaults();
        this.listener = listener;
        this.correlator =
                new ContentCorrelator(
                        this.config.fuzzy_prefix_length, this.config.fuzzy_min_length);
        this.reconciler = new Reconciler(this.config.defaultBbox(), this.config.default_role);
    }

    public SynthesisEngine(EngineConfig config) {
        this(config, null);
    }

    /** The tree builder of the current or last session. */
    public StructureTreeBuilder builder() {
        return builder;
    }

    public OperationResult<SynthesisResult> synthesize(DocumentSource source, Sidecar sidecar) {
        return synthesize(source, sidecar, () -> false);
    }

    public OperationResult<SynthesisResult> synthesize(
            DocumentSource source, Sidecar sidecar, BooleanSupplier cancelRequested) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException(
                    "A synthesis session is already running on this engine");
        }
        try {
            return runSession(source, sidecar != null ? sidecar : new Sidecar(), cancelRequested);
        } finally {
            running.set(false);
        }
    }

    private OperationResult<SynthesisResult> runSession(
            DocumentSource source, Sidecar sidecar, BooleanSupplier cancelRequested) {
        builder.reset();
        correlator.reset();
        Session session = new Session();

        ExistingRoot existing;
        try {
            existing = source.existingRoot();
        } catch (RuntimeException e) {
            logger.error("Could not inspect the existing structure root: {}", e.getMessage());
            session.diagnostics.report(
                    DiagnosticType.ROOT_INIT_FAILED,
                    DiagnosticSev.FATAL,
                    DiagnosticLoc.none(),
                    "Could not inspect the existing structure root: " + e.getMessage());
            return OperationResult.failed(session.diagnostics);
        }

        OperationResult<StructureRoot> rootResult = builder.initRoot(existing);
        session.diagnostics.addAll(rootResult.diagnostics());
        if (rootResult.isFailure()) {
            return OperationResult.failed(session.diagnostics);
        }
        if (checkpoint(Checkpoint.ROOT_CREATED, -1, cancelRequested, session)) {
            return cancelled(session);
        }

        StructureNode document = null;
        if (config.wrap_in_document) {
            document = session.collect(builder.createNode("Document"));
        }

        int pageCount = source.pageCount();
        for (int page = 0; page < pageCount; page++) {
            List<Element> elements = reconcilePage(source, sidecar, page, session);
            session.elementsByPage.put(page, elements);
            if (checkpoint(Checkpoint.ELEMENTS_RECONCILED, page, cancelRequested, session)) {
                return cancelled(session);
            }

            StructureNode part = null;
            if (document != null) {
                part = session.collect(
                        builder.createNode("Part", NodeAttributes.titled("Page " + (page + 1))));
                if (part != null) {
                    session.collect(builder.attach(document, part));
                }
            }
            Map<String, StructureNode> pageNodes = createNodes(page, elements, part, session);
            expandComposites(sidecar, page, part, session);
            if (checkpoint(Checkpoint.NODES_CREATED, page, cancelRequested, session)) {
                return cancelled(session);
            }

            session.diagnostics.addAll(
                    correlator
                            .correlatePage(page, source::extractPositions, pageNodes)
                            .diagnostics());
            session.pagesProcessed++;
            if (checkpoint(Checkpoint.CORRELATION_DONE, page, cancelRequested, session)) {
                return cancelled(session);
            }
        }

        checkpoint(Checkpoint.SESSION_COMPLETE, -1, () -> false, session);
        logger.info(
                "Synthesized {} node(s) and {} content reference(s) over {} page(s)",
                builder.nodeCount(),
                correlator.nextMcid(),
                pageCount);
        return OperationResult.ok(session.result(false), session.diagnostics);
    }

    private List<Element> reconcilePage(
            DocumentSource source, Sidecar sidecar, int page, Session session) {
        List<Element> extracted;
        try {
            extracted = source.extractElements(page);
        } catch (Exception e) {
            logger.warn("Page {}: element extraction failed: {}", page + 1, e.getMessage());
            session.diagnostics.report(
                    DiagnosticType.ELEMENT_EXTRACTION_FAILED,
                    DiagnosticSev.WARNING,
                    DiagnosticLoc.atPage(page),
                    "Element extraction failed: " + e.getMessage());
            extracted = List.of();
        }

        try {
            return reconciler.reconcile(page, extracted, sidecar.overridesFor(page));
        } catch (IllegalArgumentException e) {
            logger.warn("Page {}: {}", page + 1, e.getMessage());
            session.diagnostics.report(
                    DiagnosticType.ELEMENT_EXTRACTION_FAILED,
                    DiagnosticSev.ERROR,
                    DiagnosticLoc.atPage(page),
                    e.getMessage() + "; using sidecar elements only");
            return reconciler.reconcile(page, List.of(), sidecar.overridesFor(page));
        }
    }

    private Map<String, StructureNode> createNodes(
            int page, List<Element> elements, StructureNode part, Session session) {
        Map<String, StructureNode> pageNodes = new LinkedHashMap<>();
        for (Element element : elements) {
            if (config.skip_blank_text && element.isBlankText()) {
                session.diagnostics.report(
                        DiagnosticType.BLANK_ELEMENT_SKIPPED,
                        DiagnosticSev.INFO,
                        DiagnosticLoc.atElement(page, element.id()),
                        "Skipped blank text element");
                continue;
            }
            StructureNode node = createElementNode(page, element, session);
            if (node == null) continue;
            if (part != null) {
                session.collect(builder.attach(part, node));
            }
            pageNodes.put(element.id(), node);
            session.nodeByElementId.put(element.id(), node);
        }
        return pageNodes;
    }

    /** One node per element; an unknown role falls back to the element kind's default. */
    private StructureNode createElementNode(int page, Element element, Session session) {
        NodeAttributes attrs = attributesFor(element);
        OperationResult<StructureNode> created = builder.createNode(element.role(), attrs);
        if (created.isSuccess()) {
            return created.value();
        }

        String fallback = element.kind().defaultRole();
        session.diagnostics.report(
                DiagnosticType.ROLE_FALLBACK,
                DiagnosticSev.WARNING,
                DiagnosticLoc.atElement(page, element.id()),
                "Unknown role '" + element.role() + "', tagged as " + fallback);
        StructureNode node = session.collect(builder.createNode(fallback, attrs));
        if (node == null) {
            session.diagnostics.report(
                    DiagnosticType.NODE_CREATION_FAILED,
                    DiagnosticSev.ERROR,
                    DiagnosticLoc.atElement(page, element.id()),
                    "Could not create a node for the element");
        }
        return node;
    }

    NodeAttributes attributesFor(Element element) {
        String actualText = element.stringProperty(Element.ACTUAL_TEXT);
        if (actualText == null && !element.text().isBlank()) {
            actualText = truncate(element.text().strip(), config.actual_text_limit);
        }
        return new NodeAttributes(
                element.stringProperty(Element.TITLE),
                element.stringProperty(Element.ALT_TEXT),
                actualText,
                element.stringProperty(Element.LANGUAGE));
    }

    static String truncate(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit) + ELLIPSIS;
    }

    private void expandComposites(Sidecar sidecar, int page, StructureNode part, Session session) {
        for (TableSpec table : sidecar.tablesFor(page)) {
            StructureNode node = session.collect(expander.createTable(table));
            if (node != null && part != null) {
                session.collect(builder.attach(part, node));
            }
        }
        for (ListSpec list : sidecar.listsFor(page)) {
            StructureNode node = session.collect(expander.createList(list));
            if (node != null && part != null) {
                session.collect(builder.attach(part, node));
            }
        }
    }

    /** Reports the checkpoint and returns true if the session should stop. */
    private boolean checkpoint(
            Checkpoint checkpoint, int page, BooleanSupplier cancelRequested, Session session) {
        logger.debug("Checkpoint {}{}", checkpoint, page >= 0 ? " (page " + (page + 1) + ")" : "");
        if (listener != null) {
            listener.onCheckpoint(checkpoint, page);
        }
        if (cancelRequested.getAsBoolean()) {
            logger.info("Session cancelled at {}", checkpoint);
            session.diagnostics.report(
                    DiagnosticType.SESSION_CANCELLED,
                    DiagnosticSev.WARNING,
                    page >= 0 ? DiagnosticLoc.atPage(page) : DiagnosticLoc.none(),
                    "Cancelled at " + checkpoint.label().toLowerCase());
            return true;
        }
        return false;
    }

    private OperationResult<SynthesisResult> cancelled(Session session) {
        return OperationResult.ok(session.result(true), session.diagnostics);
    }

    /** Mutable bookkeeping of one run. */
    private final class Session {
        final DiagnosticList diagnostics = new DiagnosticList();
        final Map<Integer, List<Element>> elementsByPage = new HashMap<>();
        final Map<String, StructureNode> nodeByElementId = new HashMap<>();
        int pagesProcessed = 0;

        <T> T collect(OperationResult<T> result) {
            diagnostics.addAll(result.diagnostics());
            return result.isSuccess() ? result.value() : null;
        }

        SynthesisResult result(boolean cancelled) {
            return new SynthesisResult(
                    cancelled,
                    pagesProcessed,
                    builder.root(),
                    builder.nodes(),
                    nodeByElementId,
                    correlator.mcidsByElementId(),
                    correlator.anchorsByMcid(),
                    elementsByPage);
        }
    }
}
