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
package net.boyechko.pdf.tagsynth.document;

import com.itextpdf.kernel.pdf.PdfLiteral;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import java.util.List;
import java.util.Set;

/**
 * Canvas processor that numbers the text-showing operators of the page content itself, so that
 * every text event can be traced back to the operator that produced it. Operators inside form
 * XObjects are not numbered and report -1.
 */
class TextOperatorProcessor extends PdfCanvasProcessor {
    static final Set<String> TEXT_SHOW_OPERATORS = Set.of("Tj", "TJ", "'", "\"");

    private int contentDepth = 0;
    private int textOperatorCount = 0;
    private int currentOperator = -1;

    TextOperatorProcessor(IEventListener eventListener) {
        super(eventListener);
    }

    /** Ordinal of the page-level text operator being processed, or -1. */
    int currentOperator() {
        return currentOperator;
    }

    int textOperatorCount() {
        return textOperatorCount;
    }

    @Override
    public void processContent(byte[] contentBytes, PdfResources resources) {
        contentDepth++;
        try {
            super.processContent(contentBytes, resources);
        } finally {
            contentDepth--;
        }
    }

    @Override
    protected void invokeOperator(PdfLiteral operator, List<PdfObject> operands) {
        if (TEXT_SHOW_OPERATORS.contains(operator.toString())) {
            currentOperator = contentDepth == 1 ? textOperatorCount++ : -1;
        }
        super.invokeOperator(operator, operands);
    }
}
