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

import com.itextpdf.io.source.PdfTokenizer;
import com.itextpdf.io.source.RandomAccessFileOrArray;
import com.itextpdf.io.source.RandomAccessSourceFactory;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.canvas.parser.util.InlineImageParsingUtils;
import com.itextpdf.kernel.pdf.canvas.parser.util.PdfCanvasParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Walks the operators of a content stream, reporting each with its byte range. */
final class ContentStreamScanner {

    @FunctionalInterface
    interface OperatorVisitor {
        /**
         * @param operator the operator name
         * @param operands operands followed by the operator literal; only valid during the call
         * @param start offset where the operation starts, including any leading whitespace
         * @param end offset just past the operator
         */
        void visit(String operator, List<PdfObject> operands, int start, int end)
                throws IOException;
    }

    private ContentStreamScanner() {}

    static void scan(byte[] contentBytes, PdfResources resources, OperatorVisitor visitor)
            throws IOException {
        if (contentBytes == null || contentBytes.length == 0) {
            return;
        }
        RandomAccessFileOrArray source =
                new RandomAccessFileOrArray(
                        new RandomAccessSourceFactory().createSource(contentBytes));
        try (PdfTokenizer tokenizer = new PdfTokenizer(source)) {
            PdfCanvasParser parser = new PdfCanvasParser(tokenizer, resources);
            List<PdfObject> operands = new ArrayList<>();

            while (true) {
                int opStart = (int) tokenizer.getPosition();
                parser.parse(operands);
                if (operands.isEmpty()) {
                    break;
                }
                String operator = operands.get(operands.size() - 1).toString();
                if ("BI".equals(operator)) {
                    // Skip the image data so the tokenizer lands after EI
                    PdfDictionary colorSpaces =
                            resources != null ? resources.getResource(PdfName.ColorSpace) : null;
                    InlineImageParsingUtils.parse(parser, colorSpaces);
                }
                visitor.visit(operator, operands, opStart, (int) tokenizer.getPosition());
            }
        } finally {
            source.close();
        }
    }
}
