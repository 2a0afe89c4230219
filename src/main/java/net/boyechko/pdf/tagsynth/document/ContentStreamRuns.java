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

import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.PdfString;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.tagsynth.model.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the string operands of the text-showing operators in a page's content, numbered the same
 * way {@link TextOperatorProcessor} numbers them. The runs carry no element anchor.
 */
final class ContentStreamRuns {
    private static final Logger logger = LoggerFactory.getLogger(ContentStreamRuns.class);

    private ContentStreamRuns() {}

    static List<TextPosition> read(PdfPage page) throws IOException {
        PdfResources resources = page.getResources();
        List<TextPosition> runs = new ArrayList<>();
        Map<PdfName, PdfFont> fonts = new HashMap<>();
        int[] ordinal = {0};
        PdfFont[] currentFont = {null};

        ContentStreamScanner.scan(
                page.getContentBytes(),
                resources,
                (operator, operands, start, end) -> {
                    if ("Tf".equals(operator) && operands.size() >= 3) {
                        PdfObject name = operands.get(0);
                        if (name instanceof PdfName fontName) {
                            currentFont[0] =
                                    fonts.computeIfAbsent(
                                            fontName, n -> loadFont(resources, n));
                        }
                        return;
                    }
                    if (!TextOperatorProcessor.TEXT_SHOW_OPERATORS.contains(operator)) {
                        return;
                    }
                    String text = showText(operands, currentFont[0]);
                    runs.add(TextPosition.raw(text, ordinal[0]++));
                });

        logger.trace("Read {} raw text run(s) from page content", runs.size());
        return runs;
    }

    private static String showText(List<PdfObject> operands, PdfFont font) {
        StringBuilder text = new StringBuilder();
        // Tj, ' and " all take the string as their last operand; TJ takes an array
        PdfObject shown = operands.size() >= 2 ? operands.get(operands.size() - 2) : null;
        if (shown instanceof PdfString str) {
            text.append(decode(str, font));
        } else if (shown instanceof PdfArray array) {
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i) instanceof PdfString str) {
                    text.append(decode(str, font));
                }
            }
        }
        return text.toString();
    }

    private static String decode(PdfString str, PdfFont font) {
        if (font != null) {
            return font.decode(str);
        }
        return str.toUnicodeString();
    }

    private static PdfFont loadFont(PdfResources resources, PdfName name) {
        PdfDictionary fontResources =
                resources != null ? resources.getResource(PdfName.Font) : null;
        PdfDictionary fontDict = fontResources != null ? fontResources.getAsDictionary(name) : null;
        if (fontDict == null) {
            logger.debug("Font {} not found in page resources", name);
            return null;
        }
        try {
            return PdfFontFactory.createFont(fontDict);
        } catch (RuntimeException e) {
            logger.debug(
                    "Cannot load font {}, falling back to raw strings: {}", name, e.getMessage());
            return null;
        }
    }
}
