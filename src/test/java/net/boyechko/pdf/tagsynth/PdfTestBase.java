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
package net.boyechko.pdf.tagsynth;

import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.itextpdf.layout.Document;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import net.boyechko.pdf.tagsynth.core.ProcessingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that optionally persist PDFs via -Dpdf.tagsynth.testOutputDir. */
public abstract class PdfTestBase {
    private static final String TAGGED_PDF_SUFFIX = "_tagged.pdf";

    @TempDir protected Path tempDir;
    private Path outputDir;
    private String testClassName;
    private String testMethodName;

    // ── Test lifecycle ──────────────────────────────────────────────

    @BeforeEach
    void captureTestName(TestInfo testInfo) {
        testClassName =
                testInfo.getTestClass()
                        .map(Class::getSimpleName)
                        .orElse(getClass().getSimpleName());
        testMethodName = testInfo.getTestMethod().map(method -> method.getName()).orElse("test");
    }

    // ── Output path helpers ─────────────────────────────────────────

    protected final Path testOutputPath() {
        String methodName = testMethodName != null ? testMethodName : "test";
        return testOutputDir().resolve(methodName + ".pdf");
    }

    protected final Path testOutputPath(String filename) {
        return testOutputDir().resolve(filename);
    }

    /** Returns {baseDir}/{testClassName}/, creating it if needed. */
    protected final Path testOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }

        String configured = System.getProperty("pdf.tagsynth.testOutputDir");
        Path baseDir = configured != null && !configured.isBlank() ? Path.of(configured) : tempDir;
        String className = testClassName != null ? testClassName : getClass().getSimpleName();
        Path dir = baseDir.resolve(className);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test output dir: " + dir, e);
        }
        outputDir = dir;
        return outputDir;
    }

    // ── PDF creation ────────────────────────────────────────────────

    /** Callback for adding content to a test PDF via the iText layout API. */
    @FunctionalInterface
    protected interface TestPdfContent {
        void addTo(PdfDocument pdfDoc, Document document) throws Exception;
    }

    /** Callback for drawing raw page content; {@code font} is Helvetica. */
    @FunctionalInterface
    protected interface PageContent {
        void draw(PdfCanvas canvas, PdfFont font) throws Exception;
    }

    /** Creates a tagged PDF at {@code testOutputPath()} with the given content. */
    protected final Path createTaggedPdf(TestPdfContent content) throws Exception {
        Path outputPath = testOutputPath();
        try (PdfWriter writer = new PdfWriter(outputPath.toString());
                PdfDocument pdfDoc = new PdfDocument(writer)) {
            pdfDoc.setTagged();
            Document document = new Document(pdfDoc);
            content.addTo(pdfDoc, document);
            document.close();
        }
        return outputPath;
    }

    /** Creates an untagged PDF with one page per content callback. */
    protected final Path createUntaggedPdf(PageContent... pages) throws Exception {
        Path outputPath = testOutputPath();
        try (PdfWriter writer = new PdfWriter(outputPath.toString());
                PdfDocument pdfDoc = new PdfDocument(writer)) {
            PdfFont font = PdfFontFactory.createFont(StandardFonts.HELVETICA);
            for (PageContent content : pages) {
                PdfPage page = pdfDoc.addNewPage();
                PdfCanvas canvas = new PdfCanvas(page);
                content.draw(canvas, font);
                canvas.release();
            }
        }
        return outputPath;
    }

    /** Page content showing each string with its own Tj at x=72, y as given. */
    protected static PageContent lines(Object... textAndY) {
        return (canvas, font) -> {
            for (int i = 0; i < textAndY.length; i += 2) {
                float y = ((Number) textAndY[i + 1]).floatValue();
                showText(canvas, font, (String) textAndY[i], y);
            }
        };
    }

    protected static void showText(PdfCanvas canvas, PdfFont font, String text, float y) {
        canvas.beginText().setFontAndSize(font, 12).moveText(72, y).showText(text).endText();
    }

    /** Copies the tagged PDF to {@code {method}_tagged.pdf} in the test output directory. */
    protected final Path saveTaggedPdf(ProcessingResult result) throws IOException {
        String method = testMethodName != null ? testMethodName : "test";
        Path target = testOutputPath(method + TAGGED_PDF_SUFFIX);
        Files.copy(result.tempOutputFile(), target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }
}
