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

import com.itextpdf.kernel.pdf.EncryptionConstants;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfUAConformance;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.ReaderProperties;
import com.itextpdf.kernel.pdf.WriterProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the input PDF for reading or for tagging. A tagged copy keeps the input's encryption when
 * the input was opened with its password.
 */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private static final int DEFAULT_PERMISSIONS =
            EncryptionConstants.ALLOW_PRINTING
                    | EncryptionConstants.ALLOW_FILL_IN
                    | EncryptionConstants.ALLOW_MODIFY_ANNOTATIONS
                    | EncryptionConstants.ALLOW_SCREENREADERS;

    private static final int DEFAULT_CRYPTO_MODE =
            EncryptionConstants.ENCRYPTION_AES_256 | EncryptionConstants.DO_NOT_ENCRYPT_METADATA;

    private final Path inputPath;
    private final String password;
    private final ReaderProperties readerProps;
    private EncryptionInfo encryptionInfo;

    private record EncryptionInfo(int permissions, int cryptoMode, boolean isEncrypted) {}

    public PdfCustodian(Path inputPath, String password) {
        this.inputPath = inputPath;
        this.password = password;
        this.readerProps = new ReaderProperties();
        if (password != null) {
            this.readerProps.setPassword(password.getBytes(StandardCharsets.UTF_8));
        }
    }

    public PdfCustodian(Path inputPath) {
        this(inputPath, null);
    }

    public Path getInputPath() {
        return inputPath;
    }

    public PdfDocument openForReading() throws IOException {
        return new PdfDocument(new PdfReader(inputPath.toString(), readerProps));
    }

    /**
     * Opens the input in stamping mode, writing the tagged result to {@code outputPath} with
     * PDF/UA identification in the XMP metadata.
     */
    public PdfDocument openForTagging(Path outputPath) throws IOException {
        analyzeEncryptionIfNeeded();

        PdfReader pdfReader = new PdfReader(inputPath.toString(), readerProps);
        PdfWriter pdfWriter = new PdfWriter(outputPath.toString(), buildWriterProperties());
        return new PdfDocument(pdfReader, pdfWriter);
    }

    /** Returns whether the input is encrypted and the output will be encrypted as well. */
    public boolean isEncrypted() throws IOException {
        analyzeEncryptionIfNeeded();
        return encryptionInfo.isEncrypted() && password != null;
    }

    private void analyzeEncryptionIfNeeded() throws IOException {
        if (encryptionInfo != null) {
            return;
        }

        try (PdfReader testReader = new PdfReader(inputPath.toString(), readerProps);
                PdfDocument testDoc = new PdfDocument(testReader)) {
            logger.debug(
                    "Encryption of {}: encrypted={}, permissions={}, crypto mode={}, pages={}",
                    inputPath.getFileName(),
                    testReader.isEncrypted(),
                    testReader.getPermissions(),
                    testReader.getCryptoMode(),
                    testDoc.getNumberOfPages());

            encryptionInfo =
                    new EncryptionInfo(
                            (int) testReader.getPermissions(),
                            testReader.getCryptoMode(),
                            testReader.isEncrypted());
        }
    }

    private WriterProperties buildWriterProperties() {
        WriterProperties writerProps = new WriterProperties();
        byte[] ownerPassword = password != null ? password.getBytes(StandardCharsets.UTF_8) : null;

        if (encryptionInfo.isEncrypted() && password != null) {
            writerProps.setStandardEncryption(
                    null, ownerPassword, encryptionInfo.permissions(), encryptionInfo.cryptoMode());
        } else if (password != null) {
            writerProps.setStandardEncryption(
                    null, ownerPassword, DEFAULT_PERMISSIONS, DEFAULT_CRYPTO_MODE);
        }

        writerProps.addPdfUaXmpMetadata(PdfUAConformance.PDF_UA_1);
        return writerProps;
    }
}
