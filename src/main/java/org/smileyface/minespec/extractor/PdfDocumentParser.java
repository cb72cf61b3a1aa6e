package org.smileyface.minespec.extractor;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.RawDocument;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Converts a PDF brochure into a {@link RawDocument}. Only the text layer is read; PDF tables reach
 * the extractor as text lines.
 */
public final class PdfDocumentParser {

    /**
     * @throws IOException when the bytes are not a readable PDF
     */
    public RawDocument parse(String url, byte[] pdf, Instant fetchedAt) throws IOException {
        if (pdf == null || pdf.length == 0) {
            throw new IOException("Empty PDF body from " + url);
        }
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(doc);
            return new RawDocument(url, ContentType.PDF, text, List.of(), fetchedAt);
        }
    }
}
