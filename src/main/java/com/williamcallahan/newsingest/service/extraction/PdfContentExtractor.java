package com.williamcallahan.newsingest.service.extraction;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Extracts text content from PDF documents using Apache PDFBox.
 */
@Service
public class PdfContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfContentExtractor.class);

    /**
     * Extract text content from a PDF file, pages joined in reading order.
     *
     * @param pdfPath Path to the PDF file
     * @return Extracted text content
     * @throws IOException if the PDF cannot be read
     */
    public String extractText(Path pdfPath) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setStartPage(1);
            stripper.setEndPage(document.getNumberOfPages());

            String text = stripper.getText(document);
            log.debug("Extracted {} characters from {} PDF pages", text.length(), document.getNumberOfPages());
            return text;
        }
    }
}
