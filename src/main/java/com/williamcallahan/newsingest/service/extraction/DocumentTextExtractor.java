package com.williamcallahan.newsingest.service.extraction;

import com.williamcallahan.newsingest.domain.ingestion.SourceFileType;
import java.io.IOException;
import java.nio.file.Path;
import org.springframework.stereotype.Service;

/**
 * Converts any supported source document into plain text.
 *
 * <p>Plain text sources pass through as-is, even when empty. The other formats must yield
 * non-blank text or the conversion counts as failed.</p>
 */
@Service
public class DocumentTextExtractor {

    private final PdfContentExtractor pdfExtractor;
    private final HtmlContentExtractor htmlExtractor;
    private final DocxContentExtractor docxExtractor;
    private final FileOperationsService fileOps;

    public DocumentTextExtractor(
            PdfContentExtractor pdfExtractor,
            HtmlContentExtractor htmlExtractor,
            DocxContentExtractor docxExtractor,
            FileOperationsService fileOps) {
        this.pdfExtractor = pdfExtractor;
        this.htmlExtractor = htmlExtractor;
        this.docxExtractor = docxExtractor;
        this.fileOps = fileOps;
    }

    /**
     * Extracts text from a document.
     *
     * @param path document path
     * @param type document format
     * @return extracted text
     * @throws ContentExtractionException if a converted format yields no text
     * @throws IOException if the file cannot be read
     */
    public String extractText(Path path, SourceFileType type) throws IOException {
        String text;
        switch (type) {
            case TEXT:
                return fileOps.readTextLeniently(path);
            case PDF:
                text = pdfExtractor.extractText(path);
                break;
            case DOCX:
                text = docxExtractor.extractText(path);
                break;
            case HTML:
                text = htmlExtractor.extractText(path);
                break;
            default:
                throw new ContentExtractionException("Unsupported document type " + type);
        }
        if (text == null || text.isBlank()) {
            throw new ContentExtractionException("No text extracted from " + type + " document " + path.getFileName());
        }
        return text;
    }
}
