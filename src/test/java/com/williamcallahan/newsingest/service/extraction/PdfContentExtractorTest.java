package com.williamcallahan.newsingest.service.extraction;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.newsingest.support.TestDocuments;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfContentExtractorTest {

    @TempDir
    Path tempDir;

    private final PdfContentExtractor extractor = new PdfContentExtractor();

    @Test
    void extractsPageTextInReadingOrder() throws IOException {
        Path pdf = TestDocuments.pdf(tempDir.resolve("story.pdf"), "Evening Edition",
                List.of("Storm closes schools", "Classes resume Monday"));

        String text = extractor.extractText(pdf);

        assertTrue(text.contains("Storm closes schools"));
        assertTrue(text.indexOf("Storm closes schools") < text.indexOf("Classes resume Monday"));
    }

    @Test
    void rejectsFilesThatAreNotPdf() throws IOException {
        Path notPdf = Files.writeString(tempDir.resolve("fake.pdf"), "plain words, no PDF header");

        assertThrows(IOException.class, () -> extractor.extractText(notPdf));
    }
}
