package com.williamcallahan.newsingest.service.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.newsingest.support.TestDocuments;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies WordprocessingML bodies are flattened to one line per paragraph.
 */
class DocxContentExtractorTest {

    @TempDir
    Path tempDir;

    private final DocxContentExtractor extractor = new DocxContentExtractor();

    @Test
    void joinsParagraphsWithNewlines() throws IOException {
        Path docx = TestDocuments.docx(tempDir.resolve("minutes.docx"),
                List.of("Board minutes", "Motion carried & recorded"));

        assertEquals("Board minutes\nMotion carried & recorded", extractor.extractText(docx));
    }

    @Test
    void rendersTabsAndBreaksButNotTabStops() throws IOException {
        Path docx = TestDocuments.docxWithBody(tempDir.resolve("layout.docx"),
                "<w:p><w:pPr><w:tabs><w:tab w:val=\"left\" w:pos=\"720\"/></w:tabs></w:pPr>"
                        + "<w:r><w:t>Name</w:t><w:tab/><w:t>Value</w:t></w:r></w:p>"
                        + "<w:p><w:r><w:t>Line one</w:t><w:br/><w:t>Line two</w:t></w:r></w:p>");

        assertEquals("Name\tValue\nLine one\nLine two", extractor.extractText(docx));
    }

    @Test
    void rejectsFilesThatAreNotZipPackages() throws IOException {
        Path notDocx = Files.writeString(tempDir.resolve("fake.docx"), "not a zip archive");

        assertThrows(ContentExtractionException.class, () -> extractor.extractText(notDocx));
    }

    @Test
    void rejectsPackagesWithoutDocumentPart() throws IOException {
        Path archive = tempDir.resolve("empty.docx");
        try (OutputStream output = Files.newOutputStream(archive);
                ZipOutputStream zip = new ZipOutputStream(output)) {
            zip.putNextEntry(new ZipEntry("docProps/core.xml"));
            zip.write("<core/>".getBytes());
            zip.closeEntry();
        }

        assertThrows(ContentExtractionException.class, () -> extractor.extractText(archive));
    }
}
