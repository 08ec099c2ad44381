package com.williamcallahan.newsingest.service.extraction;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Extracts paragraph text from Word documents by streaming {@code word/document.xml}.
 */
@Service
public class DocxContentExtractor {
    private static final Logger log = LoggerFactory.getLogger(DocxContentExtractor.class);

    private static final String DOCUMENT_PART = "word/document.xml";
    private static final String WORD_NAMESPACE = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

    private final XMLInputFactory inputFactory;

    public DocxContentExtractor() {
        this.inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    /**
     * Extracts the body text of a DOCX file, one line per paragraph.
     *
     * @param docxPath Path to the DOCX file
     * @return extracted text
     * @throws ContentExtractionException if the file is not a readable DOCX package
     * @throws IOException if the file cannot be read
     */
    public String extractText(Path docxPath) throws IOException {
        try (ZipFile archive = new ZipFile(docxPath.toFile())) {
            ZipEntry documentEntry = archive.getEntry(DOCUMENT_PART);
            if (documentEntry == null) {
                throw new ContentExtractionException("DOCX package has no " + DOCUMENT_PART + ": " + docxPath.getFileName());
            }
            try (InputStream documentStream = archive.getInputStream(documentEntry)) {
                String text = readParagraphs(documentStream);
                log.debug("Extracted {} characters from DOCX", text.length());
                return text;
            }
        } catch (ZipException zipException) {
            throw new ContentExtractionException("Not a DOCX package: " + docxPath.getFileName(), zipException);
        } catch (XMLStreamException xmlException) {
            throw new ContentExtractionException("Malformed DOCX body: " + docxPath.getFileName(), xmlException);
        }
    }

    private String readParagraphs(InputStream documentStream) throws XMLStreamException {
        XMLStreamReader reader = inputFactory.createXMLStreamReader(documentStream);
        StringBuilder text = new StringBuilder();
        boolean inTextRun = false;
        boolean inTabStops = false;
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT && isWordElement(reader)) {
                    String localName = reader.getLocalName();
                    if ("t".equals(localName)) {
                        inTextRun = true;
                    } else if ("tabs".equals(localName)) {
                        inTabStops = true;
                    } else if ("tab".equals(localName) && !inTabStops) {
                        text.append('\t');
                    } else if ("br".equals(localName) || "cr".equals(localName)) {
                        text.append('\n');
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT && isWordElement(reader)) {
                    String localName = reader.getLocalName();
                    if ("t".equals(localName)) {
                        inTextRun = false;
                    } else if ("tabs".equals(localName)) {
                        // Tab stop definitions in paragraph properties are not text
                        inTabStops = false;
                    } else if ("p".equals(localName)) {
                        text.append('\n');
                    }
                } else if (inTextRun && (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA)) {
                    text.append(reader.getText());
                }
            }
        } finally {
            reader.close();
        }
        return text.toString().trim();
    }

    private static boolean isWordElement(XMLStreamReader reader) {
        return WORD_NAMESPACE.equals(reader.getNamespaceURI());
    }
}
