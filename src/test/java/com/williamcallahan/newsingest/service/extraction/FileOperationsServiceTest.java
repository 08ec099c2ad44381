package com.williamcallahan.newsingest.service.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileOperationsServiceTest {

    @TempDir
    Path tempDir;

    private final FileOperationsService fileOps = new FileOperationsService();

    @Test
    void writeIfAbsentNeverOverwrites() throws IOException {
        Path target = tempDir.resolve("news/2020/2020-01-01_story.txt");

        assertTrue(fileOps.writeIfAbsent(target, "first"));
        assertFalse(fileOps.writeIfAbsent(target, "second"));
        assertEquals("first", Files.readString(target));
    }

    @Test
    void saveTextFileReplacesContent() throws IOException {
        Path target = tempDir.resolve("ledger/failed.txt");

        fileOps.saveTextFile(target, "old");
        fileOps.saveTextFile(target, "new");

        assertEquals("new", Files.readString(target));
    }

    @Test
    void readsInvalidUtf8WithReplacementCharacters() throws IOException {
        Path source = tempDir.resolve("latin1.txt");
        Files.write(source, new byte[] {'c', 'a', 'f', (byte) 0xE9, '!'});

        assertEquals("caf\uFFFD!", fileOps.readTextLeniently(source));
    }

    @Test
    void stripsLeadingByteOrderMark() throws IOException {
        Path source = tempDir.resolve("bom.txt");
        Files.write(source, ("\uFEFF" + "Date: 2020-01-01").getBytes(StandardCharsets.UTF_8));

        assertEquals("Date: 2020-01-01", fileOps.readTextLeniently(source));
    }
}
