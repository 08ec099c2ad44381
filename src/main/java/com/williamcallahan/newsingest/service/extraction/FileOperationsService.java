package com.williamcallahan.newsingest.service.extraction;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.springframework.stereotype.Service;

/**
 * File reads and writes shared by the normalization pipeline.
 */
@Service
public class FileOperationsService {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Reads a text file as UTF-8, replacing undecodable bytes instead of failing.
     *
     * @param filePath The path to the file
     * @return The file content
     * @throws IOException If the file cannot be read
     */
    public String readTextLeniently(Path filePath) throws IOException {
        byte[] bytes = Files.readAllBytes(filePath);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        return text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text;
    }

    /**
     * Writes UTF-8 text to a new file, creating parent directories as needed.
     *
     * <p>An existing file is never overwritten.</p>
     *
     * @param filePath The path to the file
     * @param content The text content to write
     * @return true if the file was written, false if it already existed
     * @throws IOException If file operations fail
     */
    public boolean writeIfAbsent(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        try {
            Files.writeString(filePath, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException alreadyExists) {
            return false;
        }
    }

    /**
     * Writes UTF-8 text, replacing any existing file.
     *
     * @param filePath The path to the file
     * @param content The text content to write
     * @throws IOException If file operations fail
     */
    public void saveTextFile(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Creates all necessary parent directories for a file path.
     *
     * @param filePath The file path for which to create directories
     * @throws IOException If directory creation fails
     */
    public void createParentDirectories(Path filePath) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
