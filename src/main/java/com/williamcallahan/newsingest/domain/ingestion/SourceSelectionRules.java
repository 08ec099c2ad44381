package com.williamcallahan.newsingest.domain.ingestion;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inclusion and exclusion rules that decide which files under the source root belong to a batch.
 *
 * <p>A file is included when its first path segment is an allowed top-level folder and no
 * block-list rule matches: a folder segment equal to or containing a blocked folder name, a
 * file name starting with a blocked prefix, or a relative path containing a blocked substring.</p>
 *
 * @param includedFolders allowed top-level folders
 * @param excludedFolderNames folder names (or fragments) to skip
 * @param excludedFilePrefixes file name prefixes to skip
 * @param excludedPathSubstrings relative path fragments to skip
 */
public record SourceSelectionRules(
        Set<String> includedFolders,
        List<String> excludedFolderNames,
        List<String> excludedFilePrefixes,
        List<String> excludedPathSubstrings) {

    public SourceSelectionRules {
        includedFolders = Set.copyOf(Objects.requireNonNull(includedFolders, "includedFolders"));
        excludedFolderNames = copyNonBlank(excludedFolderNames);
        excludedFilePrefixes = copyNonBlank(excludedFilePrefixes);
        excludedPathSubstrings = copyNonBlank(excludedPathSubstrings);
    }

    /**
     * Decides whether a path relative to the source root is part of the batch.
     *
     * @param relativePath path relative to the source root
     * @return true when the file is in an allowed folder and no exclusion matches
     */
    public boolean includes(Path relativePath) {
        if (relativePath == null || relativePath.getNameCount() < 2) {
            return false;
        }
        if (!includedFolders.contains(relativePath.getName(0).toString())) {
            return false;
        }
        return !isExcluded(relativePath);
    }

    /**
     * Applies only the block-list rules, ignoring the top-level allow-list.
     *
     * @param relativePath path relative to the source root
     * @return true when any exclusion rule matches
     */
    public boolean isExcluded(Path relativePath) {
        int folderCount = relativePath.getNameCount() - 1;
        for (int index = 0; index < folderCount; index++) {
            String folder = relativePath.getName(index).toString();
            for (String blockedFolder : excludedFolderNames) {
                if (folder.contains(blockedFolder)) {
                    return true;
                }
            }
        }
        String key = SourceFile.toKey(relativePath);
        for (String blockedSubstring : excludedPathSubstrings) {
            if (key.contains(blockedSubstring)) {
                return true;
            }
        }
        String fileName = relativePath.getFileName().toString();
        for (String blockedPrefix : excludedFilePrefixes) {
            if (fileName.startsWith(blockedPrefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Describes the exclusion rules as human-readable lines for the ledger header.
     */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        for (String folderName : excludedFolderNames) {
            lines.add("Folders named or containing: " + folderName);
        }
        for (String filePrefix : excludedFilePrefixes) {
            lines.add("Files starting with: " + filePrefix);
        }
        for (String pathSubstring : excludedPathSubstrings) {
            lines.add("Paths containing: " + pathSubstring);
        }
        return List.copyOf(lines);
    }

    private static List<String> copyNonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(value -> value != null && !value.isBlank()).toList();
    }
}
