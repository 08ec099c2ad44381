package com.williamcallahan.newsingest.service.naming;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.newsingest.config.AppProperties;
import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import com.williamcallahan.newsingest.service.date.DateResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies recovery of source files from normalized document names.
 */
class ReverseSourceResolverTest {

    @TempDir
    Path workspace;

    private Path sourceRoot;
    private Path destinationRoot;
    private final DateResolver dateResolver = new DateResolver();
    private final NameSanitizer sanitizer = new NameSanitizer();
    private final ReverseSourceResolver resolver = new ReverseSourceResolver(dateResolver, sanitizer);

    @BeforeEach
    void createRoots() throws IOException {
        sourceRoot = Files.createDirectories(workspace.resolve("raw_txt"));
        destinationRoot = Files.createDirectories(workspace.resolve("filtered_data"));
    }

    @Test
    void roundTripsABuiltDestination() throws IOException {
        Path target = source("reddit/2021/Apr. 15, 2021_post.pdf");
        source("reddit/2021/Apr. 16, 2021_other.pdf");
        source("reddit/2021/2021-05-01_unrelated.txt");
        DestinationPathBuilder builder = new DestinationPathBuilder(sanitizer, new AppProperties());
        Path relative = sourceRoot.relativize(target);
        FullDate date = dateResolver.resolveFullDateFromFilename(target.getFileName().toString()).orElseThrow();

        Path destination = builder.buildDestination(relative, date, destinationRoot);

        assertEquals(Optional.of(SourceFile.of(sourceRoot, target)),
                resolver.findSource(destination, destinationRoot, sourceRoot));
    }

    @Test
    void singleSameDateCandidateIsReturnedWithoutNameComparison() throws IOException {
        Path only = source("news/2020-01-01_original.txt");
        source("news/2020-01-02_other.txt");

        assertEquals(Optional.of(SourceFile.of(sourceRoot, only)),
                resolver.findSource(destination("news/2020-01-01_completely_different.txt"), destinationRoot, sourceRoot));
    }

    @Test
    void prefersExactSanitizedStem() throws IOException {
        source("news/May 1, 2020 alpha.txt");
        Path beta = source("news/May 1, 2020 beta.html");

        assertEquals(Optional.of(SourceFile.of(sourceRoot, beta)),
                resolver.findSource(destination("news/2020-05-01_May_1_2020_beta.txt"), destinationRoot, sourceRoot));
    }

    @Test
    void matchesTruncatedStemsByPrefix() throws IOException {
        source("news/May 1, 2020 council budget vote.pdf");
        Path school = source("news/May 1, 2020 school board.pdf");

        assertEquals(Optional.of(SourceFile.of(sourceRoot, school)),
                resolver.findSource(destination("news/2020-05-01_May_1_2020_scho.txt"), destinationRoot, sourceRoot));
    }

    @Test
    void fallsBackToCaseInsensitiveLeadingCharacters() throws IOException {
        source("news/May 1, 2020 council budget vote.pdf");
        Path school = source("news/May 1, 2020 school board.pdf");

        assertEquals(Optional.of(SourceFile.of(sourceRoot, school)),
                resolver.findSource(
                        destination("news/2020-05-01_MAY_1_2020_SCHOOL_BOARD_EXTRA.txt"), destinationRoot, sourceRoot));
    }

    @Test
    void fallsBackToFirstCandidateInNameOrder() throws IOException {
        Path first = source("news/May 1, 2020 alpha.txt");
        source("news/May 1, 2020 beta.txt");

        assertEquals(Optional.of(SourceFile.of(sourceRoot, first)),
                resolver.findSource(destination("news/2020-05-01_unrelated.txt"), destinationRoot, sourceRoot));
    }

    @Test
    void returnsEmptyInsteadOfFailing() throws IOException {
        source("news/2020-01-01_original.txt");

        assertEquals(Optional.empty(),
                resolver.findSource(destination("news/2020-01-09_original.txt"), destinationRoot, sourceRoot));
        assertEquals(Optional.empty(),
                resolver.findSource(destination("missing/2020-01-01_original.txt"), destinationRoot, sourceRoot));
        assertEquals(Optional.empty(),
                resolver.findSource(destination("news/original.txt"), destinationRoot, sourceRoot));
        assertEquals(Optional.empty(),
                resolver.findSource(workspace.resolve("elsewhere/2020-01-01_original.txt"), destinationRoot, sourceRoot));
        assertEquals(Optional.empty(),
                resolver.findSource(destination("news/2020-01-01_original.txt"), destinationRoot,
                        workspace.resolve("no-such-root")));
    }

    private Path source(String relative) throws IOException {
        Path file = sourceRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "content");
    }

    private Path destination(String relative) {
        return destinationRoot.resolve(relative);
    }
}
