package com.williamcallahan.newsingest.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Verifies ingestion settings are validated before a batch can start.
 */
class AppPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsBlankSourceRoot() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setSourceRoot(" ");

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsEmptyIncludedFolders() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setIncludedFolders(List.of(""));

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveParallelThreshold() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setParallelThreshold(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsWorkerFractionOutsideUnitInterval() {
        AppProperties appProperties = new AppProperties();
        appProperties.getIngestion().setWorkerFraction(1.5);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);

        appProperties.getIngestion().setWorkerFraction(0.0);
        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeMaxWorkersAndNonPositivePathLength() {
        AppProperties workers = new AppProperties();
        workers.getIngestion().setMaxWorkers(-1);
        AppProperties pathLength = new AppProperties();
        pathLength.getIngestion().setMaxPathLength(0);

        assertThrows(IllegalArgumentException.class, workers::validateConfiguration);
        assertThrows(IllegalArgumentException.class, pathLength::validateConfiguration);
    }

    @Test
    void selectionRulesTrimAndSkipBlankFolders() {
        AppProperties.Ingestion settings = new AppProperties.Ingestion();
        settings.setIncludedFolders(Arrays.asList(" news ", null, "", "reddit"));

        assertEquals(Set.of("news", "reddit"), settings.selectionRules().includedFolders());
        assertTrue(settings.selectionRules().includes(Path.of("news", "2020", "a.txt")));
    }

    @Test
    void rootsResolveToAbsolutePaths() {
        AppProperties.Ingestion settings = new AppProperties.Ingestion();

        assertTrue(settings.sourceRootPath().isAbsolute());
        assertTrue(settings.destinationRootPath().endsWith(Path.of("data", "filtered_data")));
    }
}
