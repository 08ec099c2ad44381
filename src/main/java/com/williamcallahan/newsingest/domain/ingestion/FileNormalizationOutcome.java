package com.williamcallahan.newsingest.domain.ingestion;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of normalizing a single source file.
 */
public sealed interface FileNormalizationOutcome
        permits FileNormalizationOutcome.Accepted, FileNormalizationOutcome.Rejected {

    /**
     * Returns the source file this outcome describes.
     */
    SourceFile source();

    /**
     * Returns true when the file is present in the destination tree.
     */
    boolean accepted();

    /**
     * Returns the ledger entry for rejected files.
     */
    Optional<LedgerEntry> ledgerEntry();

    /**
     * Returns an accepted outcome.
     *
     * @param source source file
     * @param destination normalized document path
     * @param written false when the destination already existed and was left untouched
     */
    static FileNormalizationOutcome acceptedFile(SourceFile source, Path destination, boolean written) {
        return new Accepted(source, destination, written);
    }

    /**
     * Returns a rejected outcome.
     *
     * @param source source file
     * @param reason rejection category
     * @param detail diagnostic detail, carried into the ledger tag for {@link RejectionReason#ERROR}
     */
    static FileNormalizationOutcome rejectedFile(SourceFile source, RejectionReason reason, String detail) {
        return new Rejected(source, reason, detail == null ? "" : detail);
    }

    record Accepted(SourceFile source, Path destination, boolean written) implements FileNormalizationOutcome {
        public Accepted {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(destination, "destination");
        }

        @Override
        public boolean accepted() {
            return true;
        }

        @Override
        public Optional<LedgerEntry> ledgerEntry() {
            return Optional.empty();
        }
    }

    record Rejected(SourceFile source, RejectionReason reason, String detail) implements FileNormalizationOutcome {
        public Rejected {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean accepted() {
            return false;
        }

        @Override
        public Optional<LedgerEntry> ledgerEntry() {
            return Optional.of(LedgerEntry.of(source.relativeKey(), reason, detail));
        }
    }
}
