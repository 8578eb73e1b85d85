package de.bsommerfeld.coversync.core.domain;

import java.util.List;

/**
 * Outcome of a duplicate-cover merge run.
 *
 * @param coversMerged    redundant files actually deleted
 * @param spaceSavedBytes sum of the sizes of the deleted files
 * @param albumsProcessed distinct album names visited
 * @param errors          one human-readable entry per failed item
 */
public record MergeResult(
        int coversMerged,
        long spaceSavedBytes,
        int albumsProcessed,
        List<String> errors) {

    public MergeResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
