package io.github.jakubt4.earendil.search;

import java.util.List;

/**
 * Produces the ordered list of search circles a solve works through.
 */
public interface SearchStrategy {

    List<SearchRun> searchRuns();

    /** Whether the runs may be scanned concurrently. */
    default boolean useParallelism() {
        return true;
    }
}
