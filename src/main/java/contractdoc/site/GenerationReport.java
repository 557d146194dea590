// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package contractdoc.site;

import java.util.List;

/**
 * The outcome of a site generation run.
 *
 * @param writtenPages The file names of the pages written, relative to the output directory, sorted.
 * @param failures     The contract failures, in no particular order. With {@link FailurePolicy#SKIP}, one per
 *                     skipped page; with {@link FailurePolicy#ABORT}, the failure that stopped the run.
 * @param aborted      {@code true} iff generation stopped early.
 */
public record GenerationReport(
    List<String> writtenPages,
    List<TranspilationErrorCondition> failures,
    boolean aborted
) {
    public GenerationReport {
        writtenPages = List.copyOf(writtenPages);
        failures = List.copyOf(failures);
    }
}
