package com.framejoin.merge;

import com.framejoin.table.Table;

import java.util.List;

/**
 * A merge result together with the precision warnings raised while unifying key dtypes.
 *
 * @param table the merged table
 * @param warnings the warnings, empty when every key kept its requested dtype
 */
public record MergeReport(Table table, List<PrecisionWarning> warnings) {
}
