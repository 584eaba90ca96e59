package com.framejoin.merge;

import com.framejoin.table.Table;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.DataType;

import java.util.List;
import java.util.Map;

/**
 * Merge inputs ready for the join engine, plus the bookkeeping the result
 * assembler needs to rebuild the output.
 *
 * @param left the left table with key columns cast (and codes columns added)
 * @param right the right table with key columns cast (and codes columns added)
 * @param keys the join keys
 * @param leftNames the left column names before codes columns were added
 * @param rightNames the right column names before codes columns were added
 * @param codeSubstitutions code-substituted keys by key name
 * @param categoricalDtypes categorical dtypes of the columns the engine returns as codes, by name
 * @param decodedColumns categorical dtypes of the index-join key columns the engine
 *                       returns as category values, by name
 * @param indexDtype the categorical dtype of the result index, or null to keep the engine's index
 * @param warnings precision warnings raised while unifying
 */
public record UnifiedInputs(Table left, Table right, JoinKeys keys,
                            List<String> leftNames, List<String> rightNames,
                            Map<String, CodeSubstitutedKey> codeSubstitutions,
                            Map<String, DataType> categoricalDtypes,
                            Map<String, CategoricalType> decodedColumns,
                            CategoricalType indexDtype,
                            List<PrecisionWarning> warnings) {
}
