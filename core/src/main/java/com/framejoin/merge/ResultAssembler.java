package com.framejoin.merge;

import com.framejoin.exception.EngineContractException;
import com.framejoin.table.Column;
import com.framejoin.table.Index;
import com.framejoin.table.Table;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.DataType;
import com.framejoin.types.IntegerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the merge result from the engine's flat output.
 *
 * <p>Assembly steps:
 * <ol>
 *   <li>Take the codes columns of code-substituted keys out of the pool and rebuild
 *       those keys as categoricals</li>
 *   <li>Order the columns: the original left then right names, or, when sorting, the
 *       left non-key, key and right non-key groups each sorted by name</li>
 *   <li>Re-wrap columns declared categorical from the codes the engine returned, and
 *       re-encode index-join keys (and a categorical result index) from their values</li>
 *   <li>Require every engine column to be consumed exactly once</li>
 * </ol>
 *
 * <p>A column the engine returned but this layer cannot place is a defect and raises
 * {@link EngineContractException}.
 */
public final class ResultAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ResultAssembler.class);

    private ResultAssembler() {}

    /**
     * Assembles the final merge result.
     *
     * @param engineOutput the engine's flat result
     * @param inputs the unified inputs the engine was called with
     * @param sort whether to order columns by the sorted partition convention
     * @return the merge result
     * @throws EngineContractException if an engine column is missing or left unconsumed
     */
    public static Table assemble(Table engineOutput, UnifiedInputs inputs, boolean sort) {
        LinkedHashMap<String, Column> pool = new LinkedHashMap<>(engineOutput.columns());

        Map<String, Column> codesByKey = new HashMap<>();
        for (CodeSubstitutedKey key : inputs.codeSubstitutions().values()) {
            Column codes = pool.remove(key.codesColumn());
            if (codes == null) {
                throw new EngineContractException(
                    "Engine output lacks codes column '" + key.codesColumn() + "'", key.codesColumn());
            }
            codesByKey.put(key.keyName(), codes);
        }

        List<String> order = sort ? sortedOrder(inputs) : originalOrder(inputs);

        LinkedHashMap<String, Column> result = new LinkedHashMap<>();
        for (String name : order) {
            Column column = pool.remove(name);
            if (column == null) {
                throw new EngineContractException("Engine output lacks column '" + name + "'", name);
            }
            CategoricalType decoded = inputs.decodedColumns().get(name);
            result.put(name, decoded != null
                ? encodeValues(decoded, column)
                : restoreDtype(name, column, inputs.categoricalDtypes(), codesByKey));
        }

        if (!pool.isEmpty()) {
            String unconsumed = pool.keySet().iterator().next();
            throw new EngineContractException(String.format(
                "Unconsumed engine column '%s' (unplaced columns: %s)", unconsumed, pool.keySet()),
                unconsumed);
        }

        Index index = engineOutput.index();
        if (index != null && inputs.indexDtype() != null) {
            index = index.withColumn(encodeValues(inputs.indexDtype(), index.column()));
        }

        logger.debug("Assembled merge result with columns {}", result.keySet());
        return Table.of(result, index);
    }

    /**
     * Left names then right names, each once.
     */
    private static List<String> originalOrder(UnifiedInputs inputs) {
        Set<String> names = new LinkedHashSet<>(inputs.leftNames());
        names.addAll(inputs.rightNames());
        return new ArrayList<>(names);
    }

    /**
     * Left non-key columns, then key columns, then right non-key columns, each group
     * sorted by name on its own.
     */
    private static List<String> sortedOrder(UnifiedInputs inputs) {
        JoinKeys keys = inputs.keys();
        List<String> leftOfOn = new ArrayList<>();
        for (String name : inputs.leftNames()) {
            if (!keys.leftOn().contains(name)) {
                leftOfOn.add(name);
            }
        }
        Set<String> inOn = new LinkedHashSet<>();
        for (String name : inputs.leftNames()) {
            if (keys.isKey(name)) {
                inOn.add(name);
            }
        }
        for (String name : inputs.rightNames()) {
            if (keys.isKey(name)) {
                inOn.add(name);
            }
        }
        List<String> rightOfOn = new ArrayList<>();
        for (String name : inputs.rightNames()) {
            if (!keys.rightOn().contains(name)) {
                rightOfOn.add(name);
            }
        }

        List<String> keyGroup = new ArrayList<>(inOn);
        Collections.sort(leftOfOn);
        Collections.sort(keyGroup);
        Collections.sort(rightOfOn);

        List<String> order = new ArrayList<>(leftOfOn);
        order.addAll(keyGroup);
        order.addAll(rightOfOn);
        return order;
    }

    /**
     * Re-wraps a column declared categorical; other columns keep the engine dtype.
     */
    private static Column restoreDtype(String name, Column column,
                                       Map<String, DataType> categoricalDtypes,
                                       Map<String, Column> codesByKey) {
        DataType declared = categoricalDtypes.get(name);
        if (!(declared instanceof CategoricalType)) {
            return column;
        }
        CategoricalType categorical = (CategoricalType) declared;
        Column codes = codesByKey.get(name);
        if (codes != null) {
            return rebuildFromCodes(categorical, codes, column);
        }
        if (column.isCategorical()) {
            return column;
        }
        if (!(column.dtype() instanceof IntegerType)) {
            throw new EngineContractException(String.format(
                "Engine returned %s for categorical column '%s', expected integer codes",
                column.dtype().typeName(), name), name);
        }
        return Column.categorical(categorical.categories(), column, categorical.ordered());
    }

    /**
     * Encodes category values as a categorical column. Values that are not categories become null.
     */
    private static Column encodeValues(CategoricalType categorical, Column values) {
        Column logical = values;
        if (!values.dtypeEquals(categorical.valueType()) && values.canCastSafely(categorical.valueType())) {
            logical = values.cast(categorical.valueType());
        }
        List<Long> codes = new ArrayList<>(logical.size());
        for (int row = 0; row < logical.size(); row++) {
            int code = categorical.codeOf(logical.value(row));
            codes.add(code >= 0 ? (long) code : null);
        }
        return Column.categorical(categorical.categories(),
            Column.of(IntegerType.int32(), codes), categorical.ordered());
    }

    /**
     * Rebuilds a substituted key from its returned codes. Rows without a code whose
     * key value is a category (unmatched rows of the other side) are encoded from the value.
     */
    private static Column rebuildFromCodes(CategoricalType categorical, Column codes, Column values) {
        List<Long> rebuilt = new ArrayList<>(codes.size());
        for (int row = 0; row < codes.size(); row++) {
            Object code = codes.get(row);
            if (code == null && values.get(row) != null) {
                int encoded = categorical.codeOf(values.value(row));
                code = encoded >= 0 ? (long) encoded : null;
            }
            rebuilt.add((Long) code);
        }
        return Column.categorical(categorical.categories(),
            Column.of(IntegerType.int32(), rebuilt), categorical.ordered());
    }
}
