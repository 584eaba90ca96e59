package com.framejoin.merge;

import com.framejoin.exception.MergeException;
import com.framejoin.exception.MergeException.Kind;
import com.framejoin.merge.Unification.CodeSubstitution;
import com.framejoin.table.Column;
import com.framejoin.table.Index;
import com.framejoin.table.Table;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.DataType;
import com.framejoin.types.TemporalType;
import com.framejoin.types.TypePromotion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings each join key pair to a common dtype before the engine runs.
 *
 * <h2>Casting rules</h2>
 * <ol>
 *   <li>Equal dtypes are kept</li>
 *   <li>Two different categoricals are rejected</li>
 *   <li>One categorical side is joined on its category values with its codes carried
 *       along, unless the join kind discards that side</li>
 *   <li>Left joins keep the left dtype when the right values cast safely, and fall back
 *       to the inner-join supertype with a warning otherwise; right joins mirror this</li>
 *   <li>Inner and outer joins promote numeric pairs and pick the finer temporal resolution</li>
 *   <li>Anything else is left to the engine</li>
 * </ol>
 */
public final class TypeUnifier {

    private static final Logger logger = LoggerFactory.getLogger(TypeUnifier.class);

    private TypeUnifier() {}

    // ========================================================================
    // Casting rules
    // ========================================================================

    /**
     * Computes the dtype both sides of a key pair are cast to.
     *
     * @param leftType the left key dtype
     * @param rightType the right key dtype
     * @param how the join kind
     * @param left the left key values
     * @param right the right key values
     * @return the unification outcome
     * @throws MergeException with {@link Kind#INCOMPATIBLE_CATEGORIES} or {@link Kind#CATEGORICAL_DROPPED}
     */
    public static Unification unify(DataType leftType, DataType rightType, JoinKind how,
                                    KeyColumn left, KeyColumn right) {
        if (leftType.equals(rightType)) {
            return Unification.to(leftType);
        }

        boolean leftCategorical = leftType instanceof CategoricalType;
        boolean rightCategorical = rightType instanceof CategoricalType;
        if (leftCategorical && rightCategorical) {
            throw new MergeException(Kind.INCOMPATIBLE_CATEGORIES, String.format(
                "Left and right categories must be the same for key %s / %s", left.name(), right.name()));
        }
        if (leftCategorical) {
            if (how == JoinKind.RIGHT) {
                throw new MergeException(Kind.CATEGORICAL_DROPPED, String.format(
                    "can't implicitly cast column %s to categories from right during right join",
                    right.name()));
            }
            return Unification.withCodeSubstitution(
                ((CategoricalType) leftType).valueType(), CodeSubstitution.LEFT);
        }
        if (rightCategorical) {
            if (how == JoinKind.LEFT) {
                throw new MergeException(Kind.CATEGORICAL_DROPPED, String.format(
                    "can't implicitly cast column %s to categories from left during left join",
                    left.name()));
            }
            return Unification.withCodeSubstitution(
                ((CategoricalType) rightType).valueType(), CodeSubstitution.RIGHT);
        }

        if (how == JoinKind.LEFT) {
            return unifyTowards(leftType, right, rightType, leftType, rightType, left, right);
        }
        if (how == JoinKind.RIGHT) {
            return unifyTowards(rightType, left, leftType, leftType, rightType, left, right);
        }

        if (leftType.isNumeric() && rightType.isNumeric()) {
            return Unification.to(TypePromotion.promoteNumericTypes(leftType, rightType));
        }
        if (leftType instanceof TemporalType && rightType instanceof TemporalType) {
            TemporalType finer = TypePromotion.finerTemporal((TemporalType) leftType, (TemporalType) rightType);
            return finer == null ? Unification.none() : Unification.to(finer);
        }
        return Unification.none();
    }

    /**
     * Keeps {@code preferred} when the other side's values cast safely to it, otherwise
     * falls back to the inner-join supertype and attaches a warning.
     */
    private static Unification unifyTowards(DataType preferred, KeyColumn other, DataType otherType,
                                            DataType leftType, DataType rightType,
                                            KeyColumn left, KeyColumn right) {
        Column check = other.column().fillNullsWithNeutral();
        if (check.canCastSafely(preferred)) {
            return Unification.to(preferred);
        }
        Unification supertype = unify(leftType, rightType, JoinKind.INNER, left, right);
        PrecisionWarning warning = new PrecisionWarning(
            other.name(), other.side(), otherType, preferred, supertype.targetType());
        logger.warn(warning.message());
        return supertype.withWarning(warning);
    }

    // ========================================================================
    // Applying the rules to merge inputs
    // ========================================================================

    /**
     * Casts the key columns (or indexes) of both inputs to their unified dtypes.
     *
     * @param inputs the name-resolved inputs
     * @param how the join kind
     * @return the engine-ready inputs and assembly bookkeeping
     * @throws MergeException for categorical conflicts or reserved codes column names
     * @throws com.framejoin.exception.CastException if a key cannot be cast safely
     */
    public static UnifiedInputs unify(ResolvedInputs inputs, JoinKind how) {
        Table lhs = inputs.left();
        Table rhs = inputs.right();
        JoinKeys keys = inputs.keys();

        Map<String, DataType> categoricalDtypes = collectCategoricalDtypes(lhs, rhs);
        List<PrecisionWarning> warnings = new ArrayList<>();
        Map<String, CodeSubstitutedKey> codeSubstitutions = new LinkedHashMap<>();

        Map<String, CategoricalType> decodedColumns = new LinkedHashMap<>();
        CategoricalType indexDtype = null;

        if (keys.isIndexJoin()) {
            IndexKeys cast = unifyIndexKeys(lhs, rhs, keys, how, warnings);
            lhs = cast.left();
            rhs = cast.right();
            indexDtype = cast.indexDtype();
            // a categorical key column paired with an index reaches the engine as values
            if (!keys.leftIndex()) {
                recordDecoded(inputs.left(), keys.leftOn().get(0), categoricalDtypes, decodedColumns);
            }
            if (!keys.rightIndex()) {
                recordDecoded(inputs.right(), keys.rightOn().get(0), categoricalDtypes, decodedColumns);
            }
        } else {
            for (String[] pair : sortedKeyPairs(keys)) {
                String leftName = pair[0];
                String rightName = pair[1];
                Column leftColumn = lhs.column(leftName);
                Column rightColumn = rhs.column(rightName);
                if (leftColumn.dtypeEquals(rightColumn.dtype())) {
                    continue;
                }

                Unification unification = unify(leftColumn.dtype(), rightColumn.dtype(), how,
                    KeyColumn.left(leftName, leftColumn), KeyColumn.right(rightName, rightColumn));
                if (unification.warning() != null) {
                    warnings.add(unification.warning());
                }
                if (!unification.isUnified()) {
                    logger.debug("No common dtype for key {} ({}) / {} ({})",
                        leftName, leftColumn.dtype(), rightName, rightColumn.dtype());
                    continue;
                }

                DataType target = unification.targetType();
                if (unification.codeSubstitution() == CodeSubstitution.LEFT) {
                    CodeSubstitutedKey key = CodeSubstitutedKey.of(leftName, (CategoricalType) leftColumn.dtype());
                    requireUnusedName(key.codesColumn(), lhs, rhs);
                    lhs = lhs.withColumn(key.codesColumn(), leftColumn.codes());
                    codeSubstitutions.put(leftName, key);
                } else if (unification.codeSubstitution() == CodeSubstitution.RIGHT) {
                    CodeSubstitutedKey key = CodeSubstitutedKey.of(rightName, (CategoricalType) rightColumn.dtype());
                    requireUnusedName(key.codesColumn(), lhs, rhs);
                    rhs = rhs.withColumn(key.codesColumn(), rightColumn.codes());
                    codeSubstitutions.put(rightName, key);
                }
                logger.debug("Casting key {} / {} to {}", leftName, rightName, target);
                lhs = lhs.withColumn(leftName, leftColumn.cast(target));
                rhs = rhs.withColumn(rightName, rightColumn.cast(target));
            }
        }

        return new UnifiedInputs(lhs, rhs, keys,
            inputs.left().columnNames(), inputs.right().columnNames(),
            Collections.unmodifiableMap(codeSubstitutions),
            Collections.unmodifiableMap(categoricalDtypes),
            Collections.unmodifiableMap(decodedColumns),
            indexDtype,
            Collections.unmodifiableList(warnings));
    }

    /**
     * Unifies the single key pair of an index join. Categorical keys are decoded
     * to their values; no codes are carried. When both keys share one categorical
     * dtype, the result index is re-encoded with it.
     */
    private static IndexKeys unifyIndexKeys(Table lhs, Table rhs, JoinKeys keys, JoinKind how,
                                          List<PrecisionWarning> warnings) {
        Column leftKey = keys.leftIndex() ? lhs.index().column() : lhs.column(keys.leftOn().get(0));
        Column rightKey = keys.rightIndex() ? rhs.index().column() : rhs.column(keys.rightOn().get(0));
        String leftName = keys.leftIndex() ? describe(lhs.index()) : keys.leftOn().get(0);
        String rightName = keys.rightIndex() ? describe(rhs.index()) : keys.rightOn().get(0);
        CategoricalType indexDtype = null;

        if (!leftKey.dtypeEquals(rightKey.dtype())) {
            if (leftKey.isCategorical() && rightKey.isCategorical()) {
                throw new MergeException(Kind.INCOMPATIBLE_CATEGORIES,
                    "Left and right index categories must be the same");
            }
            Column leftValues = leftKey.isCategorical() ? leftKey.decode() : leftKey;
            Column rightValues = rightKey.isCategorical() ? rightKey.decode() : rightKey;
            Unification unification = unify(leftValues.dtype(), rightValues.dtype(), how,
                KeyColumn.left(leftName, leftValues), KeyColumn.right(rightName, rightValues));
            if (unification.warning() != null) {
                warnings.add(unification.warning());
            }
            if (unification.isUnified()) {
                leftKey = leftValues.cast(unification.targetType());
                rightKey = rightValues.cast(unification.targetType());
            } else {
                leftKey = leftValues;
                rightKey = rightValues;
            }
        } else if (leftKey.isCategorical()) {
            indexDtype = (CategoricalType) leftKey.dtype();
            leftKey = leftKey.decode();
            rightKey = rightKey.decode();
        }

        Table left = keys.leftIndex()
            ? lhs.withIndex(lhs.index().withColumn(leftKey))
            : lhs.withColumn(leftName, leftKey);
        Table right = keys.rightIndex()
            ? rhs.withIndex(rhs.index().withColumn(rightKey))
            : rhs.withColumn(rightName, rightKey);
        return new IndexKeys(left, right, indexDtype);
    }

    private record IndexKeys(Table left, Table right, CategoricalType indexDtype) {
    }

    /**
     * Returns the key pairs ordered by left name, then right name. The pairing itself is kept.
     */
    private static List<String[]> sortedKeyPairs(JoinKeys keys) {
        List<String[]> pairs = new ArrayList<>();
        for (int i = 0; i < keys.leftOn().size(); i++) {
            pairs.add(new String[] {keys.leftOn().get(i), keys.rightOn().get(i)});
        }
        pairs.sort(Comparator.<String[], String>comparing(pair -> pair[0]).thenComparing(pair -> pair[1]));
        return pairs;
    }

    /**
     * Records the declared dtype of every categorical column of both inputs.
     */
    private static Map<String, DataType> collectCategoricalDtypes(Table lhs, Table rhs) {
        Map<String, DataType> dtypes = new LinkedHashMap<>();
        for (Table table : new Table[] {lhs, rhs}) {
            for (Map.Entry<String, Column> entry : table.columns().entrySet()) {
                if (entry.getValue().isCategorical()) {
                    dtypes.putIfAbsent(entry.getKey(), entry.getValue().dtype());
                }
            }
        }
        return dtypes;
    }

    private static void recordDecoded(Table table, String name, Map<String, DataType> categoricalDtypes,
                                      Map<String, CategoricalType> decodedColumns) {
        Column column = table.column(name);
        if (column.isCategorical()) {
            categoricalDtypes.remove(name);
            decodedColumns.put(name, (CategoricalType) column.dtype());
        }
    }

    private static void requireUnusedName(String name, Table lhs, Table rhs) {
        if (lhs.hasColumn(name) || rhs.hasColumn(name)) {
            throw new MergeException(Kind.RESERVED_NAME, String.format(
                "Column '%s' is needed for categorical codes but already exists", name));
        }
    }

    private static String describe(Index index) {
        return index.name() == null ? "index" : index.name();
    }
}
