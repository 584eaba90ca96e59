package com.framejoin.merge;

import com.framejoin.exception.MergeException;
import com.framejoin.exception.MergeException.Kind;
import com.framejoin.merge.Unification.CodeSubstitution;
import com.framejoin.table.Column;
import com.framejoin.table.Index;
import com.framejoin.table.Table;
import com.framejoin.test.TestBase;
import com.framejoin.test.TestCategories;
import com.framejoin.types.BooleanType;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.DataType;
import com.framejoin.types.FloatType;
import com.framejoin.types.IntegerType;
import com.framejoin.types.StringType;
import com.framejoin.types.TemporalType;
import com.framejoin.types.TemporalType.Resolution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for TypeUnifier.
 *
 * <p>Tests the casting rules one by one, then their application to merge inputs:
 * code substitution for categorical keys, index keys and warning collection.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("TypeUnifier Tests")
public class TypeUnifierTest extends TestBase {

    private static final CategoricalType COLORS =
        new CategoricalType(Column.ofStrings("red", "green", "blue"), false);

    private static KeyColumn leftKey(Column column) {
        return KeyColumn.left("k", column);
    }

    private static KeyColumn rightKey(Column column) {
        return KeyColumn.right("k", column);
    }

    private static Unification unify(Column left, Column right, JoinKind how) {
        return TypeUnifier.unify(left.dtype(), right.dtype(), how, leftKey(left), rightKey(right));
    }

    static Stream<Arguments> dtypesAndKinds() {
        DataType[] dtypes = {
            IntegerType.int8(), IntegerType.uint64(), FloatType.float32(), BooleanType.get(),
            StringType.get(), TemporalType.timedelta(Resolution.NANOSECONDS), COLORS
        };
        return Arrays.stream(dtypes).flatMap(dtype -> Stream.of(
            Arguments.of(dtype, JoinKind.LEFT),
            Arguments.of(dtype, JoinKind.INNER),
            Arguments.of(dtype, JoinKind.OUTER)));
    }

    @Nested
    @DisplayName("Casting Rules")
    class CastingRules {

        @ParameterizedTest(name = "{0} / {1}")
        @MethodSource("com.framejoin.merge.TypeUnifierTest#dtypesAndKinds")
        @DisplayName("Equal dtypes unify to themselves")
        void testReflexive(DataType dtype, JoinKind how) {
            Column column = Column.nulls(dtype, 2);

            Unification result = TypeUnifier.unify(dtype, dtype, how, leftKey(column), rightKey(column));

            assertThat(result.targetType()).isEqualTo(dtype);
            assertThat(result.warning()).isNull();
            assertThat(result.codeSubstitution()).isEqualTo(CodeSubstitution.NONE);
        }

        @Test
        @DisplayName("Inner join promotes numeric pairs")
        void testInnerNumericPromotion() {
            Unification result = unify(Column.ofInts(1), Column.of(FloatType.float32(), Arrays.asList(1.0)),
                JoinKind.INNER);

            assertThat(result.targetType()).isEqualTo(FloatType.float64());
        }

        @Test
        @DisplayName("Outer join picks the finer temporal resolution")
        void testOuterTemporal() {
            Unification result = unify(Column.ofDatetimes(Resolution.SECONDS, 1L),
                Column.ofDatetimes(Resolution.MILLISECONDS, 1000L), JoinKind.OUTER);

            assertThat(result.targetType()).isEqualTo(TemporalType.datetime(Resolution.MILLISECONDS));
        }

        @Test
        @DisplayName("Unrelated dtypes are left to the engine")
        void testNoCommonType() {
            Unification result = unify(Column.ofStrings("1"), Column.ofLongs(1L), JoinKind.INNER);

            assertThat(result.isUnified()).isFalse();
        }

        @Test
        @DisplayName("Left join keeps the left dtype when right values fit")
        void testLeftJoinKeepsLeftType() {
            Unification result = unify(Column.ofInts(1, 2), Column.ofLongs(2L, null, 3L), JoinKind.LEFT);

            assertThat(result.targetType()).isEqualTo(IntegerType.int32());
            assertThat(result.warning()).isNull();
        }

        @Test
        @DisplayName("Left join falls back to the supertype with a warning")
        void testLeftJoinWarning() {
            Unification result = unify(Column.ofInts(1, 2), Column.ofLongs(1L << 40), JoinKind.LEFT);

            assertThat(result.targetType()).isEqualTo(IntegerType.int64());
            assertThat(result.warning()).isNotNull();
            assertThat(result.warning().side()).isEqualTo("right");
            assertThat(result.warning().requestedType()).isEqualTo(IntegerType.int32());
            assertThat(result.warning().message()).contains("upcasting to int64");
        }

        @Test
        @DisplayName("Two different categoricals are incompatible")
        void testIncompatibleCategories() {
            Column colors = Column.categorical(COLORS.categories(), Column.ofInts(0), false);
            Column other = Column.categorical(Column.ofStrings("red"), Column.ofInts(0), false);

            assertThatThrownBy(() -> unify(colors, other, JoinKind.INNER))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).kind()).isEqualTo(Kind.INCOMPATIBLE_CATEGORIES));
        }

        @Test
        @DisplayName("A categorical key joins on its values with codes carried")
        void testCodeSubstitution() {
            Column colors = Column.categorical(COLORS.categories(), Column.ofInts(2), false);

            Unification result = unify(colors, Column.ofStrings("blue"), JoinKind.INNER);

            assertThat(result.targetType()).isEqualTo(StringType.get());
            assertThat(result.codeSubstitution()).isEqualTo(CodeSubstitution.LEFT);
        }

        @Test
        @DisplayName("A left join cannot keep right categories")
        void testCategoricalDroppedOnLeftJoin() {
            Column colors = Column.categorical(COLORS.categories(), Column.ofInts(2), false);

            assertThatThrownBy(() -> unify(Column.ofStrings("blue"), colors, JoinKind.LEFT))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).kind()).isEqualTo(Kind.CATEGORICAL_DROPPED));
        }

        @Test
        @DisplayName("A right join cannot keep left categories")
        void testCategoricalDroppedOnRightJoin() {
            Column colors = Column.categorical(COLORS.categories(), Column.ofInts(2), false);

            assertThatThrownBy(() -> unify(colors, Column.ofStrings("blue"), JoinKind.RIGHT))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).kind()).isEqualTo(Kind.CATEGORICAL_DROPPED));
        }
    }

    @Nested
    @DisplayName("Merge Inputs")
    class MergeInputs {

        private ResolvedInputs inputs(Table left, Table right, String key) {
            JoinKeys keys = new JoinKeys(Collections.singletonList(key), Collections.singletonList(key), false, false);
            return new ResolvedInputs(left, right, keys);
        }

        @Test
        @DisplayName("Keys are cast to the common dtype on both sides")
        void testKeysCast() {
            Table left = Table.builder().column("id", Column.ofInts(1, 2)).build();
            Table right = Table.builder().column("id", Column.of(IntegerType.uint32(), Arrays.asList(2L))).build();

            UnifiedInputs unified = TypeUnifier.unify(inputs(left, right, "id"), JoinKind.INNER);

            assertThat(unified.left().column("id").dtype()).isEqualTo(IntegerType.int64());
            assertThat(unified.right().column("id").dtype()).isEqualTo(IntegerType.int64());
            assertThat(left.column("id").dtype()).isEqualTo(IntegerType.int32());
        }

        @Test
        @DisplayName("Categorical key gets a codes column and is decoded")
        void testCodesColumn() {
            Table left = Table.builder()
                .column("color", Column.categorical(COLORS.categories(), Column.ofInts(2, 0), false))
                .build();
            Table right = Table.builder().column("color", Column.ofStrings("red")).build();

            UnifiedInputs unified = TypeUnifier.unify(inputs(left, right, "color"), JoinKind.INNER);

            assertThat(unified.left().columnNames()).containsExactly("color", "color_codes");
            assertThat(unified.left().column("color")).isEqualTo(Column.ofStrings("blue", "red"));
            assertThat(unified.left().column("color_codes")).isEqualTo(Column.ofInts(2, 0));
            assertThat(unified.codeSubstitutions()).containsKey("color");
            assertThat(unified.categoricalDtypes().get("color")).isEqualTo(left.column("color").dtype());
            assertThat(unified.leftNames()).containsExactly("color");
        }

        @Test
        @DisplayName("An existing column with the codes name is rejected")
        void testReservedCodesName() {
            Table left = Table.builder()
                .column("color", Column.categorical(COLORS.categories(), Column.ofInts(0), false))
                .build();
            Table right = Table.builder()
                .column("color", Column.ofStrings("red"))
                .column("color_codes", Column.ofInts(9))
                .build();

            assertThatThrownBy(() -> TypeUnifier.unify(inputs(left, right, "color"), JoinKind.INNER))
                .isInstanceOf(MergeException.class)
                .satisfies(e -> assertThat(((MergeException) e).kind()).isEqualTo(Kind.RESERVED_NAME));
        }

        @Test
        @DisplayName("Categorical indexes are decoded for index joins")
        void testCategoricalIndexDecoded() {
            Column codes = Column.categorical(COLORS.categories(), Column.ofInts(1), false);
            Table left = Table.builder().column("v", Column.ofLongs(1L)).index(Index.of("c", codes)).build();
            Table right = Table.builder().column("name", Column.ofStrings("green")).build();
            JoinKeys keys = new JoinKeys(Collections.emptyList(), Collections.singletonList("name"), true, false);

            UnifiedInputs unified = TypeUnifier.unify(new ResolvedInputs(left, right, keys), JoinKind.INNER);

            assertThat(unified.left().index().column()).isEqualTo(Column.ofStrings("green"));
            assertThat(unified.codeSubstitutions()).isEmpty();
        }

        @Test
        @DisplayName("A categorical key paired with an index is sent as values and re-encoded later")
        void testCategoricalKeyAgainstIndex() {
            Table left = Table.builder()
                .column("v", Column.ofLongs(1L))
                .index(Index.of("k", Column.ofLongs(10L)))
                .build();
            CategoricalType tens = new CategoricalType(Column.ofLongs(10L, 20L), false);
            Table right = Table.builder()
                .column("key", Column.categorical(tens.categories(), Column.ofInts(1), false))
                .build();
            JoinKeys keys = new JoinKeys(Collections.emptyList(), Collections.singletonList("key"), true, false);

            UnifiedInputs unified = TypeUnifier.unify(new ResolvedInputs(left, right, keys), JoinKind.INNER);

            assertThat(unified.right().column("key")).isEqualTo(Column.ofLongs(20L));
            assertThat(unified.categoricalDtypes()).doesNotContainKey("key");
            assertThat(unified.decodedColumns()).containsEntry("key", tens);
            assertThat(unified.indexDtype()).isNull();
        }

        @Test
        @DisplayName("Indexes sharing a categorical dtype keep it for the result index")
        void testSharedCategoricalIndex() {
            Table left = Table.builder()
                .column("a", Column.ofLongs(1L))
                .index(Index.of("c", Column.categorical(COLORS.categories(), Column.ofInts(0), false)))
                .build();
            Table right = Table.builder()
                .column("b", Column.ofLongs(2L))
                .index(Index.of("c", Column.categorical(COLORS.categories(), Column.ofInts(2), false)))
                .build();
            JoinKeys keys = new JoinKeys(Collections.emptyList(), Collections.emptyList(), true, true);

            UnifiedInputs unified = TypeUnifier.unify(new ResolvedInputs(left, right, keys), JoinKind.OUTER);

            assertThat(unified.left().index().column()).isEqualTo(Column.ofStrings("red"));
            assertThat(unified.indexDtype()).isEqualTo(COLORS);
            assertThat(unified.decodedColumns()).isEmpty();
        }

        @Test
        @DisplayName("Warnings are collected per call")
        void testWarningsCollected() {
            Table left = Table.builder().column("id", Column.ofInts(1)).build();
            Table right = Table.builder().column("id", Column.ofDoubles(1.5)).build();

            UnifiedInputs unified = TypeUnifier.unify(inputs(left, right, "id"), JoinKind.LEFT);

            assertThat(unified.warnings()).hasSize(1);
            assertThat(unified.left().column("id").dtype()).isEqualTo(FloatType.float64());
        }
    }
}
