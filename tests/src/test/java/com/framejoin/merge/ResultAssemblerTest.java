package com.framejoin.merge;

import com.framejoin.exception.EngineContractException;
import com.framejoin.table.Column;
import com.framejoin.table.Index;
import com.framejoin.table.Table;
import com.framejoin.test.TestBase;
import com.framejoin.test.TestCategories;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.DataType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for ResultAssembler, fed with hand-built engine outputs.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ResultAssembler Tests")
public class ResultAssemblerTest extends TestBase {

    private static final CategoricalType COLORS =
        new CategoricalType(Column.ofStrings("red", "green", "blue"), false);

    private static UnifiedInputs inputs(List<String> leftNames, List<String> rightNames, List<String> keys,
                                        Map<String, CodeSubstitutedKey> codes,
                                        Map<String, DataType> categoricals) {
        Table empty = Table.builder().build();
        return new UnifiedInputs(empty, empty, new JoinKeys(keys, keys, false, false),
            leftNames, rightNames, codes, categoricals, Collections.emptyMap(), null, Collections.emptyList());
    }

    private static UnifiedInputs plainInputs() {
        return inputs(Arrays.asList("b", "a", "id"), Arrays.asList("id", "z", "y"),
            Collections.singletonList("id"), Collections.emptyMap(), Collections.emptyMap());
    }

    private static Table engineOutput() {
        return Table.builder()
            .column("b", Column.ofLongs(1L))
            .column("a", Column.ofLongs(2L))
            .column("id", Column.ofLongs(3L))
            .column("z", Column.ofLongs(4L))
            .column("y", Column.ofLongs(5L))
            .build();
    }

    @Nested
    @DisplayName("Column Order")
    class ColumnOrder {

        @Test
        @DisplayName("Without sorting, left names come first, then new right names")
        void testOriginalOrder() {
            Table result = ResultAssembler.assemble(engineOutput(), plainInputs(), false);

            assertThat(result.columnNames()).containsExactly("b", "a", "id", "z", "y");
        }

        @Test
        @DisplayName("Sorting orders left non-keys, keys and right non-keys separately")
        void testSortedPartitions() {
            Table result = ResultAssembler.assemble(engineOutput(), plainInputs(), true);

            assertThat(result.columnNames()).containsExactly("a", "b", "id", "y", "z");
            assertThat(result.column("y")).isEqualTo(Column.ofLongs(5L));
        }

        @Test
        @DisplayName("Engine output order does not matter")
        void testEngineOrderIgnored() {
            Table shuffled = engineOutput().select(Arrays.asList("y", "id", "a", "z", "b"));

            Table result = ResultAssembler.assemble(shuffled, plainInputs(), false);

            assertThat(result.columnNames()).containsExactly("b", "a", "id", "z", "y");
        }
    }

    @Nested
    @DisplayName("Engine Contract")
    class EngineContract {

        @Test
        @DisplayName("An unexpected engine column is reported")
        void testUnconsumedColumn() {
            Table output = engineOutput().withColumn("stray", Column.ofLongs(0L));

            assertThatThrownBy(() -> ResultAssembler.assemble(output, plainInputs(), false))
                .isInstanceOf(EngineContractException.class)
                .satisfies(e -> assertThat(((EngineContractException) e).columnName()).isEqualTo("stray"));
        }

        @Test
        @DisplayName("A missing engine column is reported")
        void testMissingColumn() {
            Table output = engineOutput().select(Arrays.asList("b", "a", "id", "z"));

            assertThatThrownBy(() -> ResultAssembler.assemble(output, plainInputs(), true))
                .isInstanceOf(EngineContractException.class)
                .satisfies(e -> assertThat(((EngineContractException) e).columnName()).isEqualTo("y"));
        }

        @Test
        @DisplayName("The engine index is kept")
        void testIndexKept() {
            Index index = Index.of("k", Column.ofLongs(9L));

            Table result = ResultAssembler.assemble(engineOutput().withIndex(index), plainInputs(), false);

            assertThat(result.index()).isEqualTo(index);
        }
    }

    @Nested
    @DisplayName("Categorical Restoration")
    class CategoricalRestoration {

        @Test
        @DisplayName("Substituted key is rebuilt from codes, re-encoding rows without a code")
        void testRebuildFromCodes() {
            UnifiedInputs unified = inputs(Arrays.asList("color", "v"), Arrays.asList("color", "w"),
                Collections.singletonList("color"),
                Map.of("color", CodeSubstitutedKey.of("color", COLORS)),
                Map.of("color", COLORS));
            Table output = Table.builder()
                .column("color", Column.ofStrings("blue", "green", "purple"))
                .column("color_codes", Column.ofInts(2, null, null))
                .column("v", Column.ofLongs(1L, null, null))
                .column("w", Column.ofLongs(7L, 8L, 9L))
                .build();

            Table result = ResultAssembler.assemble(output, unified, false);

            assertThat(result.columnNames()).containsExactly("color", "v", "w");
            Column color = result.column("color");
            assertThat(color.dtype()).isEqualTo(COLORS);
            assertThat(color.codes()).isEqualTo(Column.ofInts(2, 1, null));
        }

        @Test
        @DisplayName("Categorical non-key columns are re-wrapped from their codes")
        void testRewrapNonKey() {
            UnifiedInputs unified = inputs(Arrays.asList("id", "color"), Collections.singletonList("id"),
                Collections.singletonList("id"), Collections.emptyMap(), Map.of("color", COLORS));
            Table output = Table.builder()
                .column("id", Column.ofLongs(1L, 2L))
                .column("color", Column.ofInts(0, null))
                .build();

            Table result = ResultAssembler.assemble(output, unified, false);

            assertThat(result.column("color").isCategorical()).isTrue();
            assertThat(result.column("color").value(0)).isEqualTo("red");
            assertThat(result.column("color").isNull(1)).isTrue();
        }

        @Test
        @DisplayName("Index-join keys are re-encoded from their values")
        void testDecodedKeyReencoded() {
            CategoricalType tens = new CategoricalType(Column.ofLongs(10L, 20L), false);
            Table empty = Table.builder().build();
            UnifiedInputs unified = new UnifiedInputs(empty, empty,
                new JoinKeys(Collections.emptyList(), Collections.singletonList("key"), true, false),
                Collections.singletonList("v"), Collections.singletonList("key"),
                Collections.emptyMap(), Collections.emptyMap(), Map.of("key", tens), null,
                Collections.emptyList());
            Table output = Table.builder()
                .column("v", Column.ofLongs(1L, 2L, 3L))
                .column("key", Column.ofLongs(20L, null, 10L))
                .build();

            Table result = ResultAssembler.assemble(output, unified, false);

            Column key = result.column("key");
            assertThat(key.dtype()).isEqualTo(tens);
            assertThat(key.codes()).isEqualTo(Column.ofInts(1, null, 0));
        }

        @Test
        @DisplayName("A categorical result index is re-encoded from its values")
        void testIndexReencoded() {
            Table empty = Table.builder().build();
            UnifiedInputs unified = new UnifiedInputs(empty, empty,
                new JoinKeys(Collections.emptyList(), Collections.emptyList(), true, true),
                Collections.singletonList("a"), Collections.singletonList("b"),
                Collections.emptyMap(), Collections.emptyMap(), Collections.emptyMap(), COLORS,
                Collections.emptyList());
            Table output = Table.builder()
                .column("a", Column.ofLongs(1L, null))
                .column("b", Column.ofLongs(null, 2L))
                .index(Index.of("c", Column.ofStrings("red", "blue")))
                .build();

            Table result = ResultAssembler.assemble(output, unified, false);

            assertThat(result.index().name()).isEqualTo("c");
            assertThat(result.index().column().dtype()).isEqualTo(COLORS);
            assertThat(result.index().column().codes()).isEqualTo(Column.ofInts(0, 2));
        }

        @Test
        @DisplayName("A missing codes column is a contract violation")
        void testMissingCodesColumn() {
            UnifiedInputs unified = inputs(Collections.singletonList("color"), Collections.singletonList("color"),
                Collections.singletonList("color"),
                Map.of("color", CodeSubstitutedKey.of("color", COLORS)),
                Map.of("color", COLORS));
            Table output = Table.builder().column("color", Column.ofStrings("red")).build();

            assertThatThrownBy(() -> ResultAssembler.assemble(output, unified, false))
                .isInstanceOf(EngineContractException.class)
                .hasMessageContaining("color_codes");
        }
    }
}
