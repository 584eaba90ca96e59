package com.framejoin.table;

import com.framejoin.exception.CastException;
import com.framejoin.test.TestBase;
import com.framejoin.test.TestCategories;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.FloatType;
import com.framejoin.types.IntegerType;
import com.framejoin.types.StringType;
import com.framejoin.types.TemporalType;
import com.framejoin.types.TemporalType.Resolution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Test suite for Column: construction, categorical encoding, null filling and safe casts.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Column Tests")
public class ColumnTest extends TestBase {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Values are normalized to the dtype's boxed representation")
        void testNormalization() {
            Column column = Column.of(IntegerType.int16(), Arrays.asList(1, (short) 2, 3L, null));

            assertThat(column.values()).containsExactly(1L, 2L, 3L, null);
            assertThat(column.nullCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Float32 values are rounded through float")
        void testFloat32Rounding() {
            Column column = Column.of(FloatType.float32(), Arrays.asList(0.1d));

            assertThat(column.get(0)).isEqualTo((double) 0.1f);
        }

        @Test
        @DisplayName("Out-of-range integers are rejected")
        void testRangeCheck() {
            assertThatThrownBy(() -> Column.of(IntegerType.uint8(), Arrays.asList(256)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("out of range");
        }
    }

    @Nested
    @DisplayName("Categorical Columns")
    class Categorical {

        @Test
        @DisplayName("Codes decode to category values")
        void testDecode() {
            Column column = Column.categorical(Column.ofStrings("a", "b"), Column.ofInts(1, null, 0), false);

            assertThat(column.isCategorical()).isTrue();
            assertThat(column.value(0)).isEqualTo("b");
            assertThat(column.value(1)).isNull();
            assertThat(column.decode()).isEqualTo(Column.ofStrings("b", null, "a"));
            assertThat(column.codes()).isEqualTo(Column.ofInts(1, null, 0));
        }

        @Test
        @DisplayName("Codes outside the categories are rejected")
        void testInvalidCode() {
            assertThatThrownBy(() -> Column.categorical(Column.ofStrings("a"), Column.ofInts(1), false))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Categories may not contain nulls")
        void testNullCategory() {
            assertThatThrownBy(() -> new CategoricalType(Column.ofStrings("a", null), false))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Casting values to a categorical dtype encodes them")
        void testCastToCategorical() {
            CategoricalType dtype = new CategoricalType(Column.ofLongs(10L, 20L), true);

            Column encoded = Column.ofInts(20, null, 10).cast(dtype);

            assertThat(encoded.codes()).isEqualTo(Column.ofInts(1, null, 0));
            assertThat(Column.ofInts(30).canCastSafely(dtype)).isFalse();
        }

        @Test
        @DisplayName("Category lookup finds codes across many categories")
        void testCodeOfLookup() {
            String[] names = new String[5000];
            for (int i = 0; i < names.length; i++) {
                names[i] = "c" + i;
            }
            CategoricalType dtype = new CategoricalType(Column.ofStrings(names), false);

            assertThat(dtype.codeOf("c0")).isZero();
            assertThat(dtype.codeOf("c4999")).isEqualTo(4999);
            assertThat(dtype.codeOf("c5000")).isEqualTo(-1);
            assertThat(dtype.codeOf(null)).isEqualTo(-1);
        }
    }

    @Nested
    @DisplayName("Null Filling")
    class NullFilling {

        @Test
        @DisplayName("Neutral fill uses zero, the empty string and the first category")
        void testNeutralFill() {
            assertThat(Column.ofLongs(null, 5L).fillNullsWithNeutral()).isEqualTo(Column.ofLongs(0L, 5L));
            assertThat(Column.ofStrings((String) null).fillNullsWithNeutral()).isEqualTo(Column.ofStrings(""));

            Column categorical = Column.categorical(Column.ofStrings("x", "y"), Column.ofInts(null, 1), false);
            assertThat(categorical.fillNullsWithNeutral().codes()).isEqualTo(Column.ofInts(0, 1));
        }

        @Test
        @DisplayName("Filling does not modify the original column")
        void testFillIsPure() {
            Column original = Column.ofDoubles(null, 1.5);

            original.fillNulls(2.0);

            assertThat(original.isNull(0)).isTrue();
        }
    }

    @Nested
    @DisplayName("Safe Casts")
    class SafeCasts {

        @Test
        @DisplayName("Integers narrow only when every value fits")
        void testIntegerNarrowing() {
            assertThat(Column.ofLongs(1L, -100L).canCastSafely(IntegerType.int8())).isTrue();
            assertThat(Column.ofLongs(1L, 300L).canCastSafely(IntegerType.int8())).isFalse();
            assertThat(Column.ofLongs(-1L).canCastSafely(IntegerType.uint32())).isFalse();
        }

        @Test
        @DisplayName("Floats cast to integers only when integral")
        void testFloatToInteger() {
            assertThat(Column.ofDoubles(1.0, 2.0, null).cast(IntegerType.int32()))
                .isEqualTo(Column.ofInts(1, 2, null));
            assertThat(Column.ofDoubles(1.5).canCastSafely(IntegerType.int64())).isFalse();
            assertThat(Column.ofDoubles(Double.NaN).canCastSafely(IntegerType.int64())).isFalse();
        }

        @Test
        @DisplayName("Large integers do not fit float32 exactly")
        void testIntegerToFloat() {
            assertThat(Column.ofLongs(16_777_216L).canCastSafely(FloatType.float32())).isTrue();
            assertThat(Column.ofLongs(16_777_217L).canCastSafely(FloatType.float32())).isFalse();
            assertThat(Column.ofLongs(16_777_217L).canCastSafely(FloatType.float64())).isTrue();
        }

        @Test
        @DisplayName("Temporal casts to a coarser unit require exact division")
        void testTemporalCasts() {
            Column millis = Column.ofDatetimes(Resolution.MILLISECONDS, 2000L, 3500L);

            assertThat(millis.cast(TemporalType.datetime(Resolution.MICROSECONDS)).values())
                .containsExactly(2_000_000L, 3_500_000L);
            assertThat(millis.canCastSafely(TemporalType.datetime(Resolution.SECONDS))).isFalse();
            assertThat(Column.ofDatetimes(Resolution.MILLISECONDS, 2000L)
                .cast(TemporalType.datetime(Resolution.SECONDS)).values()).containsExactly(2L);
        }

        @Test
        @DisplayName("Unsafe casts raise CastException")
        void testUnsafeCastThrows() {
            assertThatThrownBy(() -> Column.ofStrings("1").cast(IntegerType.int64()))
                .isInstanceOf(CastException.class);
            assertThatThrownBy(() -> Column.ofLongs(1000L).cast(IntegerType.int8()))
                .isInstanceOf(CastException.class)
                .hasMessageContaining("int8");
        }

        @Test
        @DisplayName("Casting to the same dtype returns the column")
        void testIdentityCast() {
            Column column = Column.ofStrings("a");

            assertThat(column.cast(StringType.get())).isSameAs(column);
        }
    }
}
