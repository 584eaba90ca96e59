package com.framejoin.exception;

import com.framejoin.table.Column;
import com.framejoin.test.TestBase;
import com.framejoin.test.TestCategories;
import com.framejoin.types.IntegerType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the exception types and their messages.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest extends TestBase {

    @Nested
    @DisplayName("EngineExecutionException")
    class EngineExecution {

        @Test
        @DisplayName("Keeps the failed SQL and the cause")
        void testFailedSqlAndCause() {
            SQLException cause = new SQLException("boom");
            EngineExecutionException e = new EngineExecutionException("Join execution failed: boom", cause,
                "SELECT 1");

            assertThat(e.getFailedSQL()).isEqualTo("SELECT 1");
            assertThat(e.getCause()).isSameAs(cause);
        }

        @Test
        @DisplayName("Translates type mismatches")
        void testUserMessageTypeMismatch() {
            EngineExecutionException e = new EngineExecutionException(
                "Binder Error: Cannot compare values of type VARCHAR and type BIGINT", null, null);

            assertThat(e.getUserMessage()).contains("not comparable");
        }

        @Test
        @DisplayName("Translates conversion and memory errors")
        void testUserMessageOtherErrors() {
            assertThat(new EngineExecutionException("Conversion Error: bad", null, null).getUserMessage())
                .contains("could not be converted");
            assertThat(new EngineExecutionException("Out of Memory Error: x", null, null).getUserMessage())
                .contains("more memory");
        }

        @Test
        @DisplayName("Falls back to the raw message")
        void testUserMessageFallback() {
            assertThat(new EngineExecutionException("disk full", null, null).getUserMessage())
                .isEqualTo("Engine execution failed: disk full");
            assertThat(new EngineExecutionException(null, null, null).getUserMessage())
                .isEqualTo("Engine execution failed.");
        }
    }

    @Nested
    @DisplayName("MergeException and CastException")
    class UserErrors {

        @Test
        @DisplayName("MergeException carries its kind")
        void testMergeExceptionKind() {
            MergeException e = new MergeException(MergeException.Kind.NO_JOIN_KEYS, "No common columns");

            assertThat(e.kind()).isEqualTo(MergeException.Kind.NO_JOIN_KEYS);
            assertThat(e.toString()).isEqualTo("MergeException[NO_JOIN_KEYS]: No common columns");
        }

        @Test
        @DisplayName("Unsafe casts report both dtypes")
        void testCastException() {
            assertThatThrownBy(() -> Column.ofLongs(1L, 300L).cast(IntegerType.int8()))
                .isInstanceOf(CastException.class)
                .satisfies(e -> {
                    CastException cast = (CastException) e;
                    assertThat(cast.sourceType()).isEqualTo(IntegerType.int64());
                    assertThat(cast.targetType()).isEqualTo(IntegerType.int8());
                })
                .hasMessageContaining("300");
        }

        @Test
        @DisplayName("Contract violations are IllegalStateExceptions")
        void testEngineContractException() {
            EngineContractException e = new EngineContractException("Unconsumed engine column 'x'", "x");

            assertThat(e).isInstanceOf(IllegalStateException.class);
            assertThat(e.columnName()).isEqualTo("x");
        }
    }
}
