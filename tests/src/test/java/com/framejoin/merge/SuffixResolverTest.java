package com.framejoin.merge;

import com.framejoin.exception.MergeException;
import com.framejoin.exception.MergeException.Kind;
import com.framejoin.table.Column;
import com.framejoin.table.Table;
import com.framejoin.test.TestBase;
import com.framejoin.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SuffixResolver Tests")
public class SuffixResolverTest extends TestBase {

    private final Table left = Table.builder()
        .column("id", Column.ofLongs(1L, 2L))
        .column("x", Column.ofLongs(10L, 20L))
        .column("a", Column.ofStrings("p", "q"))
        .build();

    private final Table right = Table.builder()
        .column("x", Column.ofLongs(30L, 40L))
        .column("id", Column.ofLongs(2L, 3L))
        .build();

    @Test
    @DisplayName("Shared non-key names get suffixes on both sides")
    void testSuffixesOverlap() {
        JoinKeys keys = new JoinKeys(Arrays.asList("id"), Arrays.asList("id"), false, false);

        ResolvedInputs resolved = SuffixResolver.resolve(left, right, keys, "_l", "_r");

        assertThat(resolved.left().columnNames()).containsExactly("id", "x_l", "a");
        assertThat(resolved.right().columnNames()).containsExactly("x_r", "id");
        assertThat(resolved.keys().leftOn()).containsExactly("id");
    }

    @Test
    @DisplayName("Inputs are not modified")
    void testPurity() {
        JoinKeys keys = new JoinKeys(Arrays.asList("id"), Arrays.asList("id"), false, false);

        SuffixResolver.resolve(left, right, keys, "_l", "_r");

        assertThat(left.columnNames()).containsExactly("id", "x", "a");
        assertThat(right.columnNames()).containsExactly("x", "id");
    }

    @Test
    @DisplayName("Keys at different positions are renamed and keep their pairing")
    void testCrossedKeysKeepPairing() {
        JoinKeys keys = new JoinKeys(Arrays.asList("id", "x"), Arrays.asList("x", "id"), false, false);

        ResolvedInputs resolved = SuffixResolver.resolve(left, right, keys, "_l", "_r");

        assertThat(resolved.keys().leftOn()).containsExactly("id_l", "x_l");
        assertThat(resolved.keys().rightOn()).containsExactly("x_r", "id_r");
        assertThat(resolved.left().column("id_l")).isEqualTo(left.column("id"));
        assertThat(resolved.right().column("id_r")).isEqualTo(right.column("id"));
    }

    @Test
    @DisplayName("Nothing to rename returns the inputs")
    void testNoOverlap() {
        Table other = Table.builder().column("id", Column.ofLongs(5L)).build();
        JoinKeys keys = new JoinKeys(Collections.singletonList("id"), Collections.singletonList("id"), false, false);

        ResolvedInputs resolved = SuffixResolver.resolve(left, other, keys, "_l", "_r");

        assertThat(resolved.left()).isSameAs(left);
        assertThat(resolved.right()).isSameAs(other);
    }

    @Test
    @DisplayName("An empty suffix keeps the name on that side")
    void testEmptySuffix() {
        JoinKeys keys = new JoinKeys(Arrays.asList("id"), Arrays.asList("id"), false, false);

        ResolvedInputs resolved = SuffixResolver.resolve(left, right, keys, "", "_r");

        assertThat(resolved.left().columnNames()).containsExactly("id", "x", "a");
        assertThat(resolved.right().columnNames()).containsExactly("x_r", "id");
    }

    @Test
    @DisplayName("A suffixed name equal to an existing column is a collision")
    void testCollisionWithExistingColumn() {
        Table crowded = left.withColumn("x_l", Column.ofLongs(0L, 0L));
        JoinKeys keys = new JoinKeys(Arrays.asList("id"), Arrays.asList("id"), false, false);

        assertThatThrownBy(() -> SuffixResolver.resolve(crowded, right, keys, "_l", "_r"))
            .isInstanceOf(MergeException.class)
            .satisfies(e -> assertThat(((MergeException) e).kind()).isEqualTo(Kind.SUFFIX_COLLISION));
    }

    @Test
    @DisplayName("Equal suffixes collide")
    void testEqualSuffixes() {
        JoinKeys keys = new JoinKeys(Arrays.asList("id"), Arrays.asList("id"), false, false);

        assertThatThrownBy(() -> SuffixResolver.resolve(left, right, keys, "_s", "_s"))
            .isInstanceOf(MergeException.class)
            .satisfies(e -> assertThat(((MergeException) e).kind()).isEqualTo(Kind.SUFFIX_COLLISION));
    }
}
