package com.arbor.synth.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreePathTest {

    @Test
    @DisplayName("Should navigate between parents and children")
    void shouldNavigate() {
        TreePath path = TreePath.ROOT.child(1).child(0);

        assertThat(path).isEqualTo(TreePath.of(1, 0));
        assertThat(path.parent()).isEqualTo(TreePath.of(1));
        assertThat(path.parent().parent()).isSameAs(TreePath.ROOT);
        assertThat(path.last()).isZero();
        assertThat(path.length()).isEqualTo(2);
        assertThat(path.depth()).isEqualTo(3);
        assertThat(TreePath.ROOT.depth()).isEqualTo(1);
        assertThat(path.prefix(1)).isEqualTo(TreePath.of(1));
        assertThat(TreePath.of(2).resolve(TreePath.of(0, 1))).isEqualTo(TreePath.of(2, 0, 1));
    }

    @Test
    @DisplayName("Should treat a path as a prefix of itself and of its descendants only")
    void shouldDetectPrefixes() {
        TreePath parent = TreePath.of(0);

        assertThat(TreePath.ROOT.isPrefixOf(parent)).isTrue();
        assertThat(parent.isPrefixOf(parent)).isTrue();
        assertThat(parent.isPrefixOf(TreePath.of(0, 1))).isTrue();
        assertThat(parent.isPrefixOf(TreePath.of(1, 0))).isFalse();
        assertThat(TreePath.of(0, 1).isWithin(parent)).isTrue();
        assertThat(parent.isWithin(TreePath.of(0, 1))).isFalse();
    }

    @Test
    @DisplayName("Should sort paths in pre-order")
    void shouldSortInPreOrder() {
        List<TreePath> paths = new ArrayList<>(List.of(
                TreePath.of(1), TreePath.of(0, 1), TreePath.ROOT, TreePath.of(0), TreePath.of(0, 0)));

        Collections.sort(paths);

        assertThat(paths).containsExactly(
                TreePath.ROOT, TreePath.of(0), TreePath.of(0, 0), TreePath.of(0, 1), TreePath.of(1));
    }

    @Test
    @DisplayName("Should reject the parent of the root and negative indices")
    void shouldRejectInvalidPaths() {
        assertThatThrownBy(TreePath.ROOT::parent).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> TreePath.of(0, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TreePath.of(0).prefix(2)).isInstanceOf(IllegalArgumentException.class);
    }
}
