package com.essence.rewriter.term;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TermPathTest {

    @Test
    @DisplayName("Should print the root as a single slash and others as index segments")
    void shouldPrint() {
        assertThat(TermPath.root()).hasToString("/");
        assertThat(TermPath.of(0, 2, 1)).hasToString("/0/2/1");
    }

    @Test
    @DisplayName("Should navigate between parent and child paths")
    void shouldNavigate() {
        TermPath path = TermPath.root().child(1).child(3);

        assertThat(path).isEqualTo(TermPath.of(1, 3));
        assertThat(path.depth()).isEqualTo(2);
        assertThat(path.lastIndex()).isEqualTo(3);
        assertThat(path.parent()).isEqualTo(TermPath.of(1));
        assertThat(path.parent().parent().isRoot()).isTrue();
    }

    @Test
    @DisplayName("Should reject parent and last index of the root")
    void shouldRejectRootNavigation() {
        assertThatThrownBy(() -> TermPath.root().parent()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> TermPath.root().lastIndex()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should order paths in pre-order")
    void shouldOrderInPreOrder() {
        assertThat(TermPath.root()).isLessThan(TermPath.of(0));
        assertThat(TermPath.of(0)).isLessThan(TermPath.of(0, 5));
        assertThat(TermPath.of(0, 5)).isLessThan(TermPath.of(1));
    }

    @Test
    @DisplayName("Should recognise paths at or below an ancestor")
    void shouldMatchAncestors() {
        assertThat(TermPath.of(0, 2, 1).startsWith(TermPath.of(0, 2))).isTrue();
        assertThat(TermPath.of(0, 2).startsWith(TermPath.of(0, 2))).isTrue();
        assertThat(TermPath.of(0).startsWith(TermPath.root())).isTrue();
        assertThat(TermPath.of(0, 3).startsWith(TermPath.of(0, 2))).isFalse();
        assertThat(TermPath.of(0).startsWith(TermPath.of(0, 2))).isFalse();
    }
}
