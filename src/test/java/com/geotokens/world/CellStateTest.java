package com.geotokens.world;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CellStateTest {

    @Test
    void zeroMeansNoToken() {
        assertThat(CellState.of(0)).isSameAs(CellState.EMPTY);
        assertThat(CellState.EMPTY.hasToken()).isFalse();
    }

    @Test
    void positiveValueCarriesToken() {
        CellState s = CellState.of(4);
        assertThat(s.hasToken()).isTrue();
        assertThat(s.value()).isEqualTo(4);
    }

    @Test
    void negativeValueIsRejected() {
        assertThatThrownBy(() -> CellState.of(-2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void doublingEmptyCellIsAnError() {
        assertThat(CellState.of(8).doubled()).isEqualTo(CellState.of(16));
        assertThatThrownBy(CellState.EMPTY::doubled).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void canDoubleStopsBeforeOverflow() {
        assertThat(CellState.of(1 << 29).canDouble()).isTrue();
        assertThat(CellState.of(1 << 30).canDouble()).isFalse();
        assertThat(CellState.EMPTY.canDouble()).isFalse();
    }
}
