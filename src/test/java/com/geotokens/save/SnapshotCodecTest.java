package com.geotokens.save;

import com.geotokens.world.CellState;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.PlayerToken;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SnapshotCodecTest {

    @Test
    void negativeCoordinatesSurviveEncoding() throws IOException {
        Map<GridCoordinate, CellState> ledger = new LinkedHashMap<>();
        ledger.put(new GridCoordinate(-369979, -1220571), CellState.EMPTY);
        ledger.put(new GridCoordinate(-3, 7), CellState.of(16));
        ledger.put(new GridCoordinate(5, -12), CellState.of(4));
        GameSnapshot snapshot = new GameSnapshot(ledger, -36.99, -122.05, 16,
            new PlayerToken(2, new GridCoordinate(-369979, -1220571)));

        GameSnapshot decoded = SnapshotCodec.decode(SnapshotCodec.encode(snapshot));

        assertThat(decoded.ledger()).isEqualTo(ledger);
        assertThat(decoded.heldToken()).isEqualTo(snapshot.heldToken());
        assertThat(decoded.playerLat()).isEqualTo(-36.99);
        assertThat(decoded.playerLng()).isEqualTo(-122.05);
        assertThat(decoded.highestValue()).isEqualTo(16);
    }

    @Test
    void noHeldTokenIsOmitted() throws IOException {
        GameSnapshot snapshot = new GameSnapshot(Map.of(), 1.0, 2.0, 0, null);

        String blob = SnapshotCodec.encode(snapshot);

        assertThat(blob).doesNotContain("held.");
        assertThat(SnapshotCodec.decode(blob).heldToken()).isNull();
    }

    @Test
    void blankBlobIsRejected() {
        assertThatThrownBy(() -> SnapshotCodec.decode("  ")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> SnapshotCodec.decode(null)).isInstanceOf(IOException.class);
    }

    @Test
    void missingFieldIsRejected() {
        assertThatThrownBy(() -> SnapshotCodec.decode("playerLat=1\nplayerLng=2\n"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("highestValue");
    }

    @Test
    void malformedNumbersAreRejected() {
        assertThatThrownBy(() -> SnapshotCodec.decode("playerLat=1\nplayerLng=2\nhighestValue=2\ncell.1.x=4\n"))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> SnapshotCodec.decode("playerLat=1\nplayerLng=2\nhighestValue=2\ncell.5=4\n"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void heldTokenWithoutEmptyOriginIsRejected() {
        String blob = "playerLat=0\nplayerLng=0\nhighestValue=2\n"
            + "held.value=2\nheld.i=1\nheld.j=1\ncell.1.1=2\n";

        assertThatThrownBy(() -> SnapshotCodec.decode(blob))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("not recorded as empty");
    }

    @Test
    void negativeCellValueIsRejected() {
        assertThatThrownBy(() -> SnapshotCodec.decode("playerLat=0\nplayerLng=0\nhighestValue=0\ncell.0.0=-4\n"))
            .isInstanceOf(IOException.class);
    }
}
