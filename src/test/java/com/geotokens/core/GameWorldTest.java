package com.geotokens.core;

import com.geotokens.input.Direction;
import com.geotokens.save.GameSnapshot;
import com.geotokens.sim.InteractionResult;
import com.geotokens.sim.Rejection;
import com.geotokens.world.CellState;
import com.geotokens.world.GameConfig;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.PlayerToken;
import com.geotokens.world.WorldListener;
import com.geotokens.world.gen.CellGenerator;
import com.geotokens.world.gen.FixedLuck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class GameWorldTest {

    private static final double CELL = 1e-4;

    @Mock
    private WorldListener listener;

    private GameConfig config;
    private GameWorld world;

    private final GridCoordinate origin = new GridCoordinate(0, 0);
    private final GridCoordinate one = new GridCoordinate(1, 1);

    @BeforeEach
    void setUp() {
        config = new GameConfig();
        config.originLat = 0.5 * CELL;
        config.originLng = 0.5 * CELL;
        config.viewportRadius = 3;
        config.winThreshold = 8;
        FixedLuck luck = new FixedLuck()
            .raw(0, 0, 3)
            .raw(1, 1, 2)
            .raw(0, 1, 4).raw(1, 0, 4).raw(-1, 0, 4).raw(0, -1, 4);
        world = new GameWorld(config, new CellGenerator(luck, config));
        world.addListener(listener);
        world.start();
    }

    private void moveTo(int i, int j) {
        world.playerMoved((i + 0.5) * CELL, (j + 0.5) * CELL);
    }

    @Test
    void collectedCellStaysEmptyAfterLeavingAndReturning() {
        assertThat(world.cellState(origin)).isEqualTo(CellState.EMPTY);
        assertThat(world.cellState(one)).isEqualTo(CellState.of(2));

        InteractionResult r = world.attemptCollect(one);
        assertThat(r.isSuccess()).isTrue();
        assertThat(world.getHeldToken()).isEqualTo(new PlayerToken(2, one));

        moveTo(20, 20);
        assertThat(world.isLive(one)).isFalse();
        moveTo(0, 0);

        assertThat(world.isLive(one)).isTrue();
        assertThat(world.getCells().get(one).getState()).isEqualTo(CellState.EMPTY);
    }

    @Test
    void doubledValueSurvivesEviction() {
        world.attemptCollect(new GridCoordinate(0, 1));
        world.attemptDouble(new GridCoordinate(1, 0));

        moveTo(-30, 5);
        moveTo(0, 0);

        assertThat(world.getCells().get(new GridCoordinate(1, 0)).getValue()).isEqualTo(8);
    }

    @Test
    void mismatchLeavesEverythingUntouched() {
        world.attemptCollect(new GridCoordinate(0, 1));
        world.attemptDouble(new GridCoordinate(1, 0));   // (1,0) is now 8
        world.attemptCollect(new GridCoordinate(-1, 0)); // holding 4
        Map<GridCoordinate, CellState> ledgerBefore = world.getLedger().entries();

        InteractionResult r = world.attemptDouble(new GridCoordinate(1, 0));

        assertThat(r.rejection()).isEqualTo(Rejection.VALUE_MISMATCH);
        assertThat(world.getLedger().entries()).isEqualTo(ledgerBefore);
        assertThat(world.getHeldToken()).isEqualTo(new PlayerToken(4, new GridCoordinate(-1, 0)));
    }

    @Test
    void winSignalFiresOnceAcrossCells() {
        world.attemptCollect(new GridCoordinate(0, 1));
        world.attemptDouble(new GridCoordinate(1, 0));   // 8: threshold
        world.attemptCollect(new GridCoordinate(-1, 0));
        world.attemptDouble(new GridCoordinate(0, -1));  // another 8
        world.attemptCollect(new GridCoordinate(1, 0));
        InteractionResult r = world.attemptDouble(new GridCoordinate(0, -1)); // 16

        assertThat(r.isSuccess()).isTrue();
        assertThat(world.getHighestValue()).isEqualTo(16);
        assertThat(world.isWon()).isTrue();
        verify(listener, times(1)).onThresholdReached();
    }

    @Test
    void stepMovesOneCell() {
        world.step(Direction.NORTH);
        world.step(Direction.EAST);

        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(new GridCoordinate(1, 1));
        assertThat(world.isLive(new GridCoordinate(4, 4))).isTrue();
        assertThat(world.isLive(new GridCoordinate(-3, -3))).isFalse();
    }

    @Test
    void exportImportRoundTrip() {
        world.attemptCollect(one);
        moveTo(2, -1);
        GameSnapshot snapshot = world.exportState();

        GameWorld other = new GameWorld(config, world.getGenerator());
        assertThat(other.importState(snapshot)).isTrue();

        assertThat(other.getHeldToken()).isEqualTo(new PlayerToken(2, one));
        assertThat(other.getPlayer().getCurrentCell()).isEqualTo(new GridCoordinate(2, -1));
        assertThat(other.getHighestValue()).isEqualTo(world.getHighestValue());
        assertThat(other.getLedger().entries()).isEqualTo(world.getLedger().entries());
        assertThat(other.getCells().get(one).getState()).isEqualTo(CellState.EMPTY);
    }

    @Test
    void blobRoundTrip() {
        world.attemptCollect(new GridCoordinate(0, 1));
        world.attemptDouble(new GridCoordinate(1, 0));
        String blob = world.exportBlob();

        GameWorld other = new GameWorld(config, world.getGenerator());
        assertThat(other.importBlob(blob)).isTrue();
        assertThat(other.cellState(new GridCoordinate(1, 0))).isEqualTo(CellState.of(8));
        assertThat(other.isWon()).isTrue();
    }

    @Test
    void corruptBlobResetsToFreshStart() {
        world.attemptCollect(one);
        moveTo(10, 10);

        assertThat(world.importBlob("playerLat=oops\nhighestValue=")).isFalse();

        assertThat(world.getLedger().size()).isZero();
        assertThat(world.getHeldToken()).isNull();
        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(origin);
        assertThat(world.cellState(one)).isEqualTo(CellState.of(2));
    }

    @Test
    void nonFiniteBlobPositionResetsToFreshStart() {
        world.attemptCollect(one);

        assertThat(world.importBlob("playerLat=Infinity\nplayerLng=0\nhighestValue=0\n")).isFalse();

        assertThat(world.getLedger().size()).isZero();
        assertThat(world.getHeldToken()).isNull();
        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(origin);
        assertThat(world.getCells().liveCount()).isEqualTo(49);
    }

    @Test
    void blobPositionOffTheGlobeResetsToFreshStart() {
        assertThat(world.importBlob("playerLat=45\nplayerLng=200\nhighestValue=0\n")).isFalse();

        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(origin);
    }

    @Test
    void movesOffTheGlobeAreRefused() {
        assertThat(world.playerMoved(214748.3646, 0)).isFalse();
        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(origin);
        assertThat(world.getCells().liveCount()).isEqualTo(49);

        world.playerMoved(90 - 0.5 * CELL, 0);
        assertThat(world.step(Direction.NORTH)).isFalse();
        assertThat(world.step(Direction.SOUTH)).isTrue();
    }

    @Test
    void inconsistentHeldTokenIsRejected() {
        GameSnapshot bad = new GameSnapshot(Map.of(one, CellState.of(2)), 0.5 * CELL, 0.5 * CELL, 2,
            new PlayerToken(2, one));

        assertThat(world.importState(bad)).isFalse();
        assertThat(world.getHeldToken()).isNull();
        assertThat(world.getLedger().size()).isZero();
    }

    @Test
    void resetRestoresFreshWorld() {
        world.attemptCollect(one);
        world.reset();

        assertThat(world.getHeldToken()).isNull();
        assertThat(world.cellState(one)).isEqualTo(CellState.of(2));
        assertThat(world.getCells().liveCount()).isEqualTo(49);
    }
}
