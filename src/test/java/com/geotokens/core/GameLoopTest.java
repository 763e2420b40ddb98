package com.geotokens.core;

import com.geotokens.agent.ActionQueue;
import com.geotokens.input.MovementKeys;
import com.geotokens.save.SaveManager;
import com.geotokens.world.CellState;
import com.geotokens.world.GameConfig;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.gen.CellGenerator;
import com.geotokens.world.gen.FixedLuck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class GameLoopTest {

    @TempDir
    Path saves;

    private GameWorld world;
    private ActionQueue actions;
    private final List<String> replies = new ArrayList<>();

    @BeforeEach
    void setUp() {
        GameConfig config = new GameConfig();
        config.originLat = 0.5e-4;
        config.originLng = 0.5e-4;
        config.viewportRadius = 2;
        world = new GameWorld(config, new CellGenerator(new FixedLuck().raw(1, 1, 2), config));
        world.start();
        actions = new ActionQueue();
    }

    private GameLoop loop(SaveManager saveManager) {
        return new GameLoop(world, actions, saveManager, new MovementKeys());
    }

    @Test
    void collectRepliesWithResult() {
        actions.enqueue(ActionQueue.GameAction.cell(ActionQueue.Type.COLLECT, 1, 1, "c", replies::add));
        loop(null).tick();

        assertThat(replies).hasSize(1);
        assertThat(replies.get(0)).contains("\"ok\":true", "Holding: Cell [1, 1] → Value: 2");
        assertThat(world.cellState(new GridCoordinate(1, 1))).isEqualTo(CellState.EMPTY);
        assertThat(actions.getTotalProcessed()).isEqualTo(1);
    }

    @Test
    void cellOutsideViewIsRefused() {
        actions.enqueue(ActionQueue.GameAction.cell(ActionQueue.Type.DOUBLE, 40, 40, "c", replies::add));
        loop(null).tick();

        assertThat(replies).singleElement().asString().contains("\"type\":\"error\"", "not in view");
    }

    @Test
    void keyAndStepMoveThePlayer() {
        actions.enqueue(ActionQueue.GameAction.key("w", "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.step("east", "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.key("F5", "c", replies::add));
        loop(null).tick();

        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(new GridCoordinate(1, 1));
        assertThat(replies).singleElement().asString().contains("Unknown direction: F5");
    }

    @Test
    void saveIsRefusedWithoutManager() {
        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.SAVE, "c", replies::add));
        loop(null).tick();

        assertThat(replies).singleElement().asString().contains("Saving is disabled");
    }

    @Test
    void saveThenLoad() {
        SaveManager manager = new SaveManager(saves, "loop");
        GameLoop loop = loop(manager);
        actions.enqueue(ActionQueue.GameAction.cell(ActionQueue.Type.COLLECT, 1, 1, "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.SAVE, "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.RESET, "c", replies::add));
        loop.tick();
        assertThat(world.getHeldToken()).isNull();

        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.LOAD, "c", replies::add));
        loop.tick();

        assertThat(world.getHeldToken()).isNotNull();
        assertThat(replies).contains("{\"type\":\"status\",\"message\":\"Saved\"}",
            "{\"type\":\"status\",\"message\":\"Session reset\"}",
            "{\"type\":\"status\",\"message\":\"Loaded\"}");
    }

    @Test
    void syncSendsWholeView() {
        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.SYNC, "c", replies::add));
        loop(null).tick();

        // 5x5 view plus player, held and highest
        assertThat(replies).hasSize(28);
        assertThat(replies.stream().filter(r -> r.startsWith("{\"type\":\"cell_add\""))).hasSize(25);
        assertThat(replies).contains("{\"type\":\"held\",\"value\":null}", "{\"type\":\"highest\",\"value\":2}");
    }

    @Test
    void affordancesReportDisabledActions() {
        actions.enqueue(ActionQueue.GameAction.cell(ActionQueue.Type.AFFORDANCES, 1, 1, "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.cell(ActionQueue.Type.AFFORDANCES, 2, 2, "c", replies::add));
        loop(null).tick();

        assertThat(replies).hasSize(2);
        assertThat(replies.get(0)).contains("\"type\":\"affordances\"", "\"can_collect\":true",
            "\"can_double\":false", "\"collect_hint\":null", "\"double_hint\":\"No Token to Double!\"");
        // (2,2) is about 31 m away and holds no token
        assertThat(replies.get(1)).contains("\"can_collect\":false", "No token in cell [2, 2]");
        assertThat(world.cellState(new GridCoordinate(1, 1))).isEqualTo(CellState.of(2));
    }

    @Test
    void moveOffTheGlobeIsRefused() {
        actions.enqueue(ActionQueue.GameAction.move(214748.3646, 0, "c", replies::add));
        loop(null).tick();

        assertThat(replies).singleElement().asString().contains("Position out of range");
        assertThat(world.getPlayer().getCurrentCell()).isEqualTo(new GridCoordinate(0, 0));
    }

    @Test
    void loadWithoutSaveLeavesWorldAlone() {
        GameLoop loop = loop(new SaveManager(saves, "never"));
        actions.enqueue(ActionQueue.GameAction.cell(ActionQueue.Type.COLLECT, 1, 1, "c", null));
        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.LOAD, "c", replies::add));
        loop.tick();

        assertThat(replies).singleElement().asString().contains("No saved session 'never'");
        assertThat(world.getHeldToken()).isNotNull();
    }

    @Test
    void listAndDeleteSessions() throws Exception {
        new SaveManager(saves, "old").save(world);
        SaveManager current = new SaveManager(saves, "current");
        current.save(world);
        GameLoop loop = loop(current);

        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.LIST_SESSIONS, "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.deleteSession("old", "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.deleteSession("current", "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.deleteSession("../etc", "c", replies::add));
        actions.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.LIST_SESSIONS, "c", replies::add));
        loop.tick();

        assertThat(replies).containsExactly(
            "{\"type\":\"sessions\",\"current\":\"current\",\"names\":[\"current\",\"old\"]}",
            "{\"type\":\"status\",\"message\":\"Deleted session 'old'\"}",
            "{\"type\":\"error\",\"message\":\"Cannot delete the active session 'current'\"}",
            "{\"type\":\"error\",\"message\":\"Invalid session name: ../etc\"}",
            "{\"type\":\"sessions\",\"current\":\"current\",\"names\":[\"current\"]}");
    }
}
