package server;

import common.Difficulty;
import common.GamePhase;
import common.dto.cmd.ClientCommand;
import common.dto.cmd.HeartbeatCmd;
import common.dto.cmd.InfoRequestCmd;
import common.dto.cmd.PlayerActionCmd;
import common.dto.cmd.PlayerPatch;
import common.dto.cmd.PlayerUpdateCmd;
import common.dto.cmd.SetDifficultyCmd;
import common.dto.cmd.StartGameCmd;
import common.dto.msg.DifficultyChangedMsg;
import common.dto.msg.GameStartedMsg;
import common.dto.msg.ServerInfoMsg;
import common.dto.msg.ServerMessage;
import common.dto.msg.SwordAttackMsg;
import model.Player;
import model.World;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import server.ops.Metrics;

import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MessageProcessorTest {

    private static final long T0 = 10_000;

    private final List<ServerMessage> events = new ArrayList<>();
    private World world;
    private ServerState state;
    private MessageProcessor processor;
    private Session session;
    private Player player;

    @BeforeEach
    void setUp() throws Exception {
        world = new World(Difficulty.MEDIUM);
        state = new ServerState(world, new SessionRegistry(4), new Metrics(), "Test Server", 4);
        SimulationEngine engine = new SimulationEngine(state, () -> T0, new Random(3), 60_000);
        processor = new MessageProcessor(state, engine);
        session = state.admit(new Socket(), T0, new ArrayList<>());
        player = world.player(session.id());
    }

    private Optional<ServerMessage> apply(ClientCommand cmd) {
        return processor.apply(session.id(), cmd, T0, events);
    }

    @Test
    void patchUpdatesOnlyPresentFields() {
        player.setCharacter(2);

        apply(new PlayerUpdateCmd(new PlayerPatch(120.5, 80.0, 90.0, null, null, null, true, null)));

        assertEquals(120.5, player.getX());
        assertEquals(80.0, player.getY());
        assertEquals(90.0, player.getAngle());
        assertEquals(6, player.getHealth());
        assertEquals(2, player.getCharacter());
        assertTrue(player.isSpeedBoostActive());
        assertFalse(player.isImmunityBoostActive());
        assertTrue(events.isEmpty());
    }

    @Test
    void patchIsClampedToThePlayfieldAndHealthRange() {
        apply(new PlayerUpdateCmd(new PlayerPatch(900.0, -5.0, null, 99, null, null, null, null)));

        assertEquals(800, player.getX());
        assertEquals(0, player.getY());
        assertEquals(6, player.getHealth());

        apply(new PlayerUpdateCmd(new PlayerPatch(null, null, null, -3, null, null, null, null)));
        assertEquals(0, player.getHealth());
    }

    @Test
    void patchRejectsNonFiniteAndOutOfRangeValues() {
        apply(new PlayerUpdateCmd(new PlayerPatch(Double.NaN, Double.POSITIVE_INFINITY, Double.NaN, null, 300, null, null, null)));

        assertEquals(400, player.getX());
        assertEquals(300, player.getY());
        assertEquals(0, player.getAngle());
        assertEquals(0, player.getCharacter());
    }

    @Test
    void updateWithoutDataIsHarmless() {
        apply(new PlayerUpdateCmd(null));

        assertEquals(400, player.getX());
    }

    @Test
    void swordActionArmsTheAttackAndIsAnnounced() {
        apply(new PlayerActionCmd(PlayerActionCmd.SWORD_ATTACK));

        assertTrue(player.isSwordAttacking());
        assertEquals(List.of(new SwordAttackMsg(session.id())), events);
    }

    @Test
    void unknownActionIsIgnored() {
        apply(new PlayerActionCmd("dance"));

        assertFalse(player.isSwordAttacking());
        assertTrue(events.isEmpty());
    }

    @Test
    void heartbeatRefreshesLiveness() {
        processor.apply(session.id(), new HeartbeatCmd(), T0 + 5_000, events);

        assertEquals(T0 + 5_000, session.lastHeartbeat());
        assertTrue(events.isEmpty());
    }

    @Test
    void startGameOnlyFromMenu() {
        apply(new StartGameCmd());

        assertEquals(GamePhase.PLAYING, world.getPhase());
        assertEquals(2, world.chasers().size());
        assertEquals(List.of(new GameStartedMsg(Difficulty.MEDIUM)), events);

        events.clear();
        player.addScore(3);
        apply(new StartGameCmd());

        assertTrue(events.isEmpty());
        assertEquals(3, player.getScore(), "running game is not reset");
    }

    @Test
    void validDifficultyIsAppliedAndAnnounced() {
        apply(new SetDifficultyCmd(3));

        assertEquals(Difficulty.HARD, world.getDifficulty());
        assertEquals(List.of(new DifficultyChangedMsg(Difficulty.HARD)), events);
    }

    @Test
    void invalidDifficultyIsIgnored() {
        apply(new SetDifficultyCmd(7));
        apply(new SetDifficultyCmd(0));
        apply(new SetDifficultyCmd(null));

        assertEquals(Difficulty.MEDIUM, world.getDifficulty());
        assertTrue(events.isEmpty());
    }

    @Test
    void infoRequestIsAnsweredToTheSender() {
        world.setDifficulty(Difficulty.EASY);

        Optional<ServerMessage> reply = apply(new InfoRequestCmd());

        assertEquals(Optional.of(new ServerInfoMsg("Test Server", 4, Difficulty.EASY)), reply);
        assertTrue(events.isEmpty());
    }

    @Test
    void commandsFromSessionsWithoutPlayerAreDropped() {
        Optional<ServerMessage> reply = processor.apply(99, new PlayerActionCmd(PlayerActionCmd.SWORD_ATTACK), T0, events);

        assertTrue(reply.isEmpty());
        assertTrue(events.isEmpty());
    }
}
