package mapper;

import com.fasterxml.jackson.databind.JsonNode;
import common.Difficulty;
import common.GamePhase;
import common.PowerupType;
import model.Bullet;
import model.Chaser;
import model.Player;
import model.Powerup;
import model.World;
import net.Wire;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MapperTest {

    @Test
    void emptyWorldStillCarriesEveryScalar() throws Exception {
        World w = new World(Difficulty.HARD);
        w.setPhase(GamePhase.PAUSED);
        w.advanceGameTime(12.5);
        w.addGlobalScore(7);

        JsonNode n = Wire.tree(Wire.encode(Mapper.toGameState(w)));

        assertEquals("game_state", n.get("type").asText());
        assertEquals(3, n.get("state").asInt());
        assertEquals(12.5, n.get("game_time").asDouble());
        assertEquals(3, n.get("difficulty").asInt());
        assertEquals(7, n.get("global_score").asInt());
        for (String list : new String[]{"players", "chasers", "bullets", "powerups"}) {
            assertTrue(n.get(list).isArray(), list);
            assertEquals(0, n.get(list).size(), list);
        }
    }

    @Test
    void entitiesAreMappedFieldByField() throws Exception {
        World w = new World(Difficulty.MEDIUM);
        Player p = w.addPlayer(2);
        p.setCharacter(4);
        p.setSwordAttacking(true);
        p.addScore(11);
        w.addChaser(new Chaser(0, 100, 200, 1.0));
        w.bullets().add(new Bullet(10, 20, 3, 4));
        w.powerups().add(new Powerup(PowerupType.IMMUNITY, 60, 70));

        JsonNode n = Wire.tree(Wire.encode(Mapper.toGameState(w)));

        JsonNode player = n.get("players").get(0);
        assertEquals(2, player.get("id").asInt());
        assertEquals(400.0, player.get("x").asDouble());
        assertEquals(6, player.get("health").asInt());
        assertEquals(6, player.get("max_health").asInt());
        assertEquals(11, player.get("score").asInt());
        assertEquals(4, player.get("character").asInt());
        assertTrue(player.get("sword_attacking").asBoolean());
        assertFalse(player.get("immunity_boost_active").asBoolean());

        JsonNode chaser = n.get("chasers").get(0);
        assertEquals(0, chaser.get("id").asInt());
        assertEquals(1.0, chaser.get("speed").asDouble());
        assertEquals(1, chaser.get("health").asInt());

        JsonNode bullet = n.get("bullets").get(0);
        assertEquals(3.0, bullet.get("dx").asDouble());
        assertEquals(4.0, bullet.get("dy").asDouble());

        JsonNode powerup = n.get("powerups").get(0);
        assertEquals("immunity", powerup.get("type").asText());
        assertEquals(60, powerup.get("x").asInt());
    }
}
