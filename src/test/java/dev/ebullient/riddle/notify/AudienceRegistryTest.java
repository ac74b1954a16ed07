package dev.ebullient.riddle.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import dev.ebullient.riddle.GameStateException;

class AudienceRegistryTest {

    final AudienceRegistry registry = new AudienceRegistry();

    @Test
    void join_addsToRoleAndAllGroups() {
        registry.join("c1", "dm-1", Audience.DM, null, null);
        registry.join("c1", "p-1", Audience.PLAYERS, "elara", "Elara");
        registry.join("c1", "p-2", Audience.PLAYERS, "thorin", "Thorin");
        registry.join("c2", "p-3", Audience.PLAYERS, null, null);

        assertEquals(Set.of("dm-1"), registry.connections("c1", Audience.DM));
        assertEquals(Set.of("p-1", "p-2"), registry.connections("c1", Audience.PLAYERS));
        assertEquals(Set.of("dm-1", "p-1", "p-2"), registry.connections("c1", Audience.ALL));
        assertEquals(Set.of("p-3"), registry.connections("c2", Audience.ALL));
        assertEquals(2, registry.players("c1").size());
    }

    @Test
    void leave_removesFromEveryGroup() {
        registry.join("c1", "p-1", Audience.PLAYERS, "elara", "Elara");
        AudienceRegistry.Member member = registry.leave("p-1");

        assertEquals("Elara", member.characterName());
        assertTrue(registry.connections("c1", Audience.PLAYERS).isEmpty());
        assertTrue(registry.connections("c1", Audience.ALL).isEmpty());
        assertNull(registry.leave("p-1"));
        assertNull(registry.member("p-1"));
    }

    @Test
    void rejoin_movesConnection() {
        registry.join("c1", "x", Audience.PLAYERS, null, null);
        registry.join("c1", "x", Audience.DM, null, null);

        assertEquals(Set.of("x"), registry.connections("c1", Audience.DM));
        assertEquals(List.of(), registry.players("c1"));
    }

    @Test
    void join_allIsNotARole() {
        assertThrows(GameStateException.class, () -> registry.join("c1", "x", Audience.ALL, null, null));
    }
}
