package sh.harold.hearth.world;

import sh.harold.hearth.actor.ActorRuntime;
import sh.harold.hearth.world.config.WorldConfig;
import sh.harold.hearth.world.game.GameRegistry;
import sh.harold.hearth.world.room.RoomManager;
import sh.harold.hearth.world.user.AccountStore;

import java.util.Objects;

/**
 * The shared services every session, user and living works against.
 */
public record WorldServices(
        ActorRuntime runtime,
        WorldConfig config,
        RoomManager rooms,
        GameRegistry games,
        AccountStore accounts) {

    public WorldServices {
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(rooms, "rooms");
        Objects.requireNonNull(games, "games");
        Objects.requireNonNull(accounts, "accounts");
    }
}
