package com.braid.core.spi;

/**
 * Answer of {@link AgentRunner#canSpawn}.
 *
 * @param allowed whether another child agent may be spawned
 * @param reason  why not, when refused
 * @param depth   the depth a new child would have
 */
public record SpawnPermission(boolean allowed, String reason, int depth) {

    public static SpawnPermission allow(int depth) {
        return new SpawnPermission(true, null, depth);
    }

    public static SpawnPermission deny(String reason, int depth) {
        return new SpawnPermission(false, reason, depth);
    }
}
