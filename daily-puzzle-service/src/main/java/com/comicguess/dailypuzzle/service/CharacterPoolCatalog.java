package com.comicguess.dailypuzzle.service;

import com.comicguess.dailypuzzle.model.CharacterProfile;
import com.comicguess.dailypuzzle.model.Universe;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed character pools, one per universe. Pool order is part of the selection contract:
 * reordering a pool changes which character a date maps to.
 */
@Slf4j
public class CharacterPoolCatalog {

    private final Map<Universe, List<CharacterProfile>> pools = new EnumMap<>(Universe.class);

    public CharacterPoolCatalog(Map<Universe, List<CharacterProfile>> pools) {
        for (Universe universe : Universe.values()) {
            List<CharacterProfile> pool = pools.getOrDefault(universe, List.of());
            validatePool(universe, pool);
            this.pools.put(universe, List.copyOf(pool));
        }
    }

    /**
     * Read pools from a JSON document of the form {"marvel": [{"name": ..., "aliases": [...], "imageKey": ...}], ...}
     */
    public static CharacterPoolCatalog load(InputStream json) throws IOException {
        Map<String, List<CharacterProfile>> raw = new ObjectMapper().readValue(json, new TypeReference<>() {});
        Map<Universe, List<CharacterProfile>> pools = new EnumMap<>(Universe.class);
        raw.forEach((key, pool) -> pools.put(Universe.fromKey(key), pool == null ? List.of() : pool));
        return new CharacterPoolCatalog(pools);
    }

    public List<CharacterProfile> poolFor(Universe universe) {
        return pools.getOrDefault(universe, Collections.emptyList());
    }

    public int totalCharacters() {
        return pools.values().stream().mapToInt(List::size).sum();
    }

    private static void validatePool(Universe universe, List<CharacterProfile> pool) {
        if (pool.isEmpty()) {
            log.warn("Character pool for {} is empty; puzzles for it cannot be generated", universe.getKey());
            return;
        }
        String expectedPrefix = universe.getKey() + "/";
        for (CharacterProfile profile : pool) {
            if (profile.getName() == null || profile.getName().isBlank()) {
                throw new IllegalStateException("Character without a name in the " + universe.getKey() + " pool");
            }
            if (profile.getImageKey() == null || !profile.getImageKey().startsWith(expectedPrefix)) {
                log.warn("Image key '{}' of {} does not start with '{}'",
                        profile.getImageKey(), profile.getName(), expectedPrefix);
            }
        }
        log.info("Loaded {} characters for {}", pool.size(), universe.getKey());
    }
}
