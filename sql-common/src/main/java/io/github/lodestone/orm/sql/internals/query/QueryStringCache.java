package io.github.lodestone.orm.sql.internals.query;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public final class QueryStringCache {
    private final Map<String, String> cache;

    public QueryStringCache(int initialCapacity) {
        this.cache = new ConcurrentHashMap<>(initialCapacity);
    }

    public String computeIfAbsent(String key, Function<String, String> mappingFunction) {
        return cache.computeIfAbsent(key, mappingFunction);
    }

    public int size() {
        return cache.size();
    }
}
