package io.github.lodestone.orm.api.exceptions.json;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class JacksonJsonLocation {
    private JacksonJsonLocation() {}

    @Contract("_ -> new")
    public static @NotNull JsonLocation from(@Nullable com.fasterxml.jackson.core.JsonLocation location) {
        if (location == null) {
            return JsonLocation.UNKNOWN;
        }
        return new JsonLocation(location.getLineNr(), location.getColumnNr(), location.getCharOffset());
    }
}
