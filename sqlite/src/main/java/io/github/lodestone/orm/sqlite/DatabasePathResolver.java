package io.github.lodestone.orm.sqlite;

import io.github.lodestone.orm.api.exceptions.StartupException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Picks the database file: an explicit path wins, then the {@value #ENVIRONMENT_VARIABLE}
 * environment variable, then the default path. A blank variable counts as unset.
 */
public final class DatabasePathResolver {
    public static final String ENVIRONMENT_VARIABLE = "DB_PATH";

    private final @Nullable Path explicitPath;
    private final @Nullable Path defaultPath;
    private final Function<String, String> environment;

    public DatabasePathResolver(@Nullable Path explicitPath, @Nullable Path defaultPath,
                                @NotNull Function<String, String> environment) {
        this.explicitPath = explicitPath;
        this.defaultPath = defaultPath;
        this.environment = environment;
    }

    /**
     * @throws StartupException if no source provides a path
     */
    public @NotNull Path resolve() {
        if (explicitPath != null) {
            return explicitPath;
        }

        String fromEnvironment = environment.apply(ENVIRONMENT_VARIABLE);
        if (fromEnvironment != null && !fromEnvironment.isBlank()) {
            return Path.of(fromEnvironment);
        }

        if (defaultPath != null) {
            return defaultPath;
        }
        throw new StartupException("No database path was set; set one explicitly, through "
            + ENVIRONMENT_VARIABLE + " or as the default path");
    }
}
