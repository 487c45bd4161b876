package io.github.lodestone.orm.api.options;

import io.github.lodestone.orm.api.exceptions.ValidationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * One sort key of a query.
 */
public record SortOption(String field, SortOrder order) {
    @Contract("_ -> new")
    public static @NotNull SortOption ascending(String field) {
        return new SortOption(field, SortOrder.ASCENDING);
    }

    @Contract("_ -> new")
    public static @NotNull SortOption descending(String field) {
        return new SortOption(field, SortOrder.DESCENDING);
    }

    /**
     * Parses {@code "name"} or {@code "+name"} as ascending and {@code "-name"} as descending.
     */
    @Contract("_ -> new")
    public static @NotNull SortOption parse(@NotNull String spec) {
        if (spec.startsWith("-")) {
            return descending(checked(spec.substring(1), spec));
        }
        if (spec.startsWith("+")) {
            return ascending(checked(spec.substring(1), spec));
        }
        return ascending(checked(spec, spec));
    }

    private static String checked(String field, String spec) {
        if (field.isEmpty()) {
            throw new ValidationException("Sort key '" + spec + "' names no field");
        }
        return field;
    }
}
