package io.github.lodestone.orm.api.options;

import io.github.lodestone.orm.api.exceptions.ValidationException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single {@code field <operator> value} predicate. Filters of one query are combined with AND.
 */
public record FilterOption(String field, Operator operator, @Nullable Object value) {

    /**
     * Parses a {@code field__op} specifier such as {@code "age__gte"}. A specifier without a
     * double underscore compares for equality.
     */
    @Contract("_, _ -> new")
    public static @NotNull FilterOption parse(@NotNull String spec, @Nullable Object value) {
        int split = spec.lastIndexOf("__");
        if (split < 0) {
            return new FilterOption(spec, Operator.EQ, value);
        }

        String field = spec.substring(0, split);
        if (field.isEmpty()) {
            throw new ValidationException("Unable to parse filter '" + spec + "': no field name");
        }
        try {
            return new FilterOption(field, Operator.fromKeyword(spec.substring(split + 2)), value);
        } catch (ValidationException e) {
            throw new ValidationException("Unable to parse filter '" + spec + "': " + e.getMessage(), e);
        }
    }
}
