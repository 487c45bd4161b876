package io.github.lodestone.orm.sql.internals.repository;

import java.util.OptionalLong;

/**
 * Outcome of a statement run for its side effects.
 *
 * @param updateCount rows changed, or {@code -1} for statements that report none
 * @param lastInsertId the row id assigned by an {@code INSERT}, empty for other statements
 */
public record StatementResult(int updateCount, OptionalLong lastInsertId) {
    public static StatementResult of(int updateCount) {
        return new StatementResult(updateCount, OptionalLong.empty());
    }
}
