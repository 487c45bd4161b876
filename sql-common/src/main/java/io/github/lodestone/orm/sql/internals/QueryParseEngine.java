package io.github.lodestone.orm.sql.internals;

import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.meta.ReferenceEdge;
import io.github.lodestone.orm.api.options.SelectQuery;
import io.github.lodestone.orm.sql.internals.query.DeleteSqlBuilder;
import io.github.lodestone.orm.sql.internals.query.InsertSqlBuilder;
import io.github.lodestone.orm.sql.internals.query.QueryStringCache;
import io.github.lodestone.orm.sql.internals.query.RepositoryDdlBuilder;
import io.github.lodestone.orm.sql.internals.query.SelectSqlBuilder;
import io.github.lodestone.orm.sql.internals.query.SqlConditionBuilder;
import io.github.lodestone.orm.sql.internals.query.SqlSortBuilder;
import io.github.lodestone.orm.sql.internals.query.UpdateSqlBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * Produces every SQL statement issued for one entity table.
 *
 * <p>Statements that do not depend on a query are built once and cached.</p>
 */
public final class QueryParseEngine {
    private final EntityModel<?> model;
    private final QueryStringCache cache = new QueryStringCache(16);

    private final SelectSqlBuilder selectBuilder;
    private final InsertSqlBuilder insertBuilder;
    private final UpdateSqlBuilder updateBuilder;
    private final DeleteSqlBuilder deleteBuilder;
    private final RepositoryDdlBuilder ddlBuilder;

    public QueryParseEngine(@NotNull SQLType sqlType, @NotNull EntityModel<?> model) {
        this.model = model;

        SqlConditionBuilder conditionBuilder = new SqlConditionBuilder(sqlType, model);
        SqlSortBuilder sortBuilder = new SqlSortBuilder(sqlType, model);

        this.selectBuilder = new SelectSqlBuilder(sqlType, model, conditionBuilder, sortBuilder);
        this.insertBuilder = new InsertSqlBuilder(sqlType, model);
        this.updateBuilder = new UpdateSqlBuilder(sqlType, model);
        this.deleteBuilder = new DeleteSqlBuilder(sqlType, model, conditionBuilder, sortBuilder);
        this.ddlBuilder = new RepositoryDdlBuilder(sqlType, model);
    }

    public @NotNull EntityModel<?> model() {
        return model;
    }

    public @NotNull String parseSelect(@NotNull SelectQuery query) {
        return selectBuilder.parseSelect(query);
    }

    public @NotNull String parseQueryIds(@NotNull SelectQuery query) {
        return selectBuilder.parseQueryIds(query);
    }

    public @NotNull String parseCount(@NotNull SelectQuery query) {
        return selectBuilder.parseCount(query);
    }

    public @NotNull String parseSelectById() {
        return cache.computeIfAbsent("select-by-id", key -> selectBuilder.parseSelectById());
    }

    /**
     * Ids of the rows whose {@code column} holds the bound value.
     */
    public @NotNull String parseSelectIdsWhere(@NotNull String column) {
        return cache.computeIfAbsent("select-ids-where:" + column, key -> selectBuilder.parseSelectIdsWhere(column));
    }

    public @NotNull String parseInsert(boolean explicitId) {
        return explicitId
            ? cache.computeIfAbsent("insert-with-id", key -> insertBuilder.parseInsert(true))
            : cache.computeIfAbsent("insert", key -> insertBuilder.parseInsert(false));
    }

    public @NotNull String parseUpdateFromEntity() {
        return cache.computeIfAbsent("update", key -> updateBuilder.parseUpdateFromEntity());
    }

    /**
     * Clears the column of {@code edge} on the row with the bound id. Runs against the edge's source table.
     */
    public @NotNull String parseSetNull(@NotNull ReferenceEdge edge) {
        if (edge.source() != model) {
            throw new IllegalArgumentException(edge + " does not start at " + model.tableName());
        }
        return cache.computeIfAbsent("set-null:" + edge.column().name(), key -> updateBuilder.parseSetNull(edge.column()));
    }

    public @NotNull String parseDeleteById() {
        return cache.computeIfAbsent("delete-by-id", key -> deleteBuilder.parseDeleteById());
    }

    public @NotNull String parseDeleteMatching(@NotNull SelectQuery query) {
        return deleteBuilder.parseDeleteMatching(query);
    }

    public @NotNull String parseRepository() {
        return cache.computeIfAbsent("ddl", key -> ddlBuilder.parseRepository());
    }

    public enum SQLType {
        SQLITE("SQLite", '"');

        private final String displayName;
        private final char quoteChar;

        SQLType(String displayName, char quoteChar) {
            this.displayName = displayName;
            this.quoteChar = quoteChar;
        }

        public String displayName() {
            return displayName;
        }

        public char quoteChar() {
            return quoteChar;
        }

        /**
         * Quotes an identifier, doubling any embedded quote character.
         */
        public String quote(String identifier) {
            String quote = String.valueOf(quoteChar);
            return quote + identifier.replace(quote, quote + quote) + quote;
        }
    }
}
