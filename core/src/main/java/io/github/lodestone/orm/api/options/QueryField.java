package io.github.lodestone.orm.api.options;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.EntityQuery;
import org.jetbrains.annotations.Contract;

/**
 * Field-scoped comparison step of {@link EntityQuery#where(String)}.
 *
 * <pre>{@code
 * repository.getAll().where("age").gte(18).where("name").eq("Ada");
 * }</pre>
 */
public final class QueryField<E extends DbObject> {
    private final EntityQuery<E> query;
    private final String field;

    @Contract(pure = true)
    public QueryField(EntityQuery<E> query, String field) {
        this.query = query;
        this.field = field;
    }

    public EntityQuery<E> eq(Object value) {
        return query.where(new FilterOption(field, Operator.EQ, value));
    }

    public EntityQuery<E> lt(Object value) {
        return query.where(new FilterOption(field, Operator.LT, value));
    }

    public EntityQuery<E> lte(Object value) {
        return query.where(new FilterOption(field, Operator.LTE, value));
    }

    public EntityQuery<E> gt(Object value) {
        return query.where(new FilterOption(field, Operator.GT, value));
    }

    public EntityQuery<E> gte(Object value) {
        return query.where(new FilterOption(field, Operator.GTE, value));
    }
}
