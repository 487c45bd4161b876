package io.github.lodestone.orm.api;

import io.github.lodestone.orm.api.meta.SchemaRegistry;
import org.jetbrains.annotations.NotNull;

/**
 * The database an instance belongs to, as seen from the instance.
 */
public interface EntityContext {
    @NotNull SchemaRegistry getSchemaRegistry();

    /**
     * @throws io.github.lodestone.orm.api.exceptions.DeclarationException if the type is not declared
     */
    <T extends DbObject> @NotNull RepositoryAdapter<T> repository(@NotNull Class<T> entityClass);
}
