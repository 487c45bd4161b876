package io.github.lodestone.orm.sql;

/**
 * Work run once while a database is initialized, such as seeding rows or creating extra indexes.
 */
@FunctionalInterface
public interface InitHook {
    void run(RelationalDatabase database);
}
