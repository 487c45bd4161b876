package io.github.lodestone.orm.sqlite;

import io.github.lodestone.orm.api.resolver.TypeResolverRegistry;
import io.github.lodestone.orm.sqlite.Samples.Device;
import io.github.lodestone.orm.sqlite.Samples.Sample1;
import io.github.lodestone.orm.sqlite.Samples.Sample2;
import io.github.lodestone.orm.sqlite.Samples.Sample3;
import io.github.lodestone.orm.sqlite.Samples.Sample4;
import io.github.lodestone.orm.sqlite.Samples.Status;

import java.nio.file.Path;

final class SQLiteTestSupport {
    private SQLiteTestSupport() {}

    static SQLiteDatabaseBuilder builder(Path directory) {
        TypeResolverRegistry registry = new TypeResolverRegistry();
        registry.registerEnum(Status.class);

        return new SQLiteDatabaseBuilder()
            .withPath(directory.resolve("test.sqlite3"))
            .withEnvironment(name -> null)
            .withTypeResolverRegistry(registry)
            .declare(Sample1.DECLARATION, Sample2.DECLARATION, Sample3.DECLARATION, Sample4.DECLARATION, Device.DECLARATION);
    }

    static SQLiteDatabase initialized(Path directory) {
        SQLiteDatabase database = builder(directory).build();
        database.init(false);
        return database;
    }
}
