package io.github.lodestone.orm.sql;

import io.github.lodestone.orm.api.DbObject;
import io.github.lodestone.orm.api.meta.EntityDeclaration;
import io.github.lodestone.orm.api.meta.FieldModel;

/**
 * Entities shared by the tests of this module.
 */
public final class Fixtures {
    private Fixtures() {}

    public static final class Owner extends DbObject {
        public static final FieldModel<String> NAME = FieldModel.of("name", String.class);
        public static final EntityDeclaration<Owner> DECLARATION = EntityDeclaration.builder(Owner.class, "owner", Owner::new)
            .field(NAME)
            .build();
    }

    public static final class Sample extends DbObject {
        public static final FieldModel<Long> A = FieldModel.builder("a", Long.class).unique().build();
        public static final FieldModel<Owner> OWNER = FieldModel.builder("owner", Owner.class).nullable().build();
        public static final EntityDeclaration<Sample> DECLARATION = EntityDeclaration.builder(Sample.class, "sample", Sample::new)
            .fields(A, OWNER)
            .build();
    }

    public static final class Marker extends DbObject {
        public static final EntityDeclaration<Marker> DECLARATION = EntityDeclaration.builder(Marker.class, "marker", Marker::new)
            .build();
    }
}
