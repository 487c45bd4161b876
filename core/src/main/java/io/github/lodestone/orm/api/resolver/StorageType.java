package io.github.lodestone.orm.api.resolver;

/**
 * The storage primitives a column can hold, with the Java type a row reader hands back for each.
 */
public enum StorageType {
    INTEGER(Long.class),
    REAL(Double.class),
    TEXT(String.class),
    BLOB(byte[].class);

    private final Class<?> javaType;

    StorageType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Column type keyword used in {@code CREATE TABLE}.
     */
    public String sqlName() {
        return name();
    }
}
