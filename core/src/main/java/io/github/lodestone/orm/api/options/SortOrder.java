package io.github.lodestone.orm.api.options;

public enum SortOrder {
    ASCENDING,
    DESCENDING
}
