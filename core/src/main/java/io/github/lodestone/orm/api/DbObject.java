package io.github.lodestone.orm.api;

import io.github.lodestone.orm.api.exceptions.ConsistencyException;
import io.github.lodestone.orm.api.exceptions.ValidationException;
import io.github.lodestone.orm.api.meta.ColumnModel;
import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.meta.FieldModel;
import io.github.lodestone.orm.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Base class of every persistent entity. An instance is one row held in memory.
 *
 * <p>Subclasses declare their fields as {@link FieldModel} constants and typically expose
 * typed accessors over {@link #get(FieldModel)} and {@link #set(FieldModel, Object)}:</p>
 *
 * <pre>{@code
 * public final class Sample extends DbObject {
 *     public static final FieldModel<Long> A = FieldModel.of("a", Long.class);
 *     public static final EntityDeclaration<Sample> DECLARATION =
 *         EntityDeclaration.builder(Sample.class, "sample", Sample::new).field(A).build();
 *
 *     public long getA() { return get(A); }
 *     public void setA(long a) { set(A, a); }
 * }
 * }</pre>
 *
 * <p>Instances are created by a {@link RepositoryAdapter} and are not thread-safe. Writes only
 * change memory until {@link #save()}. Reference fields are loaded on first read and cached.</p>
 */
public abstract class DbObject {
    private EntityContext context;
    private EntityModel<?> model;

    private final Map<String, Object> values = new HashMap<>();
    private final Map<String, ReferenceSlot> references = new HashMap<>();
    private final Attachments attachments = new Attachments();

    private Long id;
    private long storedId = -1;
    private LifecycleState state = LifecycleState.TRANSIENT;
    private boolean modified;

    protected DbObject() {}

    /**
     * The row id.
     *
     * @throws ValidationException if the instance was never saved and has no explicit id
     * @throws ConsistencyException if the row was deleted
     */
    public final long getId() {
        if (state == LifecycleState.STALE) {
            throw stale("read the id of");
        }
        if (id == null) {
            throw new ValidationException(describeType() + " has no id until it is saved");
        }
        return id;
    }

    public final boolean hasId() {
        return id != null && state != LifecycleState.STALE;
    }

    /**
     * Changes the id. For a persisted instance the row is renumbered on the next {@link #save()}.
     */
    public final void setId(long id) {
        if (id < 0) {
            throw new ValidationException("Cannot set a negative id");
        }
        if (state == LifecycleState.STALE) {
            throw stale("change the id of");
        }
        this.id = id;
        this.modified = true;
    }

    @SuppressWarnings("unchecked")
    public final <V> V get(@NotNull FieldModel<V> field) {
        checkOwnField(field);
        if (field.isReference()) {
            return (V) resolve(field);
        }
        if (!values.containsKey(field.name())) {
            throw unset(field);
        }
        return (V) values.get(field.name());
    }

    public final Object get(@NotNull String name) {
        if (ColumnModel.ID.equals(name)) {
            return getId();
        }
        return get(requireField(name));
    }

    public final <V> void set(@NotNull FieldModel<V> field, @Nullable V value) {
        checkOwnField(field);
        assign(field, value);
    }

    public final void set(@NotNull String name, @Nullable Object value) {
        if (ColumnModel.ID.equals(name)) {
            if (!(value instanceof Number number)) {
                throw new ValidationException("id must be an integer");
            }
            setId(number.longValue());
            return;
        }
        assign(requireField(name), value);
    }

    public final boolean isSet(@NotNull String name) {
        return values.containsKey(name) || references.containsKey(name);
    }

    /**
     * Inserts the row if this instance is transient, otherwise overwrites every column of its row.
     */
    public final void save() {
        repository().save(this);
    }

    /**
     * Deletes the row and every row that depends on it, then marks this instance stale.
     */
    public final void delete() {
        repository().delete(this);
    }

    public final LifecycleState getState() {
        return state;
    }

    /**
     * Whether a field or the id was assigned since the instance was last loaded or saved.
     */
    public final boolean isModified() {
        return modified;
    }

    public final Attachments attachments() {
        return attachments;
    }

    @ApiStatus.Internal
    public final void bind(@NotNull EntityContext context, @NotNull EntityModel<?> model) {
        if (this.context != null) {
            throw new IllegalStateException(describeType() + " instance is already bound");
        }
        if (model.entityClass() != getClass()) {
            throw new IllegalStateException("Schema " + model.tableName() + " does not describe " + getClass().getName());
        }
        this.context = context;
        this.model = model;
    }

    @ApiStatus.Internal
    public final void applyDefaults() {
        for (FieldModel<?> field : requireModel().declaration().fields()) {
            if (field.hasDefault()) {
                assign(field, field.newDefault());
            }
        }
    }

    /**
     * Replaces the in-memory state with a row read from the database, keyed by column name.
     */
    @ApiStatus.Internal
    public final void load(@NotNull Map<String, Object> row) {
        for (ColumnModel column : requireModel().columns()) {
            Object stored = row.get(column.name());
            if (column.isPrimaryKey()) {
                long rowId = (Long) column.fromStorage(stored);
                this.id = rowId;
                this.storedId = rowId;
            } else if (column.isReference()) {
                references.put(column.fieldName(), stored == null ? ReferenceSlot.empty() : ReferenceSlot.unresolved((Long) column.fromStorage(stored)));
            } else {
                values.put(column.fieldName(), column.fromStorage(stored));
            }
        }
        this.state = LifecycleState.PERSISTED;
        this.modified = false;
    }

    /**
     * The storage form of every column except {@code id}, keyed by column name in declaration order.
     *
     * @throws ValidationException if a field has no value
     */
    @ApiStatus.Internal
    public final Map<String, Object> toStorage() {
        Map<String, Object> row = new LinkedHashMap<>();
        for (ColumnModel column : requireModel().valueColumns()) {
            FieldModel<?> field = column.field();
            if (column.isReference()) {
                ReferenceSlot slot = references.get(field.name());
                if (slot == null) {
                    throw unset(field);
                }
                row.put(column.name(), slot.state() == ReferenceSlot.State.NULL ? null : slot.id());
                continue;
            }

            if (!values.containsKey(field.name())) {
                throw unset(field);
            }
            row.put(column.name(), column.toStorage(values.get(field.name())));
        }
        return row;
    }

    /**
     * The id the backing row currently has, or {@code -1} while transient.
     */
    @ApiStatus.Internal
    public final long storedId() {
        return storedId;
    }

    @ApiStatus.Internal
    public final @Nullable Long pendingId() {
        return id;
    }

    @ApiStatus.Internal
    public final void markPersisted(long rowId) {
        this.id = rowId;
        this.storedId = rowId;
        this.state = LifecycleState.PERSISTED;
        this.modified = false;
    }

    @ApiStatus.Internal
    public final void markStale() {
        this.state = LifecycleState.STALE;
    }

    @ApiStatus.Internal
    public final @Nullable ReferenceSlot referenceSlot(@NotNull String name) {
        return references.get(name);
    }

    private Object resolve(FieldModel<?> field) {
        ReferenceSlot slot = references.get(field.name());
        if (slot == null) {
            throw unset(field);
        }
        if (state == LifecycleState.STALE) {
            throw stale("resolve '" + field.name() + "' on");
        }

        switch (slot.state()) {
            case NULL:
                return null;
            case RESOLVED:
                return slot.instance();
            default:
                break;
        }

        @SuppressWarnings("unchecked")
        Class<? extends DbObject> target = (Class<? extends DbObject>) field.type();
        long targetId = slot.id();
        DbObject loaded = context.repository(target).findById(targetId);
        if (loaded == null) {
            throw new ConsistencyException(describeType() + "." + field.name() + " references missing "
                + target.getSimpleName() + " #" + targetId);
        }

        references.put(field.name(), ReferenceSlot.resolved(loaded));
        Logging.deepInfo(() -> "Resolved " + describeType() + "." + field.name() + " -> " + target.getSimpleName() + " #" + targetId);
        return loaded;
    }

    private void assign(FieldModel<?> field, Object value) {
        if (state == LifecycleState.STALE) {
            throw stale("modify");
        }
        if (value == null && !field.nullable()) {
            throw new ValidationException(describeType() + "." + field.name() + " cannot be null");
        }

        Object accepted;
        try {
            accepted = field.accept(value);
        } catch (ClassCastException e) {
            throw new ValidationException(describeType() + "." + field.name() + ": " + e.getMessage(), e);
        }

        if (field.isReference()) {
            if (accepted == null) {
                references.put(field.name(), ReferenceSlot.empty());
            } else {
                DbObject target = (DbObject) accepted;
                if (!target.hasId()) {
                    throw new ValidationException(describeType() + "." + field.name() + " must reference a saved "
                        + field.type().getSimpleName());
                }
                references.put(field.name(), ReferenceSlot.resolved(target));
            }
        } else {
            values.put(field.name(), accepted);
        }
        modified = true;
    }

    private void checkOwnField(FieldModel<?> field) {
        if (requireModel().declaration().field(field.name()) != field) {
            throw new ValidationException(describeType() + " does not declare " + field);
        }
    }

    private FieldModel<?> requireField(String name) {
        FieldModel<?> field = requireModel().declaration().field(name);
        if (field == null) {
            throw new ValidationException(describeType() + " has no field '" + name + "'");
        }
        return field;
    }

    private EntityModel<?> requireModel() {
        if (model == null) {
            throw new IllegalStateException(describeType() + " instances must be created through their repository");
        }
        return model;
    }

    @SuppressWarnings("unchecked")
    private RepositoryAdapter<DbObject> repository() {
        requireModel();
        return (RepositoryAdapter<DbObject>) (RepositoryAdapter<?>) context.repository(getClass());
    }

    private ValidationException unset(FieldModel<?> field) {
        return new ValidationException("No value set for " + describeType() + "." + field.name());
    }

    private ConsistencyException stale(String action) {
        return new ConsistencyException("Cannot " + action + " a deleted " + describeType());
    }

    private String describeType() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        if (state == LifecycleState.STALE) {
            return describeType() + "(<deleted>)";
        }

        StringJoiner joiner = new StringJoiner(", ", describeType() + "(", ")");
        joiner.add("id=" + (id == null ? "<missing>" : id));
        if (model == null) {
            return joiner.toString();
        }

        for (FieldModel<?> field : model.declaration().fields()) {
            String rendered;
            if (field.isReference()) {
                ReferenceSlot slot = references.get(field.name());
                if (slot == null) {
                    rendered = "<missing>";
                } else if (slot.state() == ReferenceSlot.State.NULL) {
                    rendered = "null";
                } else if (slot.state() == ReferenceSlot.State.RESOLVED && !slot.instance().hasId()) {
                    rendered = field.type().getSimpleName() + "(<deleted>)";
                } else {
                    rendered = field.type().getSimpleName() + "#" + slot.id();
                }
            } else if (!values.containsKey(field.name())) {
                rendered = "<missing>";
            } else {
                rendered = render(values.get(field.name()));
            }
            joiner.add(field.name() + "=" + rendered);
        }
        return joiner.toString();
    }

    private static String render(Object value) {
        if (value instanceof String string) {
            return "'" + string + "'";
        }
        if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        return String.valueOf(value);
    }
}
