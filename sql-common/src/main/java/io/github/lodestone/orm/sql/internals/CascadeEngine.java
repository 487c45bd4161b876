package io.github.lodestone.orm.sql.internals;

import io.github.lodestone.orm.api.meta.EntityModel;
import io.github.lodestone.orm.api.meta.ReferenceEdge;
import io.github.lodestone.orm.api.meta.SchemaRegistry;
import io.github.lodestone.orm.api.utils.Logging;
import io.github.lodestone.orm.sql.internals.repository.SqlStatementExecutor;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Deletes rows and propagates the deletion along the reference graph.
 *
 * <p>Before a row is deleted, every row referencing it is dealt with: dependents over a nullable
 * reference have that column cleared, one {@code UPDATE} per row, and dependents over a
 * non-nullable reference are deleted first, the same way. Each row is visited once per call, so
 * reference cycles terminate, and a row that is already gone is skipped.</p>
 *
 * <p>Each statement commits on its own. There is no enclosing transaction, so a failure or crash
 * midway leaves the deletion partially propagated, and concurrent readers can observe the
 * intermediate states. Rows whose non-nullable references form a cycle between distinct rows
 * cannot be removed one at a time and fail with the foreign key violation.</p>
 */
public final class CascadeEngine {
    private final SqlStatementExecutor executor;
    private final SchemaRegistry schemas;
    private final Function<EntityModel<?>, QueryParseEngine> engines;

    public CascadeEngine(SqlStatementExecutor executor, SchemaRegistry schemas,
                         Function<EntityModel<?>, QueryParseEngine> engines) {
        this.executor = executor;
        this.schemas = schemas;
        this.engines = engines;
    }

    /**
     * @return whether the row {@code id} of {@code model} existed and was deleted
     */
    public boolean cascadeDelete(@NotNull EntityModel<?> model, long id) {
        Pending root = new Pending(model, id);
        Set<Pending> visited = new HashSet<>();
        visited.add(root);

        Deque<Step> work = new ArrayDeque<>();
        work.push(new Step(root));

        boolean rootDeleted = false;
        while (!work.isEmpty()) {
            Step step = work.peek();
            if (!step.expanded) {
                step.expanded = true;
                for (ReferenceEdge edge : schemas.incomingReferences(step.row.model().entityClass())) {
                    propagate(edge, step.row, visited, work);
                }
                continue;
            }

            work.pop();
            Pending current = step.row;
            int deleted = executor.execute(engines.apply(current.model()).parseDeleteById(), List.of(current.id())).updateCount();
            if (current.equals(root)) {
                rootDeleted = deleted > 0;
            }
            if (deleted == 0) {
                Logging.deepInfo(() -> current + " is already gone");
            } else {
                Logging.deepInfo(() -> "Deleted " + current);
            }
        }
        return rootDeleted;
    }

    private void propagate(ReferenceEdge edge, Pending target, Set<Pending> visited, Deque<Step> work) {
        EntityModel<?> source = edge.source();
        QueryParseEngine sourceEngine = engines.apply(source);
        List<Long> dependents = executor.fetchLongs(sourceEngine.parseSelectIdsWhere(edge.column().name()), List.of(target.id()));

        if (edge.nullable()) {
            String setNull = sourceEngine.parseSetNull(edge);
            for (long dependent : dependents) {
                executor.execute(setNull, List.of(dependent));
            }
            Logging.deepInfo(() -> "Cleared " + edge + " on " + dependents.size() + " row(s)");
            return;
        }

        for (long dependent : dependents) {
            Pending row = new Pending(source, dependent);
            // Rows already scheduled, the target itself included, are not revisited.
            if (visited.add(row)) {
                work.push(new Step(row));
            }
        }
    }

    private static final class Step {
        private final Pending row;
        private boolean expanded;

        private Step(Pending row) {
            this.row = row;
        }
    }

    private record Pending(EntityModel<?> model, long id) {
        @Override
        public String toString() {
            return model.tableName() + " #" + id;
        }
    }
}
