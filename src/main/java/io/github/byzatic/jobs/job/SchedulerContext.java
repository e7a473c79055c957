package io.github.byzatic.jobs.job;

import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scheduler-wide registry of named objects shared by all jobs of one host.
 */
@ThreadSafe
public class SchedulerContext {
    private final Map<String, Object> objects = new ConcurrentHashMap<>();

    public void put(@NotNull String name, @NotNull Object object) {
        objects.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(object, "object"));
    }

    public @Nullable Object get(@NotNull String name) {
        return objects.get(Objects.requireNonNull(name, "name"));
    }

    public @Nullable Object remove(@NotNull String name) {
        return objects.remove(Objects.requireNonNull(name, "name"));
    }

    public boolean containsKey(@NotNull String name) {
        return objects.containsKey(Objects.requireNonNull(name, "name"));
    }

    public @NotNull Set<String> keySet() {
        return Set.copyOf(objects.keySet());
    }

    @Override
    public String toString() {
        return "SchedulerContext{names=" + objects.keySet() + '}';
    }
}
