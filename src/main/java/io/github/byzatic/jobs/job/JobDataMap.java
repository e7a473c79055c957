package io.github.byzatic.jobs.job;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.ThreadSafe;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * String-keyed parameter and state bag of a job.
 * Null values are not stored. Every mutation marks the map dirty so a host can tell whether
 * an invocation changed state that has to be written back.
 */
@ThreadSafe
public class JobDataMap {
    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private final AtomicBoolean dirty = new AtomicBoolean(false);

    public JobDataMap() {
    }

    public JobDataMap(@NotNull Map<String, ?> initial) {
        Objects.requireNonNull(initial, "initial");
        initial.forEach((k, v) -> {
            if (k != null && v != null) values.put(k, v);
        });
    }

    public JobDataMap(@NotNull JobDataMap copy) {
        this(Objects.requireNonNull(copy, "copy").values);
    }

    public void put(@NotNull String key, @NotNull Object value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        values.put(key, value);
        dirty.set(true);
    }

    public void putAll(@NotNull JobDataMap other) {
        Objects.requireNonNull(other, "other");
        if (other.values.isEmpty()) return;
        values.putAll(other.values);
        dirty.set(true);
    }

    public @Nullable Object remove(@NotNull String key) {
        Object removed = values.remove(Objects.requireNonNull(key, "key"));
        if (removed != null) dirty.set(true);
        return removed;
    }

    public boolean containsKey(@NotNull String key) {
        return values.containsKey(Objects.requireNonNull(key, "key"));
    }

    public @Nullable Object get(@NotNull String key) {
        return values.get(Objects.requireNonNull(key, "key"));
    }

    /**
     * @throws ClassCastException if the value is not a {@link String}
     */
    public @Nullable String getString(@NotNull String key) {
        Object value = get(key);
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        throw new ClassCastException("Value under '" + key + "' is not a String: " + value.getClass().getName());
    }

    /**
     * Integral numbers are converted, strings are parsed. Fractions are rejected, never truncated.
     *
     * @throws ClassCastException    if the value is neither a {@link Number} nor a {@link String}
     * @throws NumberFormatException if the value is not a whole number within the long range
     */
    public Optional<Long> getLong(@NotNull String key) {
        Object value = get(key);
        if (value == null) return Optional.empty();
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof Number) {
            try {
                return Optional.of(new BigDecimal(value.toString()).longValueExact());
            } catch (ArithmeticException | NumberFormatException e) {
                throw new NumberFormatException("Value under '" + key + "' is not a whole number: " + value);
            }
        }
        if (value instanceof String) return Optional.of(Long.parseLong(((String) value).trim()));
        throw new ClassCastException("Value under '" + key + "' is not a long: " + value.getClass().getName());
    }

    /**
     * Accepts {@link Instant}, {@link Date} and epoch milliseconds stored as a {@link Number}.
     *
     * @throws ClassCastException if the value cannot be read as a point in time
     */
    public Optional<Instant> getInstant(@NotNull String key) {
        Object value = get(key);
        if (value == null) return Optional.empty();
        if (value instanceof Instant) return Optional.of((Instant) value);
        if (value instanceof Date) return Optional.of(((Date) value).toInstant());
        if (value instanceof Number) return Optional.of(Instant.ofEpochMilli(((Number) value).longValue()));
        throw new ClassCastException("Value under '" + key + "' is not a point in time: " + value.getClass().getName());
    }

    public @NotNull Set<String> keySet() {
        return Set.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean isDirty() {
        return dirty.get();
    }

    public void clearDirtyFlag() {
        dirty.set(false);
    }

    public @NotNull ImmutableMap<String, Object> snapshot() {
        return ImmutableMap.copyOf(values);
    }

    @Override
    public String toString() {
        return "JobDataMap{" +
                "values=" + values +
                ", dirty=" + dirty.get() +
                '}';
    }
}
