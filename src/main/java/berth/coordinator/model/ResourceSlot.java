package berth.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable sparse vector of named resource quantities (cpu, mem, cuda.shares, ...).
 * Missing keys are treated as zero.
 */
public final class ResourceSlot {

    private static final ResourceSlot EMPTY = new ResourceSlot(new TreeMap<>());

    private final Map<String, BigDecimal> values;

    private ResourceSlot(TreeMap<String, BigDecimal> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ResourceSlot empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static ResourceSlot fromJson(Map<String, BigDecimal> values) {
        return of(values);
    }

    public static ResourceSlot of(Map<String, ? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, BigDecimal> copy = new TreeMap<>();
        values.forEach((key, value) -> {
            Objects.requireNonNull(key, "resource name is required");
            if (value != null) {
                copy.put(key, toDecimal(value));
            }
        });
        return new ResourceSlot(copy);
    }

    /** Convenience factory: {@code ResourceSlot.of("cpu", 2, "mem", 4096)}. */
    public static ResourceSlot of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs");
        }
        TreeMap<String, BigDecimal> copy = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            copy.put((String) keyValues[i], toDecimal((Number) keyValues[i + 1]));
        }
        return new ResourceSlot(copy);
    }

    public BigDecimal get(String name) {
        return values.getOrDefault(name, BigDecimal.ZERO);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, BigDecimal> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** True when every quantity is zero (or there are none). */
    public boolean isZero() {
        return values.values().stream().allMatch(v -> v.signum() == 0);
    }

    public ResourceSlot add(ResourceSlot other) {
        TreeMap<String, BigDecimal> result = new TreeMap<>(values);
        other.values.forEach((key, value) -> result.merge(key, value, BigDecimal::add));
        return new ResourceSlot(result);
    }

    public ResourceSlot subtract(ResourceSlot other) {
        TreeMap<String, BigDecimal> result = new TreeMap<>(values);
        other.values.forEach((key, value) -> result.merge(key, value.negate(), BigDecimal::add));
        return new ResourceSlot(result);
    }

    /** Multiply every quantity by a scalar. */
    public ResourceSlot multiply(BigDecimal factor) {
        TreeMap<String, BigDecimal> result = new TreeMap<>();
        values.forEach((key, value) -> result.put(key, value.multiply(factor)));
        return new ResourceSlot(result);
    }

    /**
     * Per-key partial order: true if every quantity of this slot is less than or
     * equal to the same quantity of {@code capacity}. Keys missing on either side
     * count as zero.
     */
    public boolean fitsWithin(ResourceSlot capacity) {
        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            if (entry.getValue().compareTo(capacity.get(entry.getKey())) > 0) {
                return false;
            }
        }
        return true;
    }

    /** Names of the resources for which {@code requested} exceeds this slot. */
    public Set<String> shortfallAgainst(ResourceSlot requested) {
        Set<String> insufficient = new TreeSet<>();
        for (String key : requested.keys()) {
            if (requested.get(key).compareTo(get(key)) > 0) {
                insufficient.add(key);
            }
        }
        return insufficient;
    }

    private static BigDecimal toDecimal(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Integer || value instanceof Long) {
            return BigDecimal.valueOf(value.longValue());
        }
        return new BigDecimal(value.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ResourceSlot other))
            return false;
        Set<String> allKeys = new TreeSet<>(values.keySet());
        allKeys.addAll(other.values.keySet());
        for (String key : allKeys) {
            if (get(key).compareTo(other.get(key)) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (Map.Entry<String, BigDecimal> entry : values.entrySet()) {
            if (entry.getValue().signum() != 0) {
                hash += entry.getKey().hashCode() ^ entry.getValue().stripTrailingZeros().hashCode();
            }
        }
        return hash;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
