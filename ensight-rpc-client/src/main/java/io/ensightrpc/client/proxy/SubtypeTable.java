package io.ensightrpc.client.proxy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Polymorphic base classes: for each, the discriminator attribute and the value to subclass
 * mapping used to pick a concrete proxy class.
 */
public final class SubtypeTable {
    private static final SubtypeTable DEFAULTS = builder()
            .polymorphic("ENS_PART", "PARTTYPE", prefixed("ENS_PART_", Map.ofEntries(
                    Map.entry(0, "MODEL"),
                    Map.entry(1, "CLIP"),
                    Map.entry(2, "CONTOUR"),
                    Map.entry(3, "DISCRETE_PARTICLE"),
                    Map.entry(4, "FRAME"),
                    Map.entry(5, "ISOSURFACE"),
                    Map.entry(6, "PARTICLE_TRACE"),
                    Map.entry(7, "PROFILE"),
                    Map.entry(8, "VECTOR_ARROW"),
                    Map.entry(9, "ELEVATED_SURFACE"),
                    Map.entry(10, "DEVELOPED_SURFACE"),
                    Map.entry(15, "BUILTUP"),
                    Map.entry(16, "TENSOR_GLYPH"),
                    Map.entry(17, "FX_VORTEX_CORE"),
                    Map.entry(18, "FX_SHOCK"),
                    Map.entry(19, "FX_SEP_ATT"),
                    Map.entry(20, "MAT_INTERFACE"),
                    Map.entry(21, "POINT"),
                    Map.entry(22, "AXISYMMETRIC"),
                    Map.entry(24, "VOF"),
                    Map.entry(25, "AUX_GEOM"),
                    Map.entry(26, "FILTER"))))
            .polymorphic("ENS_ANNOT", "ANNOTTYPE", prefixed("ENS_ANNOT_", Map.of(
                    0, "TEXT",
                    1, "LINE",
                    2, "LOGO",
                    3, "LGND",
                    4, "MARKER",
                    5, "ARROW",
                    6, "DIAL",
                    7, "GAUGE",
                    8, "SHAPE")))
            .polymorphic("ENS_TOOL", "TOOLTYPE", prefixed("ENS_TOOL_", Map.of(
                    0, "CURSOR",
                    1, "LINE",
                    2, "PLANE",
                    3, "BOX",
                    4, "CYLINDER",
                    5, "CONE",
                    6, "SPHERE",
                    7, "REVOLUTION")))
            .build();

    /**
     * @param baseClass the class name the engine reports
     * @param discriminator attribute enum name whose value selects the subclass
     * @param subclasses discriminator value to subclass name
     */
    public record Entry(String baseClass, String discriminator, Map<Integer, String> subclasses) {
        public Entry {
            Objects.requireNonNull(baseClass, "baseClass");
            Objects.requireNonNull(discriminator, "discriminator");
            subclasses = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(subclasses, "subclasses")));
        }

        public Optional<String> subclassFor(int value) {
            return Optional.ofNullable(subclasses.get(value));
        }
    }

    private final Map<String, Entry> entries;

    private SubtypeTable(Map<String, Entry> entries) {
        this.entries = entries;
    }

    /**
     * Parts, annotations and tools.
     */
    public static SubtypeTable defaults() {
        return DEFAULTS;
    }

    public static SubtypeTable empty() {
        return new SubtypeTable(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.entries.putAll(entries);
        return b;
    }

    public Optional<Entry> lookup(String className) {
        return Optional.ofNullable(entries.get(className));
    }

    public boolean isPolymorphic(String className) {
        return entries.containsKey(className);
    }

    /**
     * @return the subclass for {@code value}, or {@code className} itself when none applies
     */
    public String resolve(String className, int value) {
        Entry e = entries.get(className);
        if (e == null) return className;
        return e.subclassFor(value).orElse(className);
    }

    private static Map<Integer, String> prefixed(String prefix, Map<Integer, String> names) {
        Map<Integer, String> out = new LinkedHashMap<>();
        names.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> out.put(e.getKey(), prefix + e.getValue()));
        return out;
    }

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder polymorphic(String baseClass, String discriminator, Map<Integer, String> subclasses) {
            entries.put(baseClass, new Entry(baseClass, discriminator, subclasses));
            return this;
        }

        public SubtypeTable build() {
            return new SubtypeTable(Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
        }
    }
}
