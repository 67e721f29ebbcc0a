package info.isaksson.erland.svinst.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A design unit declared in a source file together with what its body instantiates.
 *
 * <p>Instances and imports share one list in the order they were encountered, so an import in
 * the header precedes the instances of the body. Defs with the same name are distinct
 * objects; nothing merges them.</p>
 */
public final class ModuleDef {
    public final DefKind kind;
    public final String name;

    private final List<DefEntry> entries = new ArrayList<>();

    public ModuleDef(DefKind kind, String name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static ModuleDef module(String name) {
        return new ModuleDef(DefKind.MODULE, name);
    }

    public void addInstance(ModuleInst inst) {
        entries.add(Objects.requireNonNull(inst, "inst"));
    }

    public void addImport(PackageImport imp) {
        entries.add(Objects.requireNonNull(imp, "imp"));
    }

    /** Instances and imports interleaved in encounter order. */
    public List<DefEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<ModuleInst> instances() {
        return select(ModuleInst.class);
    }

    public List<PackageImport> imports() {
        return select(PackageImport.class);
    }

    private <T extends DefEntry> List<T> select(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (DefEntry e : entries) {
            if (type.isInstance(e)) out.add(type.cast(e));
        }
        return Collections.unmodifiableList(out);
    }

    @Override public String toString() {
        return kind + " " + name + " " + entries;
    }
}
