package info.isaksson.erland.svinst.model;

import java.util.Objects;

/** One named instance of another module (or interface) type. */
public final class ModuleInst implements DefEntry {
    public final String moduleName;
    public final String instanceName;

    public ModuleInst(String moduleName, String instanceName) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleInst)) return false;
        ModuleInst that = (ModuleInst) o;
        return moduleName.equals(that.moduleName) && instanceName.equals(that.instanceName);
    }

    @Override public int hashCode() {
        return Objects.hash(moduleName, instanceName);
    }

    @Override public String toString() {
        return moduleName + "/" + instanceName;
    }
}
