package info.isaksson.erland.svinst.model;

import java.util.Objects;

/** A {@code import pkg::item;} found inside a design unit. {@code item} is {@code *} for wildcard imports. */
public final class PackageImport implements DefEntry {
    public final String packageName;
    public final String item;

    public PackageImport(String packageName, String item) {
        this.packageName = Objects.requireNonNull(packageName, "packageName");
        this.item = item == null ? "*" : item;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PackageImport)) return false;
        PackageImport that = (PackageImport) o;
        return packageName.equals(that.packageName) && item.equals(that.item);
    }

    @Override public int hashCode() {
        return Objects.hash(packageName, item);
    }

    @Override public String toString() {
        return packageName + "::" + item;
    }
}
