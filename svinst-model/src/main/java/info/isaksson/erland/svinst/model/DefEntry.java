package info.isaksson.erland.svinst.model;

/** One entry of a def's {@code insts} list: a {@link ModuleInst} or a {@link PackageImport}. */
public interface DefEntry {
}
