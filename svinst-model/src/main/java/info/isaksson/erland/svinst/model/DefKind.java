package info.isaksson.erland.svinst.model;

/** Kind of design unit a {@link ModuleDef} was created from. */
public enum DefKind {
    MODULE("mod_name"),
    INTERFACE("intf_name"),
    PACKAGE("pkg_name");

    private final String nameKey;

    DefKind(String nameKey) {
        this.nameKey = nameKey;
    }

    /** Key the unit name is written under in report documents. */
    public String nameKey() {
        return nameKey;
    }
}
