package info.isaksson.erland.svinst.model;

/** Document format used for the report on standard output. */
public enum OutputFormat {
    YAML("yaml"),
    JSON("json");

    public final String cliValue;

    OutputFormat(String cliValue) {
        this.cliValue = cliValue;
    }

    public static OutputFormat parseCli(String v) {
        if (v == null) return YAML;
        String s = v.trim().toLowerCase();
        for (OutputFormat f : values()) {
            if (f.cliValue.equals(s)) return f;
        }
        throw new IllegalArgumentException("Invalid value for --format: " + v + " (expected one of: yaml|json)");
    }
}
