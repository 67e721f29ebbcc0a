package info.isaksson.erland.svinst.preprocess;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A text macro created by {@code `define} or by a command-line predefinition. */
public final class MacroDefinition {
    public final String name;
    public final String body;

    /** Formal parameter names; null for object-like macros. */
    private final List<String> params;
    /** Default text per formal parameter, null entries where a formal has no default. */
    private final List<String> defaults;

    private MacroDefinition(String name, List<String> params, List<String> defaults, String body) {
        this.name = Objects.requireNonNull(name, "name");
        this.params = params;
        this.defaults = defaults;
        this.body = body == null ? "" : body;
    }

    public static MacroDefinition objectLike(String name, String body) {
        return new MacroDefinition(name, null, null, body);
    }

    public static MacroDefinition functionLike(String name, List<String> params, List<String> defaults, String body) {
        Objects.requireNonNull(params, "params");
        List<String> d = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            d.add(defaults != null && i < defaults.size() ? defaults.get(i) : null);
        }
        return new MacroDefinition(name, List.copyOf(params), Collections.unmodifiableList(d), body);
    }

    public boolean isFunctionLike() {
        return params != null;
    }

    public List<String> params() {
        return params == null ? List.of() : params;
    }

    /** Default text of the formal at {@code index}, or null. */
    public String defaultFor(int index) {
        return defaults == null ? null : defaults.get(index);
    }

    @Override public String toString() {
        return isFunctionLike() ? name + params + "=" + body : name + "=" + body;
    }
}
