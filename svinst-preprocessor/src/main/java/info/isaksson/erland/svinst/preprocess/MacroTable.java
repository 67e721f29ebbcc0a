package info.isaksson.erland.svinst.preprocess;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Macro definitions active while one file is preprocessed.
 *
 * <p>Not thread-safe. Each file gets its own {@link #copy()} of the initial table, so
 * definitions made while processing one file never leak into another.</p>
 */
public final class MacroTable {

    private final Map<String, MacroDefinition> macros = new LinkedHashMap<>();

    /**
     * Build the initial table from command-line predefinitions ({@code NAME} or {@code NAME=VALUE}).
     *
     * @throws IllegalArgumentException for a predefinition without a valid macro name
     */
    public static MacroTable fromPredefinitions(List<String> defines) {
        MacroTable table = new MacroTable();
        if (defines == null) return table;
        for (String raw : defines) {
            table.define(parsePredefinition(raw));
        }
        return table;
    }

    static MacroDefinition parsePredefinition(String raw) {
        if (raw == null) throw new IllegalArgumentException("macro predefinition must not be null");
        int eq = raw.indexOf('=');
        String name = (eq < 0 ? raw : raw.substring(0, eq)).trim();
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException("Invalid macro name in predefinition: " + raw);
        }
        String value = eq < 0 ? "" : unescape(raw.substring(eq + 1));
        return MacroDefinition.objectLike(name, value);
    }

    /** Resolve backslash escapes in a command-line macro value. Unknown escapes are kept as written. */
    static String unescape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch != '\\' || i + 1 >= s.length()) {
                out.append(ch);
                continue;
            }
            char esc = s.charAt(++i);
            switch (esc) {
                case 'n': out.append('\n'); break;
                case 't': out.append('\t'); break;
                case 'r': out.append('\r'); break;
                case '\\': out.append('\\'); break;
                case '"': out.append('"'); break;
                case '\'': out.append('\''); break;
                default: out.append('\\').append(esc);
            }
        }
        return out.toString();
    }

    static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty()) return false;
        if (!isIdentifierStart(s.charAt(0))) return false;
        for (int i = 1; i < s.length(); i++) {
            if (!isIdentifierPart(s.charAt(i))) return false;
        }
        return true;
    }

    static boolean isIdentifierStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || (ch >= '0' && ch <= '9') || ch == '$';
    }

    /** Register a macro, replacing any earlier definition with the same name. */
    public void define(MacroDefinition macro) {
        macros.put(macro.name, macro);
    }

    /** Remove a macro. Removing an undefined name is a no-op. */
    public boolean undefine(String name) {
        return macros.remove(name) != null;
    }

    public void clear() {
        macros.clear();
    }

    public boolean isDefined(String name) {
        return macros.containsKey(name);
    }

    /** The current definition, or null. */
    public MacroDefinition lookup(String name) {
        return macros.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(macros.keySet());
    }

    public int size() {
        return macros.size();
    }

    public MacroTable copy() {
        MacroTable t = new MacroTable();
        t.macros.putAll(macros);
        return t;
    }
}
