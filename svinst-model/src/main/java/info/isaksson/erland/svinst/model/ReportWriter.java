package info.isaksson.erland.svinst.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Serializes a {@link Report} as a YAML or JSON document.
 *
 * <p>The document is built as a Jackson tree in report order, so identical reports always
 * produce byte-identical output. Failed files are not part of the document; they are
 * reported as diagnostics instead.</p>
 */
public final class ReportWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final ObjectMapper JSON = createJsonMapper();
    private static final ObjectMapper YAML = createYamlMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ReportWriter() {}

    public static void write(Report report, OutputFormat format, OutputStream out) throws IOException {
        if (out == null) throw new IllegalArgumentException("out is null");
        ObjectNode doc = toDocument(report);
        if (format == OutputFormat.JSON) {
            JSON.writer(PRETTY).writeValue(out, doc);
            out.write('\n');
        } else {
            YAML.writeValue(out, doc);
        }
        out.flush();
    }

    public static String toString(Report report, OutputFormat format) throws IOException {
        ObjectNode doc = toDocument(report);
        if (format == OutputFormat.JSON) {
            return JSON.writer(PRETTY).writeValueAsString(doc) + "\n";
        }
        return YAML.writeValueAsString(doc);
    }

    /** Build the document tree: {@code files:} followed by one entry per successful file. */
    static ObjectNode toDocument(Report report) {
        if (report == null) throw new IllegalArgumentException("report is null");
        ObjectNode root = NODES.objectNode();
        ArrayNode files = root.putArray("files");
        for (FileResult r : report.files) {
            if (r.isFailure()) continue;
            ObjectNode entry = files.addObject();
            entry.put("file_name", r.fileName);
            if (r.isFullTree()) {
                entry.putArray("syntax_tree").add(treeToNode(r.syntaxTree));
            } else {
                ArrayNode defs = entry.putArray("defs");
                for (ModuleDef def : r.defs) {
                    defs.add(defToNode(def));
                }
            }
        }
        return root;
    }

    private static ObjectNode defToNode(ModuleDef def) {
        ObjectNode node = NODES.objectNode();
        node.put(def.kind.nameKey(), def.name);
        ArrayNode insts = node.putArray("insts");
        for (DefEntry entry : def.entries()) {
            ObjectNode e = insts.addObject();
            if (entry instanceof ModuleInst) {
                ModuleInst inst = (ModuleInst) entry;
                e.put("mod_name", inst.moduleName);
                e.put("inst_name", inst.instanceName);
            } else {
                e.put("pkg_name", ((PackageImport) entry).packageName);
            }
        }
        return node;
    }

    /**
     * Convert a tree snapshot without recursion; generated syntax trees for long expressions
     * can be deeper than the default thread stack comfortably allows.
     */
    private static ObjectNode treeToNode(TreeNode rootNode) {
        ObjectNode rootJson = NODES.objectNode();
        Deque<Object[]> work = new ArrayDeque<>();
        work.push(new Object[] {rootNode, rootJson});
        while (!work.isEmpty()) {
            Object[] item = work.pop();
            TreeNode n = (TreeNode) item[0];
            ObjectNode target = (ObjectNode) item[1];
            if (n.isLeaf()) {
                target.put("Token", n.token);
                target.put("Line", n.line);
                if (n.file != null) target.put("File", n.file);
                continue;
            }
            ArrayNode children = target.putArray(n.kind);
            for (TreeNode c : n.children()) {
                work.push(new Object[] {c, children.addObject()});
            }
        }
        return rootJson;
    }

    private static ObjectMapper createJsonMapper() {
        ObjectMapper om = new ObjectMapper();
        // Prevent Jackson from closing the provided OutputStream (usually System.out).
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static ObjectMapper createYamlMapper() {
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .disable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build();
        return new ObjectMapper(factory);
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
