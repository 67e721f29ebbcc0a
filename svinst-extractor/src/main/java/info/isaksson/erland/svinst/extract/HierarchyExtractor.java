package info.isaksson.erland.svinst.extract;

import info.isaksson.erland.svinst.model.DefKind;
import info.isaksson.erland.svinst.model.ModuleDef;
import info.isaksson.erland.svinst.model.ModuleInst;
import info.isaksson.erland.svinst.model.PackageImport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Summarises a parsed file as its design units and what each of them instantiates.
 *
 * <p>Only grammar categories are matched: a {@code module_instantiation} is an instance no
 * matter which name it uses, while calls and gate primitives never are. Instances inside
 * generate constructs are attributed to the enclosing unit regardless of the generate
 * condition. Nested declarations become their own defs and own the instances in their body.</p>
 */
public final class HierarchyExtractor {

    private static final Logger logger = LogManager.getLogger(HierarchyExtractor.class);

    public List<ModuleDef> extract(ParsedUnit unit) {
        Collector collector = new Collector();
        SyntaxWalker.walk(unit.root(), collector);
        logger.debug("{}: {} definition(s)", unit.source.fileName, collector.defs.size());
        return collector.defs;
    }

    private static final class Collector implements SyntaxWalker.Listener {
        final List<ModuleDef> defs = new ArrayList<>();
        /** Enclosing design units, innermost first. */
        final Deque<ModuleDef> owners = new ArrayDeque<>();
        /** Depth of enclosing {@code export} declarations; their items are not imports. */
        int exportDepth;

        @Override public void enter(SyntaxNode node) {
            if (node.isLeaf()) return;
            switch (node.kind()) {
                case "module_declaration":
                    open(DefKind.MODULE, node, "module_identifier");
                    break;
                case "interface_declaration":
                    open(DefKind.INTERFACE, node, "interface_identifier");
                    break;
                case "package_declaration":
                    open(DefKind.PACKAGE, node, "package_identifier");
                    break;
                case "module_instantiation":
                    instantiation(node);
                    break;
                case "package_export_declaration":
                    exportDepth++;
                    break;
                case "package_import_item":
                    if (exportDepth == 0) packageImport(node);
                    break;
                default:
                    break;
            }
        }

        @Override public void leave(SyntaxNode node) {
            if (node.isLeaf()) return;
            switch (node.kind()) {
                case "module_declaration":
                case "interface_declaration":
                case "package_declaration":
                    owners.pop();
                    break;
                case "package_export_declaration":
                    exportDepth--;
                    break;
                default:
                    break;
            }
        }

        private void open(DefKind kind, SyntaxNode node, String identifierKind) {
            SyntaxNode id = firstDescendant(node, identifierKind);
            ModuleDef def = new ModuleDef(kind, id == null ? "" : id.text());
            defs.add(def);
            owners.push(def);
        }

        private void instantiation(SyntaxNode node) {
            ModuleDef owner = owners.peek();
            if (owner == null) return;
            String moduleName = null;
            for (SyntaxNode child : node.children()) {
                if (child.isLeaf()) continue;
                if (child.kind().equals("module_identifier")) {
                    moduleName = child.text();
                } else if (child.kind().equals("hierarchical_instance")) {
                    SyntaxNode inst = firstDescendant(child, "instance_identifier");
                    owner.addInstance(new ModuleInst(moduleName, inst == null ? "" : inst.text()));
                }
            }
        }

        private void packageImport(SyntaxNode node) {
            ModuleDef owner = owners.peek();
            if (owner == null) return;
            List<SyntaxNode> children = node.children();
            String pkg = children.get(0).text();
            String item = children.get(children.size() - 1).text();
            owner.addImport(new PackageImport(pkg, item));
        }
    }

    /** First node of {@code kind} in pre-order below (and including) {@code root}. */
    static SyntaxNode firstDescendant(SyntaxNode root, String kind) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode n = stack.pop();
            if (n.isLeaf()) continue;
            if (n.kind().equals(kind)) return n;
            List<SyntaxNode> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return null;
    }
}
