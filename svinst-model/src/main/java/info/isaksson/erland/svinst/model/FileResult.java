package info.isaksson.erland.svinst.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome for one input file: exactly one of a hierarchy summary, a full tree or a failure.
 */
public final class FileResult {
    public final String fileName;

    /** Present in summary mode. */
    public final List<ModuleDef> defs;

    /** Present in full-tree mode. */
    public final TreeNode syntaxTree;

    /** Present when processing the file failed. */
    public final FileFailure failure;

    private FileResult(String fileName, List<ModuleDef> defs, TreeNode syntaxTree, FileFailure failure) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.defs = defs;
        this.syntaxTree = syntaxTree;
        this.failure = failure;
    }

    public static FileResult summary(String fileName, List<ModuleDef> defs) {
        return new FileResult(fileName, List.copyOf(Objects.requireNonNull(defs, "defs")), null, null);
    }

    public static FileResult fullTree(String fileName, TreeNode syntaxTree) {
        return new FileResult(fileName, null, Objects.requireNonNull(syntaxTree, "syntaxTree"), null);
    }

    public static FileResult failed(String fileName, FileFailure failure) {
        return new FileResult(fileName, null, null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isFailure() {
        return failure != null;
    }

    public boolean isFullTree() {
        return syntaxTree != null;
    }
}
