package org.kos.depresolve.util;

import org.kos.depresolve.model.DependencyTreeNode;
import org.kos.depresolve.model.ResolutionReport;

import java.util.List;

/**
 * Utility class for rendering dependency trees as text
 *
 * <pre>
 * app-1.0.0
 * ├── lib-2.1.0 (^2.0.0)
 * │   └── app (circular)
 * └── extra (not found) (optional)
 * </pre>
 */
public class DependencyTreeFormatter {

    private DependencyTreeFormatter() {
    }

    /**
     * Format every tree of a report, one block per requested package.
     *
     * @param report the resolution report
     * @return the formatted trees
     */
    public static String format(ResolutionReport report) {
        StringBuilder result = new StringBuilder();
        for (DependencyTreeNode root : report.getDependencyTree().values()) {
            result.append(format(root));
        }
        return result.toString();
    }

    /**
     * Format a single tree.
     *
     * @param root the tree root
     * @return the formatted tree, one line per node
     */
    public static String format(DependencyTreeNode root) {
        StringBuilder builder = new StringBuilder();
        builder.append(label(root)).append("\n");
        appendChildren(builder, root, "");
        return builder.toString();
    }

    private static void appendChildren(StringBuilder builder, DependencyTreeNode node, String prefix) {
        List<DependencyTreeNode> children = node.getDependencies();
        for (int i = 0; i < children.size(); i++) {
            DependencyTreeNode child = children.get(i);
            boolean isLast = (i == children.size() - 1);
            builder.append(prefix).append(isLast ? "└── " : "├── ").append(label(child)).append("\n");
            appendChildren(builder, child, prefix + (isLast ? "    " : "│   "));
        }
    }

    private static String label(DependencyTreeNode node) {
        StringBuilder label = new StringBuilder(node.getName());
        if (node.getVersion() != null) {
            label.append("-").append(node.getVersion());
        }
        if (node.getRequiredVersion() != null) {
            label.append(" (").append(node.getRequiredVersion()).append(")");
        }
        if (node.isCircular()) {
            label.append(" (circular)");
        }
        if (node.isNotFound()) {
            label.append(" (not found)");
        }
        if (node.isOptional()) {
            label.append(" (optional)");
        }
        if (node.isTruncated()) {
            label.append(" ...");
        }
        return label.toString();
    }
}
