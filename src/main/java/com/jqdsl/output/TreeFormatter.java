package com.jqdsl.output;

import com.jqdsl.tree.Branch;
import com.jqdsl.tree.Scalars;
import com.jqdsl.tree.Tree;

import java.util.regex.Pattern;

/**
 * Renders trees as indented text: branches as {@code [name value]} followed by their children, leaves
 * as {@code name: value}. Sibling branches are separated by a single blank line.
 */
public class TreeFormatter {
    private static final Pattern BLANK_RUNS = Pattern.compile("\n{3,}");

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    private final int indentWidth;

    public TreeFormatter() {
        this(2);
    }

    public TreeFormatter(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    public String format(Tree node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        formatNode(node, 0, sb);

        return collapse(sb);
    }

    public String format(Iterable<? extends Tree> nodes) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (Tree node : nodes) {
            formatNode(node, 0, sb);
        }

        return collapse(sb);
    }

    private void formatNode(Tree node, int indent, StringBuilder sb) {
        String indentStr = " ".repeat(indent);
        String value = renderValue(node);

        if (node instanceof Branch) {
            sb.append("\n").append(indentStr).append("[").append(join(node.name(), " ", value)).append("]\n");
            for (Tree child : node.children()) {
                formatNode(child, indent + indentWidth, sb);
            }
            sb.append("\n");
        } else {
            String label = node.name() != null ? node.name() + ":" : null;
            sb.append(indentStr).append(join(label, " ", value)).append("\n");
        }
    }

    private static String renderValue(Tree node) {
        return node.value().collect(Scalars::render).makeString(" ");
    }

    private static String join(String left, String separator, String right) {
        if (left == null || left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + separator + right;
    }

    private static String collapse(StringBuilder sb) {
        return BLANK_RUNS.matcher(sb).replaceAll("\n\n");
    }
}
