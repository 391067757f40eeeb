package io.github.eutro.nativedec.core.likec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The C-like syntax tree generated for the whole program.
 */
public final class Tree {
    private final TreeNode root;

    public Tree(TreeNode root) {
        this.root = root;
    }

    public static Tree empty() {
        return new Tree(TreeNode.of("program"));
    }

    public TreeNode getRoot() {
        return root;
    }

    /**
     * Collect every node of the tree, in pre-order.
     *
     * @return The nodes.
     */
    public List<TreeNode> nodes() {
        List<TreeNode> nodes = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            nodes.add(node);
            List<TreeNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return nodes;
    }
}
