/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.codepath;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.javascript.rhino.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes in the parse tree, and facilitates the
 * analysis of the tree as it is being traversed.
 *
 * <p>The walk keeps its own frame stack instead of recursing, so deeply nested trees do not
 * overflow the Java stack.
 */
public final class NodeTraversal {
  private final Callback callback;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** The number of ancestors of the current node that are being traversed. */
  private int depth = 0;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns true, the node will be visited by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder and its children will be visited by both {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} in preorder and by {@link #visit(NodeTraversal,
     * Node, Node)} in postorder.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit(NodeTraversal,
     * Node, Node)} and its children will neither be visited by {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} nor {@link #visit(NodeTraversal, Node, Node)}.
     *
     * <p>Siblings are always visited left-to-right. The tree must not be modified during the
     * traversal.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} returned true for it, the root included.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  private static final class Frame {
    final Node node;
    @Nullable Node nextChild;

    Frame(Node node) {
      this.node = node;
      this.nextChild = node.getFirstChild();
    }
  }

  private NodeTraversal(Callback cb) {
    this.callback = checkNotNull(cb);
  }

  /** Traverses a parse tree recursively. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverse(root);
  }

  private void traverse(Node root) {
    Deque<Frame> stack = new ArrayDeque<>();
    currentNode = root;
    if (!callback.shouldTraverse(this, root, root.getParent())) {
      currentNode = null;
      return;
    }
    stack.push(new Frame(root));
    depth = 1;

    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      Node child = top.nextChild;
      if (child != null) {
        top.nextChild = child.getNext();
        currentNode = child;
        if (callback.shouldTraverse(this, child, top.node)) {
          stack.push(new Frame(child));
          depth++;
        }
      } else {
        stack.pop();
        depth--;
        currentNode = top.node;
        callback.visit(this, top.node, top.node.getParent());
      }
    }
    currentNode = null;
  }

  /** Returns the node currently being traversed. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Returns the number of open nodes above the current node's children. */
  public int getDepth() {
    return depth;
  }
}
