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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.codepath.CodePathSegment.EnterOrExit;
import com.google.javascript.codepath.CodePathState.ChoiceKind;
import com.google.javascript.codepath.CodePathState.LoopKind;
import com.google.javascript.rhino.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Builds the {@link CodePath}s of a syntax tree in a single traversal.
 *
 * <p>Typical usage:
 *
 * <pre>
 * CodePathAnalyzer analyzer = CodePathAnalyzer.builder()
 *                                 .setRoot(script)
 *                                 .analyze();
 * CodePath codePath = analyzer.getInnermostCodePath(node);
 * </pre>
 *
 * <p>On entering a node the analyzer first lets the parent react to the role of the child
 * ({@link #preprocess}), for branches that begin in the middle of a construct such as the right
 * operand of {@code &&}. It then handles the node itself, moves the current segments to the head
 * of the fork context and records the node on them. Exiting mirrors this.
 *
 * <p>An analyzer is used for exactly one tree and is not thread safe.
 */
public final class CodePathAnalyzer implements NodeTraversal.Callback {
  private static final Logger logger = Logger.getLogger(CodePathAnalyzer.class.getName());

  /** Setting this environment variable turns graph dumping on by default. */
  static final String DEBUG_ENV_VARIABLE = "DEBUG_CODE_PATH";

  private final boolean dumpGraphs;
  private final IdGenerator idGenerator = new IdGenerator("s");
  private final List<CodePath> codePaths = new ArrayList<>();
  private final SetMultimap<Node, CodePathSegment> enterSegments = LinkedHashMultimap.create();
  private final SetMultimap<Node, CodePathSegment> exitSegments = LinkedHashMultimap.create();

  /** The code path being built, or null outside of any. */
  private @Nullable CodePath codePath = null;

  private CodePathAnalyzer(boolean dumpGraphs) {
    this.dumpGraphs = dumpGraphs;
  }

  /** Configures and runs an analysis. */
  public static final class Builder {
    private Node root;
    private boolean dumpGraphs = !Strings.isNullOrEmpty(System.getenv(DEBUG_ENV_VARIABLE));

    private Builder() {}

    /** Sets the tree to analyze, usually a SCRIPT. */
    @CanIgnoreReturnValue
    public Builder setRoot(Node root) {
      this.root = root;
      return this;
    }

    /** Whether to log the DOT graph of every finished code path. */
    @CanIgnoreReturnValue
    public Builder setDumpGraphs(boolean dumpGraphs) {
      this.dumpGraphs = dumpGraphs;
      return this;
    }

    public CodePathAnalyzer analyze() {
      checkNotNull(root, "Need to call setRoot()");
      checkArgument(root.isScript(), "Unexpected code path root %s", root);
      CodePathAnalyzer analyzer = new CodePathAnalyzer(dumpGraphs);
      NodeTraversal.traverse(root, analyzer);
      checkState(analyzer.codePath == null, "code path %s was not finished", analyzer.codePath);
      return analyzer;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  // --------------------------------------------------------------------------
  // Queries

  /** Every code path, in the order they were started. */
  public List<CodePath> getCodePaths() {
    return Collections.unmodifiableList(codePaths);
  }

  /**
   * Returns the code path whose root contains {@code node} and none of whose child code paths
   * do, or null if {@code node} is outside of the analyzed tree.
   */
  public @Nullable CodePath getInnermostCodePath(Node node) {
    CodePath found = null;
    for (CodePath candidate : codePaths) {
      if (candidate.getUpper() == null && node.isDescendantOf(candidate.getRootNode())) {
        found = candidate;
        break;
      }
    }
    while (found != null) {
      CodePath inner = null;
      for (CodePath child : found.getChildCodePaths()) {
        if (node.isDescendantOf(child.getRootNode())) {
          inner = child;
          break;
        }
      }
      if (inner == null) {
        return found;
      }
      found = inner;
    }
    return null;
  }

  /** Every segment that was current when {@code node} was entered. */
  public ImmutableList<CodePathSegment> getSegmentsThatIncludeNodeEnter(Node node) {
    return ImmutableList.copyOf(enterSegments.get(node));
  }

  /** Every segment that was current when {@code node} was exited. */
  public ImmutableList<CodePathSegment> getSegmentsThatIncludeNodeExit(Node node) {
    return ImmutableList.copyOf(exitSegments.get(node));
  }

  // --------------------------------------------------------------------------
  // Traversal

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    if (NodeUtil.isPlaceholder(n)) {
      return false;
    }
    if (parent != null && codePath != null) {
      preprocess(n, parent);
    }
    processCodePathToEnter(n);
    return true;
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    processCodePathToExit(n);
    postprocess(n);
  }

  private CodePathState state() {
    return checkNotNull(codePath, "no active code path").getState();
  }

  /** Handles the role of {@code node} inside {@code parent}, before entering it. */
  private void preprocess(Node node, Node parent) {
    CodePathState state = state();

    if (NodeUtil.isOptionalChainRight(node)) {
      state.makeOptionalRight();
      return;
    }

    switch (parent.getToken()) {
      case AND:
      case OR:
      case COALESCE:
      case ASSIGN_AND:
      case ASSIGN_OR:
      case ASSIGN_COALESCE:
        if (node.isSecondChildOf(parent)) {
          state.makeLogicalRight();
        }
        break;

      case IF:
      case HOOK:
        if (node.isSecondChildOf(parent)) {
          state.makeIfConsequent();
        } else if (!node.isFirstChildOf(parent)) {
          state.makeIfAlternate();
        }
        break;

      case CASE:
      case DEFAULT_CASE:
        if (NodeUtil.isSwitchCaseBody(node) && node.hasChildren()) {
          state.makeSwitchCaseBody(false, parent.isDefaultCase());
        }
        break;

      case TRY:
        if (NodeUtil.isCatchHolder(node)) {
          state.makeCatchBlock();
        } else if (NodeUtil.isFinallyBlock(node)) {
          state.makeFinallyBlock();
        }
        break;

      case WHILE:
        if (node.isFirstChildOf(parent)) {
          state.makeWhileTest(NodeUtil.getLiteralBooleanValue(node));
        } else {
          state.makeWhileBody();
        }
        break;

      case DO:
        if (node.isFirstChildOf(parent)) {
          state.makeDoWhileBody();
        } else {
          state.makeDoWhileTest(NodeUtil.getLiteralBooleanValue(node));
        }
        break;

      case FOR:
        if (node.isSecondChildOf(parent)) {
          state.makeForTest(NodeUtil.getLiteralBooleanValue(node));
        } else if (node == parent.getChildAtIndex(2)) {
          state.makeForUpdate();
        } else if (node == parent.getLastChild()) {
          state.makeForBody();
        }
        break;

      case FOR_IN:
      case FOR_OF:
        if (node.isFirstChildOf(parent)) {
          state.makeForInOfLeft();
        } else if (node.isSecondChildOf(parent)) {
          state.makeForInOfRight();
        } else {
          state.makeForInOfBody();
        }
        break;

      case DEFAULT_VALUE:
        // The default is only evaluated when the value is undefined.
        if (node.isSecondChildOf(parent)) {
          state.pushForkContext();
          state.forkBypassPath();
          state.forkPath();
        }
        break;

      default:
        break;
    }
  }

  private void processCodePathToEnter(Node node) {
    if (NodeUtil.isClassFieldInitializer(node)) {
      startCodePath(node, CodePath.Origin.CLASS_FIELD_INITIALIZER);
    }

    switch (node.getToken()) {
      case SCRIPT:
        startCodePath(node, CodePath.Origin.PROGRAM);
        break;

      case FUNCTION:
        startCodePath(node, CodePath.Origin.FUNCTION);
        break;

      case BLOCK:
        if (NodeUtil.isClassStaticBlock(node)) {
          startCodePath(node, CodePath.Origin.CLASS_STATIC_BLOCK);
        }
        break;

      case OPTCHAIN_GETPROP:
      case OPTCHAIN_GETELEM:
      case OPTCHAIN_CALL:
        if (NodeUtil.isEndOfOptionalChain(node)) {
          state().pushChainContext();
        }
        if (node.isOptionalChainStart()) {
          state().makeOptionalNode();
        }
        break;

      case AND:
      case ASSIGN_AND:
        state().pushChoiceContext(ChoiceKind.AND, NodeUtil.isForkingByTrueOrFalse(node));
        break;

      case OR:
      case ASSIGN_OR:
        state().pushChoiceContext(ChoiceKind.OR, NodeUtil.isForkingByTrueOrFalse(node));
        break;

      case COALESCE:
      case ASSIGN_COALESCE:
        state().pushChoiceContext(ChoiceKind.COALESCE, NodeUtil.isForkingByTrueOrFalse(node));
        break;

      case IF:
      case HOOK:
        state().pushChoiceContext(ChoiceKind.TEST, false);
        break;

      case SWITCH:
        state().pushSwitchContext(hasCaseClause(node), NodeUtil.getLabel(node));
        break;

      case TRY:
        state().pushTryContext(node.getChildCount() == 3);
        break;

      case CASE:
      case DEFAULT_CASE:
        // Every clause after the first is tested only when the previous test failed.
        if (!node.isSecondChildOf(node.getParent())) {
          state().forkPath();
        }
        break;

      case WHILE:
        state().pushLoopContext(LoopKind.WHILE, NodeUtil.getLabel(node));
        break;

      case DO:
        state().pushLoopContext(LoopKind.DO_WHILE, NodeUtil.getLabel(node));
        break;

      case FOR:
        state().pushLoopContext(LoopKind.FOR, NodeUtil.getLabel(node));
        break;

      case FOR_IN:
      case FOR_OF:
        state().pushLoopContext(LoopKind.FOR_IN_OF, NodeUtil.getLabel(node));
        break;

      case LABEL:
        if (!NodeUtil.isBreakableStatement(node.getLastChild())) {
          state().pushBreakContext(false, node.getFirstChild().getString());
        }
        break;

      default:
        break;
    }

    forwardCurrentToHead(node);
    recordNode(EnterOrExit.ENTER, node);
  }

  private void processCodePathToExit(Node node) {
    CodePathState state = state();
    boolean dontForward = false;

    switch (node.getToken()) {
      case AND:
      case OR:
      case COALESCE:
      case ASSIGN_AND:
      case ASSIGN_OR:
      case ASSIGN_COALESCE:
      case IF:
      case HOOK:
        state.popChoiceContext();
        break;

      case SWITCH:
        state.popSwitchContext();
        break;

      case CASE:
      case DEFAULT_CASE:
        // An empty clause falls through into the next one.
        if (!node.getLastChild().hasChildren()) {
          state.makeSwitchCaseBody(true, node.isDefaultCase());
        }
        if (state.isReachable()) {
          dontForward = true;
        }
        break;

      case TRY:
        state.popTryContext();
        break;

      case BREAK:
        forwardCurrentToHead(node);
        state.makeBreak(NodeUtil.getJumpLabel(node));
        dontForward = true;
        break;

      case CONTINUE:
        forwardCurrentToHead(node);
        state.makeContinue(NodeUtil.getJumpLabel(node));
        dontForward = true;
        break;

      case RETURN:
        forwardCurrentToHead(node);
        state.makeReturn();
        dontForward = true;
        break;

      case THROW:
        forwardCurrentToHead(node);
        state.makeThrow();
        dontForward = true;
        break;

      case NAME:
      case STRING:
        if (NodeUtil.isIdentifierReference(node)) {
          state.makeFirstThrowablePathInTryBlock();
          dontForward = true;
        }
        break;

      case CALL:
      case NEW:
      case GETPROP:
      case GETELEM:
      case YIELD:
        state.makeFirstThrowablePathInTryBlock();
        break;

      case OPTCHAIN_GETPROP:
      case OPTCHAIN_GETELEM:
      case OPTCHAIN_CALL:
        state.makeFirstThrowablePathInTryBlock();
        if (node.isOptChainCall() && node.isOptionalChainStart() && node.hasOneChild()) {
          // a?.() has no argument to start the non-nullish part.
          state.makeOptionalRight();
        }
        if (NodeUtil.isEndOfOptionalChain(node)) {
          state.popChainContext();
        }
        break;

      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case FOR_OF:
        state.popLoopContext();
        break;

      case DEFAULT_VALUE:
        state.popForkContext();
        break;

      case LABEL:
        if (!NodeUtil.isBreakableStatement(node.getLastChild())) {
          state.popBreakContext();
        }
        break;

      default:
        break;
    }

    if (!dontForward) {
      forwardCurrentToHead(node);
    }
    recordNode(EnterOrExit.EXIT, node);
  }

  /** Ends the code paths rooted at {@code node}. */
  private void postprocess(Node node) {
    switch (node.getToken()) {
      case SCRIPT:
      case FUNCTION:
        endCodePath(node);
        break;

      case BLOCK:
        if (NodeUtil.isClassStaticBlock(node)) {
          endCodePath(node);
        }
        break;

      default:
        break;
    }

    if (NodeUtil.isClassFieldInitializer(node)) {
      endCodePath(node);
    }
  }

  private static boolean hasCaseClause(Node switchNode) {
    for (Node child = switchNode.getSecondChild(); child != null; child = child.getNext()) {
      if (child.isCase()) {
        return true;
      }
    }
    return false;
  }

  // --------------------------------------------------------------------------
  // Code path and segment bookkeeping

  private void startCodePath(Node node, CodePath.Origin origin) {
    if (codePath != null) {
      // Catches up the enclosing code path to the start of the nested one.
      forwardCurrentToHead(node);
      recordNode(EnterOrExit.ENTER, node);
    }

    codePath = new CodePath(idGenerator.next(), origin, codePath, node);
    codePaths.add(codePath);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(codePath.getId() + ") start " + origin + " at " + node);
    }
  }

  private void endCodePath(Node node) {
    CodePath finished = checkNotNull(codePath, "no active code path");
    CodePathState state = finished.getState();
    checkState(!state.hasOpenContexts(), "unbalanced contexts in %s at %s", finished, node);

    state.makeFinal();
    leaveFromCurrentSegment(node);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(finished.getId() + ") end at " + node);
    }
    if (dumpGraphs) {
      logger.info(DotFormatter.toDot(finished));
    }

    codePath = finished.getUpper();
    if (codePath != null) {
      recordNode(EnterOrExit.EXIT, node);
    }
  }

  /**
   * Moves the current segments to the head of the fork context. Every segment that becomes
   * current is marked used, which publishes its edges.
   */
  private void forwardCurrentToHead(Node node) {
    CodePathState state = state();
    ImmutableList<CodePathSegment> currentSegments = state.getCurrentSegments();
    ImmutableList<CodePathSegment> headSegments = state.getHeadSegments();
    int end = Math.max(currentSegments.size(), headSegments.size());

    for (int i = 0; i < end; i++) {
      CodePathSegment currentSegment = i < currentSegments.size() ? currentSegments.get(i) : null;
      CodePathSegment headSegment = i < headSegments.size() ? headSegments.get(i) : null;
      if (currentSegment != headSegment && currentSegment != null) {
        logSegment("end", currentSegment, node);
      }
    }

    state.setCurrentSegments(headSegments);

    for (int i = 0; i < end; i++) {
      CodePathSegment currentSegment = i < currentSegments.size() ? currentSegments.get(i) : null;
      CodePathSegment headSegment = i < headSegments.size() ? headSegments.get(i) : null;
      if (currentSegment != headSegment && headSegment != null) {
        CodePathSegment.markUsed(headSegment);
        logSegment("start", headSegment, node);
      }
    }
  }

  private void leaveFromCurrentSegment(Node node) {
    CodePathState state = state();
    for (CodePathSegment segment : state.getCurrentSegments()) {
      logSegment("end", segment, node);
    }
    state.setCurrentSegments(ImmutableList.of());
  }

  private void recordNode(EnterOrExit kind, Node node) {
    SetMultimap<Node, CodePathSegment> index =
        kind == EnterOrExit.ENTER ? enterSegments : exitSegments;
    for (CodePathSegment segment : state().getCurrentSegments()) {
      segment.recordNode(kind, node);
      index.put(node, segment);
    }
  }

  private static void logSegment(String event, CodePathSegment segment, Node node) {
    if (segment.isReachable() && logger.isLoggable(Level.FINE)) {
      logger.fine(segment.getId() + ") segment " + event + " at " + node);
    }
  }
}
