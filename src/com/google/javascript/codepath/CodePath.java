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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.javascript.rhino.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The control flow graph of one analyzable unit: the program, a function, a class static block
 * or a class field initializer.
 *
 * <pre>
 * CodePathAnalyzer analyzer = CodePathAnalyzer.builder().setRoot(script).analyze();
 * for (CodePath codePath : analyzer.getCodePaths()) {
 *   codePath.traverseSegments((segment, controller) -&gt; ...);
 * }
 * </pre>
 */
public final class CodePath {

  /** The kind of unit a code path was started for. */
  public enum Origin {
    PROGRAM,
    FUNCTION,
    CLASS_FIELD_INITIALIZER,
    CLASS_STATIC_BLOCK
  }

  /** Receives the segments of a traversal. */
  public interface SegmentVisitor {
    void visit(CodePathSegment segment, TraversalController controller);
  }

  /** Lets a {@link SegmentVisitor} prune or stop the traversal it is called from. */
  public static final class TraversalController {
    private final List<Frame> stack;
    private @Nullable CodePathSegment skippedSegment = null;
    private boolean broken = false;

    private TraversalController(List<Frame> stack) {
      this.stack = stack;
    }

    /** Does not visit the segments that only follow the current one. */
    public void skip() {
      if (stack.size() <= 1) {
        broken = true;
      } else {
        skippedSegment = stack.get(stack.size() - 2).segment;
      }
    }

    /** Stops the traversal. */
    public void breakTraversal() {
      broken = true;
    }
  }

  /** Bounds of a traversal. */
  public static final class TraversalOptions {
    private final @Nullable CodePathSegment first;
    private final @Nullable CodePathSegment last;

    private TraversalOptions(@Nullable CodePathSegment first, @Nullable CodePathSegment last) {
      this.first = first;
      this.last = last;
    }

    /** Starts at the initial segment and visits everything after it. */
    public static TraversalOptions all() {
      return new TraversalOptions(null, null);
    }

    /** Starts at {@code first}. */
    public static TraversalOptions from(CodePathSegment first) {
      return new TraversalOptions(checkNotNull(first), null);
    }

    /** Starts at {@code first} and does not go past {@code last}. */
    public static TraversalOptions between(CodePathSegment first, CodePathSegment last) {
      return new TraversalOptions(checkNotNull(first), checkNotNull(last));
    }
  }

  private static final class Frame {
    CodePathSegment segment;
    int index = 0;

    Frame(CodePathSegment segment) {
      this.segment = segment;
    }
  }

  private final String id;
  private final Origin origin;
  private final @Nullable CodePath upper;
  private final List<CodePath> childCodePaths = new ArrayList<>();
  private final CodePathState state;
  private final Node rootNode;

  CodePath(String id, Origin origin, @Nullable CodePath upper, Node rootNode) {
    this.id = id;
    this.origin = origin;
    this.upper = upper;
    this.rootNode = rootNode;
    this.state = new CodePathState(new IdGenerator(id + "_"));
    if (upper != null) {
      upper.childCodePaths.add(this);
    }
  }

  CodePathState getState() {
    return state;
  }

  /** The readable id, e.g. {@code s1}. */
  public String getId() {
    return id;
  }

  public Origin getOrigin() {
    return origin;
  }

  /** The code path this one was started in, or null for the program. */
  public @Nullable CodePath getUpper() {
    return upper;
  }

  public List<CodePath> getChildCodePaths() {
    return Collections.unmodifiableList(childCodePaths);
  }

  /** The node this code path was started for. */
  public Node getRootNode() {
    return rootNode;
  }

  public CodePathSegment getInitialSegment() {
    return state.getInitialSegment();
  }

  /** Segments where the code path ends, by returning, throwing or falling off the end. */
  public List<CodePathSegment> getFinalSegments() {
    return state.getFinalSegments();
  }

  public List<CodePathSegment> getReturnedSegments() {
    return state.getReturnedSegments();
  }

  public List<CodePathSegment> getThrownSegments() {
    return state.getThrownSegments();
  }

  /** The segments the analysis is at; empty once the code path is finished. */
  public ImmutableList<CodePathSegment> getCurrentSegments() {
    return state.getCurrentSegments();
  }

  /** The head of the current fork context. */
  public ImmutableList<CodePathSegment> getHeadSegments() {
    return state.getHeadSegments();
  }

  /**
   * Visits the reachable segments in a defined order: a segment is visited only after all of its
   * predecessors, except those that reach it through a loop edge.
   */
  public void traverseSegments(SegmentVisitor visitor) {
    traverseSegments(TraversalOptions.all(), visitor);
  }

  public void traverseSegments(TraversalOptions options, SegmentVisitor visitor) {
    traverse(options, visitor, /* allEdges= */ false);
  }

  /** Like {@link #traverseSegments}, following every edge including those to dead code. */
  public void traverseAllSegments(SegmentVisitor visitor) {
    traverseAllSegments(TraversalOptions.all(), visitor);
  }

  public void traverseAllSegments(TraversalOptions options, SegmentVisitor visitor) {
    traverse(options, visitor, /* allEdges= */ true);
  }

  /** Returns every segment in the order {@link #traverseAllSegments} visits them. */
  public ImmutableList<CodePathSegment> getAllSegments() {
    ImmutableList.Builder<CodePathSegment> segments = ImmutableList.builder();
    traverseAllSegments((segment, controller) -> segments.add(segment));
    return segments.build();
  }

  private void traverse(TraversalOptions options, SegmentVisitor visitor, boolean allEdges) {
    CodePathSegment startSegment =
        options.first != null ? options.first : state.getInitialSegment();
    CodePathSegment lastSegment = options.last;

    Set<CodePathSegment> visited = Sets.newIdentityHashSet();
    // The explicit stack keeps deep graphs off the Java call stack.
    List<Frame> stack = new ArrayList<>();
    stack.add(new Frame(startSegment));
    TraversalController controller = new TraversalController(stack);

    while (!stack.isEmpty()) {
      Frame item = stack.get(stack.size() - 1);
      CodePathSegment segment = item.segment;
      int index = item.index;

      if (index == 0) {
        if (visited.contains(segment)) {
          stack.remove(stack.size() - 1);
          continue;
        }

        // Waits until every predecessor is done.
        if (segment != startSegment && !allPrevSegmentsVisited(segment, visited)) {
          stack.remove(stack.size() - 1);
          continue;
        }

        if (controller.skippedSegment != null
            && segment.getPrevSegments().contains(controller.skippedSegment)) {
          controller.skippedSegment = null;
        }
        visited.add(segment);

        if (controller.skippedSegment == null) {
          visitor.visit(segment, controller);
          if (segment == lastSegment) {
            controller.skip();
          }
          if (controller.broken) {
            break;
          }
        }
      }

      List<CodePathSegment> nextSegments =
          allEdges ? segment.getAllNextSegments() : segment.getNextSegments();
      int end = nextSegments.size() - 1;
      if (index < end) {
        item.index++;
        stack.add(new Frame(nextSegments.get(index)));
      } else if (index == end) {
        item.segment = nextSegments.get(index);
        item.index = 0;
      } else {
        stack.remove(stack.size() - 1);
      }
    }
  }

  private static boolean allPrevSegmentsVisited(
      CodePathSegment segment, Set<CodePathSegment> visited) {
    for (CodePathSegment prev : segment.getPrevSegments()) {
      if (!visited.contains(prev) && !segment.isLoopedPrevSegment(prev)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return id + "(" + origin + ")";
  }
}
