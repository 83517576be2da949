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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import com.google.javascript.rhino.Node;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A maximal straight-line piece of a {@link CodePath}.
 *
 * <p>A segment keeps two views of its edges. {@link #getNextSegments()} and {@link
 * #getPrevSegments()} only connect reachable segments to each other, and they always mirror one
 * another. {@link #getAllNextSegments()} and {@link #getAllPrevSegments()} also include edges
 * from or to unreachable segments and are likewise kept symmetric once a segment is used.
 *
 * <p>Reachability is decided once, when the segment is created.
 */
public final class CodePathSegment {

  /** Whether a node was entered or exited while a segment was current. */
  public enum EnterOrExit {
    ENTER,
    EXIT
  }

  /** A node visit recorded on the segment(s) current at that moment. */
  public static final class NodeEvent {
    private final EnterOrExit kind;
    private final Node node;

    NodeEvent(EnterOrExit kind, Node node) {
      this.kind = kind;
      this.node = node;
    }

    public EnterOrExit getKind() {
      return kind;
    }

    public Node getNode() {
      return node;
    }

    @Override
    public String toString() {
      return node.getToken() + (kind == EnterOrExit.ENTER ? ":enter" : ":exit");
    }
  }

  private final String id;
  private final boolean reachable;
  private boolean used = false;

  private final List<CodePathSegment> nextSegments = new ArrayList<>();
  private final List<CodePathSegment> prevSegments;
  private final List<CodePathSegment> allNextSegments = new ArrayList<>();
  private final List<CodePathSegment> allPrevSegments;
  private final Set<CodePathSegment> loopedPrevSegments = Sets.newIdentityHashSet();
  private final List<NodeEvent> nodes = new ArrayList<>();

  private CodePathSegment(String id, List<CodePathSegment> allPrevSegments, boolean reachable) {
    this.id = id;
    this.reachable = reachable;
    this.allPrevSegments = new ArrayList<>(allPrevSegments);
    this.prevSegments = new ArrayList<>();
    if (reachable) {
      for (CodePathSegment prev : allPrevSegments) {
        if (prev.reachable) {
          prevSegments.add(prev);
        }
      }
    }
  }

  /** Creates the first segment of a code path. */
  static CodePathSegment newRoot(String id) {
    return new CodePathSegment(id, ImmutableList.of(), true);
  }

  /** Creates a segment that follows {@code allPrevSegments}; it is reachable if any of them is. */
  static CodePathSegment newNext(String id, List<CodePathSegment> allPrevSegments) {
    return new CodePathSegment(
        id, flattenUnusedSegments(allPrevSegments), anyReachable(allPrevSegments));
  }

  /** Creates an unreachable segment that follows {@code allPrevSegments}. */
  static CodePathSegment newUnreachable(String id, List<CodePathSegment> allPrevSegments) {
    CodePathSegment segment =
        new CodePathSegment(id, flattenUnusedSegments(allPrevSegments), false);
    // Nothing forwards to an unreachable head, so it would never be marked otherwise.
    markUsed(segment);
    return segment;
  }

  /**
   * Creates a segment with no incoming edges that inherits the reachability of {@code
   * allPrevSegments}. Its predecessors are connected later, as loop edges.
   */
  static CodePathSegment newDisconnected(String id, List<CodePathSegment> allPrevSegments) {
    return new CodePathSegment(id, ImmutableList.of(), anyReachable(allPrevSegments));
  }

  /** Publishes the edges of {@code segment} to its predecessors, once. */
  static void markUsed(CodePathSegment segment) {
    if (segment.used) {
      return;
    }
    segment.used = true;
    for (CodePathSegment prev : segment.allPrevSegments) {
      prev.allNextSegments.add(segment);
      if (segment.reachable && prev.reachable) {
        prev.nextSegments.add(segment);
      }
    }
  }

  static void markPrevSegmentAsLooped(CodePathSegment segment, CodePathSegment prevSegment) {
    segment.loopedPrevSegments.add(prevSegment);
  }

  /** Adds a loop edge from {@code from} back to the already existing segment {@code to}. */
  static void addLoopedEdge(CodePathSegment from, CodePathSegment to) {
    if (from.reachable && to.reachable) {
      from.nextSegments.add(to);
      to.prevSegments.add(from);
    }
    from.allNextSegments.add(to);
    to.allPrevSegments.add(from);
    if (to.allPrevSegments.size() >= 2) {
      markPrevSegmentAsLooped(to, from);
    }
  }

  /** Removes the edges between the pairs {@code prevSegments[i]} and {@code nextSegments[i]}. */
  static void removeConnection(
      List<CodePathSegment> prevSegments, List<CodePathSegment> nextSegments) {
    checkArgument(prevSegments.size() == nextSegments.size());
    for (int i = 0; i < prevSegments.size(); i++) {
      CodePathSegment prev = prevSegments.get(i);
      CodePathSegment next = nextSegments.get(i);
      removeFirst(prev.nextSegments, next);
      removeFirst(prev.allNextSegments, next);
      removeFirst(next.prevSegments, prev);
      removeFirst(next.allPrevSegments, prev);
    }
  }

  private static void removeFirst(List<CodePathSegment> segments, CodePathSegment segment) {
    for (int i = 0; i < segments.size(); i++) {
      if (segments.get(i) == segment) {
        segments.remove(i);
        return;
      }
    }
  }

  /**
   * Replaces every unused segment of {@code segments} with its own predecessors, dropping
   * duplicates.
   */
  static ImmutableList<CodePathSegment> flattenUnusedSegments(List<CodePathSegment> segments) {
    Set<CodePathSegment> done = Sets.newIdentityHashSet();
    ImmutableList.Builder<CodePathSegment> result = ImmutableList.builder();
    for (CodePathSegment segment : segments) {
      if (done.contains(segment)) {
        continue;
      }
      if (!segment.used) {
        for (CodePathSegment prev : segment.allPrevSegments) {
          if (done.add(prev)) {
            result.add(prev);
          }
        }
      } else {
        done.add(segment);
        result.add(segment);
      }
    }
    return result.build();
  }

  static boolean anyReachable(List<CodePathSegment> segments) {
    for (CodePathSegment segment : segments) {
      if (segment.reachable) {
        return true;
      }
    }
    return false;
  }

  void recordNode(EnterOrExit kind, Node node) {
    checkState(used, "segment %s is not current", id);
    nodes.add(new NodeEvent(kind, node));
  }

  /** The readable id, e.g. {@code s1_3}. */
  public String getId() {
    return id;
  }

  public boolean isReachable() {
    return reachable;
  }

  boolean isUsed() {
    return used;
  }

  /** Successors, restricted to reachable edges. */
  public List<CodePathSegment> getNextSegments() {
    return Collections.unmodifiableList(nextSegments);
  }

  /** Predecessors, restricted to reachable edges. */
  public List<CodePathSegment> getPrevSegments() {
    return Collections.unmodifiableList(prevSegments);
  }

  public List<CodePathSegment> getAllNextSegments() {
    return Collections.unmodifiableList(allNextSegments);
  }

  public List<CodePathSegment> getAllPrevSegments() {
    return Collections.unmodifiableList(allPrevSegments);
  }

  /** Whether the edge from {@code segment} to this one closes a loop. */
  public boolean isLoopedPrevSegment(CodePathSegment segment) {
    return loopedPrevSegments.contains(segment);
  }

  /** The nodes entered and exited while this segment was current, in visiting order. */
  public List<NodeEvent> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  @Override
  public String toString() {
    return id;
  }
}
