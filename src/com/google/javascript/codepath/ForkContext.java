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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The frontier of one branch point: a stack of candidate segment sets, the top of which is the
 * head.
 *
 * <p>Every segment set has {@code 2^splitDepth} parallel segments. The split depth grows by one
 * for each enclosing finally block that is currently carrying leaving paths, which run in
 * parallel with the normal path through the finally body.
 */
final class ForkContext {

  /** Creates a segment from its predecessors. */
  private interface SegmentFactory {
    CodePathSegment create(String id, List<CodePathSegment> allPrevSegments);
  }

  private final IdGenerator idGenerator;
  private final @Nullable ForkContext upper;
  private final int splitDepth;
  private final List<ImmutableList<CodePathSegment>> segmentsList = new ArrayList<>();

  private ForkContext(IdGenerator idGenerator, @Nullable ForkContext upper, int splitDepth) {
    this.idGenerator = idGenerator;
    this.upper = upper;
    this.splitDepth = splitDepth;
  }

  /** Creates the fork context of a new code path, holding its initial segment. */
  static ForkContext newRoot(IdGenerator idGenerator) {
    ForkContext context = new ForkContext(idGenerator, null, 0);
    context.add(ImmutableList.of(CodePathSegment.newRoot(idGenerator.next())));
    return context;
  }

  /**
   * Creates an empty fork context nested in {@code parent}.
   *
   * @param forkLeavingPath whether the new context carries leaving paths in parallel, which
   *     doubles the number of segments per set.
   */
  static ForkContext newEmpty(ForkContext parent, boolean forkLeavingPath) {
    return new ForkContext(
        parent.idGenerator, parent, forkLeavingPath ? parent.splitDepth + 1 : parent.splitDepth);
  }

  static ForkContext newEmpty(ForkContext parent) {
    return newEmpty(parent, false);
  }

  @Nullable ForkContext getUpper() {
    return upper;
  }

  int getSplitDepth() {
    return splitDepth;
  }

  /** The number of parallel segments in each segment set. */
  int getCount() {
    return 1 << splitDepth;
  }

  List<ImmutableList<CodePathSegment>> getSegmentsList() {
    return segmentsList;
  }

  ImmutableList<CodePathSegment> getHead() {
    return segmentsList.isEmpty()
        ? ImmutableList.of()
        : segmentsList.get(segmentsList.size() - 1);
  }

  boolean isEmpty() {
    return segmentsList.isEmpty();
  }

  /** Whether any segment of the head is reachable. */
  boolean isReachable() {
    return CodePathSegment.anyReachable(getHead());
  }

  /**
   * Creates segments that merge the segment sets from {@code begin} to {@code end}, both
   * inclusive. Negative indexes count from the top, so {@code (-1, -1)} continues the head only
   * and {@code (0, -1)} merges every candidate.
   */
  ImmutableList<CodePathSegment> makeNext(int begin, int end) {
    return makeSegments(begin, end, CodePathSegment::newNext);
  }

  ImmutableList<CodePathSegment> makeUnreachable(int begin, int end) {
    return makeSegments(begin, end, CodePathSegment::newUnreachable);
  }

  ImmutableList<CodePathSegment> makeDisconnected(int begin, int end) {
    return makeSegments(begin, end, CodePathSegment::newDisconnected);
  }

  private ImmutableList<CodePathSegment> makeSegments(
      int begin, int end, SegmentFactory factory) {
    int normalizedBegin = begin >= 0 ? begin : segmentsList.size() + begin;
    int normalizedEnd = end >= 0 ? end : segmentsList.size() + end;
    checkState(
        normalizedBegin >= 0 && normalizedBegin <= normalizedEnd,
        "no segment sets in [%s, %s] of %s",
        begin,
        end,
        segmentsList.size());

    ImmutableList.Builder<CodePathSegment> segments = ImmutableList.builder();
    for (int i = 0; i < getCount(); i++) {
      List<CodePathSegment> allPrevSegments = new ArrayList<>();
      for (int j = normalizedBegin; j <= normalizedEnd; j++) {
        allPrevSegments.add(segmentsList.get(j).get(i));
      }
      segments.add(factory.create(idGenerator.next(), allPrevSegments));
    }
    return segments.build();
  }

  /** Pushes a new segment set; extra parallel segments are merged down to this split depth. */
  void add(List<CodePathSegment> segments) {
    checkArgument(
        segments.size() >= getCount(), "%s segments, expected %s", segments.size(), getCount());
    segmentsList.add(mergeExtraSegments(segments));
  }

  void replaceHead(List<CodePathSegment> segments) {
    checkArgument(
        segments.size() >= getCount(), "%s segments, expected %s", segments.size(), getCount());
    checkState(!segmentsList.isEmpty(), "no head to replace");
    segmentsList.set(segmentsList.size() - 1, mergeExtraSegments(segments));
  }

  /** Pushes every segment set of {@code context}, which must have the same split depth. */
  void addAll(ForkContext context) {
    checkNotNull(context);
    checkArgument(
        context.splitDepth == splitDepth,
        "split depth mismatch: %s vs %s",
        context.splitDepth,
        splitDepth);
    segmentsList.addAll(context.segmentsList);
  }

  void clear() {
    segmentsList.clear();
  }

  /**
   * Halves {@code segments} until it fits this split depth, joining segment {@code i} of the
   * first half with segment {@code i} of the second half.
   */
  private ImmutableList<CodePathSegment> mergeExtraSegments(List<CodePathSegment> segments) {
    ImmutableList<CodePathSegment> current = ImmutableList.copyOf(segments);
    while (current.size() > getCount()) {
      int half = current.size() / 2;
      ImmutableList.Builder<CodePathSegment> merged = ImmutableList.builder();
      for (int i = 0; i < half; i++) {
        merged.add(
            CodePathSegment.newNext(
                idGenerator.next(), ImmutableList.of(current.get(i), current.get(i + half))));
      }
      current = merged.build();
    }
    return current;
  }
}
