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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ForkContext}. */
@RunWith(JUnit4.class)
public final class ForkContextTest {

  private ForkContext root;
  private CodePathSegment initial;

  @Before
  public void setUp() {
    root = ForkContext.newRoot(new IdGenerator("s"));
    initial = root.getHead().get(0);
    CodePathSegment.markUsed(initial);
  }

  @Test
  public void testRoot() {
    assertThat(root.getSplitDepth()).isEqualTo(0);
    assertThat(root.getCount()).isEqualTo(1);
    assertThat(root.getUpper()).isNull();
    assertThat(initial.getId()).isEqualTo("s1");
    assertThat(root.isReachable()).isTrue();
  }

  @Test
  public void testMakeNextFromHead() {
    ImmutableList<CodePathSegment> next = root.makeNext(-1, -1);
    assertThat(next).hasSize(1);
    assertThat(next.get(0).getId()).isEqualTo("s2");
    assertThat(next.get(0).getAllPrevSegments()).containsExactly(initial);
  }

  @Test
  public void testMakeNextMergesEveryCandidate() {
    ForkContext choice = ForkContext.newEmpty(root);
    CodePathSegment a = use(root.makeNext(-1, -1));
    CodePathSegment b = use(root.makeNext(-1, -1));
    choice.add(ImmutableList.of(a));
    choice.add(ImmutableList.of(b));

    ImmutableList<CodePathSegment> merged = choice.makeNext(0, -1);
    assertThat(merged.get(0).getAllPrevSegments()).containsExactly(a, b).inOrder();
    assertThat(choice.makeNext(-1, -1).get(0).getAllPrevSegments()).containsExactly(b);
  }

  @Test
  public void testMakeUnreachable() {
    ImmutableList<CodePathSegment> dead = root.makeUnreachable(-1, -1);
    root.replaceHead(dead);
    assertThat(root.isReachable()).isFalse();
    assertThat(root.getSegmentsList()).hasSize(1);
  }

  @Test
  public void testMakeDisconnected() {
    CodePathSegment disconnected = root.makeDisconnected(-1, -1).get(0);
    assertThat(disconnected.isReachable()).isTrue();
    assertThat(disconnected.getAllPrevSegments()).isEmpty();
  }

  @Test
  public void testEmptyContext() {
    ForkContext empty = ForkContext.newEmpty(root);
    assertThat(empty.isEmpty()).isTrue();
    assertThat(empty.getHead()).isEmpty();
    assertThat(empty.isReachable()).isFalse();
    assertThat(empty.getUpper()).isSameInstanceAs(root);
    assertThrows(IllegalStateException.class, () -> empty.makeNext(-1, -1));
    assertThrows(IllegalStateException.class, () -> empty.replaceHead(root.getHead()));
  }

  @Test
  public void testForkingLeavingPathDoublesCount() {
    ForkContext finallyContext = ForkContext.newEmpty(root, true);
    assertThat(finallyContext.getSplitDepth()).isEqualTo(1);
    assertThat(finallyContext.getCount()).isEqualTo(2);

    CodePathSegment normal = use(root.makeNext(-1, -1));
    CodePathSegment leaving = use(root.makeNext(-1, -1));
    finallyContext.add(ImmutableList.of(normal, leaving));

    ImmutableList<CodePathSegment> next = finallyContext.makeNext(-1, -1);
    assertThat(next).hasSize(2);
    assertThat(next.get(0).getAllPrevSegments()).containsExactly(normal);
    assertThat(next.get(1).getAllPrevSegments()).containsExactly(leaving);

    assertThrows(
        IllegalArgumentException.class, () -> finallyContext.add(ImmutableList.of(normal)));
  }

  @Test
  public void testAddMergesExtraSegments() {
    CodePathSegment normal = use(root.makeNext(-1, -1));
    CodePathSegment leaving = use(root.makeNext(-1, -1));
    ForkContext narrow = ForkContext.newEmpty(root);

    narrow.add(ImmutableList.of(normal, leaving));
    ImmutableList<CodePathSegment> head = narrow.getHead();
    assertThat(head).hasSize(1);
    assertThat(head.get(0).getAllPrevSegments()).containsExactly(normal, leaving).inOrder();
  }

  @Test
  public void testAddAllRequiresSameSplitDepth() {
    ForkContext target = ForkContext.newEmpty(root);
    ForkContext source = ForkContext.newEmpty(root);
    source.add(root.getHead());
    source.add(root.getHead());
    target.addAll(source);
    assertThat(target.getSegmentsList()).hasSize(2);

    ForkContext deeper = ForkContext.newEmpty(root, true);
    assertThrows(IllegalArgumentException.class, () -> target.addAll(deeper));

    target.clear();
    assertThat(target.isEmpty()).isTrue();
  }

  private static CodePathSegment use(ImmutableList<CodePathSegment> segments) {
    CodePathSegment segment = segments.get(0);
    CodePathSegment.markUsed(segment);
    return segment;
  }
}
