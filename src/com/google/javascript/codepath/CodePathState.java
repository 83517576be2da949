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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.codepath.base.Tri;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The state machine that grows the segment graph of one {@link CodePath}.
 *
 * <p>It owns the current fork context and one stack per kind of open construct. Each stack is a
 * linked list through the {@code upper} field of its entries. The driver calls the {@code push},
 * {@code make} and {@code pop} transitions as it enters and exits nodes; each transition only
 * looks at the tops of the stacks and replaces the head of the fork context.
 */
final class CodePathState {
  private static final Logger logger = Logger.getLogger(CodePathState.class.getName());

  /** The kinds of choice context. */
  enum ChoiceKind {
    AND,
    OR,
    COALESCE,
    /** An if statement or a conditional expression. */
    TEST,
    LOOP
  }

  /** Where the analysis currently is inside a try statement. */
  enum TryPosition {
    TRY,
    CATCH,
    FINALLY
  }

  enum LoopKind {
    WHILE,
    DO_WHILE,
    FOR,
    FOR_IN_OF
  }

  /** True, false and nullish branches of a condition or a short circuiting operator. */
  private static final class ChoiceContext {
    final @Nullable ChoiceContext upper;
    final ChoiceKind kind;
    // Whether this expression is itself the condition of the enclosing choice context.
    final boolean isForkingAsResult;
    final ForkContext trueForkContext;
    final ForkContext falseForkContext;
    final ForkContext qqForkContext;
    boolean processed = false;

    ChoiceContext(
        @Nullable ChoiceContext upper,
        ChoiceKind kind,
        boolean isForkingAsResult,
        ForkContext forkContext) {
      this.upper = upper;
      this.kind = kind;
      this.isForkingAsResult = isForkingAsResult;
      this.trueForkContext = ForkContext.newEmpty(forkContext);
      this.falseForkContext = ForkContext.newEmpty(forkContext);
      this.qqForkContext = ForkContext.newEmpty(forkContext);
    }
  }

  private static final class SwitchContext {
    final @Nullable SwitchContext upper;
    final boolean hasCase;
    @Nullable ImmutableList<CodePathSegment> defaultSegments = null;
    @Nullable ImmutableList<CodePathSegment> defaultBodySegments = null;
    // An empty default was seen and no non-empty case followed it yet.
    boolean foundDefault = false;
    boolean lastIsDefault = false;
    int countForks = 0;

    SwitchContext(@Nullable SwitchContext upper, boolean hasCase) {
      this.upper = upper;
      this.hasCase = hasCase;
    }
  }

  private static final class TryContext {
    final @Nullable TryContext upper;
    final boolean hasFinalizer;
    TryPosition position = TryPosition.TRY;
    // Only present with a finally block, which defers the returns.
    final @Nullable ForkContext returnedForkContext;
    ForkContext thrownForkContext;
    boolean lastOfTryIsReachable = false;
    boolean lastOfCatchIsReachable = false;

    TryContext(@Nullable TryContext upper, boolean hasFinalizer, ForkContext forkContext) {
      this.upper = upper;
      this.hasFinalizer = hasFinalizer;
      this.returnedForkContext = hasFinalizer ? ForkContext.newEmpty(forkContext) : null;
      this.thrownForkContext = ForkContext.newEmpty(forkContext);
    }
  }

  private static final class LoopContext {
    final @Nullable LoopContext upper;
    final LoopKind kind;
    final @Nullable String label;
    final ForkContext brokenForkContext;
    Tri test = Tri.UNKNOWN;
    @Nullable ImmutableList<CodePathSegment> continueDestSegments = null;

    // do-while
    @Nullable ImmutableList<CodePathSegment> entrySegments = null;
    @Nullable ForkContext continueForkContext = null;

    // for
    @Nullable ImmutableList<CodePathSegment> endOfInitSegments = null;
    @Nullable ImmutableList<CodePathSegment> testSegments = null;
    @Nullable ImmutableList<CodePathSegment> endOfTestSegments = null;
    @Nullable ImmutableList<CodePathSegment> updateSegments = null;
    @Nullable ImmutableList<CodePathSegment> endOfUpdateSegments = null;

    // for-in, for-of
    @Nullable ImmutableList<CodePathSegment> prevSegments = null;
    @Nullable ImmutableList<CodePathSegment> leftSegments = null;
    @Nullable ImmutableList<CodePathSegment> endOfLeftSegments = null;

    LoopContext(
        @Nullable LoopContext upper,
        LoopKind kind,
        @Nullable String label,
        ForkContext brokenForkContext) {
      this.upper = upper;
      this.kind = kind;
      this.label = label;
      this.brokenForkContext = brokenForkContext;
    }
  }

  private static final class BreakContext {
    final @Nullable BreakContext upper;
    final boolean breakable;
    final @Nullable String label;
    final ForkContext brokenForkContext;

    BreakContext(
        @Nullable BreakContext upper,
        boolean breakable,
        @Nullable String label,
        ForkContext forkContext) {
      this.upper = upper;
      this.breakable = breakable;
      this.label = label;
      this.brokenForkContext = ForkContext.newEmpty(forkContext);
    }
  }

  private static final class ChainContext {
    final @Nullable ChainContext upper;
    int countChoiceContexts = 0;

    ChainContext(@Nullable ChainContext upper) {
      this.upper = upper;
    }
  }

  private final IdGenerator idGenerator;
  private ForkContext forkContext;
  private @Nullable ChoiceContext choiceContext = null;
  private @Nullable SwitchContext switchContext = null;
  private @Nullable TryContext tryContext = null;
  private @Nullable LoopContext loopContext = null;
  private @Nullable BreakContext breakContext = null;
  private @Nullable ChainContext chainContext = null;

  private ImmutableList<CodePathSegment> currentSegments = ImmutableList.of();
  private final CodePathSegment initialSegment;
  private final List<CodePathSegment> finalSegments = new ArrayList<>();
  private final List<CodePathSegment> returnedSegments = new ArrayList<>();
  private final List<CodePathSegment> thrownSegments = new ArrayList<>();

  CodePathState(IdGenerator idGenerator) {
    this.idGenerator = idGenerator;
    this.forkContext = ForkContext.newRoot(idGenerator);
    this.initialSegment = forkContext.getHead().get(0);
  }

  CodePathSegment getInitialSegment() {
    return initialSegment;
  }

  List<CodePathSegment> getFinalSegments() {
    return Collections.unmodifiableList(finalSegments);
  }

  List<CodePathSegment> getReturnedSegments() {
    return Collections.unmodifiableList(returnedSegments);
  }

  List<CodePathSegment> getThrownSegments() {
    return Collections.unmodifiableList(thrownSegments);
  }

  ImmutableList<CodePathSegment> getCurrentSegments() {
    return currentSegments;
  }

  void setCurrentSegments(ImmutableList<CodePathSegment> currentSegments) {
    this.currentSegments = currentSegments;
  }

  ImmutableList<CodePathSegment> getHeadSegments() {
    return forkContext.getHead();
  }

  /** Whether the head of the current fork context is reachable. */
  boolean isReachable() {
    return forkContext.isReachable();
  }

  private ForkContext getParentForkContext() {
    return checkNotNull(forkContext.getUpper(), "the root fork context has no parent");
  }

  private void addReturned(List<CodePathSegment> segments) {
    addToReturnedOrThrown(returnedSegments, thrownSegments, segments);
  }

  private void addThrown(List<CodePathSegment> segments) {
    addToReturnedOrThrown(thrownSegments, returnedSegments, segments);
  }

  private void addToReturnedOrThrown(
      List<CodePathSegment> dest, List<CodePathSegment> others, List<CodePathSegment> segments) {
    for (CodePathSegment segment : segments) {
      dest.add(segment);
      if (!containsSegment(others, segment)) {
        finalSegments.add(segment);
      }
    }
  }

  private static boolean containsSegment(List<CodePathSegment> list, CodePathSegment segment) {
    for (CodePathSegment s : list) {
      if (s == segment) {
        return true;
      }
    }
    return false;
  }

  /** Continues the head with an unreachable segment, after a jump. */
  private void markHeadUnreachable() {
    forkContext.replaceHead(forkContext.makeUnreachable(-1, -1));
  }

  // --------------------------------------------------------------------------
  // Fork contexts

  /**
   * Pushes a new fork context nested in the current one.
   *
   * @param forkLeavingPath whether leaving paths run in parallel, see {@link #makeFinallyBlock}.
   */
  @CanIgnoreReturnValue
  ForkContext pushForkContext(boolean forkLeavingPath) {
    forkContext = ForkContext.newEmpty(forkContext, forkLeavingPath);
    return forkContext;
  }

  @CanIgnoreReturnValue
  ForkContext pushForkContext() {
    return pushForkContext(false);
  }

  /** Pops the current fork context and merges all of its candidates into the parent's head. */
  @CanIgnoreReturnValue
  ForkContext popForkContext() {
    ForkContext lastContext = forkContext;
    forkContext = getParentForkContext();
    forkContext.replaceHead(lastContext.makeNext(0, -1));
    return lastContext;
  }

  /** Adds a new alternative branch that continues from the parent's head. */
  void forkPath() {
    forkContext.add(getParentForkContext().makeNext(-1, -1));
  }

  /** Adds the parent's head itself as an alternative, for a branch that may be skipped. */
  void forkBypassPath() {
    forkContext.add(getParentForkContext().getHead());
  }

  // --------------------------------------------------------------------------
  // Conditions: &&, ||, ??, if, ?:, loop tests

  void pushChoiceContext(ChoiceKind kind, boolean isForkingAsResult) {
    choiceContext = new ChoiceContext(choiceContext, kind, isForkingAsResult, forkContext);
  }

  private ChoiceContext currentChoiceContext() {
    return checkNotNull(choiceContext, "no open choice context");
  }

  /** Pops the choice context and merges its branches, or hands them to its parent. */
  @CanIgnoreReturnValue
  ChoiceContext popChoiceContext() {
    ChoiceContext context = currentChoiceContext();
    choiceContext = context.upper;
    ImmutableList<CodePathSegment> headSegments = forkContext.getHead();

    switch (context.kind) {
      case AND:
      case OR:
      case COALESCE:
        // Reaching here without a processed child means the right operand just ended, so
        // it decides all three branches.
        if (!context.processed) {
          context.trueForkContext.add(headSegments);
          context.falseForkContext.add(headSegments);
          context.qqForkContext.add(headSegments);
        }

        if (context.isForkingAsResult) {
          ChoiceContext parentContext = currentChoiceContext();
          parentContext.trueForkContext.addAll(context.trueForkContext);
          parentContext.falseForkContext.addAll(context.falseForkContext);
          parentContext.qqForkContext.addAll(context.qqForkContext);
          parentContext.processed = true;
          return context;
        }
        break;

      case TEST:
        if (!context.processed) {
          // No alternate: the consequent's end joins the false branch.
          context.trueForkContext.clear();
          context.trueForkContext.add(headSegments);
        } else {
          context.falseForkContext.clear();
          context.falseForkContext.add(headSegments);
        }
        break;

      case LOOP:
        // Loops merge their own branches in popLoopContext.
        return context;
    }

    ForkContext prevForkContext = context.trueForkContext;
    prevForkContext.addAll(context.falseForkContext);
    forkContext.replaceHead(prevForkContext.makeNext(0, -1));
    return context;
  }

  /** Starts the right operand of a short circuiting operator. */
  void makeLogicalRight() {
    ChoiceContext context = currentChoiceContext();

    if (context.processed) {
      // The left operand was itself a logical expression that already forked.
      ForkContext prevForkContext;
      switch (context.kind) {
        case AND:
          prevForkContext = context.trueForkContext;
          break;
        case OR:
          prevForkContext = context.falseForkContext;
          break;
        case COALESCE:
          prevForkContext = context.qqForkContext;
          break;
        default:
          throw new IllegalStateException("not a logical choice context: " + context.kind);
      }
      forkContext.replaceHead(prevForkContext.makeNext(0, -1));
      prevForkContext.clear();
      context.processed = false;
    } else {
      switch (context.kind) {
        case AND:
          context.falseForkContext.add(forkContext.getHead());
          break;
        case OR:
          context.trueForkContext.add(forkContext.getHead());
          break;
        case COALESCE:
          context.trueForkContext.add(forkContext.getHead());
          context.falseForkContext.add(forkContext.getHead());
          break;
        default:
          throw new IllegalStateException("not a logical choice context: " + context.kind);
      }
      forkContext.replaceHead(forkContext.makeNext(-1, -1));
    }
  }

  /** Starts the consequent of an if statement or a conditional expression. */
  void makeIfConsequent() {
    ChoiceContext context = currentChoiceContext();

    // A processed context was filled in by a logical expression in the test.
    if (!context.processed) {
      context.trueForkContext.add(forkContext.getHead());
      context.falseForkContext.add(forkContext.getHead());
      context.qqForkContext.add(forkContext.getHead());
    }
    context.processed = false;

    forkContext.replaceHead(context.trueForkContext.makeNext(0, -1));
  }

  /** Starts the alternate; the end of the consequent becomes the whole true branch. */
  void makeIfAlternate() {
    ChoiceContext context = currentChoiceContext();

    context.trueForkContext.clear();
    context.trueForkContext.add(forkContext.getHead());
    context.processed = true;

    forkContext.replaceHead(context.falseForkContext.makeNext(0, -1));
  }

  // --------------------------------------------------------------------------
  // Optional chains

  void pushChainContext() {
    chainContext = new ChainContext(chainContext);
  }

  /** Ends an optional chain, closing every choice context its optional links opened. */
  void popChainContext() {
    ChainContext context = checkNotNull(chainContext, "no open chain context");
    chainContext = context.upper;
    for (int i = context.countChoiceContexts; i > 0; i--) {
      popChoiceContext();
    }
  }

  /** An optional link ({@code ?.}) may short circuit the rest of the chain. */
  void makeOptionalNode() {
    if (chainContext != null) {
      chainContext.countChoiceContexts++;
      pushChoiceContext(ChoiceKind.COALESCE, false);
    }
  }

  /** Starts the part of an optional link that only runs when the object is not nullish. */
  void makeOptionalRight() {
    if (chainContext != null) {
      makeLogicalRight();
    }
  }

  // --------------------------------------------------------------------------
  // switch

  void pushSwitchContext(boolean hasCase, @Nullable String label) {
    switchContext = new SwitchContext(switchContext, hasCase);
    pushBreakContext(true, label);
  }

  void popSwitchContext() {
    SwitchContext context = checkNotNull(switchContext, "no open switch context");
    switchContext = context.upper;

    ForkContext currentForkContext = forkContext;
    ForkContext brokenForkContext = popBreakContext().brokenForkContext;

    if (context.countForks == 0) {
      // No case bodies were forked, so only breaks need merging.
      if (!brokenForkContext.isEmpty()) {
        brokenForkContext.add(currentForkContext.makeNext(-1, -1));
        currentForkContext.replaceHead(brokenForkContext.makeNext(0, -1));
      }
      return;
    }

    ImmutableList<CodePathSegment> lastSegments = currentForkContext.getHead();

    // The path where every test failed.
    forkBypassPath();
    ImmutableList<CodePathSegment> lastCaseSegments = currentForkContext.getHead();

    brokenForkContext.add(lastSegments);

    if (!context.lastIsDefault) {
      if (context.defaultBodySegments != null) {
        // A default that is not last: when every test fails, control goes to its body
        // instead of following the textual order.
        CodePathSegment.removeConnection(
            checkNotNull(context.defaultSegments), context.defaultBodySegments);
        makeLooped(lastCaseSegments, context.defaultBodySegments);
      } else {
        brokenForkContext.add(lastCaseSegments);
      }
    }

    // Pops the fork contexts pushed for the case bodies.
    for (int i = 0; i < context.countForks; i++) {
      forkContext = getParentForkContext();
    }

    forkContext.replaceHead(brokenForkContext.makeNext(0, -1));
  }

  /**
   * Starts the body of a case or default clause.
   *
   * @param isEmpty whether the clause has no statements
   * @param isDefault whether the clause is the default clause
   */
  void makeSwitchCaseBody(boolean isEmpty, boolean isDefault) {
    SwitchContext context = checkNotNull(switchContext, "no open switch context");
    if (!context.hasCase) {
      return;
    }

    // Merges the fallthrough from the previous case with the path where this test matched.
    ForkContext parentForkContext = forkContext;
    ForkContext newForkContext = pushForkContext();
    newForkContext.add(parentForkContext.makeNext(0, -1));

    if (isDefault) {
      context.defaultSegments = parentForkContext.getHead();
      if (isEmpty) {
        context.foundDefault = true;
      } else {
        context.defaultBodySegments = newForkContext.getHead();
      }
    } else {
      if (!isEmpty && context.foundDefault) {
        context.foundDefault = false;
        context.defaultBodySegments = newForkContext.getHead();
      }
    }

    context.lastIsDefault = isDefault;
    context.countForks++;
  }

  // --------------------------------------------------------------------------
  // try, catch, finally

  void pushTryContext(boolean hasFinalizer) {
    tryContext = new TryContext(tryContext, hasFinalizer, forkContext);
  }

  void popTryContext() {
    TryContext context = checkNotNull(tryContext, "no open try context");
    tryContext = context.upper;

    if (context.position == TryPosition.CATCH) {
      // Merges the ends of the try block and the catch block.
      popForkContext();
      return;
    }

    // From here on the statement has a finally block.
    ForkContext returned = checkNotNull(context.returnedForkContext);
    ForkContext thrown = context.thrownForkContext;

    if (returned.isEmpty() && thrown.isEmpty()) {
      return;
    }

    // Splits the parallel segments of the finally block back into the normal and leaving paths.
    ImmutableList<CodePathSegment> headSegments = forkContext.getHead();
    forkContext = getParentForkContext();
    int half = headSegments.size() / 2;
    ImmutableList<CodePathSegment> normalSegments = headSegments.subList(0, half);
    ImmutableList<CodePathSegment> leavingSegments =
        headSegments.subList(half, headSegments.size());

    if (!returned.isEmpty()) {
      TryContext returnContext = getReturnContext();
      if (returnContext != null) {
        checkNotNull(returnContext.returnedForkContext).add(leavingSegments);
      } else {
        addReturned(leavingSegments);
      }
    }
    if (!thrown.isEmpty()) {
      TryContext throwContext = getThrowContext();
      if (throwContext != null) {
        throwContext.thrownForkContext.add(leavingSegments);
      } else {
        addThrown(leavingSegments);
      }
    }

    forkContext.replaceHead(normalSegments);

    // Only the leaving paths got through the finally block.
    if (!context.lastOfTryIsReachable && !context.lastOfCatchIsReachable) {
      markHeadUnreachable();
    }
  }

  void makeCatchBlock() {
    TryContext context = checkNotNull(tryContext, "no open try context");
    ForkContext thrown = context.thrownForkContext;

    context.position = TryPosition.CATCH;
    context.thrownForkContext = ForkContext.newEmpty(forkContext);
    context.lastOfTryIsReachable = forkContext.isReachable();

    // The catch block starts from every throw point collected in the try block.
    thrown.add(forkContext.getHead());
    ImmutableList<CodePathSegment> thrownSegments = thrown.makeNext(0, -1);

    // The end of the try block bypasses the catch block.
    pushForkContext();
    forkBypassPath();
    forkContext.add(thrownSegments);
  }

  /**
   * Starts the finally block. Every return and throw collected inside the try statement leaves
   * through the finally block, so it is analyzed once for the normal path and once, in parallel,
   * for a leaving path that joins all of them.
   */
  void makeFinallyBlock() {
    TryContext context = checkNotNull(tryContext, "no open try context");
    ForkContext currentForkContext = forkContext;
    ForkContext returned = checkNotNull(context.returnedForkContext);
    ForkContext thrown = context.thrownForkContext;
    ImmutableList<CodePathSegment> headOfLeavingSegments = currentForkContext.getHead();

    if (context.position == TryPosition.CATCH) {
      // Merges the ends of the try block and the catch block.
      popForkContext();
      currentForkContext = forkContext;
      context.lastOfCatchIsReachable = currentForkContext.isReachable();
    } else {
      context.lastOfTryIsReachable = currentForkContext.isReachable();
    }
    context.position = TryPosition.FINALLY;

    if (returned.isEmpty() && thrown.isEmpty()) {
      // Nothing leaves through this finally block.
      return;
    }

    ImmutableList<CodePathSegment> normalSegments = currentForkContext.makeNext(-1, -1);
    ImmutableList.Builder<CodePathSegment> segments = ImmutableList.builder();
    segments.addAll(normalSegments);
    for (int i = 0; i < currentForkContext.getCount(); i++) {
      List<CodePathSegment> prevSegsOfLeavingSegment = new ArrayList<>();
      prevSegsOfLeavingSegment.add(headOfLeavingSegments.get(i));
      for (ImmutableList<CodePathSegment> returnedSegments : returned.getSegmentsList()) {
        prevSegsOfLeavingSegment.add(returnedSegments.get(i));
      }
      for (ImmutableList<CodePathSegment> thrownSegments : thrown.getSegmentsList()) {
        prevSegsOfLeavingSegment.add(thrownSegments.get(i));
      }
      segments.add(CodePathSegment.newNext(idGenerator.next(), prevSegsOfLeavingSegment));
    }

    pushForkContext(true);
    forkContext.add(segments.build());
  }

  /**
   * Forks an implicit "may throw here" edge at the first node of a try block that can throw.
   * Later throw points of the same block share that edge.
   */
  void makeFirstThrowablePathInTryBlock() {
    if (!forkContext.isReachable()) {
      return;
    }

    TryContext context = getThrowContext();
    if (context == null
        || context.position != TryPosition.TRY
        || !context.thrownForkContext.isEmpty()) {
      return;
    }

    context.thrownForkContext.add(forkContext.getHead());
    forkContext.replaceHead(forkContext.makeNext(-1, -1));
  }

  /** The try statement whose finally block a return must run first, if any. */
  private @Nullable TryContext getReturnContext() {
    for (TryContext context = tryContext; context != null; context = context.upper) {
      if (context.hasFinalizer && context.position != TryPosition.FINALLY) {
        return context;
      }
    }
    return null;
  }

  /** The try statement that catches or defers a throw from here, if any. */
  private @Nullable TryContext getThrowContext() {
    for (TryContext context = tryContext; context != null; context = context.upper) {
      if (context.position == TryPosition.TRY
          || (context.hasFinalizer && context.position == TryPosition.CATCH)) {
        return context;
      }
    }
    return null;
  }

  // --------------------------------------------------------------------------
  // Loops

  void pushLoopContext(LoopKind kind, @Nullable String label) {
    ForkContext loopForkContext = forkContext;
    BreakContext breakContext = pushBreakContext(true, label);
    LoopContext context =
        new LoopContext(loopContext, kind, label, breakContext.brokenForkContext);

    switch (kind) {
      case WHILE:
      case FOR:
        pushChoiceContext(ChoiceKind.LOOP, false);
        break;
      case DO_WHILE:
        pushChoiceContext(ChoiceKind.LOOP, false);
        context.continueForkContext = ForkContext.newEmpty(loopForkContext);
        break;
      case FOR_IN_OF:
        break;
    }
    loopContext = context;
  }

  void popLoopContext() {
    LoopContext context = currentLoopContext();
    loopContext = context.upper;

    ForkContext currentForkContext = forkContext;
    ForkContext brokenForkContext = popBreakContext().brokenForkContext;

    switch (context.kind) {
      case WHILE:
      case FOR:
        popChoiceContext();
        makeLooped(currentForkContext.getHead(), checkNotNull(context.continueDestSegments));
        break;

      case DO_WHILE:
        {
          ChoiceContext choice = popChoiceContext();
          if (!choice.processed) {
            choice.trueForkContext.add(currentForkContext.getHead());
            choice.falseForkContext.add(currentForkContext.getHead());
          }
          if (context.test != Tri.TRUE) {
            brokenForkContext.addAll(choice.falseForkContext);
          }

          // Every path where the test held goes back to the top of the body.
          for (ImmutableList<CodePathSegment> segments :
              choice.trueForkContext.getSegmentsList()) {
            makeLooped(segments, checkNotNull(context.entrySegments));
          }
          break;
        }

      case FOR_IN_OF:
        // The loop also ends when the iterable is exhausted.
        brokenForkContext.add(currentForkContext.getHead());
        makeLooped(currentForkContext.getHead(), checkNotNull(context.leftSegments));
        break;
    }

    if (brokenForkContext.isEmpty()) {
      markHeadUnreachable();
    } else {
      currentForkContext.replaceHead(brokenForkContext.makeNext(0, -1));
    }
  }

  private LoopContext currentLoopContext() {
    return checkNotNull(loopContext, "no open loop context");
  }

  void makeWhileTest(Tri test) {
    LoopContext context = currentLoopContext();
    ImmutableList<CodePathSegment> testSegments = forkContext.makeNext(0, -1);

    context.test = test;
    context.continueDestSegments = testSegments;
    forkContext.replaceHead(testSegments);
  }

  void makeWhileBody() {
    LoopContext context = currentLoopContext();
    ChoiceContext choice = currentChoiceContext();

    if (!choice.processed) {
      choice.trueForkContext.add(forkContext.getHead());
      choice.falseForkContext.add(forkContext.getHead());
    }

    // A test that is always true never exits the loop.
    if (context.test != Tri.TRUE) {
      context.brokenForkContext.addAll(choice.falseForkContext);
    }
    forkContext.replaceHead(choice.trueForkContext.makeNext(0, -1));
  }

  void makeDoWhileBody() {
    LoopContext context = currentLoopContext();
    ImmutableList<CodePathSegment> bodySegments = forkContext.makeNext(-1, -1);

    context.entrySegments = bodySegments;
    forkContext.replaceHead(bodySegments);
  }

  void makeDoWhileTest(Tri test) {
    LoopContext context = currentLoopContext();
    ForkContext continueForkContext = checkNotNull(context.continueForkContext);

    context.test = test;

    // Continue statements jump to the test.
    if (!continueForkContext.isEmpty()) {
      continueForkContext.add(forkContext.getHead());
      forkContext.replaceHead(continueForkContext.makeNext(0, -1));
    }
  }

  void makeForTest(Tri test) {
    LoopContext context = currentLoopContext();
    ImmutableList<CodePathSegment> endOfInitSegments = forkContext.getHead();
    ImmutableList<CodePathSegment> testSegments = forkContext.makeNext(-1, -1);

    context.test = test;
    context.endOfInitSegments = endOfInitSegments;
    context.testSegments = testSegments;
    context.continueDestSegments = testSegments;
    forkContext.replaceHead(testSegments);
  }

  void makeForUpdate() {
    LoopContext context = currentLoopContext();

    if (context.testSegments != null) {
      finalizeTestSegmentsOfFor(context, currentChoiceContext(), forkContext.getHead());
    } else {
      context.endOfInitSegments = forkContext.getHead();
    }

    // The update runs after the body, which is not analyzed yet.
    ImmutableList<CodePathSegment> updateSegments = forkContext.makeDisconnected(-1, -1);

    context.updateSegments = updateSegments;
    context.continueDestSegments = updateSegments;
    forkContext.replaceHead(updateSegments);
  }

  void makeForBody() {
    LoopContext context = currentLoopContext();

    if (context.updateSegments != null) {
      context.endOfUpdateSegments = forkContext.getHead();

      // update -> test
      if (context.testSegments != null) {
        makeLooped(context.endOfUpdateSegments, context.testSegments);
      }
    } else if (context.testSegments != null) {
      finalizeTestSegmentsOfFor(context, currentChoiceContext(), forkContext.getHead());
    } else {
      context.endOfInitSegments = forkContext.getHead();
    }

    ImmutableList<CodePathSegment> bodySegments = context.endOfTestSegments;
    if (bodySegments == null) {
      // Without a test the body follows the init and the update.
      ForkContext prevForkContext = ForkContext.newEmpty(forkContext);
      prevForkContext.add(checkNotNull(context.endOfInitSegments));
      if (context.endOfUpdateSegments != null) {
        prevForkContext.add(context.endOfUpdateSegments);
      }
      bodySegments = prevForkContext.makeNext(0, -1);
    }

    if (context.updateSegments != null) {
      context.continueDestSegments = context.updateSegments;
    } else if (context.testSegments != null) {
      context.continueDestSegments = context.testSegments;
    } else {
      context.continueDestSegments = bodySegments;
    }
    forkContext.replaceHead(bodySegments);
  }

  private static void finalizeTestSegmentsOfFor(
      LoopContext context, ChoiceContext choice, ImmutableList<CodePathSegment> head) {
    if (!choice.processed) {
      choice.trueForkContext.add(head);
      choice.falseForkContext.add(head);
      choice.qqForkContext.add(head);
    }

    if (context.test != Tri.TRUE) {
      context.brokenForkContext.addAll(choice.falseForkContext);
    }
    context.endOfTestSegments = choice.trueForkContext.makeNext(0, -1);
  }

  /** Starts the left side of a for-in or for-of, which runs after the right side. */
  void makeForInOfLeft() {
    LoopContext context = currentLoopContext();
    ImmutableList<CodePathSegment> leftSegments = forkContext.makeDisconnected(-1, -1);

    context.prevSegments = forkContext.getHead();
    context.leftSegments = leftSegments;
    context.continueDestSegments = leftSegments;
    forkContext.replaceHead(leftSegments);
  }

  void makeForInOfRight() {
    LoopContext context = currentLoopContext();
    ForkContext temp = ForkContext.newEmpty(forkContext);

    temp.add(checkNotNull(context.prevSegments));
    ImmutableList<CodePathSegment> rightSegments = temp.makeNext(-1, -1);

    context.endOfLeftSegments = forkContext.getHead();
    forkContext.replaceHead(rightSegments);
  }

  void makeForInOfBody() {
    LoopContext context = currentLoopContext();
    ForkContext temp = ForkContext.newEmpty(forkContext);

    temp.add(checkNotNull(context.endOfLeftSegments));
    ImmutableList<CodePathSegment> bodySegments = temp.makeNext(-1, -1);

    // right -> left
    makeLooped(forkContext.getHead(), checkNotNull(context.leftSegments));

    // An empty iterable skips the body.
    context.brokenForkContext.add(forkContext.getHead());
    forkContext.replaceHead(bodySegments);
  }

  // --------------------------------------------------------------------------
  // Jumps

  @CanIgnoreReturnValue
  BreakContext pushBreakContext(boolean breakable, @Nullable String label) {
    breakContext = new BreakContext(breakContext, breakable, label, forkContext);
    return breakContext;
  }

  @CanIgnoreReturnValue
  BreakContext popBreakContext() {
    BreakContext context = checkNotNull(breakContext, "no open break context");
    breakContext = context.upper;

    // Labeled statements merge their breaks here; loops and switches do it themselves.
    if (!context.breakable) {
      ForkContext brokenForkContext = context.brokenForkContext;
      if (!brokenForkContext.isEmpty()) {
        brokenForkContext.add(forkContext.getHead());
        forkContext.replaceHead(brokenForkContext.makeNext(0, -1));
      }
    }
    return context;
  }

  void makeBreak(@Nullable String label) {
    if (!forkContext.isReachable()) {
      return;
    }

    BreakContext context = getBreakContext(label);
    if (context != null) {
      context.brokenForkContext.add(forkContext.getHead());
    }
    markHeadUnreachable();
  }

  void makeContinue(@Nullable String label) {
    if (!forkContext.isReachable()) {
      return;
    }

    LoopContext context = getContinueContext(label);
    if (context != null) {
      if (context.continueDestSegments != null) {
        makeLooped(forkContext.getHead(), context.continueDestSegments);

        // A for-in or for-of may also be done once it goes back to the left side.
        if (context.kind == LoopKind.FOR_IN_OF) {
          context.brokenForkContext.add(forkContext.getHead());
        }
      } else {
        checkNotNull(context.continueForkContext).add(forkContext.getHead());
      }
    }
    markHeadUnreachable();
  }

  void makeReturn() {
    if (forkContext.isReachable()) {
      TryContext context = getReturnContext();
      if (context != null) {
        checkNotNull(context.returnedForkContext).add(forkContext.getHead());
      } else {
        addReturned(forkContext.getHead());
      }
      markHeadUnreachable();
    }
  }

  void makeThrow() {
    if (forkContext.isReachable()) {
      TryContext context = getThrowContext();
      if (context != null) {
        context.thrownForkContext.add(forkContext.getHead());
      } else {
        addThrown(forkContext.getHead());
      }
      markHeadUnreachable();
    }
  }

  /** Records the natural end of the code path as an implicit return. */
  void makeFinal() {
    if (!currentSegments.isEmpty() && currentSegments.get(0).isReachable()) {
      addReturned(currentSegments);
    }
  }

  private @Nullable BreakContext getBreakContext(@Nullable String label) {
    for (BreakContext context = breakContext; context != null; context = context.upper) {
      if (label != null ? label.equals(context.label) : context.breakable) {
        return context;
      }
    }
    return null;
  }

  private @Nullable LoopContext getContinueContext(@Nullable String label) {
    if (label == null) {
      return loopContext;
    }
    for (LoopContext context = loopContext; context != null; context = context.upper) {
      if (label.equals(context.label)) {
        return context;
      }
    }
    return null;
  }

  /** Connects {@code fromSegments[i]} back to {@code toSegments[i]}, closing a loop. */
  private void makeLooped(
      List<CodePathSegment> unflattenedFromSegments, List<CodePathSegment> unflattenedToSegments) {
    ImmutableList<CodePathSegment> fromSegments =
        CodePathSegment.flattenUnusedSegments(unflattenedFromSegments);
    ImmutableList<CodePathSegment> toSegments =
        CodePathSegment.flattenUnusedSegments(unflattenedToSegments);

    int end = Math.min(fromSegments.size(), toSegments.size());
    for (int i = 0; i < end; i++) {
      CodePathSegment fromSegment = fromSegments.get(i);
      CodePathSegment toSegment = toSegments.get(i);
      CodePathSegment.addLoopedEdge(fromSegment, toSegment);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("looped " + fromSegment + " -> " + toSegment);
      }
    }
  }

  boolean hasOpenContexts() {
    return choiceContext != null
        || switchContext != null
        || tryContext != null
        || loopContext != null
        || breakContext != null
        || chainContext != null;
  }
}
