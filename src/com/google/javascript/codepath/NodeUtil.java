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

import static com.google.common.base.Preconditions.checkState;

import com.google.javascript.codepath.base.Tri;
import com.google.javascript.rhino.Node;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful tree predicates for the code path analysis. */
final class NodeUtil {

  // Utility class; do not instantiate.
  private NodeUtil() {}

  /**
   * Gets the boolean value of a literal, or {@code Tri.UNKNOWN} for anything else. Only these
   * simple constants make a loop test statically true.
   */
  static Tri getLiteralBooleanValue(Node n) {
    switch (n.getToken()) {
      case NULL:
      case FALSE:
        return Tri.FALSE;

      case TRUE:
      case REGEXP:
        return Tri.TRUE;

      case STRINGLIT:
        return Tri.forBoolean(n.getString().length() > 0);

      case NUMBER:
        {
          double value = n.getDouble();
          return Tri.forBoolean(value != 0 && !Double.isNaN(value));
        }

      default:
        return Tri.UNKNOWN;
    }
  }

  /** Gets the condition of an IF, a loop or a HOOK, or null if it has none. */
  static @Nullable Node getConditionExpression(Node n) {
    switch (n.getToken()) {
      case IF:
      case WHILE:
      case HOOK:
        return n.getFirstChild();
      case DO:
        return n.getLastChild();
      case FOR:
        {
          Node cond = n.getSecondChild();
          return cond.isEmpty() ? null : cond;
        }
      default:
        return null;
    }
  }

  /**
   * Whether {@code n} is the condition of its parent, or an operand of a logical expression, so
   * that its true and false outcomes flow into the parent's choice instead of merging.
   */
  static boolean isForkingByTrueOrFalse(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case HOOK:
      case IF:
      case WHILE:
      case DO:
      case FOR:
        return getConditionExpression(parent) == n;
      case AND:
      case OR:
      case COALESCE:
      case ASSIGN_AND:
      case ASSIGN_OR:
      case ASSIGN_COALESCE:
        return true;
      default:
        return false;
    }
  }

  static boolean isOptChainNode(@Nullable Node n) {
    return n != null && (n.isOptChainGetProp() || n.isOptChainGetElem() || n.isOptChainCall());
  }

  /** Whether {@code n} is the last link of an optional chain, e.g. {@code a?.b.c} as a whole. */
  static boolean isEndOfOptionalChain(Node n) {
    if (!isOptChainNode(n)) {
      return false;
    }
    Node parent = n.getParent();
    return !(isOptChainNode(parent) && n.isFirstChildOf(parent));
  }

  /**
   * Whether entering {@code n} starts the part of an optional link that is skipped when the
   * object is nullish: the property of {@code a?.b}, the key of {@code a?.[k]}, the first
   * argument of {@code a?.(x)}.
   */
  static boolean isOptionalChainRight(Node n) {
    Node parent = n.getParent();
    return isOptChainNode(parent) && parent.isOptionalChainStart() && n.isSecondChildOf(parent);
  }

  /** Whether the loop or switch {@code n} is a target of unlabeled breaks. */
  static boolean isBreakableStatement(Node n) {
    switch (n.getToken()) {
      case WHILE:
      case DO:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case SWITCH:
        return true;
      default:
        return false;
    }
  }

  /** Returns the label of a labeled statement, or null. */
  static @Nullable String getLabel(Node n) {
    Node parent = n.getParent();
    if (parent != null && parent.isLabel() && n.isSecondChildOf(parent)) {
      return parent.getFirstChild().getString();
    }
    return null;
  }

  /** Returns the label a break or continue jumps to, or null if it has none. */
  static @Nullable String getJumpLabel(Node n) {
    checkState(n.isBreak() || n.isContinue(), n);
    Node label = n.getFirstChild();
    return label != null ? label.getString() : null;
  }

  /** Is this node a static block of a class? */
  static boolean isClassStaticBlock(Node n) {
    Node parent = n.getParent();
    return n.isBlock() && parent != null && parent.isClassMembers();
  }

  /** Is this node the value of a class field, such as {@code b()} in {@code a = b();}? */
  static boolean isClassFieldInitializer(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    if (parent.isMemberFieldDef()) {
      return n.isFirstChildOf(parent);
    }
    return parent.isComputedFieldDef() && n.isSecondChildOf(parent);
  }

  /**
   * Whether a NAME or a property name reads or writes a binding at run time, and so may throw.
   * Declared names, parameters and pattern targets do not.
   */
  static boolean isIdentifierReference(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    if (n.isString()) {
      return parent.isGetProp() || parent.isOptChainGetProp();
    }
    if (!n.isName()) {
      return false;
    }
    switch (parent.getToken()) {
      case FUNCTION:
      case CLASS:
      case VAR:
      case LET:
      case CONST:
      case CATCH:
      case PARAM_LIST:
      case ARRAY_PATTERN:
      case ITER_REST:
        return false;
      case DEFAULT_VALUE:
        return !n.isFirstChildOf(parent);
      case STRING_KEY:
        // The key of {a} stands for a property name; the value of {a: b} is a reference.
        return !parent.isShorthandProperty();
      default:
        return true;
    }
  }

  /** Whether the driver should skip {@code n} and its subtree, as it only fills a slot. */
  static boolean isPlaceholder(Node n) {
    Node parent = n.getParent();
    if (parent == null) {
      return false;
    }
    if (n.isEmpty()) {
      switch (parent.getToken()) {
        case FOR:
        case CLASS:
        case CATCH:
          return true;
        default:
          return false;
      }
    }
    if (n.isBlock() && parent.isTry() && n.isSecondChildOf(parent)) {
      // The holder of an absent catch clause.
      return !n.hasChildren();
    }
    return n.isName() && n.getString().isEmpty() && parent.isFunction();
  }

  /** Whether {@code n} is the catch holder block of a try that has a catch clause. */
  static boolean isCatchHolder(Node n) {
    Node parent = n.getParent();
    return n.isBlock() && parent != null && parent.isTry() && n.isSecondChildOf(parent);
  }

  /** Whether {@code n} is the finally block of a try. */
  static boolean isFinallyBlock(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.isTry() && parent.getChildCount() == 3
        && parent.getLastChild() == n;
  }

  /** Whether {@code n} is the statement list of a case or default clause. */
  static boolean isSwitchCaseBody(Node n) {
    Node parent = n.getParent();
    return n.isBlock()
        && parent != null
        && (parent.isCase() || parent.isDefaultCase())
        && parent.getLastChild() == n;
  }
}
