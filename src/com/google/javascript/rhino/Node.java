/*
 *
 * ***** BEGIN LICENSE BLOCK *****
 * Version: MPL 1.1/GPL 2.0
 *
 * The contents of this file are subject to the Mozilla Public License Version
 * 1.1 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * http://www.mozilla.org/MPL/
 *
 * Software distributed under the License is distributed on an "AS IS" basis,
 * WITHOUT WARRANTY OF ANY KIND, either express or implied. See the License
 * for the specific language governing rights and limitations under the
 * License.
 *
 * The Original Code is Rhino code, released
 * May 6, 1999.
 *
 * The Initial Developer of the Original Code is
 * Netscape Communications Corporation.
 * Portions created by the Initial Developer are Copyright (C) 1997-1999
 * the Initial Developer. All Rights Reserved.
 *
 * Contributor(s):
 *   Roger Lawrence
 *   Mike McCabe
 *   Igor Bukanov
 *   Milen Nankov
 *
 * Alternatively, the contents of this file may be used under the terms of
 * the GNU General Public License Version 2 or later (the "GPL"), in which
 * case the provisions of the GPL are applicable instead of those above. If
 * you wish to allow use of your version of this file only under the terms of
 * the GPL and not to allow others to use your version of this file under the
 * MPL, indicate your decision by deleting the provisions above and replacing
 * them with the notice and other provisions required by the GPL. If you do
 * not delete the provisions above, a recipient may use your version of this
 * file under either the MPL or the GPL.
 *
 * ***** END LICENSE BLOCK ***** */

package com.google.javascript.rhino;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree handed to the code path analysis.
 *
 * <p>Children are kept as a doubly linked sibling list: {@code first.previous} is the last
 * child, and {@code last.next} is null. The role of a child ("condition", "body", ...) is given
 * by its position under the parent, see {@link IR} for the shape of every kind.
 */
public class Node {

  /** Boolean properties a node can carry. */
  public enum Prop {
    /** The first link of an optional chain segment, written {@code ?.}. */
    OPTIONAL_CHAIN_START,
    ARROW_FN,
    STATIC_MEMBER,
    /** A property written as {@code {a}}, standing for {@code {a: a}}. */
    IS_SHORTHAND_PROPERTY
  }

  private static final class StringNode extends Node {
    private final String str;

    StringNode(Token token, String str) {
      super(token);
      checkArgument(token.isStringToken(), "%s does not carry a string", token);
      this.str = str;
    }

    @Override
    public String getString() {
      return str;
    }
  }

  private static final class NumberNode extends Node {
    private final double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    public double getDouble() {
      return number;
    }
  }

  private Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private final Set<Prop> props = EnumSet.noneOf(Prop.class);

  private int lineno = -1;
  private int charno = -1;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node mid2, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(mid2);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public static Node newString(String str) {
    return new StringNode(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "no child at index %s", i);
      n = n.next;
      i--;
    }
    checkArgument(n != null, "no child at index %s", i);
    return n;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    checkArgument(child.next == null);
    checkArgument(child.previous == null);

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /**
   * Returns an {@link Iterable} over the children of this node.
   *
   * <p>Do not use it for recursive descent of the tree, {@link
   * com.google.javascript.codepath.NodeTraversal} does that without iterator overhead.
   */
  public final Iterable<Node> children() {
    if (first == null) {
      return Collections.emptySet();
    }
    Node start = first;
    return () -> new SiblingNodeIterator(start);
  }

  private static final class SiblingNodeIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingNodeIterator(Node start) {
      this.current = start;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node n = current;
      current = current.getNext();
      return n;
    }
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final @Nullable Node getGrandparent() {
    return parent == null ? null : parent.parent;
  }

  /** Is this Node the same as {@code node} or a descendant of {@code node}? */
  public final boolean isDescendantOf(Node node) {
    for (Node n = this; n != null; n = n.parent) {
      if (n == node) {
        return true;
      }
    }
    return false;
  }

  public final boolean isFirstChildOf(Node possibleParent) {
    return possibleParent == getParent() && getPrevious() == null;
  }

  public final boolean isSecondChildOf(Node possibleParent) {
    Node previousNode = getPrevious();
    return previousNode != null && previousNode.isFirstChildOf(possibleParent);
  }

  // ==========================================================================
  // Payloads and properties

  /** Returns the string payload; only nodes built with {@link #newString} carry one. */
  public String getString() {
    throw new UnsupportedOperationException(token + " does not have a string");
  }

  /** Returns the number payload; only NUMBER nodes carry one. */
  public double getDouble() {
    throw new UnsupportedOperationException(token + " is not a number node");
  }

  public final boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  public final Node putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
    return this;
  }

  public final void setIsOptionalChainStart(boolean isOptionalChainStart) {
    checkState(isOptChainGetProp() || isOptChainGetElem() || isOptChainCall(), this);
    putBooleanProp(Prop.OPTIONAL_CHAIN_START, isOptionalChainStart);
  }

  /** Whether this link of an optional chain is written with {@code ?.}. */
  public final boolean isOptionalChainStart() {
    return getBooleanProp(Prop.OPTIONAL_CHAIN_START);
  }

  public final boolean isArrowFunction() {
    return getBooleanProp(Prop.ARROW_FN);
  }

  public final boolean isStaticMember() {
    return getBooleanProp(Prop.STATIC_MEMBER);
  }

  /** Sets the isShorthandProperty annotation. */
  public final void setShorthandProperty(boolean shorthand) {
    putBooleanProp(Prop.IS_SHORTHAND_PROPERTY, shorthand);
  }

  public final boolean isShorthandProperty() {
    return getBooleanProp(Prop.IS_SHORTHAND_PROPERTY);
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (token.isStringToken()) {
      sb.append(' ').append(getString());
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(getDouble());
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    return sb.toString();
  }

  // ==========================================================================
  // Token predicates

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isBreak() {
    return token == Token.BREAK;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isClassMembers() {
    return token == Token.CLASS_MEMBERS;
  }

  public final boolean isComputedFieldDef() {
    return token == Token.COMPUTED_FIELD_DEF;
  }

  public final boolean isConst() {
    return token == Token.CONST;
  }

  public final boolean isContinue() {
    return token == Token.CONTINUE;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isDefaultValue() {
    return token == Token.DEFAULT_VALUE;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isLabel() {
    return token == Token.LABEL;
  }

  public final boolean isLabelName() {
    return token == Token.LABEL_NAME;
  }

  public final boolean isLet() {
    return token == Token.LET;
  }

  public final boolean isMemberFieldDef() {
    return token == Token.MEMBER_FIELD_DEF;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isObjectPattern() {
    return token == Token.OBJECT_PATTERN;
  }

  public final boolean isOptChainCall() {
    return token == Token.OPTCHAIN_CALL;
  }

  public final boolean isOptChainGetElem() {
    return token == Token.OPTCHAIN_GETELEM;
  }

  public final boolean isOptChainGetProp() {
    return token == Token.OPTCHAIN_GETPROP;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isString() {
    return token == Token.STRING;
  }

  public final boolean isStringKey() {
    return token == Token.STRING_KEY;
  }

  public final boolean isTry() {
    return token == Token.TRY;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }
}
