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

import com.google.javascript.codepath.base.Tri;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link NodeUtil}. */
@RunWith(JUnit4.class)
public final class NodeUtilTest {

  @Test
  public void testGetLiteralBooleanValue() {
    assertThat(NodeUtil.getLiteralBooleanValue(IR.trueNode())).isEqualTo(Tri.TRUE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.falseNode())).isEqualTo(Tri.FALSE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.nullNode())).isEqualTo(Tri.FALSE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.number(1))).isEqualTo(Tri.TRUE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.number(0))).isEqualTo(Tri.FALSE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.number(Double.NaN))).isEqualTo(Tri.FALSE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.str("x"))).isEqualTo(Tri.TRUE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.str(""))).isEqualTo(Tri.FALSE);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.regexp("a+"))).isEqualTo(Tri.TRUE);

    // Only literals are folded.
    assertThat(NodeUtil.getLiteralBooleanValue(IR.name("x"))).isEqualTo(Tri.UNKNOWN);
    assertThat(NodeUtil.getLiteralBooleanValue(IR.not(IR.falseNode()))).isEqualTo(Tri.UNKNOWN);
  }

  @Test
  public void testGetConditionExpression() {
    Node cond = IR.name("c");
    assertThat(NodeUtil.getConditionExpression(IR.whileNode(cond, IR.block())))
        .isSameInstanceAs(cond);
    Node doCond = IR.name("d");
    assertThat(NodeUtil.getConditionExpression(IR.doNode(IR.block(), doCond)))
        .isSameInstanceAs(doCond);
    Node forNode = IR.forNode(IR.empty(), IR.empty(), IR.empty(), IR.block());
    assertThat(NodeUtil.getConditionExpression(forNode)).isNull();
    assertThat(NodeUtil.getConditionExpression(IR.block())).isNull();
  }

  @Test
  public void testIsForkingByTrueOrFalse() {
    Node cond = IR.name("a");
    IR.ifNode(cond, IR.block());
    assertThat(NodeUtil.isForkingByTrueOrFalse(cond)).isTrue();

    Node operand = IR.name("b");
    IR.and(operand, IR.name("c"));
    assertThat(NodeUtil.isForkingByTrueOrFalse(operand)).isTrue();

    Node and = IR.and(IR.name("a"), IR.name("b"));
    IR.exprResult(IR.assign(IR.name("x"), and));
    assertThat(NodeUtil.isForkingByTrueOrFalse(and)).isFalse();

    Node body = IR.block();
    IR.whileNode(IR.name("a"), body);
    assertThat(NodeUtil.isForkingByTrueOrFalse(body)).isFalse();
    assertThat(NodeUtil.isForkingByTrueOrFalse(IR.name("detached"))).isFalse();
  }

  @Test
  public void testOptionalChain() {
    // a?.b.c
    Node a = IR.name("a");
    Node inner = IR.optChainGetprop(a, "b", true);
    Node outer = IR.optChainGetprop(inner, "c", false);
    assertThat(NodeUtil.isEndOfOptionalChain(outer)).isTrue();
    assertThat(NodeUtil.isEndOfOptionalChain(inner)).isFalse();
    assertThat(NodeUtil.isOptionalChainRight(inner.getSecondChild())).isTrue();
    assertThat(NodeUtil.isOptionalChainRight(outer.getSecondChild())).isFalse();
    assertThat(NodeUtil.isOptionalChainRight(a)).isFalse();

    // a?.(x)
    Node arg = IR.name("x");
    Node call = IR.optChainCall(IR.name("a"), true, arg);
    assertThat(NodeUtil.isOptionalChainRight(arg)).isTrue();
    assertThat(NodeUtil.isEndOfOptionalChain(call)).isTrue();
  }

  @Test
  public void testLabels() {
    Node loop = IR.whileNode(IR.name("a"), IR.block());
    IR.label(IR.labelName("outer"), loop);
    assertThat(NodeUtil.getLabel(loop)).isEqualTo("outer");
    assertThat(NodeUtil.isBreakableStatement(loop)).isTrue();
    assertThat(NodeUtil.isBreakableStatement(IR.block())).isFalse();
    assertThat(NodeUtil.getLabel(IR.block())).isNull();

    assertThat(NodeUtil.getJumpLabel(IR.breakNode(IR.labelName("outer")))).isEqualTo("outer");
    assertThat(NodeUtil.getJumpLabel(IR.continueNode())).isNull();
  }

  @Test
  public void testClassMembers() {
    Node value = IR.call(IR.name("b"));
    Node field = IR.memberFieldDef("a", value);
    Node staticBlock = IR.staticBlock();
    Node computedValue = IR.number(1);
    Node computed = IR.computedFieldDef(IR.name("k"), computedValue);
    IR.classNode(IR.name("C"), IR.empty(), IR.classMembers(field, staticBlock, computed));

    assertThat(NodeUtil.isClassFieldInitializer(value)).isTrue();
    assertThat(NodeUtil.isClassFieldInitializer(computedValue)).isTrue();
    assertThat(NodeUtil.isClassFieldInitializer(computed.getFirstChild())).isFalse();
    assertThat(NodeUtil.isClassStaticBlock(staticBlock)).isTrue();
    assertThat(NodeUtil.isClassStaticBlock(IR.block())).isFalse();
  }

  @Test
  public void testIsIdentifierReference() {
    Node callee = IR.name("f");
    IR.call(callee);
    assertThat(NodeUtil.isIdentifierReference(callee)).isTrue();

    Node declared = IR.name("x");
    IR.var(declared, IR.number(1));
    assertThat(NodeUtil.isIdentifierReference(declared)).isFalse();

    Node param = IR.name("p");
    IR.paramList(param);
    assertThat(NodeUtil.isIdentifierReference(param)).isFalse();

    Node target = IR.name("t");
    Node defaultExpr = IR.name("d");
    IR.defaultValue(target, defaultExpr);
    assertThat(NodeUtil.isIdentifierReference(target)).isFalse();
    assertThat(NodeUtil.isIdentifierReference(defaultExpr)).isTrue();

    Node shorthandKey = IR.shorthandStringKey("s");
    IR.objectPattern(shorthandKey);
    assertThat(NodeUtil.isIdentifierReference(shorthandKey.getFirstChild())).isFalse();

    Node pairTarget = IR.name("b");
    IR.objectPattern(IR.stringKey("a", pairTarget));
    assertThat(NodeUtil.isIdentifierReference(pairTarget)).isTrue();

    Node getprop = IR.getprop(IR.name("o"), "p");
    assertThat(NodeUtil.isIdentifierReference(getprop.getSecondChild())).isTrue();
    assertThat(NodeUtil.isIdentifierReference(IR.str("literal"))).isFalse();
  }

  @Test
  public void testIsPlaceholder() {
    Node forNode = IR.forNode(IR.empty(), IR.name("c"), IR.empty(), IR.block());
    assertThat(NodeUtil.isPlaceholder(forNode.getFirstChild())).isTrue();
    assertThat(NodeUtil.isPlaceholder(forNode.getSecondChild())).isFalse();

    Node emptyStatement = IR.empty();
    IR.block(emptyStatement);
    assertThat(NodeUtil.isPlaceholder(emptyStatement)).isFalse();

    Node tryFinally = IR.tryFinally(IR.block(), IR.block());
    assertThat(NodeUtil.isPlaceholder(tryFinally.getSecondChild())).isTrue();
    assertThat(NodeUtil.isCatchHolder(tryFinally.getSecondChild())).isTrue();
    assertThat(NodeUtil.isFinallyBlock(tryFinally.getLastChild())).isTrue();

    Node tryCatch = IR.tryCatch(IR.block(), IR.catchNode(IR.name("e"), IR.block()));
    assertThat(NodeUtil.isPlaceholder(tryCatch.getSecondChild())).isFalse();
    assertThat(NodeUtil.isFinallyBlock(tryCatch.getLastChild())).isFalse();

    Node anonymous = IR.function(IR.name(""), IR.paramList(), IR.block());
    assertThat(NodeUtil.isPlaceholder(anonymous.getFirstChild())).isTrue();
  }

  @Test
  public void testIsSwitchCaseBody() {
    Node body = IR.block();
    Node caseNode = IR.caseNode(IR.number(1), body);
    assertThat(NodeUtil.isSwitchCaseBody(body)).isTrue();
    assertThat(NodeUtil.isSwitchCaseBody(caseNode.getFirstChild())).isFalse();
    Node defaultBody = IR.block();
    IR.defaultCase(defaultBody);
    assertThat(NodeUtil.isSwitchCaseBody(defaultBody)).isTrue();
  }
}
