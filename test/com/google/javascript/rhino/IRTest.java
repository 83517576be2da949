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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link IR}. */
@RunWith(JUnit4.class)
public final class IRTest {

  @Test
  public void testTryShapes() {
    Node tryFinally = IR.tryFinally(IR.block(), IR.block());
    assertThat(tryFinally.getChildCount()).isEqualTo(3);
    assertThat(tryFinally.getSecondChild().hasChildren()).isFalse();

    Node tryCatch = IR.tryCatch(IR.block(), IR.catchNode(IR.name("e"), IR.block()));
    assertThat(tryCatch.getChildCount()).isEqualTo(2);
    assertThat(tryCatch.getSecondChild().getFirstChild().isCatch()).isTrue();

    Node all =
        IR.tryCatchFinally(IR.block(), IR.catchNode(IR.empty(), IR.block()), IR.block());
    assertThat(all.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testForShapes() {
    Node forNode = IR.forNode(IR.empty(), IR.empty(), IR.empty(), IR.block());
    assertThat(forNode.getChildCount()).isEqualTo(4);
    Node forOf = IR.forOf(IR.name("x"), IR.name("xs"), IR.block());
    assertThat(forOf.getToken()).isEqualTo(Token.FOR_OF);
    assertThrows(
        IllegalStateException.class,
        () -> IR.forNode(IR.block(), IR.empty(), IR.empty(), IR.block()));
  }

  @Test
  public void testDeclarationCarriesValueUnderName() {
    Node value = IR.number(1);
    Node let = IR.let(IR.name("x"), value);
    assertThat(let.getFirstChild().getFirstChild()).isSameInstanceAs(value);
  }

  @Test
  public void testOptionalChainMustStartOrContinue() {
    Node start = IR.optChainGetprop(IR.name("a"), "b", true);
    Node continued = IR.optChainGetelem(start, IR.number(0), false);
    assertThat(continued.isOptionalChainStart()).isFalse();
    assertThrows(
        IllegalStateException.class, () -> IR.optChainGetprop(IR.name("a"), "b", false));
  }

  @Test
  public void testStatementsAndExpressions() {
    assertThat(IR.mayBeStatement(IR.block())).isTrue();
    assertThat(IR.mayBeStatement(IR.name("x"))).isFalse();
    assertThat(IR.mayBeExpression(IR.name("x"))).isTrue();
    assertThat(IR.mayBeExpression(IR.block())).isFalse();
    assertThrows(IllegalStateException.class, () -> IR.exprResult(IR.block()));
    assertThrows(IllegalStateException.class, () -> IR.script(IR.name("x")));
  }

  @Test
  public void testLogicalOperatorsAreExpressions() {
    Node or = IR.or(IR.name("a"), IR.name("b"));
    Node and = IR.and(IR.name("c"), IR.name("d"));
    Node coalesce = IR.coalesce(IR.name("e"), IR.name("f"));
    assertThat(IR.mayBeExpression(or)).isTrue();
    assertThat(IR.mayBeExpression(and)).isTrue();
    assertThat(IR.mayBeExpression(coalesce)).isTrue();

    Node doWhile = IR.doNode(IR.block(), or);
    assertThat(doWhile.getLastChild()).isSameInstanceAs(or);
    assertThat(IR.ifNode(and, IR.block()).getFirstChild()).isSameInstanceAs(and);
    assertThat(IR.whileNode(coalesce, IR.block()).getFirstChild()).isSameInstanceAs(coalesce);
  }

  @Test
  public void testConstAndAwait() {
    Node constNode = IR.constNode(IR.name("c"), IR.number(1));
    assertThat(constNode.isConst()).isTrue();
    assertThat(constNode.getFirstChild().getString()).isEqualTo("c");
    assertThat(constNode.getFirstChild().getFirstChild().getDouble()).isEqualTo(1.0);

    Node await = IR.await(IR.name("p"));
    assertThat(IR.mayBeExpression(await)).isTrue();
    assertThrows(IllegalStateException.class, () -> IR.await(IR.block()));
  }

  @Test
  public void testShorthandStringKey() {
    Node key = IR.shorthandStringKey("a");
    assertThat(key.isStringKey()).isTrue();
    assertThat(key.isShorthandProperty()).isTrue();
    assertThat(key.getString()).isEqualTo("a");
    assertThat(key.getFirstChild().getString()).isEqualTo("a");

    assertThat(IR.stringKey("a", IR.name("b")).isShorthandProperty()).isFalse();
  }
}
