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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * A syntax tree construction helper class. Every factory checks the shape it builds, so a tree
 * assembled only through this class has the child positions the code path analysis expects.
 */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node arrowFunction(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock() || mayBeExpression(body));
    Node func = new Node(Token.FUNCTION, name, params, body);
    func.putBooleanProp(Node.Prop.ARROW_FN, true);
    return func;
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(mayBeLhs(param) || param.getToken() == Token.ITER_REST, param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node var(Node name) {
    return declaration(name, Token.VAR);
  }

  public static Node var(Node name, Node value) {
    return declaration(name, value, Token.VAR);
  }

  public static Node let(Node name, Node value) {
    return declaration(name, value, Token.LET);
  }

  public static Node constNode(Node name, Node value) {
    return declaration(name, value, Token.CONST);
  }

  public static Node declaration(Node name, Token type) {
    checkState(name.isName(), name);
    return new Node(type, name);
  }

  public static Node declaration(Node name, Node value, Token type) {
    checkState(name.isName(), name);
    checkState(mayBeExpression(value), value);
    name.addChildToBack(value);
    return new Node(type, name);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node yield() {
    return new Node(Token.YIELD);
  }

  public static Node yield(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.YIELD, expr);
  }

  public static Node await(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.AWAIT, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.THROW, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(elseNode.isBlock());
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node doNode(Node body, Node cond) {
    checkState(body.isBlock());
    checkState(mayBeExpression(cond));
    return new Node(Token.DO, body, cond);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(body.isBlock());
    checkState(mayBeExpression(cond));
    return new Node(Token.WHILE, cond, body);
  }

  public static Node forIn(Node target, Node cond, Node body) {
    return forInOrOf(Token.FOR_IN, target, cond, body);
  }

  public static Node forOf(Node target, Node cond, Node body) {
    return forInOrOf(Token.FOR_OF, target, cond, body);
  }

  private static Node forInOrOf(Token token, Node target, Node cond, Node body) {
    checkState(target.isVar() || target.isLet() || target.isConst() || mayBeLhs(target));
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(token, target, cond, body);
  }

  /** Builds a FOR; pass {@link #empty()} for an absent init, condition or update clause. */
  public static Node forNode(Node init, Node cond, Node incr, Node body) {
    checkState(init.isVar() || init.isLet() || init.isConst() || mayBeExpressionOrEmpty(init));
    checkState(mayBeExpressionOrEmpty(cond));
    checkState(mayBeExpressionOrEmpty(incr));
    checkState(body.isBlock());
    return new Node(Token.FOR, init, cond, incr, body);
  }

  public static Node switchNode(Node cond, Node... cases) {
    checkState(mayBeExpression(cond));
    Node switchNode = new Node(Token.SWITCH, cond);
    for (Node caseNode : cases) {
      checkState(caseNode.isCase() || caseNode.isDefaultCase());
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node expr, Node body) {
    checkState(mayBeExpression(expr));
    checkState(body.isBlock());
    return new Node(Token.CASE, expr, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock());
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node label(Node name, Node stmt) {
    checkState(name.isLabelName());
    checkState(mayBeStatement(stmt));
    return new Node(Token.LABEL, name, stmt);
  }

  public static Node labelName(String name) {
    checkState(!name.isEmpty());
    return Node.newString(Token.LABEL_NAME, name);
  }

  /** TRY(tryBlock, BLOCK(), finallyBlock): the empty second block stands for the absent catch. */
  public static Node tryFinally(Node tryBody, Node finallyBody) {
    checkState(tryBody.isBlock());
    checkState(finallyBody.isBlock());
    return new Node(Token.TRY, tryBody, block(), finallyBody);
  }

  public static Node tryCatch(Node tryBody, Node catchNode) {
    checkState(tryBody.isBlock());
    checkState(catchNode.isCatch());
    Node catchBody = new Node(Token.BLOCK, catchNode);
    return new Node(Token.TRY, tryBody, catchBody);
  }

  public static Node tryCatchFinally(Node tryBody, Node catchNode, Node finallyBody) {
    checkState(finallyBody.isBlock());
    Node tryNode = tryCatch(tryBody, catchNode);
    tryNode.addChildToBack(finallyBody);
    return tryNode;
  }

  /** Builds a CATCH; pass {@link #empty()} for an optional catch binding. */
  public static Node catchNode(Node expr, Node body) {
    checkState(expr.isName() || expr.isEmpty() || isPattern(expr));
    checkState(body.isBlock());
    return new Node(Token.CATCH, expr, body);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  public static Node breakNode(Node name) {
    checkState(name.isLabelName());
    return new Node(Token.BREAK, name);
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  public static Node continueNode(Node name) {
    checkState(name.isLabelName());
    return new Node(Token.CONTINUE, name);
  }

  public static Node call(Node target, Node... args) {
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node newNode(Node target, Node... args) {
    Node newcall = new Node(Token.NEW, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg));
      newcall.addChildToBack(arg);
    }
    return newcall;
  }

  /** Builds a NAME; the empty name is only valid as the name of an anonymous function. */
  public static Node name(String name) {
    Preconditions.checkState(name.indexOf('.') == -1, "Invalid name '%s'", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target));
    Node result = new Node(Token.GETPROP, target, string(prop));
    for (String moreProp : moreProps) {
      result = new Node(Token.GETPROP, result, string(moreProp));
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  /**
   * Builds an OPTCHAIN_GETPROP. {@code isOptionalChainStart} is true for {@code a?.b} and false
   * for a later plain link such as the {@code .c} of {@code a?.b.c}.
   */
  public static Node optChainGetprop(Node target, String prop, boolean isOptionalChainStart) {
    checkState(mayBeExpression(target));
    Node result = new Node(Token.OPTCHAIN_GETPROP, target, string(prop));
    result.setIsOptionalChainStart(isOptionalChainStart);
    return checkChainLink(result);
  }

  public static Node optChainGetelem(Node target, Node elem, boolean isOptionalChainStart) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    Node result = new Node(Token.OPTCHAIN_GETELEM, target, elem);
    result.setIsOptionalChainStart(isOptionalChainStart);
    return checkChainLink(result);
  }

  public static Node optChainCall(Node target, boolean isOptionalChainStart, Node... args) {
    checkState(mayBeExpression(target));
    Node call = new Node(Token.OPTCHAIN_CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    call.setIsOptionalChainStart(isOptionalChainStart);
    return checkChainLink(call);
  }

  private static Node checkChainLink(Node link) {
    // A plain link only continues an existing chain.
    checkState(
        link.isOptionalChainStart() || isOptChain(link.getFirstChild()),
        "%s neither starts nor continues an optional chain",
        link);
    return link;
  }

  public static Node string(String s) {
    return Node.newString(Token.STRING, s);
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value) || value.isDefaultValue() || isPattern(value));
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  /** Creates the key of {@code {name}}, which reads or binds {@code name} itself. */
  public static Node shorthandStringKey(String name) {
    Node stringKey = stringKey(name, name(name));
    stringKey.setShorthandProperty(true);
    return stringKey;
  }

  public static Node str(String s) {
    return Node.newString(s);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node regexp(String pattern) {
    return Node.newString(Token.REGEXP, pattern);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node not(Node expr) {
    return unaryOp(Token.NOT, expr);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node coalesce(Node expr1, Node expr2) {
    return binaryOp(Token.COALESCE, expr1, expr2);
  }

  public static Node hook(Node cond, Node expr1, Node expr2) {
    checkState(mayBeExpression(cond));
    checkState(mayBeExpression(expr1));
    checkState(mayBeExpression(expr2));
    return new Node(Token.HOOK, cond, expr1, expr2);
  }

  public static Node add(Node expr1, Node expr2) {
    return binaryOp(Token.ADD, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node inc(Node target) {
    checkState(mayBeLhs(target));
    return new Node(Token.INC, target);
  }

  public static Node assign(Node target, Node expr) {
    checkState(mayBeLhs(target), target);
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node assignOr(Node target, Node expr) {
    return logicalAssign(Token.ASSIGN_OR, target, expr);
  }

  public static Node assignAnd(Node target, Node expr) {
    return logicalAssign(Token.ASSIGN_AND, target, expr);
  }

  public static Node assignCoalesce(Node target, Node expr) {
    return logicalAssign(Token.ASSIGN_COALESCE, target, expr);
  }

  private static Node logicalAssign(Token token, Node target, Node expr) {
    checkState(target.isName() || target.isGetProp() || target.getToken() == Token.GETELEM);
    checkState(mayBeExpression(expr), expr);
    return new Node(token, target, expr);
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr) || expr.isEmpty());
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node arrayPattern(Node... targets) {
    Node pattern = new Node(Token.ARRAY_PATTERN);
    for (Node target : targets) {
      checkState(mayBeLhs(target) || target.isEmpty() || target.getToken() == Token.ITER_REST);
      pattern.addChildToBack(target);
    }
    return pattern;
  }

  public static Node objectPattern(Node... keys) {
    Node pattern = new Node(Token.OBJECT_PATTERN);
    for (Node key : keys) {
      checkState(key.isStringKey() || key.getToken() == Token.ITER_REST);
      pattern.addChildToBack(key);
    }
    return pattern;
  }

  public static Node defaultValue(Node target, Node defaultValue) {
    checkState(target.isName() || isPattern(target) || target.isGetProp(), target);
    checkState(mayBeExpression(defaultValue));
    return new Node(Token.DEFAULT_VALUE, target, defaultValue);
  }

  public static Node iterRest(Node target) {
    checkState(target.isName() || isPattern(target));
    return new Node(Token.ITER_REST, target);
  }

  /** Builds a CLASS; pass {@link #empty()} for an anonymous class or an absent superclass. */
  public static Node classNode(Node name, Node superClass, Node members) {
    checkState(name.isName() || name.isEmpty());
    checkState(superClass.isEmpty() || mayBeExpression(superClass));
    checkState(members.isClassMembers());
    return new Node(Token.CLASS, name, superClass, members);
  }

  public static Node classMembers(Node... members) {
    Node classMembers = new Node(Token.CLASS_MEMBERS);
    for (Node member : members) {
      checkState(
          member.getToken() == Token.MEMBER_FUNCTION_DEF
              || member.isMemberFieldDef()
              || member.isComputedFieldDef()
              || member.isBlock(),
          member);
      classMembers.addChildToBack(member);
    }
    return classMembers;
  }

  public static Node memberFunctionDef(String name, Node function) {
    checkState(function.isFunction());
    Node member = Node.newString(Token.MEMBER_FUNCTION_DEF, name);
    member.addChildToBack(function);
    return member;
  }

  /** A class field without an initializer, {@code x;}. */
  public static Node memberFieldDef(String name) {
    return Node.newString(Token.MEMBER_FIELD_DEF, name);
  }

  /** A class field with an initializer, {@code x = value;}. */
  public static Node memberFieldDef(String name, Node value) {
    checkState(mayBeExpression(value));
    Node member = Node.newString(Token.MEMBER_FIELD_DEF, name);
    member.addChildToBack(value);
    return member;
  }

  public static Node computedFieldDef(Node key, Node value) {
    checkState(mayBeExpression(key));
    checkState(mayBeExpression(value));
    return new Node(Token.COMPUTED_FIELD_DEF, key, value);
  }

  /** A {@code static { ... }} block, which is a BLOCK directly under CLASS_MEMBERS. */
  public static Node staticBlock(Node... stmts) {
    Node block = block(stmts);
    block.putBooleanProp(Node.Prop.STATIC_MEMBER, true);
    return block;
  }

  // helper methods

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }

  private static boolean isOptChain(@Nullable Node n) {
    return n != null && (n.isOptChainGetProp() || n.isOptChainGetElem() || n.isOptChainCall());
  }

  private static boolean isPattern(Node n) {
    return n.getToken() == Token.ARRAY_PATTERN || n.isObjectPattern();
  }

  private static boolean mayBeLhs(Node n) {
    switch (n.getToken()) {
      case NAME:
      case GETPROP:
      case GETELEM:
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
      case DEFAULT_VALUE:
        return true;
      default:
        return false;
    }
  }

  // NOTE: some nodes are neither statements nor expression nodes:
  //   SCRIPT, LABEL_NAME, PARAM_LIST, CASE, DEFAULT_CASE, CATCH

  /**
   * It isn't possible to always determine if a detached node is a expression,
   * so make a best guess.
   */
  public static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case BREAK:
      case CLASS:
      case CONST:
      case CONTINUE:
      case DO:
      case EXPR_RESULT:
      case FOR:
      case FOR_IN:
      case FOR_OF:
      case IF:
      case LABEL:
      case LET:
      case RETURN:
      case SWITCH:
      case THROW:
      case TRY:
      case VAR:
      case WHILE:
        return true;

      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a expression,
   * so make a best guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case CLASS:
        // FUNCTION and CLASS are used both in expression and statement
        // contexts.
        return true;

      case ADD:
      case AND:
      case ARRAYLIT:
      case ASSIGN:
      case ASSIGN_ADD:
      case ASSIGN_AND:
      case ASSIGN_COALESCE:
      case ASSIGN_OR:
      case AWAIT:
      case BITAND:
      case BITOR:
      case BITXOR:
      case CALL:
      case COALESCE:
      case COMMA:
      case DEC:
      case DIV:
      case EQ:
      case FALSE:
      case GE:
      case GETELEM:
      case GETPROP:
      case GT:
      case HOOK:
      case IN:
      case INC:
      case INSTANCEOF:
      case LE:
      case LT:
      case MOD:
      case MUL:
      case NAME:
      case NE:
      case NEG:
      case NEW:
      case NOT:
      case NULL:
      case NUMBER:
      case OPTCHAIN_CALL:
      case OPTCHAIN_GETELEM:
      case OPTCHAIN_GETPROP:
      case OR:
      case REGEXP:
      case SHEQ:
      case SHNE:
      case STRINGLIT:
      case SUB:
      case THIS:
      case TRUE:
      case YIELD:
        return true;

      default:
        return false;
    }
  }
}
