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

/** The node kinds of a JavaScript syntax tree. */
public enum Token {
  RETURN,
  BITOR,
  BITXOR,
  BITAND,
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  NOT,
  NEG,
  NEW,
  GETPROP,
  GETELEM,
  CALL,
  NAME,
  NUMBER,
  STRINGLIT,
  NULL,
  THIS,
  FALSE,
  TRUE,
  SHEQ,
  SHNE,
  REGEXP,
  THROW,
  IN,
  INSTANCEOF,
  ARRAYLIT,

  TRY,
  PARAM_LIST,
  COMMA,

  ASSIGN,
  ASSIGN_ADD,
  ASSIGN_OR,
  ASSIGN_AND,
  ASSIGN_COALESCE,

  HOOK,
  OR,
  AND,
  COALESCE,
  INC,
  DEC,
  FUNCTION,
  IF,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  WHILE,
  DO,
  FOR,
  FOR_IN,
  FOR_OF,
  BREAK,
  CONTINUE,
  VAR,
  CATCH,
  EMPTY,
  BLOCK,
  LABEL,
  EXPR_RESULT,
  SCRIPT,

  // The property name of a GETPROP or OPTCHAIN_GETPROP.
  STRING,
  STRING_KEY,
  LABEL_NAME,

  OPTCHAIN_GETPROP,
  OPTCHAIN_GETELEM,
  OPTCHAIN_CALL,

  YIELD,
  AWAIT,

  LET,
  CONST,

  ARRAY_PATTERN,
  OBJECT_PATTERN,
  DEFAULT_VALUE,
  ITER_REST,

  CLASS,
  CLASS_MEMBERS,
  MEMBER_FUNCTION_DEF,
  MEMBER_FIELD_DEF,
  COMPUTED_FIELD_DEF;

  /** Whether nodes of this kind carry a string payload. */
  public boolean isStringToken() {
    switch (this) {
      case NAME:
      case STRINGLIT:
      case STRING:
      case STRING_KEY:
      case LABEL_NAME:
      case REGEXP:
      case MEMBER_FUNCTION_DEF:
      case MEMBER_FIELD_DEF:
        return true;
      default:
        return false;
    }
  }
}
