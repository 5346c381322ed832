/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.pycst.syntax;

/**
 * The node kinds of a Python syntax tree.
 *
 * <p>Child layouts are documented on the corresponding {@link IR} factory methods.
 */
public enum Token {
  MODULE,
  BLOCK,
  EMPTY,

  // Definitions
  FUNCTION_DEF,
  LAMBDA,
  PARAM_LIST,
  PARAM,
  CLASS_DEF,
  DECORATOR_LIST,
  DECORATOR,

  // Statements
  ASSIGN,
  AUG_ASSIGN,
  ANN_ASSIGN,
  FOR,
  WHILE,
  IF,
  TRY,
  EXCEPT_HANDLER,
  WITH,
  WITH_ITEM,
  IMPORT,
  IMPORT_FROM,
  IMPORT_ALIAS,
  IMPORT_STAR,
  DOTTED_NAME,
  DEL,
  GLOBAL,
  NONLOCAL,
  RETURN,
  RAISE,
  EXPR_STMT,
  PASS,
  BREAK,
  CONTINUE,

  // Expressions
  NAME,
  ATTRIBUTE,
  SUBSCRIPT,
  STARRED,
  TUPLE,
  LIST,
  SET,
  DICT,
  DICT_ENTRY,
  CALL,
  ARG_LIST,
  ARG,
  BIN_OP,
  BOOL_OP,
  UNARY_OP,
  COMPARE,
  IF_EXP,
  YIELD,
  AWAIT,
  NUMBER,
  STRING,
  ELLIPSIS,

  // Comprehensions
  LIST_COMP,
  SET_COMP,
  GENERATOR_EXP,
  DICT_COMP,
  COMP_FOR;
}
