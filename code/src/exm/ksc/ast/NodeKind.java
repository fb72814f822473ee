/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.ksc.ast;

/**
 * Tag of every concrete AST node class.  The set is closed: walkers switch
 * over it and fall back to visiting {@link KernelAST#children()}.
 */
public enum NodeKind {
  PROGRAM,
  INCLUDE,
  DEFINE,
  VARIABLE_DECL,
  ARRAY_DECL,
  FUNCTION_DECL,
  PARAM,
  STRUCT_DECL,
  UNION_DECL,
  ENUM_DECL,
  TYPEDEF,

  BLOCK,
  EXPRESSION_STMT,
  RETURN,
  IF,
  WHILE,
  FOR,
  DO_WHILE,
  SWITCH,
  CASE,
  DEFAULT,
  BREAK,
  CONTINUE,
  GOTO,
  LABEL,

  BINARY_OP,
  UNARY_OP,
  CALL,
  ARRAY_ACCESS,
  MEMBER_ACCESS,
  CAST,
  SIZEOF,
  TERNARY,
  ASSIGNMENT,
  VARIABLE,

  NUMBER,
  STRING,
  CHAR,
  BOOL,
  NULL,
}
