/**
 * This package contains the lexer and parser used for generating an AST
 * from KernelScript source, and the base class of all AST nodes.
 * The node classes themselves live in {@link exm.ksc.ast.tree}.
 */
package exm.ksc.ast;
