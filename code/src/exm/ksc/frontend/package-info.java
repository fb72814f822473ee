/**
 * Semantic checks over the AST: scopes, symbols, name resolution and
 * the unused symbol report.
 */
package exm.ksc.frontend;
