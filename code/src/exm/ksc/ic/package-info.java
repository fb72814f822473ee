/**
 * Control flow graph construction.  {@link exm.ksc.ic.CFGBuilder} lowers
 * one function body into {@link exm.ksc.ic.BasicBlock}s on request; it
 * is not part of semantic analysis.
 */
package exm.ksc.ic;
