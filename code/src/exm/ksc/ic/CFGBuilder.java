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
package exm.ksc.ic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.ksc.ast.KernelAST;
import exm.ksc.ast.tree.Declarations.FunctionDecl;
import exm.ksc.ast.tree.Statements.Block;
import exm.ksc.ast.tree.Statements.DoWhile;
import exm.ksc.ast.tree.Statements.For;
import exm.ksc.ast.tree.Statements.If;
import exm.ksc.ast.tree.Statements.While;
import exm.ksc.common.Logging;
import exm.ksc.common.exceptions.KSCRuntimeError;

/**
 * Lowers one block or function body to a graph of {@link BasicBlock}s.
 *
 * Statements are appended to the current block in source order.  Control
 * statements end the current block and move the cursor to a new one:
 * <ul>
 *  <li>if: a "cond" block branching to the then branch and to the else
 *      branch or, without an else, an empty "merge" block.  Code after the
 *      if continues in the else branch or merge block.</li>
 *  <li>while, for, do-while: a "loop_header" block branching to the body
 *      and to a "loop_exit" block.  The last block of the body jumps back
 *      to the header.  Code after the loop continues in the exit block.
 *  </li>
 *  <li>return: an exit block holding the return.  Code after it goes in
 *      an "unreachable" block that nothing jumps to.</li>
 * </ul>
 * Nested blocks are flattened into the enclosing flow.
 */
public class CFGBuilder {

  private static final Logger logger = Logging.getKSCLogger();

  private final List<BasicBlock> blocks = new ArrayList<BasicBlock>();

  /**
   * Entry and last block of a lowered region
   */
  private static class Region {
    final BasicBlock entry;
    final BasicBlock tail;

    Region(BasicBlock entry, BasicBlock tail) {
      this.entry = entry;
      this.tail = tail;
    }
  }

  /**
   * @param node a Block, or a FunctionDecl with a body
   * @return entry block of the graph
   */
  public BasicBlock build(KernelAST node) {
    blocks.clear();
    BasicBlock entry;
    if (node instanceof Block) {
      entry = lowerRegion(node).entry;
    } else if (node instanceof FunctionDecl &&
               ((FunctionDecl)node).getBody() != null) {
      FunctionDecl func = (FunctionDecl)node;
      entry = newBlock("func_" + func.getName());
      entry.setNext(lowerRegion(func.getBody()).entry);
    } else {
      throw new KSCRuntimeError("Cannot build control flow graph for " +
                                node);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Built control flow graph with " + blocks.size() +
                   " blocks for " + node);
    }
    return entry;
  }

  /**
   * @return every block created by the last call to build, in creation
   *         order
   */
  public List<BasicBlock> getBlocks() {
    return Collections.unmodifiableList(blocks);
  }

  private BasicBlock newBlock(String label) {
    BasicBlock block = new BasicBlock(blocks.size(), label);
    blocks.add(block);
    return block;
  }

  private Region lowerRegion(KernelAST stmt) {
    BasicBlock entry = newBlock("entry");
    BasicBlock tail = lower(stmt, entry);
    return new Region(entry, tail);
  }

  /**
   * Append a statement to the graph
   * @param current block that has no outgoing edges yet
   * @return block that code following the statement goes in
   */
  private BasicBlock lower(KernelAST stmt, BasicBlock current) {
    switch (stmt.kind()) {
      case BLOCK:
        for (KernelAST s: ((Block)stmt).getStatements()) {
          current = lower(s, current);
        }
        return current;
      case IF:
        return lowerIf((If)stmt, current);
      case WHILE: {
        While loop = (While)stmt;
        return lowerLoop(current, loop.getCondition(), loop.getBody(), null);
      }
      case FOR: {
        For loop = (For)stmt;
        if (loop.getInit() != null) {
          current.addStatement(loop.getInit());
        }
        return lowerLoop(current, loop.getCondition(), loop.getBody(),
                         loop.getIncrement());
      }
      case DO_WHILE:
        return lowerDoWhile((DoWhile)stmt, current);
      case RETURN: {
        BasicBlock ret = newBlock("return");
        ret.setExit(true);
        ret.addStatement(stmt);
        current.setNext(ret);
        return newBlock("unreachable");
      }
      default:
        current.addStatement(stmt);
        return current;
    }
  }

  private BasicBlock lowerIf(If stmt, BasicBlock current) {
    BasicBlock cond = newBlock("cond");
    cond.setCondition(stmt.getCondition());
    current.setNext(cond);

    Region thenRegion = lowerRegion(stmt.getThen());
    if (stmt.hasElse()) {
      Region elseRegion = lowerRegion(stmt.getElse());
      cond.setBranches(thenRegion.entry, elseRegion.entry);
      return elseRegion.tail;
    }
    BasicBlock merge = newBlock("merge");
    cond.setBranches(thenRegion.entry, merge);
    thenRegion.tail.setNext(merge);
    return merge;
  }

  /**
   * @param condition null for a for loop without condition
   * @param increment appended to the end of the body, may be null
   */
  private BasicBlock lowerLoop(BasicBlock current, KernelAST condition,
                               KernelAST body, KernelAST increment) {
    BasicBlock header = newBlock("loop_header");
    header.setLoopHeader(true);
    header.setCondition(condition);
    current.setNext(header);

    Region bodyRegion = lowerRegion(body);
    if (increment != null) {
      bodyRegion.tail.addStatement(increment);
    }
    BasicBlock exit = newBlock("loop_exit");
    header.setBranches(bodyRegion.entry, exit);
    bodyRegion.tail.setNext(header);
    return exit;
  }

  private BasicBlock lowerDoWhile(DoWhile stmt, BasicBlock current) {
    Region bodyRegion = lowerRegion(stmt.getBody());
    current.setNext(bodyRegion.entry);

    BasicBlock header = newBlock("loop_header");
    header.setLoopHeader(true);
    header.setCondition(stmt.getCondition());
    bodyRegion.tail.setNext(header);

    BasicBlock exit = newBlock("loop_exit");
    header.setBranches(bodyRegion.entry, exit);
    return exit;
  }
}
