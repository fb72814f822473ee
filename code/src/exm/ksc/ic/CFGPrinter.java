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

import java.io.PrintStream;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.ksc.ast.KernelAST;

/**
 * Text rendering of a control flow graph, one block after another
 */
public class CFGPrinter {

  public static void print(List<BasicBlock> blocks, PrintStream out) {
    out.print(render(blocks));
  }

  public static String render(List<BasicBlock> blocks) {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock block: blocks) {
      renderBlock(sb, block);
    }
    return sb.toString();
  }

  private static void renderBlock(StringBuilder sb, BasicBlock block) {
    sb.append(block);
    if (block.isLoopHeader()) {
      sb.append(" [loop header]");
    }
    if (block.isExit()) {
      sb.append(" [exit]");
    }
    sb.append('\n');

    for (KernelAST stmt: block.getStatements()) {
      sb.append("    ").append(describe(stmt)).append('\n');
    }
    if (block.getCondition() != null) {
      sb.append("    condition: ").append(describe(block.getCondition()))
        .append('\n');
    }

    if (block.isConditional()) {
      sb.append("  true -> ").append(block.getTrueBranch());
      sb.append(", false -> ").append(block.getFalseBranch()).append('\n');
    } else if (block.getNext() != null) {
      sb.append("  -> ").append(block.getNext()).append('\n');
    }
  }

  private static String describe(KernelAST node) {
    String summary = node.summary();
    return node.kind() + (StringUtils.isEmpty(summary) ? "" : " " + summary) +
           " (line " + node.getLine() + ")";
  }
}
