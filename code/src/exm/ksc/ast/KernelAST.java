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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collection;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Base class of all AST nodes.
 *
 * Nodes are immutable and own their children.  Every node records the
 * source position of the token that starts it.
 */
public abstract class KernelAST {

  private final int line;
  private final int column;

  protected KernelAST(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public abstract NodeKind kind();

  /**
   * @return every AST-typed child field in declaration order, absent
   *        optional children omitted
   */
  public abstract List<KernelAST> children();

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  /**
   * @return short description printed after the node kind by printTree,
   *         empty if nothing to add
   */
  public String summary() {
    return "";
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    writer.print(StringUtils.repeat(' ', indent));
    writer.print(kind());
    String summary = summary();
    if (!summary.isEmpty()) {
      writer.print(" ");
      writer.print(summary);
    }
    writer.println();
    for (KernelAST child: children()) {
      child.printTree(writer, indent + 2);
    }
  }

  @Override
  public String toString() {
    String summary = summary();
    return kind() + (summary.isEmpty() ? "" : " " + summary) +
           " @" + line + ":" + column;
  }

  /**
   * Build child list from a mix of nodes, node collections and nulls
   */
  protected static List<KernelAST> childList(Object... parts) {
    ImmutableList.Builder<KernelAST> result = ImmutableList.builder();
    for (Object part: parts) {
      if (part == null) {
        continue;
      } else if (part instanceof KernelAST) {
        result.add((KernelAST)part);
      } else {
        for (Object o: (Collection<?>)part) {
          result.add((KernelAST)o);
        }
      }
    }
    return result.build();
  }
}
