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

import exm.ksc.ast.KernelAST;
import exm.ksc.common.exceptions.KSCRuntimeError;

/**
 * Straight-line sequence of statements with its outgoing edges.
 *
 * A block either falls through to {@link #getNext()} or, for condition
 * and loop header blocks, branches to {@link #getTrueBranch()} or
 * {@link #getFalseBranch()}.
 */
public class BasicBlock {

  private final int id;
  private final String label;
  private final List<KernelAST> statements = new ArrayList<KernelAST>();

  /** Expression deciding between the branches, if any */
  private KernelAST condition = null;

  private BasicBlock next = null;
  private BasicBlock trueBranch = null;
  private BasicBlock falseBranch = null;

  private boolean loopHeader = false;
  private boolean exit = false;

  BasicBlock(int id, String label) {
    this.id = id;
    this.label = label;
  }

  public int getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public List<KernelAST> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  void addStatement(KernelAST stmt) {
    statements.add(stmt);
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public KernelAST getCondition() {
    return condition;
  }

  void setCondition(KernelAST condition) {
    this.condition = condition;
  }

  public BasicBlock getNext() {
    return next;
  }

  void setNext(BasicBlock next) {
    if (trueBranch != null) {
      throw new KSCRuntimeError("Block " + this + " already branches");
    }
    this.next = next;
  }

  public BasicBlock getTrueBranch() {
    return trueBranch;
  }

  public BasicBlock getFalseBranch() {
    return falseBranch;
  }

  void setBranches(BasicBlock trueBranch, BasicBlock falseBranch) {
    if (next != null) {
      throw new KSCRuntimeError("Block " + this + " already falls through");
    }
    this.trueBranch = trueBranch;
    this.falseBranch = falseBranch;
  }

  public boolean isConditional() {
    return trueBranch != null;
  }

  public boolean isLoopHeader() {
    return loopHeader;
  }

  void setLoopHeader(boolean loopHeader) {
    this.loopHeader = loopHeader;
  }

  public boolean isExit() {
    return exit;
  }

  void setExit(boolean exit) {
    this.exit = exit;
  }

  /**
   * @return outgoing edges: true then false branch, or the fall-through
   */
  public List<BasicBlock> successors() {
    List<BasicBlock> result = new ArrayList<BasicBlock>(2);
    if (trueBranch != null) {
      result.add(trueBranch);
      if (falseBranch != null) {
        result.add(falseBranch);
      }
    } else if (next != null) {
      result.add(next);
    }
    return result;
  }

  @Override
  public String toString() {
    return label + "#" + id;
  }
}
