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
package exm.ksc.ast.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ksc.ast.KernelAST;
import exm.ksc.ast.NodeKind;

/**
 * Root of a parsed file: the top-level declarations in source order.
 */
public class Program extends KernelAST {

  private final ImmutableList<KernelAST> declarations;

  public Program(List<KernelAST> declarations) {
    super(1, 1);
    this.declarations = ImmutableList.copyOf(declarations);
  }

  public List<KernelAST> getDeclarations() {
    return declarations;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PROGRAM;
  }

  @Override
  public List<KernelAST> children() {
    return declarations;
  }

  @Override
  public String summary() {
    return "(" + declarations.size() + " declarations)";
  }
}
