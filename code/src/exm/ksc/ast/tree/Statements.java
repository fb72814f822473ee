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
 * Statement nodes
 */
public class Statements {

  public static class Block extends KernelAST {
    private final ImmutableList<KernelAST> statements;

    public Block(int line, int col, List<KernelAST> statements) {
      super(line, col);
      this.statements = ImmutableList.copyOf(statements);
    }

    public List<KernelAST> getStatements() {
      return statements;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BLOCK;
    }

    @Override
    public List<KernelAST> children() {
      return statements;
    }

    @Override
    public String summary() {
      return "(" + statements.size() + " statements)";
    }
  }

  public static class ExpressionStatement extends KernelAST {
    private final KernelAST expression;

    public ExpressionStatement(int line, int col, KernelAST expression) {
      super(line, col);
      this.expression = expression;
    }

    /**
     * @return expression, or null for the empty statement
     */
    public KernelAST getExpression() {
      return expression;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.EXPRESSION_STMT;
    }

    @Override
    public List<KernelAST> children() {
      return childList(expression);
    }
  }

  public static class Return extends KernelAST {
    private final KernelAST value;

    public Return(int line, int col, KernelAST value) {
      super(line, col);
      this.value = value;
    }

    public KernelAST getValue() {
      return value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.RETURN;
    }

    @Override
    public List<KernelAST> children() {
      return childList(value);
    }
  }

  public static class If extends KernelAST {
    private final KernelAST condition;
    private final KernelAST thenStmt;
    private final KernelAST elseStmt;

    public If(int line, int col, KernelAST condition, KernelAST thenStmt,
              KernelAST elseStmt) {
      super(line, col);
      this.condition = condition;
      this.thenStmt = thenStmt;
      this.elseStmt = elseStmt;
    }

    public KernelAST getCondition() {
      return condition;
    }

    public KernelAST getThen() {
      return thenStmt;
    }

    /**
     * @return else branch, or null if absent
     */
    public KernelAST getElse() {
      return elseStmt;
    }

    public boolean hasElse() {
      return elseStmt != null;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.IF;
    }

    @Override
    public List<KernelAST> children() {
      return childList(condition, thenStmt, elseStmt);
    }
  }

  public static class While extends KernelAST {
    private final KernelAST condition;
    private final KernelAST body;

    public While(int line, int col, KernelAST condition, KernelAST body) {
      super(line, col);
      this.condition = condition;
      this.body = body;
    }

    public KernelAST getCondition() {
      return condition;
    }

    public KernelAST getBody() {
      return body;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.WHILE;
    }

    @Override
    public List<KernelAST> children() {
      return childList(condition, body);
    }
  }

  public static class For extends KernelAST {
    private final KernelAST init;
    private final KernelAST condition;
    private final KernelAST increment;
    private final KernelAST body;

    /**
     * init, condition and increment may each be null
     */
    public For(int line, int col, KernelAST init, KernelAST condition,
               KernelAST increment, KernelAST body) {
      super(line, col);
      this.init = init;
      this.condition = condition;
      this.increment = increment;
      this.body = body;
    }

    /**
     * @return declaration or expression, or null
     */
    public KernelAST getInit() {
      return init;
    }

    public KernelAST getCondition() {
      return condition;
    }

    public KernelAST getIncrement() {
      return increment;
    }

    public KernelAST getBody() {
      return body;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FOR;
    }

    @Override
    public List<KernelAST> children() {
      return childList(init, condition, increment, body);
    }
  }

  public static class DoWhile extends KernelAST {
    private final KernelAST body;
    private final KernelAST condition;

    public DoWhile(int line, int col, KernelAST body, KernelAST condition) {
      super(line, col);
      this.body = body;
      this.condition = condition;
    }

    public KernelAST getBody() {
      return body;
    }

    public KernelAST getCondition() {
      return condition;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DO_WHILE;
    }

    @Override
    public List<KernelAST> children() {
      return childList(body, condition);
    }
  }

  /*
   * The nodes below have no production in the grammar yet but are part
   * of the tree model so that later passes can handle them.
   */

  public static class Switch extends KernelAST {
    private final KernelAST expression;
    private final ImmutableList<KernelAST> cases;

    public Switch(int line, int col, KernelAST expression,
                  List<KernelAST> cases) {
      super(line, col);
      this.expression = expression;
      this.cases = ImmutableList.copyOf(cases);
    }

    public KernelAST getExpression() {
      return expression;
    }

    /**
     * @return Case and Default nodes
     */
    public List<KernelAST> getCases() {
      return cases;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SWITCH;
    }

    @Override
    public List<KernelAST> children() {
      return childList(expression, cases);
    }
  }

  public static class Case extends KernelAST {
    private final KernelAST value;
    private final ImmutableList<KernelAST> statements;

    public Case(int line, int col, KernelAST value,
                List<KernelAST> statements) {
      super(line, col);
      this.value = value;
      this.statements = ImmutableList.copyOf(statements);
    }

    public KernelAST getValue() {
      return value;
    }

    public List<KernelAST> getStatements() {
      return statements;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CASE;
    }

    @Override
    public List<KernelAST> children() {
      return childList(value, statements);
    }
  }

  public static class Default extends KernelAST {
    private final ImmutableList<KernelAST> statements;

    public Default(int line, int col, List<KernelAST> statements) {
      super(line, col);
      this.statements = ImmutableList.copyOf(statements);
    }

    public List<KernelAST> getStatements() {
      return statements;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DEFAULT;
    }

    @Override
    public List<KernelAST> children() {
      return statements;
    }
  }

  public static class Break extends KernelAST {
    public Break(int line, int col) {
      super(line, col);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BREAK;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }
  }

  public static class Continue extends KernelAST {
    public Continue(int line, int col) {
      super(line, col);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONTINUE;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }
  }

  public static class Goto extends KernelAST {
    private final String label;

    public Goto(int line, int col, String label) {
      super(line, col);
      this.label = label;
    }

    public String getLabel() {
      return label;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.GOTO;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }

    @Override
    public String summary() {
      return label;
    }
  }

  public static class Label extends KernelAST {
    private final String name;
    private final KernelAST statement;

    public Label(int line, int col, String name, KernelAST statement) {
      super(line, col);
      this.name = name;
      this.statement = statement;
    }

    public String getName() {
      return name;
    }

    public KernelAST getStatement() {
      return statement;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.LABEL;
    }

    @Override
    public List<KernelAST> children() {
      return childList(statement);
    }

    @Override
    public String summary() {
      return name;
    }
  }
}
