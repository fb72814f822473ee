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
import exm.ksc.ast.TypeSpec;

/**
 * Expression nodes other than literals
 */
public class Expressions {

  public static class BinaryOp extends KernelAST {
    private final String op;
    private final KernelAST left;
    private final KernelAST right;

    public BinaryOp(int line, int col, String op, KernelAST left,
                    KernelAST right) {
      super(line, col);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public String getOp() {
      return op;
    }

    public KernelAST getLeft() {
      return left;
    }

    public KernelAST getRight() {
      return right;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BINARY_OP;
    }

    @Override
    public List<KernelAST> children() {
      return childList(left, right);
    }

    @Override
    public String summary() {
      return op;
    }
  }

  public static class UnaryOp extends KernelAST {
    private final String op;
    private final KernelAST operand;
    private final boolean postfix;

    public UnaryOp(int line, int col, String op, KernelAST operand,
                   boolean postfix) {
      super(line, col);
      this.op = op;
      this.operand = operand;
      this.postfix = postfix;
    }

    public String getOp() {
      return op;
    }

    public KernelAST getOperand() {
      return operand;
    }

    public boolean isPostfix() {
      return postfix;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNARY_OP;
    }

    @Override
    public List<KernelAST> children() {
      return childList(operand);
    }

    @Override
    public String summary() {
      return postfix ? "(postfix) " + op : op;
    }
  }

  public static class Call extends KernelAST {
    private final KernelAST function;
    private final ImmutableList<KernelAST> args;

    public Call(int line, int col, KernelAST function, List<KernelAST> args) {
      super(line, col);
      this.function = function;
      this.args = ImmutableList.copyOf(args);
    }

    public KernelAST getFunction() {
      return function;
    }

    public List<KernelAST> getArgs() {
      return args;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CALL;
    }

    @Override
    public List<KernelAST> children() {
      return childList(function, args);
    }

    @Override
    public String summary() {
      return "(" + args.size() + " args)";
    }
  }

  public static class ArrayAccess extends KernelAST {
    private final KernelAST array;
    private final KernelAST index;

    public ArrayAccess(int line, int col, KernelAST array, KernelAST index) {
      super(line, col);
      this.array = array;
      this.index = index;
    }

    public KernelAST getArray() {
      return array;
    }

    public KernelAST getIndex() {
      return index;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ARRAY_ACCESS;
    }

    @Override
    public List<KernelAST> children() {
      return childList(array, index);
    }
  }

  public static class MemberAccess extends KernelAST {
    private final KernelAST object;
    private final String member;
    /** true for ->, false for . */
    private final boolean arrow;

    public MemberAccess(int line, int col, KernelAST object, String member,
                        boolean arrow) {
      super(line, col);
      this.object = object;
      this.member = member;
      this.arrow = arrow;
    }

    public KernelAST getObject() {
      return object;
    }

    public String getMember() {
      return member;
    }

    public boolean isArrow() {
      return arrow;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.MEMBER_ACCESS;
    }

    @Override
    public List<KernelAST> children() {
      return childList(object);
    }

    @Override
    public String summary() {
      return (arrow ? "->" : ".") + member;
    }
  }

  /**
   * Explicit cast.  Not produced by the grammar yet.
   */
  public static class Cast extends KernelAST {
    private final TypeSpec type;
    private final KernelAST expression;

    public Cast(int line, int col, TypeSpec type, KernelAST expression) {
      super(line, col);
      this.type = type;
      this.expression = expression;
    }

    public TypeSpec getType() {
      return type;
    }

    public KernelAST getExpression() {
      return expression;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CAST;
    }

    @Override
    public List<KernelAST> children() {
      return childList(expression);
    }

    @Override
    public String summary() {
      return "(" + type + ")";
    }
  }

  /**
   * sizeof over either a type or an expression; exactly one is non-null
   */
  public static class SizeOf extends KernelAST {
    private final TypeSpec type;
    private final KernelAST expression;

    public SizeOf(int line, int col, TypeSpec type) {
      super(line, col);
      this.type = type;
      this.expression = null;
    }

    public SizeOf(int line, int col, KernelAST expression) {
      super(line, col);
      this.type = null;
      this.expression = expression;
    }

    public boolean isType() {
      return type != null;
    }

    public TypeSpec getType() {
      return type;
    }

    public KernelAST getExpression() {
      return expression;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SIZEOF;
    }

    @Override
    public List<KernelAST> children() {
      return childList(expression);
    }

    @Override
    public String summary() {
      return type == null ? "" : "(" + type + ")";
    }
  }

  public static class Ternary extends KernelAST {
    private final KernelAST condition;
    private final KernelAST trueExpr;
    private final KernelAST falseExpr;

    public Ternary(int line, int col, KernelAST condition,
                   KernelAST trueExpr, KernelAST falseExpr) {
      super(line, col);
      this.condition = condition;
      this.trueExpr = trueExpr;
      this.falseExpr = falseExpr;
    }

    public KernelAST getCondition() {
      return condition;
    }

    public KernelAST getTrueExpr() {
      return trueExpr;
    }

    public KernelAST getFalseExpr() {
      return falseExpr;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TERNARY;
    }

    @Override
    public List<KernelAST> children() {
      return childList(condition, trueExpr, falseExpr);
    }
  }

  public static class Assignment extends KernelAST {
    private final KernelAST left;
    private final String op;
    private final KernelAST right;

    public Assignment(int line, int col, KernelAST left, String op,
                      KernelAST right) {
      super(line, col);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    public KernelAST getLeft() {
      return left;
    }

    /**
     * @return "=" or a compound operator such as "+="
     */
    public String getOp() {
      return op;
    }

    public boolean isCompound() {
      return !op.equals("=");
    }

    public KernelAST getRight() {
      return right;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ASSIGNMENT;
    }

    @Override
    public List<KernelAST> children() {
      return childList(left, right);
    }

    @Override
    public String summary() {
      return op;
    }
  }

  public static class Variable extends KernelAST {
    private final String name;

    public Variable(int line, int col, String name) {
      super(line, col);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VARIABLE;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }

    @Override
    public String summary() {
      return name;
    }
  }
}
