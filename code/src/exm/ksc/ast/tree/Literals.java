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

import java.math.BigInteger;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.ksc.ast.Escapes;
import exm.ksc.ast.KernelAST;
import exm.ksc.ast.NodeKind;

/**
 * Literal value nodes.  None of these have children.
 */
public class Literals {

  private abstract static class Leaf extends KernelAST {
    protected Leaf(int line, int col) {
      super(line, col);
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }
  }

  public static class NumberLiteral extends Leaf {
    /**
     * Long for integer literals, BigInteger for integer literals beyond
     * the range of long, Double for floating point
     */
    private final Number value;

    public NumberLiteral(int line, int col, Number value) {
      super(line, col);
      this.value = value;
    }

    public Number getValue() {
      return value;
    }

    public boolean isInteger() {
      return value instanceof Long || value instanceof BigInteger;
    }

    public boolean isZero() {
      return value.doubleValue() == 0.0;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.NUMBER;
    }

    @Override
    public String summary() {
      return value.toString();
    }
  }

  public static class StringLiteral extends Leaf {
    private final String value;

    public StringLiteral(int line, int col, String value) {
      super(line, col);
      this.value = value;
    }

    /**
     * @return decoded value
     */
    public String getValue() {
      return value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRING;
    }

    @Override
    public String summary() {
      return Escapes.quoteString(value);
    }
  }

  public static class CharLiteral extends Leaf {
    private final String value;

    public CharLiteral(int line, int col, String value) {
      super(line, col);
      this.value = value;
    }

    public String getValue() {
      return value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CHAR;
    }

    @Override
    public String summary() {
      return Escapes.quoteChar(value);
    }
  }

  public static class BoolLiteral extends Leaf {
    private final boolean value;

    public BoolLiteral(int line, int col, boolean value) {
      super(line, col);
      this.value = value;
    }

    public boolean getValue() {
      return value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BOOL;
    }

    @Override
    public String summary() {
      return Boolean.toString(value);
    }
  }

  public static class NullLiteral extends Leaf {
    public NullLiteral(int line, int col) {
      super(line, col);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.NULL;
    }
  }
}
