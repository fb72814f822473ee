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
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.ksc.ast.KernelAST;
import exm.ksc.ast.NodeKind;
import exm.ksc.ast.TypeSpec;

/**
 * Declaration nodes: preprocessor directives, variables, functions and
 * user-defined types.
 */
public class Declarations {

  public static class Include extends KernelAST {
    private final String filename;
    /** true for the angle bracket form */
    private final boolean system;

    public Include(int line, int col, String filename, boolean system) {
      super(line, col);
      this.filename = filename;
      this.system = system;
    }

    public String getFilename() {
      return filename;
    }

    public boolean isSystem() {
      return system;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.INCLUDE;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }

    @Override
    public String summary() {
      return system ? "<" + filename + ">" : "\"" + filename + "\"";
    }
  }

  public static class Define extends KernelAST {
    private final String name;
    private final KernelAST value;

    public Define(int line, int col, String name, KernelAST value) {
      super(line, col);
      this.name = name;
      this.value = value;
    }

    public String getName() {
      return name;
    }

    /**
     * @return replacement expression, or null for a bare #define NAME
     */
    public KernelAST getValue() {
      return value;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.DEFINE;
    }

    @Override
    public List<KernelAST> children() {
      return childList(value);
    }

    @Override
    public String summary() {
      return name;
    }
  }

  public static class VariableDecl extends KernelAST {
    private final TypeSpec type;
    private final String name;
    private final KernelAST value;
    private final ImmutableList<String> modifiers;

    public VariableDecl(int line, int col, TypeSpec type, String name,
                        KernelAST value, List<String> modifiers) {
      super(line, col);
      this.type = type;
      this.name = name;
      this.value = value;
      this.modifiers = ImmutableList.copyOf(modifiers);
    }

    public TypeSpec getType() {
      return type;
    }

    public String getName() {
      return name;
    }

    /**
     * @return initializer, or null if none
     */
    public KernelAST getValue() {
      return value;
    }

    public List<String> getModifiers() {
      return modifiers;
    }

    public boolean isConst() {
      return modifiers.contains("const");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VARIABLE_DECL;
    }

    @Override
    public List<KernelAST> children() {
      return childList(value);
    }

    @Override
    public String summary() {
      return prefix(modifiers) + type + " " + name;
    }
  }

  public static class ArrayDeclaration extends KernelAST {
    private final TypeSpec elementType;
    private final String name;
    private final KernelAST size;
    private final ImmutableList<KernelAST> initializers;
    private final ImmutableList<String> modifiers;

    /**
     * @param size explicit size expression, or null for []
     * @param initializers brace initializer elements, or null if the
     *        declaration has no initializer
     */
    public ArrayDeclaration(int line, int col, TypeSpec elementType,
        String name, KernelAST size, List<KernelAST> initializers,
        List<String> modifiers) {
      super(line, col);
      this.elementType = elementType;
      this.name = name;
      this.size = size;
      this.initializers = initializers == null ? null :
                                  ImmutableList.copyOf(initializers);
      this.modifiers = ImmutableList.copyOf(modifiers);
    }

    public TypeSpec getElementType() {
      return elementType;
    }

    public String getName() {
      return name;
    }

    public KernelAST getSize() {
      return size;
    }

    public boolean hasInitializer() {
      return initializers != null;
    }

    public List<KernelAST> getInitializers() {
      return initializers == null ? ImmutableList.<KernelAST>of() :
                                    initializers;
    }

    public List<String> getModifiers() {
      return modifiers;
    }

    public boolean isConst() {
      return modifiers.contains("const");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ARRAY_DECL;
    }

    @Override
    public List<KernelAST> children() {
      return childList(size, initializers);
    }

    @Override
    public String summary() {
      return prefix(modifiers) + elementType + " " + name + "[]" +
          (initializers == null ? "" : " = {" + initializers.size() + "}");
    }
  }

  public static class Param extends KernelAST {
    private final TypeSpec type;
    private final String name;

    public Param(int line, int col, TypeSpec type, String name) {
      super(line, col);
      this.type = type;
      this.name = name;
    }

    public TypeSpec getType() {
      return type;
    }

    /**
     * @return parameter name, or null if omitted
     */
    public String getName() {
      return name;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.PARAM;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }

    @Override
    public String summary() {
      return type + (name == null ? "" : " " + name);
    }
  }

  public static class FunctionDecl extends KernelAST {
    private final TypeSpec returnType;
    private final String name;
    private final ImmutableList<Param> params;
    private final Statements.Block body;
    private final ImmutableList<String> modifiers;

    public FunctionDecl(int line, int col, TypeSpec returnType, String name,
        List<Param> params, Statements.Block body, List<String> modifiers) {
      super(line, col);
      this.returnType = returnType;
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.body = body;
      this.modifiers = ImmutableList.copyOf(modifiers);
    }

    public TypeSpec getReturnType() {
      return returnType;
    }

    public String getName() {
      return name;
    }

    public List<Param> getParams() {
      return params;
    }

    /**
     * @return body, or null for a prototype
     */
    public Statements.Block getBody() {
      return body;
    }

    public boolean isPrototype() {
      return body == null;
    }

    public List<String> getModifiers() {
      return modifiers;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.FUNCTION_DECL;
    }

    @Override
    public List<KernelAST> children() {
      return childList(params, body);
    }

    @Override
    public String summary() {
      return prefix(modifiers) + name + " -> " + returnType +
             (body == null ? " (prototype)" : "");
    }
  }

  /**
   * Common structure of struct and union declarations
   */
  public abstract static class AggregateDecl extends KernelAST {
    private final String name;
    private final ImmutableList<KernelAST> fields;

    protected AggregateDecl(int line, int col, String name,
                            List<KernelAST> fields) {
      super(line, col);
      this.name = name;
      this.fields = ImmutableList.copyOf(fields);
    }

    /**
     * @return tag name, empty if anonymous
     */
    public String getName() {
      return name;
    }

    /**
     * @return VariableDecl or ArrayDeclaration per field
     */
    public List<KernelAST> getFields() {
      return fields;
    }

    public abstract boolean isUnion();

    @Override
    public List<KernelAST> children() {
      return fields;
    }

    @Override
    public String summary() {
      return (name.isEmpty() ? "<anonymous>" : name) +
             " (" + fields.size() + " fields)";
    }
  }

  public static class StructDecl extends AggregateDecl {
    public StructDecl(int line, int col, String name, List<KernelAST> fields) {
      super(line, col, name, fields);
    }

    @Override
    public boolean isUnion() {
      return false;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STRUCT_DECL;
    }
  }

  public static class UnionDecl extends AggregateDecl {
    public UnionDecl(int line, int col, String name, List<KernelAST> fields) {
      super(line, col, name, fields);
    }

    @Override
    public boolean isUnion() {
      return true;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.UNION_DECL;
    }
  }

  public static class EnumDecl extends KernelAST {
    private final String name;
    private final ImmutableMap<String, Number> values;
    private final ImmutableMap<String, KernelAST> initializers;

    /**
     * @param values enumerator values in declaration order: Long
     *        unless a literal initializer was floating point or too
     *        large for a long
     * @param initializers explicit initializer expressions by enumerator
     */
    public EnumDecl(int line, int col, String name, Map<String, Number> values,
                    Map<String, KernelAST> initializers) {
      super(line, col);
      this.name = name;
      this.values = ImmutableMap.copyOf(values);
      this.initializers = ImmutableMap.copyOf(initializers);
    }

    /**
     * @return tag name, empty if anonymous
     */
    public String getName() {
      return name;
    }

    public Map<String, Number> getValues() {
      return values;
    }

    /**
     * @return initializer written for enumerator, or null
     */
    public KernelAST getInitializer(String enumerator) {
      return initializers.get(enumerator);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.ENUM_DECL;
    }

    @Override
    public List<KernelAST> children() {
      return initializers.values().asList();
    }

    @Override
    public String summary() {
      return (name.isEmpty() ? "<anonymous>" : name) + " " + values;
    }
  }

  /**
   * typedef.  Only the first alias of a comma-separated alias list is
   * kept.
   */
  public static class Typedef extends KernelAST {
    private final TypeSpec type;
    private final String alias;

    public Typedef(int line, int col, TypeSpec type, String alias) {
      super(line, col);
      this.type = type;
      this.alias = alias;
    }

    /**
     * @return aliased type, including the alias's own pointer and
     *        array suffixes
     */
    public TypeSpec getType() {
      return type;
    }

    public String getAlias() {
      return alias;
    }

    @Override
    public NodeKind kind() {
      return NodeKind.TYPEDEF;
    }

    @Override
    public List<KernelAST> children() {
      return ImmutableList.of();
    }

    @Override
    public String summary() {
      return alias + " = " + type;
    }
  }

  private static String prefix(List<String> modifiers) {
    return modifiers.isEmpty() ? "" : StringUtils.join(modifiers, ' ') + " ";
  }
}
