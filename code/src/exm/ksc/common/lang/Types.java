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
package exm.ksc.common.lang;

import exm.ksc.common.exceptions.KSCRuntimeError;

/**
 * Type descriptors attached to symbols.
 *
 * Descriptors are compared structurally.  No conversion or compatibility
 * rules live here: the front end only needs to record what a name was
 * declared as.
 */
public class Types {

  public abstract static class Type {

    /**
     * @return name of the type the descriptor is ultimately built on,
     *    e.g. "int" for int*[]
     */
    public abstract String baseName();

    public boolean isVoid() {
      return false;
    }

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();
  }

  /**
   * One of the built-in types listed in {@link PrimitiveSizes}
   */
  public static class PrimitiveType extends Type {
    private final String name;

    public PrimitiveType(String name) {
      if (!PrimitiveSizes.isPrimitive(name)) {
        throw new KSCRuntimeError("Not a primitive type: " + name);
      }
      this.name = name;
    }

    public String name() {
      return name;
    }

    public int size() {
      return PrimitiveSizes.sizeOf(name);
    }

    @Override
    public String baseName() {
      return name;
    }

    @Override
    public boolean isVoid() {
      return name.equals("void");
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PrimitiveType &&
             ((PrimitiveType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * Reference to a user-declared type by name: a typedef alias,
   * struct, union or enum name
   */
  public static class NamedType extends Type {
    private final String name;

    public NamedType(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String baseName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof NamedType &&
             ((NamedType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + 1;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class PointerType extends Type {
    private final Type target;

    public PointerType(Type target) {
      this.target = target;
    }

    public Type target() {
      return target;
    }

    @Override
    public String baseName() {
      return target.baseName();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof PointerType &&
             ((PointerType)other).target.equals(target);
    }

    @Override
    public int hashCode() {
      return 31 * target.hashCode() + 2;
    }

    @Override
    public String toString() {
      return target + "*";
    }
  }

  public static class ArrayType extends Type {
    private final Type element;

    public ArrayType(Type element) {
      this.element = element;
    }

    public Type element() {
      return element;
    }

    @Override
    public String baseName() {
      return element.baseName();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof ArrayType &&
             ((ArrayType)other).element.equals(element);
    }

    @Override
    public int hashCode() {
      return 31 * element.hashCode() + 3;
    }

    @Override
    public String toString() {
      return element + "[]";
    }
  }

  public static class FunctionType extends Type {
    private final Type returnType;

    public FunctionType(Type returnType) {
      this.returnType = returnType;
    }

    public Type returnType() {
      return returnType;
    }

    @Override
    public String baseName() {
      return returnType.baseName();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof FunctionType &&
             ((FunctionType)other).returnType.equals(returnType);
    }

    @Override
    public int hashCode() {
      return 31 * returnType.hashCode() + 4;
    }

    @Override
    public String toString() {
      return "function:" + returnType;
    }
  }

  /**
   * Struct or union type.  Anonymous aggregates have an empty name.
   */
  public static class StructType extends Type {
    private final String name;
    private final boolean union;

    public StructType(String name, boolean union) {
      this.name = name;
      this.union = union;
    }

    public String name() {
      return name;
    }

    public boolean isUnion() {
      return union;
    }

    @Override
    public String baseName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof StructType)) {
        return false;
      }
      StructType o = (StructType)other;
      return o.name.equals(name) && o.union == union;
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + (union ? 5 : 6);
    }

    @Override
    public String toString() {
      return (union ? "union:" : "struct:") + name;
    }
  }

  public static class EnumType extends Type {
    private final String name;

    public EnumType(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public String baseName() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof EnumType &&
             ((EnumType)other).name.equals(name);
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + 7;
    }

    @Override
    public String toString() {
      return "enum:" + name;
    }
  }

  public static final PrimitiveType INT = new PrimitiveType("int");
  public static final PrimitiveType VOID = new PrimitiveType("void");

  /**
   * @param baseName built-in or user type name
   * @param pointerDepth number of trailing '*'
   * @return descriptor for the spelled type
   */
  public static Type fromName(String baseName, int pointerDepth) {
    Type result;
    if (PrimitiveSizes.isPrimitive(baseName)) {
      result = new PrimitiveType(baseName);
    } else {
      result = new NamedType(baseName);
    }
    for (int i = 0; i < pointerDepth; i++) {
      result = new PointerType(result);
    }
    return result;
  }
}
