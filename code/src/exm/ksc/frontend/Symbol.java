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
package exm.ksc.frontend;

import java.util.Locale;

import exm.ksc.ast.KernelAST;
import exm.ksc.common.lang.Types.Type;

/**
 * Compile-time record of a declared name.  Usage and initialization are
 * tracked as the analyzer walks the program.
 */
public class Symbol {

  public static enum Kind {
    /** built-in, struct, union, enum or typedef name */
    TYPE,
    FUNCTION,
    VARIABLE,
    PARAMETER,
    /** struct or union member */
    FIELD,
    ENUM_CONSTANT,
    MACRO;

    /**
     * @return true if an unreferenced symbol of this kind is worth a
     *        warning
     */
    public boolean reportUnused() {
      return this != TYPE && this != FUNCTION;
    }

    /**
     * @return noun used in diagnostics
     */
    public String describe() {
      switch (this) {
        case ENUM_CONSTANT:
          return "enumerator";
        case MACRO:
          return "macro";
        default:
          return name().toLowerCase(Locale.ROOT);
      }
    }
  }

  private final String name;
  private final Kind kind;
  private final Type type;
  private final KernelAST declaration;
  private final int scopeId;
  private final int level;
  private final boolean constant;
  private boolean used = false;
  private boolean initialized = false;

  public Symbol(String name, Kind kind, Type type, KernelAST declaration,
                int scopeId, int level, boolean constant) {
    this.name = name;
    this.kind = kind;
    this.type = type;
    this.declaration = declaration;
    this.scopeId = scopeId;
    this.level = level;
    this.constant = constant;
  }

  public String getName() {
    return name;
  }

  public Kind getKind() {
    return kind;
  }

  public Type getType() {
    return type;
  }

  /**
   * @return declaring node, or null for built-ins
   */
  public KernelAST getDeclaration() {
    return declaration;
  }

  public int getScopeId() {
    return scopeId;
  }

  public int getLevel() {
    return level;
  }

  public boolean isConstant() {
    return constant;
  }

  public boolean isUsed() {
    return used;
  }

  public void markUsed() {
    this.used = true;
  }

  public boolean isInitialized() {
    return initialized;
  }

  public void markInitialized() {
    this.initialized = true;
  }

  public int getLine() {
    return declaration == null ? 0 : declaration.getLine();
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase() + " " + name + ": " + type +
           " (level " + level + (constant ? ", const" : "") + ")";
  }
}
