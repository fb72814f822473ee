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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.ksc.ast.KernelAST;
import exm.ksc.common.exceptions.DoubleDefineException;
import exm.ksc.common.exceptions.KSCRuntimeError;
import exm.ksc.common.lang.Types.Type;

/**
 * All scopes created during one analysis, stored in creation order.
 *
 * A cursor marks the current scope.  Entering a construct creates a child
 * of the current scope and moves the cursor there; leaving moves it back
 * to the parent.  Scopes are never removed, so the whole tree is
 * available after the walk.
 */
public class ScopeTree {

  public static final int GLOBAL = 0;

  private final List<Scope> scopes = new ArrayList<Scope>();
  private int current;

  public ScopeTree() {
    scopes.add(new Scope(GLOBAL, Scope.NO_PARENT, "global", 0));
    current = GLOBAL;
  }

  /**
   * Create a child of the current scope and make it current
   * @return index of the new scope
   */
  public int enterScope(String name) {
    Scope parent = scopes.get(current);
    int id = scopes.size();
    scopes.add(new Scope(id, current, name, parent.getLevel() + 1));
    parent.addChild(id);
    current = id;
    return id;
  }

  /**
   * Make the parent of the current scope current
   */
  public void leaveScope() {
    int parent = scopes.get(current).getParent();
    if (parent == Scope.NO_PARENT) {
      throw new KSCRuntimeError("Cannot leave global scope");
    }
    current = parent;
  }

  public Scope currentScope() {
    return scopes.get(current);
  }

  public int currentLevel() {
    return currentScope().getLevel();
  }

  public Scope getScope(int id) {
    return scopes.get(id);
  }

  public Scope globalScope() {
    return scopes.get(GLOBAL);
  }

  /**
   * @return every scope created so far, in creation order
   */
  public List<Scope> getScopes() {
    return Collections.unmodifiableList(scopes);
  }

  /**
   * Find the innermost visible symbol with this name
   * @return the symbol, or null if not declared in the current scope or
   *         any enclosing one
   */
  public Symbol lookup(String name) {
    int id = current;
    while (id != Scope.NO_PARENT) {
      Scope scope = scopes.get(id);
      Symbol sym = scope.lookupLocal(name);
      if (sym != null) {
        return sym;
      }
      id = scope.getParent();
    }
    return null;
  }

  public Symbol lookupLocal(String name) {
    return currentScope().lookupLocal(name);
  }

  /**
   * Declare a symbol in the current scope
   * @param declaration declaring node, null for built-ins
   * @throws DoubleDefineException if the name is already declared in the
   *        current scope
   */
  public Symbol declare(String name, Symbol.Kind kind, Type type,
      KernelAST declaration, boolean constant) throws DoubleDefineException {
    Scope scope = currentScope();
    if (scope.lookupLocal(name) != null) {
      if (declaration == null) {
        throw new DoubleDefineException(name);
      }
      throw new DoubleDefineException(declaration.getLine(),
                                      declaration.getColumn(), name);
    }
    Symbol sym = new Symbol(name, kind, type, declaration, scope.getId(),
                            scope.getLevel(), constant);
    scope.put(sym);
    return sym;
  }
}
