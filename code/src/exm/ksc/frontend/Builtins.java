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

import java.util.Set;

import exm.ksc.common.exceptions.DoubleDefineException;
import exm.ksc.common.exceptions.KSCRuntimeError;
import exm.ksc.common.lang.PrimitiveSizes;
import exm.ksc.common.lang.Types.PrimitiveType;

/**
 * Names predefined by the language
 */
public class Builtins {

  /**
     Is this the name of a built-in type?
   */
  public static boolean isType(String name) {
    return PrimitiveSizes.isPrimitive(name);
  }

  public static Set<String> typeNames() {
    return PrimitiveSizes.names();
  }

  /**
   * Register built-in type names in the global scope
   */
  public static void register(ScopeTree scopes) {
    if (scopes.currentScope() != scopes.globalScope()) {
      throw new KSCRuntimeError("Built-ins must go in global scope");
    }
    for (String name: typeNames()) {
      try {
        scopes.declare(name, Symbol.Kind.TYPE, new PrimitiveType(name), null,
                       true);
      } catch (DoubleDefineException e) {
        throw new KSCRuntimeError("Built-in " + name + " declared twice");
      }
    }
  }
}
