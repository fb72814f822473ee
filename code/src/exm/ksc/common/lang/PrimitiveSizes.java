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

import java.util.Set;

import com.google.common.collect.ImmutableMap;

/**
 * Byte sizes of the built-in primitive types.  The key set doubles as
 * the list of built-in type names.
 */
public class PrimitiveSizes {

  private static final ImmutableMap<String, Integer> SIZES =
      ImmutableMap.<String, Integer>builder()
        .put("void", 0)
        .put("char", 1)
        .put("short", 2)
        .put("int", 4)
        .put("long", 8)
        .put("float", 4)
        .put("double", 8)
        .put("bool", 1)
        .build();

  public static boolean isPrimitive(String name) {
    return SIZES.containsKey(name);
  }

  /**
   * @param name
   * @return size in bytes, or -1 if not a primitive type
   */
  public static int sizeOf(String name) {
    Integer size = SIZES.get(name);
    return size == null ? -1 : size;
  }

  public static Set<String> names() {
    return SIZES.keySet();
  }
}
