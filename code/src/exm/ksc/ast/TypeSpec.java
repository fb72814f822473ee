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
package exm.ksc.ast;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.ksc.common.lang.Types;
import exm.ksc.common.lang.Types.ArrayType;
import exm.ksc.common.lang.Types.Type;

/**
 * A type as spelled in source: optional signedness, one or more base
 * words, trailing pointer stars and, for typedef aliases, array
 * dimensions.
 */
public class TypeSpec {

  private final String signedness;
  private final ImmutableList<String> baseWords;
  private final int pointerDepth;
  private final int arrayDims;

  public TypeSpec(String signedness, List<String> baseWords,
                  int pointerDepth, int arrayDims) {
    assert(!baseWords.isEmpty());
    this.signedness = signedness;
    this.baseWords = ImmutableList.copyOf(baseWords);
    this.pointerDepth = pointerDepth;
    this.arrayDims = arrayDims;
  }

  public static TypeSpec simple(String baseName) {
    return new TypeSpec(null, ImmutableList.of(baseName), 0, 0);
  }

  /**
   * @return "signed" or "unsigned", or null if not given
   */
  public String signedness() {
    return signedness;
  }

  /**
   * @return name used to resolve the type: the first base word, which
   *         for multi-word spellings like "long long" is a primitive
   */
  public String baseName() {
    return baseWords.get(0);
  }

  public int pointerDepth() {
    return pointerDepth;
  }

  public int arrayDims() {
    return arrayDims;
  }

  public boolean isVoid() {
    return baseName().equals("void") && pointerDepth == 0 && arrayDims == 0;
  }

  /**
   * @return same spelling with pointer and array suffixes added
   */
  public TypeSpec derive(int extraPointers, int extraDims) {
    return new TypeSpec(signedness, baseWords, pointerDepth + extraPointers,
                        arrayDims + extraDims);
  }

  public Type toType() {
    Type result = Types.fromName(baseName(), pointerDepth);
    for (int i = 0; i < arrayDims; i++) {
      result = new ArrayType(result);
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeSpec)) {
      return false;
    }
    TypeSpec o = (TypeSpec)obj;
    return StringUtils.equals(signedness, o.signedness) &&
           baseWords.equals(o.baseWords) &&
           pointerDepth == o.pointerDepth && arrayDims == o.arrayDims;
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  /**
   * E.g. "unsigned int", "char*", "Node*[]"
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (signedness != null) {
      sb.append(signedness).append(' ');
    }
    sb.append(StringUtils.join(baseWords, ' '));
    sb.append(StringUtils.repeat('*', pointerDepth));
    sb.append(StringUtils.repeat("[]", arrayDims));
    return sb.toString();
  }
}
