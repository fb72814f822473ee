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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One lexical region and its symbol table.  Scopes live in a
 * {@link ScopeTree} and refer to each other by index.
 */
public class Scope {

  public static final int NO_PARENT = -1;

  private final int id;
  private final int parent;
  private final String name;
  private final int level;
  private final Map<String, Symbol> symbols =
                          new LinkedHashMap<String, Symbol>();
  private final List<Integer> children = new ArrayList<Integer>();

  Scope(int id, int parent, String name, int level) {
    this.id = id;
    this.parent = parent;
    this.name = name;
    this.level = level;
  }

  public int getId() {
    return id;
  }

  /**
   * @return parent index, or NO_PARENT for the global scope
   */
  public int getParent() {
    return parent;
  }

  public String getName() {
    return name;
  }

  public int getLevel() {
    return level;
  }

  public List<Integer> getChildren() {
    return Collections.unmodifiableList(children);
  }

  void addChild(int child) {
    children.add(child);
  }

  public Symbol lookupLocal(String symName) {
    return symbols.get(symName);
  }

  public Collection<Symbol> getSymbols() {
    return Collections.unmodifiableCollection(symbols.values());
  }

  void put(Symbol sym) {
    symbols.put(sym.getName(), sym);
  }

  @Override
  public String toString() {
    return name + "#" + id + " (level " + level + ", " + symbols.size() +
           " symbols)";
  }
}
