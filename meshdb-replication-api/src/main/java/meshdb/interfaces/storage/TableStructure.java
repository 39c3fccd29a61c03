/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package meshdb.interfaces.storage;

import com.google.common.collect.ImmutableList;

/**
 * The record-shape dictionary of a table: field names addressed by position. It only ever grows;
 * an encoded record refers to fields by their index here.
 */
public final class TableStructure {
  public static final TableStructure EMPTY = new TableStructure(ImmutableList.of());

  public final ImmutableList<String> fieldNames;

  public TableStructure(ImmutableList<String> fieldNames) {
    this.fieldNames = fieldNames;
  }

  public int size() {
    return fieldNames.size();
  }

  public int indexOf(String fieldName) {
    return fieldNames.indexOf(fieldName);
  }

  public String fieldName(int index) {
    if (index < 0 || index >= fieldNames.size()) {
      throw new IndexOutOfBoundsException("field index " + index + " is not in a structure of " + size());
    }
    return fieldNames.get(index);
  }

  /**
   * This structure with the given field appended, or this structure if it already has it.
   */
  public TableStructure with(String fieldName) {
    if (fieldNames.contains(fieldName)) {
      return this;
    }
    return new TableStructure(ImmutableList.<String>builder().addAll(fieldNames).add(fieldName).build());
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TableStructure && ((TableStructure) o).fieldNames.equals(fieldNames);
  }

  @Override
  public int hashCode() {
    return fieldNames.hashCode();
  }

  @Override
  public String toString() {
    return "TableStructure" + fieldNames;
  }
}
