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
 * Declared shape of a table: its primary key attribute and the attributes it was defined with.
 */
public final class TableSchema {
  public final String primaryKey;
  public final ImmutableList<String> attributes;

  public TableSchema(String primaryKey, ImmutableList<String> attributes) {
    this.primaryKey = primaryKey;
    this.attributes = attributes;
  }

  @Override
  public String toString() {
    return "TableSchema{primaryKey='" + primaryKey + "', attributes=" + attributes + '}';
  }
}
