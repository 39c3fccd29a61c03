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

package meshdb.replication.wire;

import com.google.common.collect.ImmutableList;
import meshdb.interfaces.storage.TableStructure;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of SEND_TABLE_FIXED_STRUCTURE: the sender's whole field dictionary for one table.
 */
public class FixedStructureDescriptor {
  List<String> fieldNames = new ArrayList<>();

  public FixedStructureDescriptor() {
  }

  public static FixedStructureDescriptor from(TableStructure structure) {
    FixedStructureDescriptor descriptor = new FixedStructureDescriptor();
    descriptor.fieldNames = new ArrayList<>(structure.fieldNames);
    return descriptor;
  }

  public TableStructure toStructure() {
    return fieldNames == null ? TableStructure.EMPTY : new TableStructure(ImmutableList.copyOf(fieldNames));
  }
}
