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
import meshdb.interfaces.storage.TableSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of SEND_TABLE_STRUCTURE, serialized with a protostuff runtime schema.
 */
public class TableSchemaDescriptor {
  String primaryKey;
  List<String> attributes = new ArrayList<>();

  public TableSchemaDescriptor() {
  }

  public static TableSchemaDescriptor from(TableSchema schema) {
    TableSchemaDescriptor descriptor = new TableSchemaDescriptor();
    descriptor.primaryKey = schema.primaryKey;
    descriptor.attributes = new ArrayList<>(schema.attributes);
    return descriptor;
  }

  public TableSchema toSchema() {
    return new TableSchema(primaryKey == null ? "id" : primaryKey,
        attributes == null ? ImmutableList.of() : ImmutableList.copyOf(attributes));
  }
}
