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

package meshdb.util;

import org.jetlang.core.BatchExecutor;
import org.jetlang.core.EventReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * BatchExecutor that runs every event of a batch even if an earlier one throws. Each Throwable is
 * logged with the name of the fiber it came from and then handed to the handler, which runs on the
 * failing fiber and can take remedial action (e.g. fail the owning service).
 */
public class ExceptionHandlingBatchExecutor implements BatchExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(ExceptionHandlingBatchExecutor.class);

  private final String fiberName;
  private final Consumer<Throwable> handler;

  public ExceptionHandlingBatchExecutor(String fiberName, Consumer<Throwable> handler) {
    this.fiberName = fiberName;
    this.handler = handler;
  }

  public ExceptionHandlingBatchExecutor(Consumer<Throwable> handler) {
    this("unnamed", handler);
  }

  @Override
  public void execute(EventReader toExecute) {
    for (int i = 0; i < toExecute.size(); i++) {
      try {
        toExecute.get(i).run();
      } catch (Throwable throwable) {
        LOG.debug("fiber {} callback threw", fiberName, throwable);
        handler.accept(throwable);
      }
    }
  }
}
