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

import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * FiberSupplier handing out one daemon ThreadFiber per call, each guarded by an
 * {@link ExceptionHandlingBatchExecutor}. Thread names are prefix-N so that log lines can be
 * attributed to the component owning the fiber.
 */
public class ThreadFiberSupplier implements FiberSupplier {
  private final String namePrefix;
  private final AtomicInteger counter = new AtomicInteger(0);

  public ThreadFiberSupplier(String namePrefix) {
    this.namePrefix = namePrefix;
  }

  @Override
  public Fiber getFiber(Consumer<Throwable> throwableHandler) {
    String name = namePrefix + "-" + counter.incrementAndGet();
    return new ThreadFiber(
        new RunnableExecutorImpl(new ExceptionHandlingBatchExecutor(name, throwableHandler)),
        name,
        true);
  }
}
