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

import org.jetlang.fibers.Fiber;

import java.util.function.Consumer;

/**
 * Source of fibers for components that own their own single-threaded execution context. The
 * caller is responsible for starting and disposing the fiber it gets.
 */
@FunctionalInterface
public interface FiberSupplier {
  /**
   * @param throwableHandler receives anything thrown out of a callback run on the fiber.
   */
  Fiber getFiber(Consumer<Throwable> throwableHandler);
}
