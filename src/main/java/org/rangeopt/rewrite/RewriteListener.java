/*
 * Copyright 2025 The Rangeopt Authors
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
 * limitations under the License.
 */

package org.rangeopt.rewrite;

import java.util.List;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;

/**
 * Receives synchronous notifications of each change that a {@link PatternRewriter} makes to the
 * IR. Notifications are delivered before the change takes effect for replacement and erasure (so
 * the affected operation's results still have their original uses) and after it for insertion and
 * in-place modification.
 *
 * <p>All methods have empty default implementations.
 */
public interface RewriteListener {

  /** Called after {@code op} has been inserted into the region. */
  default void notifyOperationInserted(Operation op) {}

  /** Called before {@code op} is removed from the region. */
  default void notifyOperationErased(Operation op) {}

  /** Called after {@code op}'s operands or result types were changed in place. */
  default void notifyOperationModified(Operation op) {}

  /** Called before all uses of {@code op}'s results are redirected to {@code replacement}'s. */
  default void notifyOperationReplaced(Operation op, Operation replacement) {}

  /** Called before all uses of {@code op}'s results are redirected to {@code replacement}. */
  default void notifyOperationReplaced(Operation op, List<Value> replacement) {}

  /** Returns a listener that forwards each notification to {@code first}, then {@code second}. */
  static RewriteListener chain(RewriteListener first, RewriteListener second) {
    return new RewriteListener() {
      @Override
      public void notifyOperationInserted(Operation op) {
        first.notifyOperationInserted(op);
        second.notifyOperationInserted(op);
      }

      @Override
      public void notifyOperationErased(Operation op) {
        first.notifyOperationErased(op);
        second.notifyOperationErased(op);
      }

      @Override
      public void notifyOperationModified(Operation op) {
        first.notifyOperationModified(op);
        second.notifyOperationModified(op);
      }

      @Override
      public void notifyOperationReplaced(Operation op, Operation replacement) {
        first.notifyOperationReplaced(op, replacement);
        second.notifyOperationReplaced(op, replacement);
      }

      @Override
      public void notifyOperationReplaced(Operation op, List<Value> replacement) {
        first.notifyOperationReplaced(op, replacement);
        second.notifyOperationReplaced(op, replacement);
      }
    };
  }
}
