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

package org.rangeopt.arith;

import java.util.ArrayDeque;
import java.util.List;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;
import org.rangeopt.range.IntRangeAnalysis;
import org.rangeopt.rewrite.RewriteListener;

/**
 * Keeps an {@link IntRangeAnalysis} sound while the IR is rewritten: whenever an operation is
 * erased, modified or replaced, the range states of its results and of everything computed from
 * them are evicted, so that they will be recomputed by the next {@link IntRangeAnalysis#solve}.
 *
 * <p>The traversal stops at values that have no state, since anything computed from them has
 * already been evicted (or was never computed).
 */
public class RangeInvalidator implements RewriteListener {

  private final IntRangeAnalysis analysis;
  private final ArrayDeque<Value> queue = new ArrayDeque<>();

  /** The total number of states evicted by this listener. */
  private int numEvicted;

  public RangeInvalidator(IntRangeAnalysis analysis) {
    this.analysis = analysis;
  }

  public int numEvicted() {
    return numEvicted;
  }

  @Override
  public void notifyOperationErased(Operation op) {
    flush(op);
  }

  @Override
  public void notifyOperationModified(Operation op) {
    flush(op);
  }

  @Override
  public void notifyOperationReplaced(Operation op, Operation replacement) {
    flush(op);
  }

  @Override
  public void notifyOperationReplaced(Operation op, List<Value> replacement) {
    flush(op);
  }

  private void flush(Operation op) {
    for (Value result : op.results()) {
      flush(result);
    }
  }

  /** Evicts the state of {@code start} and of every value transitively computed from it. */
  void flush(Value start) {
    assert queue.isEmpty();
    queue.add(start);
    for (Value v = queue.poll(); v != null; v = queue.poll()) {
      if (!analysis.evict(v)) {
        continue;
      }
      ++numEvicted;
      for (Operation user : v.users()) {
        queue.addAll(user.results());
      }
    }
  }
}
