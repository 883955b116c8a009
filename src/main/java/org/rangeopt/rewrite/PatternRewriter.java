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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.Location;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Region;
import org.rangeopt.ir.Value;

/**
 * The only way that {@link RewritePattern}s should change the IR. Each change is reported to a
 * {@link RewriteListener} so that the rewrite driver and any analyses can react to it.
 *
 * <p>New operations are inserted immediately before the current insertion point.
 */
public class PatternRewriter {

  private final Region region;
  private final RewriteListener listener;
  private @Nullable Operation insertionPoint;

  public PatternRewriter(Region region, RewriteListener listener) {
    this.region = region;
    this.listener = listener;
  }

  public Region region() {
    return region;
  }

  /** Subsequently created operations will be inserted immediately before {@code op}. */
  public void setInsertionPoint(Operation op) {
    Preconditions.checkArgument(op.region() == region, "%s is not in this region", op);
    insertionPoint = op;
  }

  /** Creates a new operation at the insertion point. */
  @CanIgnoreReturnValue
  public Operation create(
      OpKind kind,
      @Nullable IntType resultType,
      List<Value> operands,
      ImmutableMap<String, Object> attributes,
      Location location) {
    Preconditions.checkState(insertionPoint != null, "No insertion point");
    Operation op = Operation.create(kind, resultType, operands, attributes, location);
    region.insertBefore(insertionPoint, op);
    listener.notifyOperationInserted(op);
    return op;
  }

  /** Creates a new {@link OpKind#CONSTANT} at the insertion point and returns its result. */
  public Value createConstant(IntType type, BigInteger value, Location location) {
    return create(
            OpKind.CONSTANT,
            type,
            List.of(),
            ImmutableMap.of(OpKind.VALUE_ATTR, value),
            location)
        .result();
  }

  /**
   * Redirects all uses of {@code op}'s results to the corresponding elements of {@code
   * replacement}, and then erases {@code op}.
   */
  public void replaceOp(Operation op, List<Value> replacement) {
    List<Value> results = op.results();
    Preconditions.checkArgument(
        results.size() == replacement.size(), "Wrong number of replacement values");
    listener.notifyOperationReplaced(op, replacement);
    for (int i = 0; i < results.size(); i++) {
      results.get(i).replaceAllUsesWith(replacement.get(i));
    }
    eraseOp(op);
  }

  /**
   * Creates a new operation immediately before {@code op}, redirects all uses of {@code op}'s
   * result to the new operation's result, and then erases {@code op}. The new operation has the
   * same location as {@code op}.
   */
  @CanIgnoreReturnValue
  public Operation replaceOpWithNewOp(
      Operation op,
      OpKind kind,
      IntType resultType,
      List<Value> operands,
      ImmutableMap<String, Object> attributes) {
    setInsertionPoint(op);
    Operation newOp = create(kind, resultType, operands, attributes, op.location());
    listener.notifyOperationReplaced(op, newOp);
    op.result().replaceAllUsesWith(newOp.result());
    eraseOp(op);
    return newOp;
  }

  /**
   * Runs {@code modification}, which may change {@code op}'s operands and result type (and may
   * create new operations), and then reports {@code op} as modified.
   */
  public void modifyOpInPlace(Operation op, Runnable modification) {
    modification.run();
    listener.notifyOperationModified(op);
  }

  /** Removes {@code op}, which must have no remaining uses, from the region. */
  public void eraseOp(Operation op) {
    listener.notifyOperationErased(op);
    region.erase(op);
    if (insertionPoint == op) {
      insertionPoint = null;
    }
  }
}
