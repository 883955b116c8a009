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

package org.rangeopt.ir;

import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.util.StringUtil;

/**
 * An SSA value: either the result of an {@link Operation} or an argument of a {@link Region}.
 *
 * <p>A Value's identity is stable for its whole lifetime, even if its type is changed by {@link
 * #setType}; analyses may use Values as keys in side tables.
 */
public final class Value {

  private IntType type;

  /** The operation that produces this value, or null if it is a region argument. */
  private final @Nullable Operation definingOp;

  /**
   * If this is a region argument with declared bounds, the smallest and largest values (read as
   * signed integers) that it may take.
   */
  private final @Nullable BigInteger assumedMin;

  private final @Nullable BigInteger assumedMax;

  /** Each operation that reads this value; an operation appears once for each operand slot. */
  private final List<Operation> users = new ArrayList<>();

  Value(IntType type, @Nullable Operation definingOp) {
    this.type = type;
    this.definingOp = definingOp;
    this.assumedMin = null;
    this.assumedMax = null;
  }

  Value(IntType type, BigInteger assumedMin, BigInteger assumedMax) {
    Preconditions.checkArgument(assumedMin.compareTo(assumedMax) <= 0, "Empty bounds");
    this.type = type;
    this.definingOp = null;
    this.assumedMin = assumedMin;
    this.assumedMax = assumedMax;
  }

  public IntType type() {
    return type;
  }

  /**
   * Changes this value's type without changing its identity or uses. The caller is responsible for
   * leaving the IR consistent (e.g. by also retyping the operands of the defining operation).
   */
  public void setType(IntType type) {
    this.type = type;
  }

  /** Returns the operation that produces this value, or null if it is a region argument. */
  public @Nullable Operation definingOp() {
    return definingOp;
  }

  public boolean isArgument() {
    return definingOp == null;
  }

  /** True if this is an argument with bounds declared in the IR. */
  public boolean hasAssumedBounds() {
    return assumedMin != null;
  }

  public @Nullable BigInteger assumedMin() {
    return assumedMin;
  }

  public @Nullable BigInteger assumedMax() {
    return assumedMax;
  }

  /**
   * Returns the operations that use this value, once per operand slot that reads it. The returned
   * list is a view and will change if uses are added or removed.
   */
  public List<Operation> users() {
    return Collections.unmodifiableList(users);
  }

  public boolean hasUses() {
    return !users.isEmpty();
  }

  void addUse(Operation user) {
    users.add(user);
  }

  void removeUse(Operation user) {
    boolean removed = users.remove(user);
    assert removed;
  }

  /** Makes every operand that currently reads this value read {@code replacement} instead. */
  public void replaceAllUsesWith(Value replacement) {
    Preconditions.checkArgument(replacement != this);
    for (Operation user : new ArrayList<>(users)) {
      for (int i = 0; i < user.numOperands(); i++) {
        if (user.operand(i) == this) {
          user.setOperand(i, replacement);
        }
      }
    }
    assert users.isEmpty();
  }

  @Override
  public String toString() {
    return "%" + StringUtil.id(this);
  }
}
