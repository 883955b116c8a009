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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.rangeopt.util.StringUtil;

/**
 * An Operation reads zero or more operand {@link Value}s and produces zero or one result Values.
 * Its behavior is determined by its {@link OpKind} and its (immutable) attributes.
 *
 * <p>Operations are created detached and then inserted into a {@link Region}; an Operation's
 * operands are registered as uses as soon as it is created.
 */
public final class Operation {

  private final OpKind kind;
  private final List<Value> operands;
  private final @Nullable Value result;
  private final ImmutableMap<String, Object> attributes;
  private final Location location;

  /** The region containing this operation; null if it has not been inserted or was erased. */
  @Nullable Region region;

  private boolean erased;

  private Operation(
      OpKind kind,
      @Nullable IntType resultType,
      List<Value> operands,
      ImmutableMap<String, Object> attributes,
      Location location) {
    this.kind = kind;
    this.operands = new ArrayList<>(operands);
    this.result = (resultType == null) ? null : new Value(resultType, this);
    this.attributes = attributes;
    this.location = location;
    for (Value operand : operands) {
      operand.addUse(this);
    }
  }

  /**
   * Creates a new (detached) Operation. Checks that the operand count and types are consistent with
   * {@code kind}; throws an IllegalArgumentException if they are not.
   *
   * @param resultType must be null if and only if {@code kind} has no result
   */
  public static Operation create(
      OpKind kind,
      @Nullable IntType resultType,
      List<Value> operands,
      ImmutableMap<String, Object> attributes,
      Location location) {
    Preconditions.checkArgument(
        kind.hasResult() == (resultType != null), "%s: bad result type %s", kind, resultType);
    int expected = kind.numOperands();
    Preconditions.checkArgument(
        expected < 0 || operands.size() == expected,
        "%s expects %s operands, got %s",
        kind,
        expected,
        operands.size());
    switch (kind.shape) {
      case NULLARY -> {
        Preconditions.checkArgument(
            attributes.get(OpKind.VALUE_ATTR) instanceof BigInteger, "constant requires a value");
        Preconditions.checkArgument(!resultType.isIndex(), "index constants are not supported");
      }
      case BINARY -> {
        for (Value operand : operands) {
          Preconditions.checkArgument(
              operand.type() == resultType, "%s operand %s is not %s", kind, operand, resultType);
        }
      }
      case COMPARE -> {
        Preconditions.checkArgument(resultType == IntType.I1, "cmpi result must be i1");
        Preconditions.checkArgument(
            operands.get(0).type() == operands.get(1).type(), "cmpi operand types differ");
        Preconditions.checkArgument(
            attributes.get(OpKind.PREDICATE_ATTR) instanceof CmpPredicate,
            "cmpi requires a predicate");
      }
      case CAST -> checkCast(kind, operands.get(0).type(), resultType);
      case TERMINATOR -> {}
    }
    return new Operation(kind, resultType, operands, attributes, location);
  }

  /** Creates a new Operation with no attributes and an unknown location. */
  public static Operation create(OpKind kind, @Nullable IntType resultType, Value... operands) {
    return create(kind, resultType, List.of(operands), ImmutableMap.of(), Location.UNKNOWN);
  }

  private static void checkCast(OpKind kind, IntType from, IntType to) {
    switch (kind) {
      case EXT_SI, EXT_UI ->
          Preconditions.checkArgument(
              !from.isIndex() && !to.isIndex() && to.width() > from.width(),
              "%s from %s to %s does not widen",
              kind,
              from,
              to);
      case TRUNC ->
          Preconditions.checkArgument(
              !from.isIndex() && !to.isIndex() && to.width() < from.width(),
              "trunci from %s to %s does not narrow",
              from,
              to);
      case INDEX_CAST, INDEX_CAST_UI ->
          Preconditions.checkArgument(
              from.isIndex() != to.isIndex(),
              "%s from %s to %s must convert to or from index",
              kind,
              from,
              to);
      default -> throw new AssertionError();
    }
  }

  public OpKind kind() {
    return kind;
  }

  public int numOperands() {
    return operands.size();
  }

  public Value operand(int i) {
    return operands.get(i);
  }

  public ImmutableList<Value> operands() {
    return ImmutableList.copyOf(operands);
  }

  /**
   * Replaces one of this operation's operands. No type checking is done; the caller is responsible
   * for leaving the IR consistent.
   */
  public void setOperand(int i, Value value) {
    Value prev = operands.get(i);
    if (prev == value) {
      return;
    }
    prev.removeUse(this);
    operands.set(i, value);
    value.addUse(this);
  }

  /** Returns this operation's results (empty or a single Value). */
  public ImmutableList<Value> results() {
    return (result == null) ? ImmutableList.of() : ImmutableList.of(result);
  }

  /** Returns this operation's result; may only be called if {@code kind().hasResult()}. */
  public Value result() {
    Preconditions.checkState(result != null, "%s has no result", kind);
    return result;
  }

  public ImmutableMap<String, Object> attributes() {
    return attributes;
  }

  /** The value of a {@link OpKind#CONSTANT}, as a signed integer. */
  public BigInteger constantValue() {
    Preconditions.checkState(kind == OpKind.CONSTANT);
    return (BigInteger) attributes.get(OpKind.VALUE_ATTR);
  }

  /** The predicate of a {@link OpKind#CMP}. */
  public CmpPredicate predicate() {
    Preconditions.checkState(kind == OpKind.CMP);
    return (CmpPredicate) attributes.get(OpKind.PREDICATE_ATTR);
  }

  public Location location() {
    return location;
  }

  /** Returns the region containing this operation, or null if it is detached or erased. */
  public @Nullable Region region() {
    return region;
  }

  /** True if this operation has been removed from its region by {@link Region#erase}. */
  public boolean isErased() {
    return erased;
  }

  /** True if this operation can be removed: it has no side effects and its result is unused. */
  public boolean isTriviallyDead() {
    return !kind.hasSideEffects() && (result == null || !result.hasUses());
  }

  /** Removes this operation from the use lists of its operands; called when it is erased. */
  void dropOperands() {
    for (Value operand : operands) {
      operand.removeUse(this);
    }
    operands.clear();
    erased = true;
  }

  @Override
  public String toString() {
    String prefix = (result == null) ? "" : (result + " = ");
    prefix += kind;
    if (kind == OpKind.CONSTANT) {
      prefix += " " + constantValue();
    } else if (kind == OpKind.CMP) {
      prefix += " " + predicate();
    }
    String suffix = (result == null) ? "" : (" : " + result.type());
    if (!operands.isEmpty()) {
      prefix += " ";
    }
    return StringUtil.joinAll(prefix, suffix, operands);
  }

  /** Returns a short identifier, stable for this operation's lifetime; useful for logging. */
  public String id() {
    return kind + "@" + StringUtil.id(this);
  }
}
