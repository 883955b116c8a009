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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * A Region is a straight-line sequence of {@link Operation}s with a list of argument {@link
 * Value}s. Operations are kept in definition-before-use order: every operand of an operation is
 * either an argument or the result of an earlier operation.
 *
 * <p>A Region is usually ended by a {@link OpKind#RETURN}; operations after the first return are
 * unreachable.
 *
 * <p>Regions are not thread-safe.
 */
public final class Region {

  private final Location location;
  private final List<Value> arguments = new ArrayList<>();
  private final List<Operation> operations = new ArrayList<>();

  public Region(Location location) {
    this.location = location;
  }

  public Region() {
    this(Location.UNKNOWN);
  }

  public Location location() {
    return location;
  }

  /** Adds an argument with no declared bounds. */
  @CanIgnoreReturnValue
  public Value addArgument(IntType type) {
    Value arg = new Value(type, null);
    arguments.add(arg);
    return arg;
  }

  /**
   * Adds an argument that is known to lie in {@code [min, max]} when read as a signed integer of
   * its type.
   */
  @CanIgnoreReturnValue
  public Value addArgument(IntType type, long min, long max) {
    return addArgument(type, BigInteger.valueOf(min), BigInteger.valueOf(max));
  }

  @CanIgnoreReturnValue
  public Value addArgument(IntType type, BigInteger min, BigInteger max) {
    BigInteger typeMin = BigInteger.ONE.shiftLeft(type.width() - 1).negate();
    BigInteger typeMax = BigInteger.ONE.shiftLeft(type.width() - 1).subtract(BigInteger.ONE);
    Preconditions.checkArgument(
        min.compareTo(typeMin) >= 0 && max.compareTo(typeMax) <= 0,
        "Bounds [%s, %s] do not fit in %s",
        min,
        max,
        type);
    Value arg = new Value(type, min, max);
    arguments.add(arg);
    return arg;
  }

  public ImmutableList<Value> arguments() {
    return ImmutableList.copyOf(arguments);
  }

  public int numArguments() {
    return arguments.size();
  }

  public Value argument(int i) {
    return arguments.get(i);
  }

  /** Returns a snapshot of the operations in this region, in order. */
  public ImmutableList<Operation> operations() {
    return ImmutableList.copyOf(operations);
  }

  public int numOperations() {
    return operations.size();
  }

  /** Returns the position of {@code op} in this region, or -1 if it is not here. */
  public int indexOf(Operation op) {
    return (op.region == this) ? operations.indexOf(op) : -1;
  }

  /** Adds a detached operation at the end of this region. */
  @CanIgnoreReturnValue
  public Operation append(Operation op) {
    Preconditions.checkArgument(op.region == null && !op.isErased(), "%s is already placed", op);
    op.region = this;
    operations.add(op);
    return op;
  }

  /** Adds a detached operation immediately before {@code anchor}. */
  @CanIgnoreReturnValue
  public Operation insertBefore(Operation anchor, Operation op) {
    Preconditions.checkArgument(op.region == null && !op.isErased(), "%s is already placed", op);
    int index = indexOf(anchor);
    Preconditions.checkArgument(index >= 0, "%s is not in this region", anchor);
    op.region = this;
    operations.add(index, op);
    return op;
  }

  /**
   * Removes {@code op} from this region and drops its operands. Its result must have no remaining
   * uses.
   */
  public void erase(Operation op) {
    Preconditions.checkArgument(op.region == this, "%s is not in this region", op);
    Preconditions.checkState(
        op.results().stream().noneMatch(Value::hasUses), "%s still has uses", op);
    operations.remove(op);
    op.region = null;
    op.dropOperands();
  }

  /** Appends an operation of the given kind, with no attributes, and returns its result. */
  @CanIgnoreReturnValue
  public Value add(OpKind kind, IntType resultType, Value... operands) {
    return append(
            Operation.create(kind, resultType, List.of(operands), ImmutableMap.of(), location))
        .result();
  }

  /** Appends a {@link OpKind#CONSTANT} and returns its result. */
  public Value constant(IntType type, long value) {
    BigInteger v = ArithSemantics.toSigned(BigInteger.valueOf(value), type.width());
    return append(
            Operation.create(
                OpKind.CONSTANT,
                type,
                List.of(),
                ImmutableMap.of(OpKind.VALUE_ATTR, v),
                location))
        .result();
  }

  /** Appends a {@link OpKind#CMP} and returns its result. */
  public Value compare(CmpPredicate predicate, Value lhs, Value rhs) {
    return append(
            Operation.create(
                OpKind.CMP,
                IntType.I1,
                List.of(lhs, rhs),
                ImmutableMap.of(OpKind.PREDICATE_ATTR, predicate),
                location))
        .result();
  }

  /** Appends a {@link OpKind#RETURN}. */
  @CanIgnoreReturnValue
  public Operation ret(Value... values) {
    return append(
        Operation.create(OpKind.RETURN, null, List.of(values), ImmutableMap.of(), location));
  }

  @Override
  public String toString() {
    return IrPrinter.print(this);
  }
}
