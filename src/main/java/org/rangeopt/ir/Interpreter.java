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
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a {@link Region} on concrete inputs. Used to check that transformations preserve
 * behavior; {@code index} values may be given any width so that a region can be run as it would
 * be on 32-bit and 64-bit targets.
 */
public class Interpreter {

  private Interpreter() {}

  /**
   * Runs {@code region} with the given argument values and returns the operands of its first
   * {@link OpKind#RETURN}, as signed integers. Arguments may be given as either signed or unsigned
   * integers. Throws an ArithmeticException if execution reaches undefined behavior.
   */
  public static ImmutableList<BigInteger> run(
      Region region, List<BigInteger> args, int indexWidth) {
    Preconditions.checkArgument(args.size() == region.numArguments(), "Wrong number of args");
    Map<Value, BigInteger> values = new HashMap<>();
    for (int i = 0; i < args.size(); i++) {
      Value arg = region.argument(i);
      values.put(arg, ArithSemantics.toUnsigned(args.get(i), widthOf(arg, indexWidth)));
    }
    for (Operation op : region.operations()) {
      ImmutableList<BigInteger> operands =
          op.operands().stream().map(values::get).collect(ImmutableList.toImmutableList());
      if (op.kind() == OpKind.RETURN) {
        ImmutableList.Builder<BigInteger> results = ImmutableList.builder();
        for (int i = 0; i < operands.size(); i++) {
          results.add(ArithSemantics.toSigned(operands.get(i), widthOf(op.operand(i), indexWidth)));
        }
        return results.build();
      }
      values.put(op.result(), ArithSemantics.evaluate(op, operands, indexWidth));
    }
    throw new IllegalStateException("Region has no return");
  }

  private static int widthOf(Value v, int indexWidth) {
    return ArithSemantics.widthOf(v.type(), indexWidth);
  }
}
