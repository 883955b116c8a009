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

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import org.rangeopt.util.StringUtil;

/**
 * Renders a {@link Region} in the textual form accepted by {@link IrParser}. Arguments are named
 * {@code %arg0, %arg1, ...} and results {@code %0, %1, ...} in order of appearance, so two regions
 * with the same structure print identically.
 */
public class IrPrinter {

  private final Map<Value, String> names = new HashMap<>();
  private final StringBuilder sb = new StringBuilder();

  private IrPrinter() {}

  /** Returns the textual form of {@code region}. */
  public static String print(Region region) {
    return new IrPrinter().printRegion(region);
  }

  private String printRegion(Region region) {
    for (int i = 0; i < region.numArguments(); i++) {
      names.put(region.argument(i), "%arg" + i);
    }
    sb.append(
        StringUtil.joinElements(
            "region(", ") {\n", region.numArguments(), i -> argument(region.argument(i))));
    int nextResult = 0;
    for (Operation op : region.operations()) {
      sb.append("  ");
      if (op.kind().hasResult()) {
        String name = "%" + nextResult++;
        names.put(op.result(), name);
        sb.append(name).append(" = ");
      }
      sb.append(op.kind().mnemonic);
      if (op.kind() == OpKind.CONSTANT) {
        sb.append(' ').append(constant(op));
      } else if (op.kind() == OpKind.CMP) {
        sb.append(' ').append(op.predicate().mnemonic);
      }
      if (op.numOperands() > 0) {
        sb.append(StringUtil.joinElements(" ", "", op.numOperands(), i -> name(op.operand(i))));
      }
      if (op.kind().hasResult()) {
        sb.append(" : ").append(op.result().type());
      }
      sb.append('\n');
    }
    return sb.append("}\n").toString();
  }

  /** Booleans are printed as 0 or 1; other constants by their signed value. */
  private static BigInteger constant(Operation op) {
    BigInteger value = op.constantValue();
    return (op.result().type() == IntType.I1) ? ArithSemantics.toUnsigned(value, 1) : value;
  }

  private String argument(Value arg) {
    String result = names.get(arg) + ": " + arg.type();
    if (arg.hasAssumedBounds()) {
      result += " in [" + arg.assumedMin() + ", " + arg.assumedMax() + "]";
    }
    return result;
  }

  private String name(Value v) {
    // A value that isn't defined in this region (which will fail analysis) is still printable.
    return names.getOrDefault(v, v.toString());
  }
}
