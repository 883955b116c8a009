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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.rangeopt.ir.ArithSemantics;
import org.rangeopt.ir.IntType;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;

/**
 * Static-only class that simplifies an operation without reference to any pattern: casts whose
 * source and result types are the same are replaced by their operand, and operations whose operands
 * are all constants are replaced by a constant.
 *
 * <p>Operations on {@code index} values are never folded to constants, since their results may
 * depend on the target's index width. Operations that would have undefined behavior are left
 * alone.
 */
public class Folder {

  private Folder() {}

  /** If {@code op} can be folded, replaces it using {@code rewriter} and returns true. */
  public static boolean tryFold(Operation op, PatternRewriter rewriter) {
    OpKind kind = op.kind();
    if (!kind.hasResult() || kind == OpKind.CONSTANT) {
      return false;
    }
    if (kind.shape == OpKind.Shape.CAST && op.operand(0).type() == op.result().type()) {
      rewriter.replaceOp(op, List.of(op.operand(0)));
      return true;
    }
    if (op.result().type().isIndex()) {
      return false;
    }
    ImmutableList.Builder<BigInteger> args = ImmutableList.builder();
    for (Value operand : op.operands()) {
      Operation def = operand.definingOp();
      if (def == null || def.kind() != OpKind.CONSTANT || operand.type().isIndex()) {
        return false;
      }
      args.add(ArithSemantics.toUnsigned(def.constantValue(), operand.type().width()));
    }
    IntType type = op.result().type();
    BigInteger folded;
    try {
      // Fixed-width operations don't depend on the index width.
      folded = ArithSemantics.evaluate(op, args.build(), IntType.INDEX_ANALYSIS_WIDTH);
    } catch (ArithmeticException e) {
      return false;
    }
    rewriter.setInsertionPoint(op);
    Value constant =
        rewriter.createConstant(
            type, ArithSemantics.toSigned(folded, type.width()), op.location());
    rewriter.replaceOp(op, List.of(constant));
    return true;
  }
}
