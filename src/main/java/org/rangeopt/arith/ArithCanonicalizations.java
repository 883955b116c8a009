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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import org.rangeopt.ir.ArithSemantics;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;
import org.rangeopt.rewrite.PatternRewriter;
import org.rangeopt.rewrite.RewritePattern;

/**
 * Static-only class with range-independent simplifications that clean up after the range-driven
 * patterns.
 */
public class ArithCanonicalizations {

  private ArithCanonicalizations() {}

  /** Returns a new instance of each canonicalization pattern. */
  public static ImmutableList<RewritePattern> patterns() {
    return ImmutableList.of(
        new IdentityOperand(OpKind.ADD, BigInteger.ZERO),
        new IdentityOperand(OpKind.MUL, BigInteger.ONE),
        new MergeExtUI());
  }

  /**
   * True if {@code v} is the result of a {@link OpKind#CONSTANT} with the given value, compared as
   * {@code v}'s type sees it (so {@code 1} matches an {@code i1} true).
   */
  static boolean isConstant(Value v, BigInteger value) {
    Operation def = v.definingOp();
    if (def == null || def.kind() != OpKind.CONSTANT) {
      return false;
    }
    int width = v.type().width();
    return ArithSemantics.toUnsigned(def.constantValue(), width)
        .equals(ArithSemantics.toUnsigned(value, width));
  }

  /**
   * {@code addi %x, 0} and {@code muli %x, 1} are replaced by {@code %x}, as are {@code addi 0, %x}
   * and {@code muli 1, %x}.
   */
  static class IdentityOperand extends RewritePattern {
    final BigInteger identity;

    IdentityOperand(OpKind kind, BigInteger identity) {
      super(kind);
      this.identity = identity;
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
      for (int i = 1; i >= 0; i--) {
        if (isConstant(op.operand(i), identity)) {
          rewriter.replaceOp(op, List.of(op.operand(1 - i)));
          return true;
        }
      }
      return false;
    }
  }

  /** {@code extui (extui %x)} is replaced by a single {@code extui %x}. */
  static class MergeExtUI extends RewritePattern {
    MergeExtUI() {
      super(OpKind.EXT_UI);
    }

    @Override
    public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
      Operation inner = op.operand(0).definingOp();
      if (inner == null || inner.kind() != OpKind.EXT_UI) {
        return false;
      }
      rewriter.replaceOpWithNewOp(
          op, OpKind.EXT_UI, op.result().type(), List.of(inner.operand(0)), ImmutableMap.of());
      return true;
    }
  }
}
