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

import java.util.List;
import org.rangeopt.ir.OpKind;
import org.rangeopt.ir.Operation;
import org.rangeopt.ir.Value;
import org.rangeopt.range.ConstantRange;
import org.rangeopt.rewrite.PatternRewriter;
import org.rangeopt.rewrite.RewritePattern;

/**
 * Replaces {@code remui %x, %c} or {@code remsi %x, %c} with {@code %x} when {@code %c} is a known
 * positive value and {@code %x} is proven to lie in {@code [0, c)}.
 */
public class DeleteTrivialRem extends RewritePattern {

  private final UnsignedLegality legality;

  public DeleteTrivialRem(OpKind kind, UnsignedLegality legality) {
    super(kind);
    assert kind == OpKind.REM_UI || kind == OpKind.REM_SI;
    this.legality = legality;
  }

  @Override
  public boolean matchAndRewrite(Operation op, PatternRewriter rewriter) {
    Value dividend = op.operand(0);
    Value divisor = op.operand(1);
    // For index operands this also requires that both fit in 32 bits.
    if (!legality.valueSafeToUnsign(dividend) || !legality.valueSafeToUnsign(divisor)) {
      return false;
    }
    ConstantRange divisorRange = legality.query().query(divisor);
    ConstantRange dividendRange = legality.query().query(dividend);
    if (!divisorRange.isSingleValue()
        || divisorRange.umin().signum() == 0
        || dividendRange.umax().compareTo(divisorRange.umin()) >= 0) {
      return false;
    }
    rewriter.replaceOp(op, List.of(dividend));
    return true;
  }
}
