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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/** The kinds of {@link Operation} that may appear in a {@link Region}. */
public enum OpKind {
  /** Produces the integer in its {@code value} attribute. */
  CONSTANT("constant", Shape.NULLARY),
  ADD("addi", Shape.BINARY),
  SUB("subi", Shape.BINARY),
  MUL("muli", Shape.BINARY),
  /** Signed division, rounding towards zero. */
  DIV_SI("divsi", Shape.BINARY),
  DIV_UI("divui", Shape.BINARY),
  CEIL_DIV_SI("ceildivsi", Shape.BINARY),
  CEIL_DIV_UI("ceildivui", Shape.BINARY),
  FLOOR_DIV_SI("floordivsi", Shape.BINARY),
  /** Signed remainder; the result has the sign of the dividend. */
  REM_SI("remsi", Shape.BINARY),
  REM_UI("remui", Shape.BINARY),
  MIN_SI("minsi", Shape.BINARY),
  MIN_UI("minui", Shape.BINARY),
  MAX_SI("maxsi", Shape.BINARY),
  MAX_UI("maxui", Shape.BINARY),
  EXT_SI("extsi", Shape.CAST),
  EXT_UI("extui", Shape.CAST),
  TRUNC("trunci", Shape.CAST),
  /** Converts between {@code index} and a fixed-width integer, sign-extending if widening. */
  INDEX_CAST("index_cast", Shape.CAST),
  /** Converts between {@code index} and a fixed-width integer, zero-extending if widening. */
  INDEX_CAST_UI("index_castui", Shape.CAST),
  /** Compares two values using the {@link CmpPredicate} in its {@code predicate} attribute. */
  CMP("cmpi", Shape.COMPARE),
  /** Ends the region, returning its operands; has no results. */
  RETURN("return", Shape.TERMINATOR);

  /** The attribute holding a {@link #CONSTANT}'s value (a {@link java.math.BigInteger}). */
  public static final String VALUE_ATTR = "value";

  /** The attribute holding a {@link #CMP}'s {@link CmpPredicate}. */
  public static final String PREDICATE_ATTR = "predicate";

  /** Distinguishes kinds by their operand and result structure. */
  public enum Shape {
    NULLARY,
    /** Two operands and a result, all of the same type. */
    BINARY,
    /** One operand and a result of a different type. */
    CAST,
    /** Two operands of the same type and an {@code i1} result. */
    COMPARE,
    /** Any number of operands and no results. */
    TERMINATOR
  }

  public final String mnemonic;
  public final Shape shape;

  OpKind(String mnemonic, Shape shape) {
    this.mnemonic = mnemonic;
    this.shape = shape;
  }

  /** The number of operands required by this kind, or -1 if any number is allowed. */
  public int numOperands() {
    return switch (shape) {
      case NULLARY -> 0;
      case CAST -> 1;
      case BINARY, COMPARE -> 2;
      case TERMINATOR -> -1;
    };
  }

  /** True if operations of this kind produce a result. */
  public boolean hasResult() {
    return shape != Shape.TERMINATOR;
  }

  /**
   * True if operations of this kind have effects beyond computing their result, and so must not
   * be removed even if their result is unused.
   */
  public boolean hasSideEffects() {
    return shape == Shape.TERMINATOR;
  }

  private static final ImmutableMap<String, OpKind> BY_MNEMONIC =
      Arrays.stream(values())
          .collect(ImmutableMap.toImmutableMap(k -> k.mnemonic, Function.identity()));

  /** Returns the kind with the given mnemonic, or null if there is none. */
  public static @Nullable OpKind forMnemonic(String mnemonic) {
    return BY_MNEMONIC.get(mnemonic);
  }

  @Override
  public String toString() {
    return mnemonic;
  }
}
