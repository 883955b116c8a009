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
import org.jspecify.annotations.Nullable;

/**
 * The type of a {@link Value}: either a fixed-width integer ({@code i1} through {@code i64}) or
 * {@code index}, an integer whose width is chosen by the eventual compilation target.
 *
 * <p>Fixed-width integers are signless; whether their bits are read as signed or unsigned is
 * determined by the operations that consume them (e.g. {@link OpKind#DIV_SI} vs {@link
 * OpKind#DIV_UI}).
 *
 * <p>IntTypes are interned, so they can be compared with {@code ==}.
 */
public final class IntType {

  /** The widest fixed-width integer type. */
  public static final int MAX_WIDTH = 64;

  /**
   * The width used to represent {@code index} values and their ranges; this is also the widest
   * index of any supported target.
   */
  public static final int INDEX_ANALYSIS_WIDTH = 64;

  /**
   * The narrowest index of any supported target. Range inference covers both this width and
   * {@link #INDEX_ANALYSIS_WIDTH}.
   */
  public static final int MIN_INDEX_WIDTH = 32;

  private static final IntType[] FIXED = new IntType[MAX_WIDTH + 1];

  static {
    for (int i = 1; i <= MAX_WIDTH; i++) {
      FIXED[i] = new IntType(i, false);
    }
  }

  public static final IntType I1 = FIXED[1];
  public static final IntType I8 = FIXED[8];
  public static final IntType I16 = FIXED[16];
  public static final IntType I32 = FIXED[32];
  public static final IntType I64 = FIXED[64];
  public static final IntType INDEX = new IntType(INDEX_ANALYSIS_WIDTH, true);

  private final int width;
  private final boolean isIndex;

  private IntType(int width, boolean isIndex) {
    this.width = width;
    this.isIndex = isIndex;
  }

  /** Returns the fixed-width integer type with the given number of bits. */
  public static IntType integer(int width) {
    Preconditions.checkArgument(width >= 1 && width <= MAX_WIDTH, "Bad integer width: %s", width);
    return FIXED[width];
  }

  /** True if this is the platform-word {@code index} type. */
  public boolean isIndex() {
    return isIndex;
  }

  /**
   * The number of bits used when analyzing or evaluating values of this type; for {@code index}
   * this is {@link #INDEX_ANALYSIS_WIDTH}.
   */
  public int width() {
    return width;
  }

  /** True if this is a fixed-width integer type with exactly the given width. */
  public boolean isInteger(int width) {
    return !isIndex && this.width == width;
  }

  /** Parses the textual form used by {@link IrPrinter}; returns null if not a valid type. */
  public static @Nullable IntType parse(String s) {
    if (s.equals("index")) {
      return INDEX;
    } else if (s.length() > 1 && s.charAt(0) == 'i') {
      try {
        int width = Integer.parseInt(s.substring(1));
        if (width >= 1 && width <= MAX_WIDTH) {
          return FIXED[width];
        }
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return isIndex ? "index" : ("i" + width);
  }
}
