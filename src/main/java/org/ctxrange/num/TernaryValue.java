/*
 * Copyright 2025 The Ctxrange Authors
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

package org.ctxrange.num;

/** What is known about a single bit. */
public enum TernaryValue {
  KNOWN_ZERO,
  KNOWN_ONE,
  UNKNOWN;

  public static TernaryValue of(boolean bit) {
    return bit ? KNOWN_ONE : KNOWN_ZERO;
  }

  public boolean isKnown() {
    return this != UNKNOWN;
  }

  @Override
  public String toString() {
    return switch (this) {
      case KNOWN_ZERO -> "0";
      case KNOWN_ONE -> "1";
      case UNKNOWN -> "X";
    };
  }
}
