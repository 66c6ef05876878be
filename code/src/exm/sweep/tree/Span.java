/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sweep.tree;

import exm.sweep.common.exceptions.SweepRuntimeError;

/**
 * Half-open range of byte offsets [start, end) in the source text a
 * node was parsed from.  Nodes synthesized by the engine that have no
 * counterpart in the source carry {@link #UNKNOWN}.
 */
public class Span implements Comparable<Span> {

  public static final Span UNKNOWN = new Span(-1, -1);

  public final int start;
  public final int end;

  private Span(int start, int end) {
    this.start = start;
    this.end = end;
  }

  public static Span of(int start, int end) {
    if (start < 0 || end < start) {
      throw new SweepRuntimeError("Invalid span [" + start + ", " + end
                                  + ")");
    }
    return new Span(start, end);
  }

  /**
   * Smallest span covering both arguments. Unknown spans are ignored.
   */
  public static Span cover(Span a, Span b) {
    if (!a.isKnown()) {
      return b;
    } else if (!b.isKnown()) {
      return a;
    }
    return new Span(Math.min(a.start, b.start), Math.max(a.end, b.end));
  }

  public boolean isKnown() {
    return start >= 0;
  }

  public int length() {
    return isKnown() ? end - start : 0;
  }

  /**
   * @return true if other lies entirely within this span
   */
  public boolean contains(Span other) {
    return isKnown() && other.isKnown() &&
           start <= other.start && other.end <= end;
  }

  @Override
  public int compareTo(Span o) {
    if (start != o.start) {
      return start < o.start ? -1 : 1;
    }
    return end < o.end ? -1 : (end == o.end ? 0 : 1);
  }

  @Override
  public int hashCode() {
    return 31 * start + end;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Span)) {
      return false;
    }
    Span other = (Span)obj;
    return start == other.start && end == other.end;
  }

  @Override
  public String toString() {
    if (!isKnown()) {
      return "[?]";
    }
    return "[" + start + ", " + end + ")";
  }
}
