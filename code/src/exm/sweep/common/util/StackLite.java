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
package exm.sweep.common.util;

import java.util.ArrayList;

/**
 * Stack backed by an ArrayList.  Iterating visits the bottom of the
 * stack first, so a stack of ancestors reads root first.
 * @param <T>
 */
public class StackLite<T> extends ArrayList<T> {

  private static final long serialVersionUID = 1L;

  public void push(T o) {
    this.add(o);
  }

  public T pop() {
    return this.remove(this.size() - 1);
  }
}
