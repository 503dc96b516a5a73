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
package exm.pyparse.ast;

/**
 * Named field of a node, in declaration order.  The value is a
 * {@link Node}, a list, an operator enum, an identifier or constant,
 * or null for an absent optional field.
 */
public class Field {
  public final String name;
  public final Object value;

  public Field(String name, Object value) {
    this.name = name;
    this.value = value;
  }

  public static Field of(String name, Object value) {
    return new Field(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
