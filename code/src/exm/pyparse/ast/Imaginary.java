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
 * Value of an imaginary literal such as 2.5j
 */
public class Imaginary {
  public final double imag;

  public Imaginary(double imag) {
    this.imag = imag;
  }

  @Override
  public int hashCode() {
    return Double.valueOf(imag).hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Imaginary &&
           Double.compare(imag, ((Imaginary) obj).imag) == 0;
  }

  @Override
  public String toString() {
    return AstDump.repr(this);
  }
}
