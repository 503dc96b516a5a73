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

package exm.pyparse.common.exceptions;

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 *
 * Lines are 1-based and columns 0-based, matching token positions.
 * The rendered message shows a 1-based column.
 * */
public class UserException
extends Exception
{
  private final String file;
  private final int line;
  private final int column;
  private final String detail;

  public UserException(String file, int line, int col, String message) {
    super(file + ":" + line + ":" + (col + 1) + ": " + message);
    this.file = file;
    this.line = line;
    this.column = col;
    this.detail = message;
  }

  public UserException(String message) {
    super(message);
    this.file = null;
    this.line = -1;
    this.column = -1;
    this.detail = message;
  }

  public String getFile() {
    return file;
  }

  /**
   * @return 1-based line, or -1 if unknown
   */
  public int getLine() {
    return line;
  }

  /**
   * @return 0-based column, or -1 if unknown
   */
  public int getColumn() {
    return column;
  }

  /**
   * @return message without position prefix
   */
  public String getDetail() {
    return detail;
  }

  private static final long serialVersionUID = 1L;
}
