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
package exm.ksc.ast;

/**
 * Escape sequence handling for string and character literals.
 *
 * Decoding recognizes \n \t \" \' \\ in both literal kinds, and \0 in
 * character literals.  Any other escape in a string is kept as the two
 * source characters.
 */
public class Escapes {

  /**
   * @param body literal text between the quotes
   */
  public static String decodeString(String body) {
    return decode(body, false);
  }

  /**
   * @param body literal text between the quotes
   */
  public static String decodeChar(String body) {
    return decode(body, true);
  }

  /**
   * Inverse of {@link #decodeString(String)}.
   * @return source form including surrounding double quotes
   */
  public static String quoteString(String value) {
    return '"' + encode(value, false) + '"';
  }

  /**
   * Inverse of {@link #decodeChar(String)}.
   * @return source form including surrounding single quotes
   */
  public static String quoteChar(String value) {
    return '\'' + encode(value, true) + '\'';
  }

  private static String decode(String body, boolean charLiteral) {
    if (body.indexOf('\\') < 0) {
      return body;
    }
    StringBuilder sb = new StringBuilder(body.length());
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c != '\\' || i + 1 >= body.length()) {
        sb.append(c);
        i++;
        continue;
      }
      char next = body.charAt(i + 1);
      switch (next) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case '"':
          sb.append('"');
          break;
        case '\'':
          sb.append('\'');
          break;
        case '\\':
          sb.append('\\');
          break;
        case '0':
          if (charLiteral) {
            sb.append('\0');
          } else {
            sb.append(c).append(next);
          }
          break;
        default:
          sb.append(c).append(next);
          break;
      }
      i += 2;
    }
    return sb.toString();
  }

  private static String encode(String value, boolean charLiteral) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\'':
          sb.append(charLiteral ? "\\'" : "'");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\0':
          sb.append(charLiteral ? "\\0" : "\0");
          break;
        default:
          sb.append(c);
          break;
      }
    }
    return sb.toString();
  }
}
