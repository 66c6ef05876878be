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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.sweep.common.exceptions.InvalidTreeException;

/**
 * Textual form of trees exchanged with external parsers and printers:
 *
 * <pre>
 *   (if_statement condition:(identifier "enabled") consequence:(block ...))
 * </pre>
 *
 * A node is a parenthesized kind, an optional quoted value and its
 * children.  A child may be prefixed with {@code field:}.  Values use
 * backslash escapes for quotes, backslashes, newlines and tabs.
 *
 * When reading, leaf values are laid out one after another to assign
 * spans, so the span of every node is exactly covered by its children.
 */
public class TreeNotation {

  public static String print(Node node) {
    StringBuilder sb = new StringBuilder();
    print(sb, node, -1);
    return sb.toString();
  }

  /**
   * Print one node per line, indenting children
   */
  public static String printIndented(Node node) {
    StringBuilder sb = new StringBuilder();
    print(sb, node, 0);
    return sb.toString();
  }

  private static void print(StringBuilder sb, Node node, int indent) {
    if (indent > 0) {
      sb.append(StringUtils.repeat(' ', indent));
    }
    if (node.field() != null) {
      sb.append(node.field()).append(':');
    }
    sb.append('(').append(node.kind());
    if (node.value() != null) {
      sb.append(" \"").append(escape(node.value())).append('"');
    }
    for (Node child: node.children()) {
      if (indent < 0) {
        sb.append(' ');
        print(sb, child, -1);
      } else {
        sb.append('\n');
        print(sb, child, indent + 2);
      }
    }
    sb.append(')');
  }

  static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }

  public static Node read(String text) throws InvalidTreeException {
    return read("<input>", text);
  }

  /**
   * @param source name of input for error messages
   * @param text
   * @return the root node
   * @throws InvalidTreeException
   */
  public static Node read(String source, String text)
                                          throws InvalidTreeException {
    Reader r = new Reader(source, text);
    r.skipSpace();
    Node root = r.node();
    r.skipSpace();
    if (!r.atEnd()) {
      throw r.error("Unexpected text after root node");
    }
    return root;
  }

  private static class Reader {
    private final String source;
    private final String text;
    private int pos = 0;
    /** Next span offset to hand out to a leaf value */
    private int offset = 0;

    Reader(String source, String text) {
      this.source = source;
      this.text = text;
    }

    boolean atEnd() {
      return pos >= text.length();
    }

    InvalidTreeException error(String msg) {
      return new InvalidTreeException(source, pos, msg);
    }

    void skipSpace() {
      while (!atEnd()) {
        char c = text.charAt(pos);
        if (Character.isWhitespace(c)) {
          pos++;
        } else if (c == ';') {
          // Comment to end of line
          while (!atEnd() && text.charAt(pos) != '\n') {
            pos++;
          }
        } else {
          break;
        }
      }
    }

    Node node() throws InvalidTreeException {
      String field = null;
      if (!atEnd() && text.charAt(pos) != '(') {
        field = fieldName();
      }
      expect('(');
      skipSpace();
      String kind = kind();
      skipSpace();
      String value = null;
      int start = offset;
      if (!atEnd() && text.charAt(pos) == '"') {
        value = string();
        offset += value.length();
        skipSpace();
      }
      List<Node> children = new ArrayList<Node>();
      while (!atEnd() && text.charAt(pos) != ')') {
        children.add(node());
        skipSpace();
      }
      expect(')');
      return Node.create(kind, field, value, children,
                         Span.of(start, offset));
    }

    private String fieldName() throws InvalidTreeException {
      int start = pos;
      while (!atEnd() && isFieldChar(text.charAt(pos))) {
        pos++;
      }
      if (pos == start || atEnd() || text.charAt(pos) != ':') {
        throw error("Expected '(' or field label");
      }
      String field = text.substring(start, pos);
      pos++;
      return field;
    }

    private static boolean isFieldChar(char c) {
      return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private String kind() throws InvalidTreeException {
      int start = pos;
      while (!atEnd()) {
        char c = text.charAt(pos);
        if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"') {
          break;
        }
        pos++;
      }
      if (pos == start) {
        throw error("Expected node kind");
      }
      return text.substring(start, pos);
    }

    private String string() throws InvalidTreeException {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (true) {
        if (atEnd()) {
          throw error("Unterminated string");
        }
        char c = text.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        } else if (c == '\\') {
          if (atEnd()) {
            throw error("Unterminated escape");
          }
          char esc = text.charAt(pos++);
          switch (esc) {
            case 'n':
              sb.append('\n');
              break;
            case 't':
              sb.append('\t');
              break;
            case '"':
            case '\\':
              sb.append(esc);
              break;
            default:
              throw error("Unknown escape \\" + esc);
          }
        } else {
          sb.append(c);
        }
      }
    }

    private void expect(char c) throws InvalidTreeException {
      if (atEnd() || text.charAt(pos) != c) {
        throw error("Expected '" + c + "'");
      }
      pos++;
    }
  }
}
