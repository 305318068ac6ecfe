package com.eventledger.expression;

import java.util.Locale;
import java.util.Set;

/**
 * Text-level preparation of a hint expression before it is parsed: nesting depth,
 * case folding of string literals and expansion of the per-item helpers
 * {@code all_match(cond)}, {@code any_match(cond)} and {@code same(field)} into
 * selections over {@code items}.
 *
 * <p>String literals use single or double quotes, a doubled quote escapes itself.
 */
final class ExpressionSource {
  private static final Set<String> MACROS = Set.of("all_match", "any_match", "same");

  private ExpressionSource() {
  }

  static int nestingDepth(String source) {
    int depth = 0;
    int max = 0;
    for (int i = 0; i < source.length(); i++) {
      char c = source.charAt(i);
      if (isQuote(c)) {
        int end = literalEnd(source, i);
        if (end < 0) {
          break;
        }
        i = end;
      } else if (c == '(') {
        max = Math.max(max, ++depth);
      } else if (c == ')') {
        depth--;
      }
    }
    return max;
  }

  /**
   * Lower-cases string literals so they compare against the lower-cased line item fields.
   * A literal used as a {@code matches} pattern keeps its case and becomes case-insensitive.
   */
  static String foldLiterals(String source) {
    StringBuilder out = new StringBuilder(source.length() + 8);
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (!isQuote(c)) {
        out.append(c);
        i++;
        continue;
      }
      int end = literalEnd(source, i);
      if (end < 0) {
        out.append(source, i, source.length());
        break;
      }
      String body = source.substring(i + 1, end);
      out.append(c)
          .append(followsMatches(out) ? "(?i)" + body : body.toLowerCase(Locale.ROOT))
          .append(c);
      i = end + 1;
    }
    return out.toString();
  }

  static String expandMacros(String source) throws ExpressionException {
    StringBuilder out = new StringBuilder(source.length() + 32);
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (isQuote(c)) {
        int end = literalEnd(source, i);
        if (end < 0) {
          out.append(source, i, source.length());
          break;
        }
        out.append(source, i, end + 1);
        i = end + 1;
      } else if (Character.isLetter(c) || c == '_') {
        int j = i;
        while (j < source.length() && isIdentifierPart(source.charAt(j))) {
          j++;
        }
        String word = source.substring(i, j);
        int open = skipSpaces(source, j);
        if (MACROS.contains(word) && open < source.length() && source.charAt(open) == '(' && !qualified(out)) {
          int close = closingParen(source, open);
          if (close < 0) {
            throw new ExpressionException("Missing ')' after " + word, i);
          }
          String argument = expandMacros(source.substring(open + 1, close).trim());
          out.append(expand(word, argument, i));
          i = close + 1;
        } else {
          out.append(word);
          i = j;
        }
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private static String expand(String macro, String argument, int position) throws ExpressionException {
    if (argument.isEmpty()) {
      throw new ExpressionException(macro + "() needs an argument", position);
    }
    return switch (macro) {
      case "all_match" -> "items.?[!(" + argument + ")].isEmpty()";
      case "any_match" -> "(!items.?[" + argument + "].isEmpty())";
      default -> {
        if (!ItemRecord.FIELDS.contains(argument)) {
          throw new ExpressionException("same() only accepts a line item field, got '" + argument + "'", position);
        }
        yield "items.?[" + argument + " != #root.items[0]." + argument + "].isEmpty()";
      }
    };
  }

  /** Index of the closing quote of the literal opened at {@code start}, or -1 when unterminated. */
  private static int literalEnd(String source, int start) {
    char quote = source.charAt(start);
    int i = start + 1;
    while (i < source.length()) {
      if (source.charAt(i) == quote) {
        if (i + 1 < source.length() && source.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i;
      }
      i++;
    }
    return -1;
  }

  private static int closingParen(String source, int open) {
    int depth = 0;
    for (int i = open; i < source.length(); i++) {
      char c = source.charAt(i);
      if (isQuote(c)) {
        int end = literalEnd(source, i);
        if (end < 0) {
          return -1;
        }
        i = end;
      } else if (c == '(') {
        depth++;
      } else if (c == ')' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }

  private static boolean followsMatches(CharSequence before) {
    int i = before.length() - 1;
    while (i >= 0 && Character.isWhitespace(before.charAt(i))) {
      i--;
    }
    if (i >= 0 && before.charAt(i) == '(') {
      i--;
      while (i >= 0 && Character.isWhitespace(before.charAt(i))) {
        i--;
      }
    }
    int end = i + 1;
    int start = end - "matches".length();
    return start >= 0
        && "matches".contentEquals(before.subSequence(start, end))
        && (start == 0 || !isIdentifierPart(before.charAt(start - 1)));
  }

  private static boolean qualified(CharSequence before) {
    int i = before.length() - 1;
    while (i >= 0 && Character.isWhitespace(before.charAt(i))) {
      i--;
    }
    return i >= 0 && (before.charAt(i) == '.' || before.charAt(i) == '#');
  }

  private static int skipSpaces(String source, int from) {
    int i = from;
    while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
      i++;
    }
    return i;
  }

  private static boolean isQuote(char c) {
    return c == '\'' || c == '"';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
