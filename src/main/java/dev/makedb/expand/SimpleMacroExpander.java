// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package dev.makedb.expand;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import dev.makedb.filedb.Dependency;
import dev.makedb.filedb.FileNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * A small macro expander covering what prerequisite lists need: variable references in all three
 * spellings ({@code $(NAME)}, {@code ${NAME}}, {@code $X}), {@code $$}, the automatic variables
 * and their {@code F}/{@code D} forms, and a handful of text functions.
 *
 * <p>Variables are recursively expanded. A reference to an undefined variable expands to nothing.
 */
public final class SimpleMacroExpander implements MacroExpander {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final ImmutableSet<String> FUNCTIONS =
      ImmutableSet.of("strip", "subst", "patsubst", "notdir", "dir", "addprefix", "addsuffix");

  private static final int MAX_DEPTH = 100;

  private final VariableSet globals;
  private final Map<String, String> automatic = new HashMap<>();
  @Nullable private FileNode boundFile;

  public SimpleMacroExpander(VariableSet globals) {
    this.globals = checkNotNull(globals);
  }

  public SimpleMacroExpander() {
    this(new VariableSet());
  }

  public VariableSet getGlobals() {
    return globals;
  }

  @Override
  public String expand(String text) {
    return expand(text, name -> globals.get(name), 0);
  }

  @Override
  public void initializeFileVariables(FileNode file) {
    automatic.clear();
    boundFile = file;
  }

  @Override
  public void setFileVariables(FileNode file, @Nullable String stem) {
    boundFile = file;
    automatic.clear();
    String name = file.getName();
    String star = stem == null ? "" : stem;
    putWithParts("@", name);
    putWithParts("*", star);

    List<String> all = new ArrayList<>();
    Set<String> unique = new LinkedHashSet<>();
    Set<String> orderOnly = new LinkedHashSet<>();
    for (Dependency d : file.getDependencies()) {
      if (d.getFile() == null || d.ignoresAutomaticVars()) {
        continue;
      }
      String depName = d.getFile().getName();
      if (d.isOrderOnly()) {
        orderOnly.add(depName);
      } else {
        all.add(depName);
        unique.add(depName);
      }
    }
    putWithParts("<", all.isEmpty() ? "" : all.get(0));
    automatic.put("^", Joiner.on(' ').join(unique));
    automatic.put("+", Joiner.on(' ').join(all));
    automatic.put("|", Joiner.on(' ').join(orderOnly));
    logger.atFinest().log("bound automatic variables of %s: %s", name, automatic);
  }

  private void putWithParts(String variable, String value) {
    automatic.put(variable, value);
    automatic.put(variable + "F", notdir(value));
    String dir = dir(value);
    automatic.put(variable + "D", dir.equals("./") ? "." : dir.substring(0, dir.length() - 1));
  }

  @Override
  public String expandForFile(String text, FileNode file) {
    checkNotNull(file);
    return expand(text, name -> lookupForFile(name, file), 0);
  }

  @Nullable
  private String lookupForFile(String name, FileNode file) {
    if (file == boundFile) {
      String value = automatic.get(name);
      if (value != null) {
        return value;
      }
    }
    VariableSet targetVariables = file.getVariables();
    if (targetVariables != null && targetVariables.isDefined(name)) {
      return targetVariables.get(name);
    }
    return globals.get(name);
  }

  @Override
  @Nullable
  public String lookupVariable(String name) {
    return globals.get(name);
  }

  public ImmutableMap<String, String> getAutomaticVariables() {
    return ImmutableMap.copyOf(automatic);
  }

  private String expand(String text, Function<String, String> lookup, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalStateException("recursive variable reference while expanding: " + text);
    }
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c != '$' || i + 1 == text.length()) {
        out.append(c);
        i++;
        continue;
      }
      char next = text.charAt(i + 1);
      if (next == '$') {
        out.append('$');
        i += 2;
      } else if (next == '(' || next == '{') {
        int close = PatternSubstitution.findClose(text, i + 1);
        if (close < 0) {
          // Unterminated reference: keep the text as written.
          out.append(text, i, text.length());
          break;
        }
        out.append(reference(text.substring(i + 2, close), lookup, depth));
        i = close + 1;
      } else {
        out.append(variable(String.valueOf(next), lookup, depth));
        i += 2;
      }
    }
    return out.toString();
  }

  private String reference(String body, Function<String, String> lookup, int depth) {
    int space = CharMatcher.anyOf(" \t").indexIn(body);
    if (space > 0 && FUNCTIONS.contains(body.substring(0, space))) {
      return function(
          body.substring(0, space), splitArguments(body.substring(space + 1)), lookup, depth);
    }
    return variable(expand(body, lookup, depth + 1), lookup, depth);
  }

  private String variable(String name, Function<String, String> lookup, int depth) {
    String value = lookup.apply(name);
    return value == null ? "" : expand(value, lookup, depth + 1);
  }

  /** Splits function arguments on commas outside of nested references. */
  private static List<String> splitArguments(String args) {
    List<String> result = new ArrayList<>();
    int level = 0;
    int start = 0;
    for (int i = 0; i < args.length(); i++) {
      char c = args.charAt(i);
      if (c == '(' || c == '{') {
        level++;
      } else if (c == ')' || c == '}') {
        level--;
      } else if (c == ',' && level == 0) {
        result.add(args.substring(start, i));
        start = i + 1;
      }
    }
    result.add(args.substring(start));
    return result;
  }

  private String function(
      String function, List<String> rawArgs, Function<String, String> lookup, int depth) {
    List<String> args = new ArrayList<>(rawArgs.size());
    for (String raw : rawArgs) {
      args.add(expand(raw, lookup, depth + 1));
    }
    String last = args.get(args.size() - 1);
    switch (function) {
      case "strip":
        return Joiner.on(' ').join(PatternSubstitution.words(Joiner.on(',').join(args)));
      case "subst":
        checkArity(function, args, 3);
        return args.get(0).isEmpty() ? args.get(2) : args.get(2).replace(args.get(0), args.get(1));
      case "patsubst":
        checkArity(function, args, 3);
        return PatternSubstitution.patsubst(args.get(0), args.get(1), args.get(2));
      case "notdir":
        return mapWords(last, SimpleMacroExpander::notdir);
      case "dir":
        return mapWords(last, SimpleMacroExpander::dir);
      case "addprefix":
        checkArity(function, args, 2);
        return mapWords(args.get(1), w -> args.get(0) + w);
      case "addsuffix":
        checkArity(function, args, 2);
        return mapWords(args.get(1), w -> w + args.get(0));
      default:
        throw new IllegalArgumentException("unknown function: " + function);
    }
  }

  private static void checkArity(String function, List<String> args, int expected) {
    if (args.size() < expected) {
      throw new IllegalArgumentException(
          String.format(
              "insufficient number of arguments (%d) to function '%s'", args.size(), function));
    }
  }

  private static String mapWords(String text, Function<String, String> f) {
    List<String> out = new ArrayList<>();
    for (String word : PatternSubstitution.words(text)) {
      out.add(f.apply(word));
    }
    return Joiner.on(' ').join(out);
  }

  static String notdir(String name) {
    return name.substring(name.lastIndexOf('/') + 1);
  }

  static String dir(String name) {
    int slash = name.lastIndexOf('/');
    return slash < 0 ? "./" : name.substring(0, slash + 1);
  }
}
