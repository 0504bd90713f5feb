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
package dev.makedb.filedb;

import static java.util.Arrays.asList;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

/**
 * The run-wide settings the file database consults. They come from the command line (see
 * {@link #parse}) and from special variables such as {@code .SECONDEXPANSION}.
 */
public final class MakeOptions {
  private final boolean justPrint;
  private final boolean question;
  private final boolean touch;
  private final boolean silent;
  private final boolean noBuiltinRules;
  private final boolean printDatabase;
  private final boolean verifyDatabase;
  private final boolean secondExpansion;
  private final boolean caseInsensitiveTargets;
  private final String shuffle;
  private final ImmutableList<String> goals;

  private MakeOptions(Builder builder) {
    this.justPrint = builder.justPrint;
    this.question = builder.question;
    this.touch = builder.touch;
    this.silent = builder.silent;
    this.noBuiltinRules = builder.noBuiltinRules;
    this.printDatabase = builder.printDatabase;
    this.verifyDatabase = builder.verifyDatabase;
    this.secondExpansion = builder.secondExpansion;
    this.caseInsensitiveTargets = builder.caseInsensitiveTargets;
    this.shuffle = builder.shuffle;
    this.goals = builder.goals;
  }

  /** {@code -n}: print recipes instead of running them. */
  public boolean justPrint() {
    return justPrint;
  }

  /** {@code -q}: only report whether the goals are up to date. */
  public boolean question() {
    return question;
  }

  /** {@code -t}: touch targets instead of remaking them. */
  public boolean touch() {
    return touch;
  }

  /** {@code -s}: do not echo recipes. */
  public boolean silent() {
    return silent;
  }

  /** {@code -r}: built-in rules are disabled and built-in targets are hidden from dumps. */
  public boolean noBuiltinRules() {
    return noBuiltinRules;
  }

  /** {@code -p}: print the database. */
  public boolean printDatabase() {
    return printDatabase;
  }

  /** {@code --verify-database}: check every stored name against the string pool. */
  public boolean verifyDatabase() {
    return verifyDatabase;
  }

  /** Whether {@code .SECONDEXPANSION} is in effect. */
  public boolean secondExpansion() {
    return secondExpansion;
  }

  /** Whether target names are case-folded before they are stored or looked up. */
  public boolean caseInsensitiveTargets() {
    return caseInsensitiveTargets;
  }

  /** The {@code --shuffle} mode. */
  public String shuffle() {
    return shuffle;
  }

  /** Goals named on the command line. */
  public ImmutableList<String> goals() {
    return goals;
  }

  public Builder toBuilder() {
    return new Builder().copyFrom(this);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static MakeOptions defaults() {
    return builder().build();
  }

  /**
   * Reads the switches the file database cares about from a make command line. Everything that
   * is not an option is a goal.
   */
  public static MakeOptions parse(String... args) throws MakeFatalException {
    OptionParser parser = new OptionParser();
    OptionSpec<Void> justPrint =
        parser.acceptsAll(asList("n", "just-print", "dry-run", "recon"), "print recipes only");
    OptionSpec<Void> question = parser.acceptsAll(asList("q", "question"), "question mode");
    OptionSpec<Void> touch = parser.acceptsAll(asList("t", "touch"), "touch targets");
    OptionSpec<Void> silent = parser.acceptsAll(asList("s", "silent", "quiet"), "no echo");
    OptionSpec<Void> noBuiltinRules =
        parser.acceptsAll(asList("r", "no-builtin-rules"), "disable built-in rules");
    OptionSpec<Void> printDatabase =
        parser.acceptsAll(asList("p", "print-data-base"), "print the database");
    OptionSpec<Void> verifyDatabase =
        parser.accepts("verify-database", "verify the database");
    OptionSpec<Void> secondExpansion =
        parser.accepts("second-expansion", "enable second expansion of prerequisites");
    OptionSpec<Void> caseInsensitive =
        parser.accepts("case-insensitive-targets", "fold the case of target names");
    OptionSpec<String> shuffle =
        parser
            .accepts("shuffle", "visit prerequisites in another order")
            .withOptionalArg()
            .defaultsTo("random");
    OptionSpec<String> goals = parser.nonOptions("goals");

    OptionSet set;
    try {
      set = parser.parse(args);
    } catch (OptionException e) {
      throw new MakeFatalException(e.getMessage(), e);
    }
    Builder builder =
        builder()
            .setJustPrint(set.has(justPrint))
            .setQuestion(set.has(question))
            .setTouch(set.has(touch))
            .setSilent(set.has(silent))
            .setNoBuiltinRules(set.has(noBuiltinRules))
            .setPrintDatabase(set.has(printDatabase))
            .setVerifyDatabase(set.has(verifyDatabase))
            .setSecondExpansion(set.has(secondExpansion))
            .setCaseInsensitiveTargets(set.has(caseInsensitive))
            .setGoals(set.valuesOf(goals));
    if (set.has(shuffle)) {
      String mode = set.valueOf(shuffle);
      try {
        DependencyShuffler.forMode(mode);
      } catch (IllegalArgumentException e) {
        throw new MakeFatalException(e.getMessage(), e);
      }
      builder.setShuffle(mode);
    }
    return builder.build();
  }

  /** Builder for {@link MakeOptions}. */
  public static final class Builder {
    private boolean justPrint;
    private boolean question;
    private boolean touch;
    private boolean silent;
    private boolean noBuiltinRules;
    private boolean printDatabase;
    private boolean verifyDatabase;
    private boolean secondExpansion;
    private boolean caseInsensitiveTargets;
    private String shuffle = "none";
    private ImmutableList<String> goals = ImmutableList.of();

    private Builder() {}

    @CanIgnoreReturnValue
    private Builder copyFrom(MakeOptions options) {
      this.justPrint = options.justPrint;
      this.question = options.question;
      this.touch = options.touch;
      this.silent = options.silent;
      this.noBuiltinRules = options.noBuiltinRules;
      this.printDatabase = options.printDatabase;
      this.verifyDatabase = options.verifyDatabase;
      this.secondExpansion = options.secondExpansion;
      this.caseInsensitiveTargets = options.caseInsensitiveTargets;
      this.shuffle = options.shuffle;
      this.goals = options.goals;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setJustPrint(boolean justPrint) {
      this.justPrint = justPrint;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setQuestion(boolean question) {
      this.question = question;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTouch(boolean touch) {
      this.touch = touch;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSilent(boolean silent) {
      this.silent = silent;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setNoBuiltinRules(boolean noBuiltinRules) {
      this.noBuiltinRules = noBuiltinRules;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPrintDatabase(boolean printDatabase) {
      this.printDatabase = printDatabase;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setVerifyDatabase(boolean verifyDatabase) {
      this.verifyDatabase = verifyDatabase;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSecondExpansion(boolean secondExpansion) {
      this.secondExpansion = secondExpansion;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCaseInsensitiveTargets(boolean caseInsensitiveTargets) {
      this.caseInsensitiveTargets = caseInsensitiveTargets;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setShuffle(String shuffle) {
      this.shuffle = shuffle;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setGoals(List<String> goals) {
      this.goals = ImmutableList.copyOf(goals);
      return this;
    }

    public MakeOptions build() {
      return new MakeOptions(this);
    }
  }
}
