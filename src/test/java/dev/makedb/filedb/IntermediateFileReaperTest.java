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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import dev.makedb.events.Event;
import dev.makedb.events.EventKind;
import dev.makedb.events.StoredEventHandler;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests for {@link IntermediateFileReaper}. */
@RunWith(TestParameterInjector.class)
public final class IntermediateFileReaperTest {
  private final StoredEventHandler events = new StoredEventHandler();
  private final FileDeleter deleter = mock(FileDeleter.class);
  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(outBytes, true);
  private BuildState state;
  private FileRegistry registry;

  private IntermediateFileReaper reaper(MakeOptions options) {
    state = new BuildState(options, events);
    registry = new FileRegistry(state);
    return new IntermediateFileReaper(registry, deleter, out);
  }

  private IntermediateFileReaper reaper() {
    return reaper(MakeOptions.defaults());
  }

  /** A file that was made on the way and is eligible for deletion. */
  private FileNode madeIntermediate(String name) {
    FileNode f = registry.getOrCreate(name).set(FileFlag.INTERMEDIATE);
    f.setUpdateStatus(UpdateStatus.SUCCESS);
    return f;
  }

  private String output() {
    return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void deletesAndEchoesOneRmLine() throws Exception {
    IntermediateFileReaper reaper = reaper();
    madeIntermediate("a.c");
    registry.getOrCreate("plain.o").setUpdateStatus(UpdateStatus.SUCCESS);
    madeIntermediate("b.c");

    reaper.removeIntermediates(false);

    verify(deleter).delete("a.c");
    verify(deleter).delete("b.c");
    verify(deleter, never()).delete("plain.o");
    assertThat(output()).isEqualTo("rm a.c b.c\n");
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void nothingToDelete() throws Exception {
    IntermediateFileReaper reaper = reaper();
    registry.getOrCreate("plain.o");

    reaper.removeIntermediates(false);

    verifyNoInteractions(deleter);
    assertThat(output()).isEmpty();
  }

  enum Keeper {
    NEVER_UPDATED {
      @Override
      void apply(FileNode f) {
        f.setUpdateStatus(UpdateStatus.NONE);
      }
    },
    SECONDARY {
      @Override
      void apply(FileNode f) {
        f.set(FileFlag.SECONDARY);
      }
    },
    PRECIOUS {
      @Override
      void apply(FileNode f) {
        f.set(FileFlag.PRECIOUS);
      }
    },
    NOT_INTERMEDIATE {
      @Override
      void apply(FileNode f) {
        f.set(FileFlag.NOT_INTERMEDIATE);
      }
    },
    COMMAND_LINE_GOAL {
      @Override
      void apply(FileNode f) {
        f.set(FileFlag.CMD_TARGET);
      }
    };

    abstract void apply(FileNode f);
  }

  @Test
  public void keptFiles(@TestParameter Keeper keeper) throws Exception {
    IntermediateFileReaper reaper = reaper();
    FileNode f = madeIntermediate("gen.c");
    keeper.apply(f);

    assertThat(IntermediateFileReaper.isEligibleForDeletion(f)).isFalse();
    reaper.removeIntermediates(false);

    verifyNoInteractions(deleter);
    assertThat(output()).isEmpty();
  }

  @Test
  public void preciousOptionalMakefileDeletedQuietly() throws Exception {
    IntermediateFileReaper reaper = reaper();
    madeIntermediate("deps.mk").set(FileFlag.PRECIOUS).set(FileFlag.DONT_CARE);

    reaper.removeIntermediates(false);

    verify(deleter).delete("deps.mk");
    assertThat(output()).isEmpty();
  }

  @Test
  public void disabledByRunMode(
      @TestParameter({"question", "touch", "allSecondary", "noIntermediates"}) String mode)
      throws Exception {
    MakeOptions.Builder options = MakeOptions.builder();
    if (mode.equals("question")) {
      options.setQuestion(true);
    } else if (mode.equals("touch")) {
      options.setTouch(true);
    }
    IntermediateFileReaper reaper = reaper(options.build());
    if (mode.equals("allSecondary")) {
      state.setAllSecondary();
    } else if (mode.equals("noIntermediates")) {
      state.setNoIntermediates();
    }
    madeIntermediate("gen.c");

    reaper.removeIntermediates(false);

    verifyNoInteractions(deleter);
    assertThat(output()).isEmpty();
  }

  @Test
  public void justPrintEchoesWithoutDeleting() throws Exception {
    IntermediateFileReaper reaper = reaper(MakeOptions.builder().setJustPrint(true).build());
    madeIntermediate("gen.c");

    reaper.removeIntermediates(false);

    verifyNoInteractions(deleter);
    assertThat(output()).isEqualTo("rm gen.c\n");
  }

  @Test
  public void silentRunDeletesWithoutEcho() throws Exception {
    IntermediateFileReaper reaper = reaper(MakeOptions.builder().setSilent(true).build());
    madeIntermediate("gen.c");

    reaper.removeIntermediates(false);

    verify(deleter).delete("gen.c");
    assertThat(output()).isEmpty();
  }

  @Test
  public void signalReportsEachDeletion() throws Exception {
    IntermediateFileReaper reaper = reaper();
    madeIntermediate("a.c");
    madeIntermediate("b.c");

    reaper.removeIntermediates(true);

    verify(deleter).delete("a.c");
    verify(deleter).delete("b.c");
    assertThat(output()).isEmpty();
    assertThat(events.getEvents())
        .containsExactly(
            Event.error("*** deleting intermediate file 'a.c'"),
            Event.error("*** deleting intermediate file 'b.c'"))
        .inOrder();
  }

  @Test
  public void signalUnderJustPrintDoesNothing() throws Exception {
    IntermediateFileReaper reaper = reaper(MakeOptions.builder().setJustPrint(true).build());
    madeIntermediate("gen.c");

    reaper.removeIntermediates(true);

    verifyNoInteractions(deleter);
    assertThat(output()).isEmpty();
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void alreadyGoneIsSkipped() throws Exception {
    IntermediateFileReaper reaper = reaper();
    madeIntermediate("gone.c");
    madeIntermediate("here.c");
    doThrow(new NoSuchFileException("gone.c")).when(deleter).delete("gone.c");

    reaper.removeIntermediates(false);

    assertThat(output()).isEqualTo("rm here.c\n");
    assertThat(events.isEmpty()).isTrue();
  }

  @Test
  public void failureReportedAndSweepContinues() throws Exception {
    IntermediateFileReaper reaper = reaper();
    madeIntermediate("locked.c");
    madeIntermediate("free.c");
    doThrow(new AccessDeniedException("locked.c")).when(deleter).delete("locked.c");

    reaper.removeIntermediates(false);

    verify(deleter).delete("free.c");
    assertThat(output()).isEqualTo("rm locked.c\nrm free.c\n");
    assertThat(events.getEvents(EventKind.ERROR)).hasSize(1);
    assertThat(events.getEvents().get(0).getMessage()).startsWith("unlink: locked.c: ");
  }

  @Test
  public void failureWithoutMessage() throws Exception {
    IntermediateFileReaper reaper = reaper();
    madeIntermediate("locked.c");
    doThrow(new IOException()).when(deleter).delete(anyString());

    reaper.removeIntermediates(false);

    assertThat(events.getEvents().get(0).getMessage())
        .isEqualTo("unlink: locked.c: IOException");
  }
}
