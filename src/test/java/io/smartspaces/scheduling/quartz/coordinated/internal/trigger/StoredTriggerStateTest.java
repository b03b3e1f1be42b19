/*
 * Copyright (C) 2016 Keith M. Hughes
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package io.smartspaces.scheduling.quartz.coordinated.internal.trigger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.quartz.Trigger.TriggerState;

/**
 * Tests for the trigger state machine.
 */
public class StoredTriggerStateTest {

  @Test
  void initialStateFollowsPauseAndBlock() {
    assertEquals(StoredTriggerState.WAITING, StoredTriggerState.initial(false, false));
    assertEquals(StoredTriggerState.BLOCKED, StoredTriggerState.initial(false, true));
    assertEquals(StoredTriggerState.PAUSED, StoredTriggerState.initial(true, false));
    assertEquals(StoredTriggerState.PAUSED_AND_BLOCKED, StoredTriggerState.initial(true, true));
  }

  @Test
  void pauseThenResumeRestoresBlockedness() {
    assertEquals(StoredTriggerState.WAITING,
        StoredTriggerState.WAITING.paused().resumed(false));
    assertEquals(StoredTriggerState.BLOCKED,
        StoredTriggerState.BLOCKED.paused().resumed(true));
    assertEquals(StoredTriggerState.PAUSED, StoredTriggerState.ACQUIRED.paused());
  }

  @Test
  void finalStatesDoNotMove() {
    for (StoredTriggerState state : new StoredTriggerState[] { StoredTriggerState.COMPLETE,
        StoredTriggerState.ERROR }) {
      assertSame(state, state.paused());
      assertSame(state, state.resumed(false));
      assertSame(state, state.blocked());
      assertSame(state, state.unblocked());
      assertSame(state, state.released(false));
    }
  }

  @Test
  void blockingKeepsPause() {
    assertEquals(StoredTriggerState.PAUSED_AND_BLOCKED, StoredTriggerState.PAUSED.blocked());
    assertEquals(StoredTriggerState.PAUSED, StoredTriggerState.PAUSED_AND_BLOCKED.unblocked());
    assertEquals(StoredTriggerState.WAITING, StoredTriggerState.BLOCKED.unblocked());
    assertSame(StoredTriggerState.ACQUIRED, StoredTriggerState.ACQUIRED.blocked());
  }

  @Test
  void releaseOnlyMovesAcquired() {
    assertEquals(StoredTriggerState.WAITING, StoredTriggerState.ACQUIRED.released(false));
    assertEquals(StoredTriggerState.BLOCKED, StoredTriggerState.ACQUIRED.released(true));
    assertSame(StoredTriggerState.PAUSED, StoredTriggerState.PAUSED.released(false));
  }

  @Test
  void onlyWaitingAndAcquiredAreReclaimable() {
    for (StoredTriggerState state : StoredTriggerState.values()) {
      boolean expected =
          state == StoredTriggerState.WAITING || state == StoredTriggerState.ACQUIRED;
      assertEquals(expected, state.isReclaimable(), state.name());
    }
    assertTrue(StoredTriggerState.PAUSED_AND_BLOCKED.isPaused());
    assertFalse(StoredTriggerState.BLOCKED.isPaused());
  }

  @Test
  void mapsToQuartzStates() {
    assertEquals(TriggerState.NORMAL, StoredTriggerState.ACQUIRED.toTriggerState());
    assertEquals(TriggerState.PAUSED, StoredTriggerState.PAUSED_AND_BLOCKED.toTriggerState());
    assertEquals(TriggerState.BLOCKED, StoredTriggerState.BLOCKED.toTriggerState());
    assertEquals(TriggerState.COMPLETE, StoredTriggerState.COMPLETE.toTriggerState());
    assertEquals(TriggerState.ERROR, StoredTriggerState.ERROR.toTriggerState());
  }

  @Test
  void storedValuesRoundTrip() {
    for (StoredTriggerState state : StoredTriggerState.values()) {
      assertSame(state, StoredTriggerState.fromValue(state.getValue()));
    }
    assertNull(StoredTriggerState.fromValue(null));
    assertThrows(IllegalArgumentException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        StoredTriggerState.fromValue("sleeping");
      }
    });
  }
}
