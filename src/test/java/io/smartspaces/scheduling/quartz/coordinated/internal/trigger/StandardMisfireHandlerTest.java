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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.Date;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;

import io.smartspaces.scheduling.quartz.coordinated.JobStoreTestSupport;
import io.smartspaces.scheduling.quartz.coordinated.NoOpJob;
import io.smartspaces.scheduling.quartz.coordinated.RecordingSchedulerSignaler;
import io.smartspaces.scheduling.quartz.coordinated.TestClock;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.OrientDbConnector.StoreMethod;

/**
 * Tests for the misfire handler.
 */
public class StandardMisfireHandlerTest extends JobStoreTestSupport {

  private RecordingSchedulerSignaler signaler;
  private StandardOrientDbStoreAssembler assembler;

  @BeforeEach
  void buildAssembler() throws Exception {
    signaler = new RecordingSchedulerSignaler();
    assembler = createAssembler("instanceA", new TestClock(), signaler, 5000);
  }

  @Test
  void correctedTriggerDoesNotMisfireAgain() throws Exception {
    final OperableTrigger trigger = store(TriggerBuilder.newTrigger()
        .withIdentity(TriggerKey.triggerKey("trigger1")).startAt(secondsFromNow(-120))
        .withSchedule(SimpleScheduleBuilder.simpleSchedule().withIntervalInSeconds(10)
            .repeatForever().withMisfireHandlingInstructionNextWithRemainingCount()));

    assertTrue(applyMisfire(trigger));
    assertTrue(trigger.getNextFireTime().getTime() > System.currentTimeMillis() - 5000);

    assertFalse(applyMisfire(trigger));
    assertFalse(applyMisfire(reload(trigger.getKey())));
    assertEquals(trigger.getNextFireTime(), reload(trigger.getKey()).getNextFireTime());
    assertEquals(Collections.singletonList(trigger.getKey()), signaler.getMisfired());
  }

  @Test
  void ignoredMisfireLeavesTriggerUnchanged() throws Exception {
    final OperableTrigger trigger = store(TriggerBuilder.newTrigger()
        .withIdentity(TriggerKey.triggerKey("trigger1")).startAt(secondsFromNow(-10))
        .withSchedule(SimpleScheduleBuilder.simpleSchedule().withIntervalInMinutes(1)
            .repeatForever().withMisfireHandlingInstructionIgnoreMisfires()));
    Date fireTime = trigger.getNextFireTime();

    assertFalse(applyMisfire(trigger));

    assertEquals(fireTime, reload(trigger.getKey()).getNextFireTime());
    assertEquals(StoredTriggerState.WAITING, stateOf(trigger.getKey()));
    assertTrue(signaler.getMisfired().isEmpty());
  }

  @Test
  void triggerWithoutFurtherFireTimesIsCompleted() throws Exception {
    final OperableTrigger trigger = store(TriggerBuilder.newTrigger()
        .withIdentity(TriggerKey.triggerKey("trigger1")).startAt(secondsFromNow(-120))
        .withSchedule(SimpleScheduleBuilder.simpleSchedule()
            .withMisfireHandlingInstructionNextWithRemainingCount()));

    assertTrue(applyMisfire(trigger));

    assertNull(trigger.getNextFireTime());
    assertEquals(StoredTriggerState.COMPLETE, stateOf(trigger.getKey()));
    assertEquals(Collections.singletonList(trigger.getKey()), signaler.getFinalized());
  }

  @Test
  void triggerMovedByOthersIsNotOverwritten() throws Exception {
    final OperableTrigger trigger = store(TriggerBuilder.newTrigger()
        .withIdentity(TriggerKey.triggerKey("trigger1")).startAt(secondsFromNow(-120))
        .withSchedule(SimpleScheduleBuilder.simpleSchedule().withIntervalInSeconds(10)
            .repeatForever().withMisfireHandlingInstructionNextWithRemainingCount()));
    final Date storedFireTime = trigger.getNextFireTime();

    // The trigger is expected to be paused, which it is not.
    inStore(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getMisfireHandler().applyMisfire(trigger, StoredTriggerState.PAUSED);
      }
    });

    assertEquals(storedFireTime, reload(trigger.getKey()).getNextFireTime());
  }

  private OperableTrigger store(TriggerBuilder<?> builder) throws JobPersistenceException {
    final JobDetail job = newJob("job1", NoOpJob.class, true);
    final OperableTrigger trigger = (OperableTrigger) builder.forJob(job.getKey()).build();
    trigger.computeFirstFireTime(null);

    inStore(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getPersister().storeJobAndTrigger(job, trigger);

        return null;
      }
    });

    return trigger;
  }

  private boolean applyMisfire(final OperableTrigger trigger) throws JobPersistenceException {
    return inStore(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getMisfireHandler().applyMisfire(trigger, StoredTriggerState.WAITING);
      }
    });
  }

  private OperableTrigger reload(final TriggerKey triggerKey) throws JobPersistenceException {
    return inStore(new StoreMethod<OperableTrigger>() {
      @Override
      public OperableTrigger doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().getTrigger(triggerKey);
      }
    });
  }

  private StoredTriggerState stateOf(final TriggerKey triggerKey)
      throws JobPersistenceException {
    return inStore(new StoreMethod<StoredTriggerState>() {
      @Override
      public StoredTriggerState doInStore() throws JobPersistenceException {
        return assembler.getTriggerDao().getState(triggerKey);
      }
    });
  }

  private <T> T inStore(StoreMethod<T> method) throws JobPersistenceException {
    return assembler.getOrientDbConnector().doInLock(method);
  }
}
