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

package io.smartspaces.scheduling.quartz.coordinated.internal.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobDetail;
import org.quartz.JobPersistenceException;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;

import io.smartspaces.scheduling.quartz.coordinated.CoordinatedOrientDbJobStore;
import io.smartspaces.scheduling.quartz.coordinated.JobStoreTestSupport;
import io.smartspaces.scheduling.quartz.coordinated.NonConcurrentJob;
import io.smartspaces.scheduling.quartz.coordinated.RecordingSchedulerSignaler;
import io.smartspaces.scheduling.quartz.coordinated.TestClock;
import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.db.OrientDbConnector.StoreMethod;
import io.smartspaces.scheduling.quartz.coordinated.internal.trigger.StoredTriggerState;

/**
 * Tests for the liveness records of scheduler instances.
 */
public class InstanceLivenessTrackerTest extends JobStoreTestSupport {

  private TestClock clock;
  private StandardOrientDbStoreAssembler assembler;

  @BeforeEach
  void buildAssembler() throws Exception {
    clock = new TestClock();
    assembler = createAssembler("instanceA", clock, new RecordingSchedulerSignaler(), 5000);
  }

  @Test
  void cycleRenewsTheLease() throws Exception {
    runCycle(assembler);

    SchedulerInstance instance = findInstance(assembler, "instanceA");
    assertNotNull(instance);
    assertEquals("TestScheduler", instance.getName());
    assertEquals(Constants.SCHEDULER_STATE_RUNNING, instance.getState());
    long expectedExpiry =
        clock.millis() + CoordinatedOrientDbJobStore.DEFAULT_INSTANCE_LEASE_MILLIS;
    assertTrue(Math.abs(expectedExpiry - instance.getExpires().getTime()) < 1000);
    assertFalse(instance.isExpired(clock.millis()));
  }

  @Test
  void stateChangeIsRecorded() throws Exception {
    assembler.getOrientDbConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getLivenessTracker().setSchedulerState(Constants.SCHEDULER_STATE_PAUSED);

        return null;
      }
    });

    assertEquals(Constants.SCHEDULER_STATE_PAUSED,
        assembler.getLivenessTracker().getSchedulerState());
    assertEquals(Constants.SCHEDULER_STATE_PAUSED,
        findInstance(assembler, "instanceA").getState());

    // Later check ins keep the state.
    runCycle(assembler);
    assertEquals(Constants.SCHEDULER_STATE_PAUSED,
        findInstance(assembler, "instanceA").getState());
  }

  @Test
  void expiredInstanceRecordIsRemoved() throws Exception {
    TestClock staleClock = new TestClock();
    staleClock.shift(-60 * 60 * 1000L);
    StandardOrientDbStoreAssembler stale =
        createAssembler("instanceB", staleClock, new RecordingSchedulerSignaler(), 5000);
    runCycle(stale);

    SchedulerInstance staleInstance = findInstance(assembler, "instanceB");
    assertNotNull(staleInstance);
    assertTrue(staleInstance.isExpired(clock.millis()));

    runCycle(assembler);

    assertNull(findInstance(assembler, "instanceB"));
    assertNotNull(findInstance(assembler, "instanceA"));
  }

  @Test
  void removeSelfDeletesTheRecord() throws Exception {
    runCycle(assembler);

    assembler.getOrientDbConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assembler.getLivenessTracker().removeSelf();

        return null;
      }
    });

    assertNull(findInstance(assembler, "instanceA"));
  }

  @Test
  void blockedTriggersWithoutMarkerAreFreedByNextCycle() throws Exception {
    final JobDetail job = storeJobWithTriggers("T1", "T2");
    inStore(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        // The job finished elsewhere after these were blocked.
        assembler.getTriggerDao().setState(TriggerKey.triggerKey("T1"),
            StoredTriggerState.BLOCKED);
        assembler.getTriggerDao().setState(TriggerKey.triggerKey("T2"),
            StoredTriggerState.PAUSED_AND_BLOCKED);

        return null;
      }
    });
    assertFalse(isBlocked(job));

    runCycle(assembler);

    assertEquals(StoredTriggerState.WAITING, stateOf(TriggerKey.triggerKey("T1")));
    assertEquals(StoredTriggerState.PAUSED, stateOf(TriggerKey.triggerKey("T2")));
  }

  @Test
  void blockedTriggersOfExecutingJobStayBlocked() throws Exception {
    final JobDetail job = storeJobWithTriggers("T1");
    runCycle(assembler);
    inStore(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        assertTrue(assembler.getBlockedJobsDao().tryBlock(job.getKey(), "instanceA"));
        assembler.getTriggerStateManager().blockJobTriggers(job.getKey());

        return null;
      }
    });

    runCycle(assembler);

    assertEquals(StoredTriggerState.BLOCKED, stateOf(TriggerKey.triggerKey("T1")));
    assertTrue(isBlocked(job));
  }

  @Test
  void reclaimedTriggerOfExecutingJobIsBlocked() throws Exception {
    final JobDetail job = storeJobWithTriggers("T1");
    runCycle(assembler);
    inStore(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        // Acquired by an instance that never checked in, while this instance
        // runs the job.
        assertTrue(assembler.getTriggerDao().acquire(TriggerKey.triggerKey("T1"), "instanceGone",
            "instanceGone-1"));
        assertTrue(assembler.getBlockedJobsDao().tryBlock(job.getKey(), "instanceA"));

        return null;
      }
    });

    runCycle(assembler);

    assertEquals(StoredTriggerState.BLOCKED, stateOf(TriggerKey.triggerKey("T1")));
  }

  @Test
  void liveRecordUnderOwnIdIsDetected() throws Exception {
    assertFalse(checkForLiveNamesake());

    runCycle(assembler);

    assertTrue(checkForLiveNamesake());
  }

  @Test
  void expiredRecordUnderOwnIdIsNotReported() throws Exception {
    TestClock staleClock = new TestClock();
    staleClock.shift(-60 * 60 * 1000L);
    StandardOrientDbStoreAssembler earlierRun =
        createAssembler("instanceA", staleClock, new RecordingSchedulerSignaler(), 5000);
    runCycle(earlierRun);

    assertFalse(checkForLiveNamesake());
  }

  private JobDetail storeJobWithTriggers(String... triggerNames) throws JobPersistenceException {
    final JobDetail job = newJob("job1", NonConcurrentJob.class, true);
    for (String triggerName : triggerNames) {
      final OperableTrigger trigger = newTrigger(TriggerKey.triggerKey(triggerName),
          job.getKey(), secondsFromNow(60), 0);
      inStore(new StoreMethod<Void>() {
        @Override
        public Void doInStore() throws JobPersistenceException {
          assembler.getPersister().storeJob(job, true);
          assembler.getPersister().storeTrigger(trigger, false);

          return null;
        }
      });
    }

    return job;
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

  private boolean isBlocked(final JobDetail job) throws JobPersistenceException {
    return inStore(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getBlockedJobsDao().isBlocked(job.getKey());
      }
    });
  }

  private boolean checkForLiveNamesake() throws JobPersistenceException {
    return inStore(new StoreMethod<Boolean>() {
      @Override
      public Boolean doInStore() throws JobPersistenceException {
        return assembler.getLivenessTracker().checkForLiveNamesake();
      }
    });
  }

  private <T> T inStore(StoreMethod<T> method) throws JobPersistenceException {
    return assembler.getOrientDbConnector().doInLock(method);
  }

  private void runCycle(final StandardOrientDbStoreAssembler target)
      throws JobPersistenceException {
    target.getOrientDbConnector().doInLock(new StoreMethod<Void>() {
      @Override
      public Void doInStore() throws JobPersistenceException {
        target.getLivenessTracker().runCycle();

        return null;
      }
    });
  }

  private SchedulerInstance findInstance(final StandardOrientDbStoreAssembler target,
      final String instanceId) throws JobPersistenceException {
    return target.getOrientDbConnector().doInLock(new StoreMethod<SchedulerInstance>() {
      @Override
      public SchedulerInstance doInStore() throws JobPersistenceException {
        return target.getSchedulerDao().findInstance(instanceId);
      }
    });
  }
}
