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

package io.smartspaces.scheduling.quartz.coordinated;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobDetail;
import org.quartz.Trigger.CompletedExecutionInstruction;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerKey;
import org.quartz.spi.OperableTrigger;
import org.quartz.spi.TriggerFiredBundle;
import org.quartz.spi.TriggerFiredResult;

/**
 * Tests for acquiring, firing and completing triggers with more than one
 * scheduler instance sharing the database.
 */
public class TriggerAcquisitionTest extends JobStoreTestSupport {

  private static final long ONE_HOUR = 60 * 60 * 1000L;

  private TestClock clockA;
  private TestClock clockB;
  private RecordingSchedulerSignaler signalerA;
  private RecordingSchedulerSignaler signalerB;

  @BeforeEach
  void createClocksAndSignalers() {
    clockA = new TestClock();
    clockB = new TestClock();
    signalerA = new RecordingSchedulerSignaler();
    signalerB = new RecordingSchedulerSignaler();
  }

  @Test
  void acquiredTriggerIsNotAcquiredAgain() throws Exception {
    CoordinatedOrientDbJobStore storeA = createStore("instanceA", clockA, signalerA);
    CoordinatedOrientDbJobStore storeB = createStore("instanceB", clockB, signalerB);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    OperableTrigger trigger =
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-1), 0);
    storeA.storeJobAndTrigger(job, trigger);

    List<OperableTrigger> acquiredByA = storeA.acquireNextTriggers(noLaterThan(), 10, 0);
    assertEquals(1, acquiredByA.size());
    assertEquals(trigger.getKey(), acquiredByA.get(0).getKey());
    assertNotNull(acquiredByA.get(0).getFireInstanceId());

    assertTrue(storeB.acquireNextTriggers(noLaterThan(), 10, 0).isEmpty());
    assertTrue(storeA.acquireNextTriggers(noLaterThan(), 10, 0).isEmpty());
  }

  @Test
  void triggerOfExpiredInstanceIsReclaimed() throws Exception {
    // Instance A checks in with a lease that has already run out for B.
    clockA.shift(-ONE_HOUR);
    CoordinatedOrientDbJobStore storeA = createStore("instanceA", clockA, signalerA);
    CoordinatedOrientDbJobStore storeB = createStore("instanceB", clockB, signalerB);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    OperableTrigger trigger =
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-1), 0);
    storeA.storeJobAndTrigger(job, trigger);

    assertEquals(1, storeA.acquireNextTriggers(noLaterThan(), 10, 0).size());

    List<OperableTrigger> acquiredByB = storeB.acquireNextTriggers(noLaterThan(), 10, 0);
    assertEquals(1, acquiredByB.size());
    assertEquals(trigger.getKey(), acquiredByB.get(0).getKey());
  }

  @Test
  void shutdownReleasesAcquiredTriggers() throws Exception {
    CoordinatedOrientDbJobStore storeA = createStore("instanceA", clockA, signalerA);
    CoordinatedOrientDbJobStore storeB = createStore("instanceB", clockB, signalerB);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    storeA.storeJobAndTrigger(job,
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-1), 0));
    assertEquals(1, storeA.acquireNextTriggers(noLaterThan(), 10, 0).size());

    shutdownStore(storeA);

    assertEquals(1, storeB.acquireNextTriggers(noLaterThan(), 10, 0).size());
  }

  @Test
  void onlyOneTriggerOfNonConcurrentJobIsAcquired() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NonConcurrentJob.class, true);
    Date startAt = secondsFromNow(-1);
    OperableTrigger trigger1 = newTrigger(TriggerKey.triggerKey("T1"), job.getKey(), startAt, 0);
    OperableTrigger trigger2 = newTrigger(TriggerKey.triggerKey("T2"), job.getKey(), startAt, 0);
    store.storeJobAndTrigger(job, trigger1);
    store.storeTrigger(trigger2, false);

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 10, 0);

    assertEquals(1, acquired.size());
    TriggerKey other =
        acquired.get(0).getKey().equals(trigger1.getKey()) ? trigger2.getKey() : trigger1.getKey();
    assertEquals(TriggerState.NORMAL, store.getTriggerState(other));
  }

  @Test
  void acquisitionIsOrderedAndLimited() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    store.storeJob(job, false);
    OperableTrigger late =
        newTrigger(TriggerKey.triggerKey("late"), job.getKey(), secondsFromNow(-1), 0);
    OperableTrigger early =
        newTrigger(TriggerKey.triggerKey("early"), job.getKey(), secondsFromNow(-3), 0);
    OperableTrigger future =
        newTrigger(TriggerKey.triggerKey("future"), job.getKey(), secondsFromNow(3600), 0);
    store.storeTrigger(late, false);
    store.storeTrigger(early, false);
    store.storeTrigger(future, false);

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 1, 10000);
    assertEquals(1, acquired.size());
    assertEquals(early.getKey(), acquired.get(0).getKey());

    acquired = store.acquireNextTriggers(noLaterThan(), 10, 10000);
    assertEquals(1, acquired.size());
    assertEquals(late.getKey(), acquired.get(0).getKey());
  }

  @Test
  void releasedTriggerCanBeAcquiredAgain() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    store.storeJobAndTrigger(job,
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-1), 0));

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 10, 0);
    store.releaseAcquiredTrigger(acquired.get(0));

    assertEquals(1, store.acquireNextTriggers(noLaterThan(), 10, 0).size());
  }

  @Test
  void misfiredTriggerIsRescheduledAndAcquired() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    OperableTrigger trigger =
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-120), 0);
    store.storeJobAndTrigger(job, trigger);

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 10, 0);

    assertEquals(1, acquired.size());
    assertTrue(acquired.get(0).getNextFireTime().after(trigger.getNextFireTime()));
    assertEquals(Collections.singletonList(trigger.getKey()), signalerA.getMisfired());
  }

  @Test
  void firingNonConcurrentJobBlocksItsOtherTriggers() throws Exception {
    CoordinatedOrientDbJobStore storeA = createStore("instanceA", clockA, signalerA);
    CoordinatedOrientDbJobStore storeB = createStore("instanceB", clockB, signalerB);

    JobDetail job = newJob("job1", NonConcurrentJob.class, true);
    Date startAt = secondsFromNow(-1);
    OperableTrigger trigger1 =
        newTrigger(TriggerKey.triggerKey("T1"), job.getKey(), startAt, ONE_HOUR);
    OperableTrigger trigger2 =
        newTrigger(TriggerKey.triggerKey("T2"), job.getKey(), startAt, ONE_HOUR);
    storeA.storeJobAndTrigger(job, trigger1);
    storeA.storeTrigger(trigger2, false);

    List<OperableTrigger> acquired = storeA.acquireNextTriggers(noLaterThan(), 10, 0);
    assertEquals(1, acquired.size());
    TriggerKey firedKey = acquired.get(0).getKey();
    TriggerKey otherKey =
        firedKey.equals(trigger1.getKey()) ? trigger2.getKey() : trigger1.getKey();

    List<TriggerFiredResult> results = storeA.triggersFired(acquired);
    assertEquals(1, results.size());
    TriggerFiredBundle bundle = results.get(0).getTriggerFiredBundle();
    assertNotNull(bundle);
    assertNull(results.get(0).getException());

    assertEquals(TriggerState.BLOCKED, storeA.getTriggerState(firedKey));
    assertEquals(TriggerState.BLOCKED, storeA.getTriggerState(otherKey));
    assertTrue(storeB.acquireNextTriggers(noLaterThan(), 10, 0).isEmpty());

    bundle.getJobDetail().getJobDataMap().put("ran", true);
    storeA.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.NOOP);

    assertEquals(TriggerState.NORMAL, storeA.getTriggerState(firedKey));
    assertEquals(TriggerState.NORMAL, storeA.getTriggerState(otherKey));
    assertFalse(signalerA.getSchedulingChanges().isEmpty());
    assertTrue(storeA.retrieveJob(job.getKey()).getJobDataMap().getBoolean("ran"));

    List<OperableTrigger> acquiredByB = storeB.acquireNextTriggers(noLaterThan(), 10, 0);
    assertEquals(1, acquiredByB.size());
    assertEquals(otherKey, acquiredByB.get(0).getKey());
  }

  @Test
  void triggerNoLongerHeldIsNotFired() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    store.storeJobAndTrigger(job,
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-1), 0));

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 10, 0);
    store.pauseTrigger(acquired.get(0).getKey());

    List<TriggerFiredResult> results = store.triggersFired(acquired);
    assertEquals(1, results.size());
    assertNull(results.get(0).getTriggerFiredBundle());
    assertEquals(TriggerState.PAUSED, store.getTriggerState(acquired.get(0).getKey()));
  }

  @Test
  void deleteTriggerInstructionRemovesTriggerAndOrphanedJob() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, false);
    OperableTrigger trigger =
        newTrigger(TriggerKey.triggerKey("trigger1"), job.getKey(), secondsFromNow(-1), 0);
    store.storeJobAndTrigger(job, trigger);

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 10, 0);
    TriggerFiredBundle bundle = store.triggersFired(acquired).get(0).getTriggerFiredBundle();
    assertNotNull(bundle);
    assertNull(bundle.getTrigger().getNextFireTime());
    assertEquals(TriggerState.COMPLETE, store.getTriggerState(trigger.getKey()));

    store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.DELETE_TRIGGER);

    assertFalse(store.checkExists(trigger.getKey()));
    assertFalse(store.checkExists(job.getKey()));
    assertEquals(Collections.singletonList(job.getKey()), signalerA.getDeletedJobs());
  }

  @Test
  void blockedJobOfExpiredInstanceIsReclaimed() throws Exception {
    clockA.shift(-ONE_HOUR);
    CoordinatedOrientDbJobStore storeA = createStore("instanceA", clockA, signalerA);
    CoordinatedOrientDbJobStore storeB = createStore("instanceB", clockB, signalerB);

    JobDetail job = newJob("job1", NonConcurrentJob.class, true);
    Date startAt = secondsFromNow(-1);
    OperableTrigger trigger1 =
        newTrigger(TriggerKey.triggerKey("T1"), job.getKey(), startAt, ONE_HOUR);
    OperableTrigger trigger2 =
        newTrigger(TriggerKey.triggerKey("T2"), job.getKey(), startAt, ONE_HOUR);
    storeA.storeJobAndTrigger(job, trigger1);
    storeA.storeTrigger(trigger2, false);

    List<OperableTrigger> acquired = storeA.acquireNextTriggers(noLaterThan(), 10, 0);
    assertNotNull(storeA.triggersFired(acquired).get(0).getTriggerFiredBundle());
    TriggerKey firedKey = acquired.get(0).getKey();
    TriggerKey otherKey =
        firedKey.equals(trigger1.getKey()) ? trigger2.getKey() : trigger1.getKey();
    assertEquals(TriggerState.BLOCKED, storeB.getTriggerState(otherKey));

    // A never completes the job, B takes the job back on its next cycle.
    List<OperableTrigger> acquiredByB = storeB.acquireNextTriggers(noLaterThan(), 10, 0);

    assertEquals(1, acquiredByB.size());
    assertEquals(otherKey, acquiredByB.get(0).getKey());
    assertEquals(TriggerState.NORMAL, storeB.getTriggerState(firedKey));
  }

  @Test
  void fireAheadStopsAtFirstFireTimePlusWindow() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    store.storeJob(job, false);
    long now = System.currentTimeMillis();
    store.storeTrigger(
        newTrigger(TriggerKey.triggerKey("first"), job.getKey(), new Date(now + 2000), 0), false);
    store.storeTrigger(
        newTrigger(TriggerKey.triggerKey("near"), job.getKey(), new Date(now + 5000), 0), false);
    store.storeTrigger(
        newTrigger(TriggerKey.triggerKey("far"), job.getKey(), new Date(now + 30000), 0), false);

    // All three are due before noLaterThan + timeWindow, far is more than the
    // window past the first one acquired.
    List<OperableTrigger> acquired = store.acquireNextTriggers(now + 60000, 10, 10000);

    assertEquals(Arrays.asList("first", "near"), names(acquired));
    assertEquals(TriggerState.NORMAL, store.getTriggerState(TriggerKey.triggerKey("far")));
  }

  @Test
  void equalFireTimesGoByPriority() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    store.storeJob(job, false);
    Date startAt = secondsFromNow(-1);
    OperableTrigger low = newTrigger(TriggerKey.triggerKey("lo"), job.getKey(), startAt, 0);
    low.setPriority(1);
    OperableTrigger high = newTrigger(TriggerKey.triggerKey("hi"), job.getKey(), startAt, 0);
    high.setPriority(9);
    store.storeTrigger(low, false);
    store.storeTrigger(high, false);

    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 10, 0);
    assertEquals(Arrays.asList("hi", "lo"), names(acquired));
  }

  @Test
  void setTriggerCompleteInstructionCompletesTrigger() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    OperableTrigger trigger =
        newTrigger(TriggerKey.triggerKey("T1"), job.getKey(), secondsFromNow(-1), ONE_HOUR);
    store.storeJobAndTrigger(job, trigger);

    TriggerFiredBundle bundle = acquireAndFire(store);
    store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.SET_TRIGGER_COMPLETE);

    assertEquals(TriggerState.COMPLETE, store.getTriggerState(trigger.getKey()));
  }

  @Test
  void setAllJobTriggersErrorInstructionReachesEveryTriggerOfTheJob() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);
    JobDetail job = storeJobWithFiringAndFutureTrigger(store);

    TriggerFiredBundle bundle = acquireAndFire(store);
    store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.SET_ALL_JOB_TRIGGERS_ERROR);

    for (OperableTrigger trigger : store.getTriggersForJob(job.getKey())) {
      assertEquals(TriggerState.ERROR, store.getTriggerState(trigger.getKey()));
    }
    assertTrue(store.acquireNextTriggers(System.currentTimeMillis() + ONE_HOUR, 10, 0).isEmpty());
  }

  @Test
  void setAllJobTriggersCompleteInstructionReachesEveryTriggerOfTheJob() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);
    JobDetail job = storeJobWithFiringAndFutureTrigger(store);

    TriggerFiredBundle bundle = acquireAndFire(store);
    store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.SET_ALL_JOB_TRIGGERS_COMPLETE);

    assertEquals(TriggerState.COMPLETE, store.getTriggerState(TriggerKey.triggerKey("T1")));
    assertEquals(TriggerState.COMPLETE, store.getTriggerState(TriggerKey.triggerKey("T2")));
    assertEquals(2, store.getTriggersForJob(job.getKey()).size());
  }

  @Test
  void triggerRescheduledByItsJobSurvivesDeleteInstruction() throws Exception {
    CoordinatedOrientDbJobStore store = createStore("instanceA", clockA, signalerA);

    JobDetail job = newJob("job1", NoOpJob.class, true);
    TriggerKey triggerKey = TriggerKey.triggerKey("T1");
    store.storeJobAndTrigger(job, newTrigger(triggerKey, job.getKey(), secondsFromNow(-1), 0));

    TriggerFiredBundle bundle = acquireAndFire(store);
    assertNull(bundle.getTrigger().getNextFireTime());

    // While executing, the job schedules its trigger once more.
    Date rescheduledAt = secondsFromNow(600);
    store.storeTrigger(newTrigger(triggerKey, job.getKey(), rescheduledAt, 0), true);

    store.triggeredJobComplete(bundle.getTrigger(), bundle.getJobDetail(),
        CompletedExecutionInstruction.DELETE_TRIGGER);

    assertTrue(store.checkExists(triggerKey));
    assertEquals(TriggerState.NORMAL, store.getTriggerState(triggerKey));
    assertEquals(rescheduledAt, store.retrieveTrigger(triggerKey).getNextFireTime());
  }

  private JobDetail storeJobWithFiringAndFutureTrigger(CoordinatedOrientDbJobStore store)
      throws Exception {
    JobDetail job = newJob("job1", NoOpJob.class, true);
    store.storeJobAndTrigger(job,
        newTrigger(TriggerKey.triggerKey("T1"), job.getKey(), secondsFromNow(-1), ONE_HOUR));
    store.storeTrigger(
        newTrigger(TriggerKey.triggerKey("T2"), job.getKey(), secondsFromNow(3600), 0), false);

    return job;
  }

  private TriggerFiredBundle acquireAndFire(CoordinatedOrientDbJobStore store) throws Exception {
    List<OperableTrigger> acquired = store.acquireNextTriggers(noLaterThan(), 1, 0);
    assertEquals(1, acquired.size());
    TriggerFiredBundle bundle = store.triggersFired(acquired).get(0).getTriggerFiredBundle();
    assertNotNull(bundle);

    return bundle;
  }

  private List<String> names(List<OperableTrigger> triggers) {
    List<String> names = new ArrayList<>();
    for (OperableTrigger trigger : triggers) {
      names.add(trigger.getKey().getName());
    }

    return names;
  }

  private long noLaterThan() {
    return System.currentTimeMillis() + 1000;
  }
}
