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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.quartz.JobKey;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerKey;
import org.quartz.spi.SchedulerSignaler;

/**
 * A scheduler signaler that remembers what it was told.
 */
public class RecordingSchedulerSignaler implements SchedulerSignaler {

  private final List<TriggerKey> misfired = new CopyOnWriteArrayList<>();
  private final List<TriggerKey> finalized = new CopyOnWriteArrayList<>();
  private final List<JobKey> deletedJobs = new CopyOnWriteArrayList<>();
  private final List<Long> schedulingChanges = new CopyOnWriteArrayList<>();

  @Override
  public void notifyTriggerListenersMisfired(Trigger trigger) {
    misfired.add(trigger.getKey());
  }

  @Override
  public void notifySchedulerListenersFinalized(Trigger trigger) {
    finalized.add(trigger.getKey());
  }

  @Override
  public void notifySchedulerListenersJobDeleted(JobKey jobKey) {
    deletedJobs.add(jobKey);
  }

  @Override
  public void signalSchedulingChange(long candidateNewNextFireTime) {
    schedulingChanges.add(candidateNewNextFireTime);
  }

  @Override
  public void notifySchedulerListenersError(String string, SchedulerException jpe) {
    // Not needed by the tests
  }

  public List<TriggerKey> getMisfired() {
    return misfired;
  }

  public List<TriggerKey> getFinalized() {
    return finalized;
  }

  public List<JobKey> getDeletedJobs() {
    return deletedJobs;
  }

  public List<Long> getSchedulingChanges() {
    return schedulingChanges;
  }
}
