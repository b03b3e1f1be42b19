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

import org.quartz.JobPersistenceException;
import org.quartz.spi.OperableTrigger;

/**
 * The handler for misfires.
 *
 * @author Keith M. Hughes
 */
public interface MisfireHandler {

  /**
   * Apply the misfire policy of a trigger if it has missed its fire time.
   *
   * <p>
   * The recomputed trigger is only written if the stored trigger is still in
   * the expected state.
   *
   * @param trigger
   *          on which apply misfire logic, updated in place
   * @param expectedState
   *          the state the stored trigger must be in for the result to be
   *          saved
   *
   * @return {@code true} if the trigger misfired and its next fire time
   *         changed
   *
   * @throws JobPersistenceException
   *           the trigger's calendar could not be read or the trigger could not
   *           be written
   */
  boolean applyMisfire(OperableTrigger trigger, StoredTriggerState expectedState)
      throws JobPersistenceException;

  /**
   * Calculate the earliest time in the past that a trigger will not be
   * considered misfired.
   *
   * @return the earliest time for non-misfired triggers
   */
  long getMisfireTime();

  /**
   * Get the misfire threshold.
   *
   * @return the threshold, in milliseconds
   */
  long getMisfireThreshold();
}
