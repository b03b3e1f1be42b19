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

import org.quartz.Trigger.TriggerState;

/**
 * The states a trigger can be in while stored in the database.
 *
 * <p>
 * The transition methods never touch the database. They return the state a
 * trigger in this state should move to, which is this state itself when the
 * transition does not apply.
 *
 * @author Keith M. Hughes
 */
public enum StoredTriggerState {

  /**
   * The trigger is waiting to be acquired.
   */
  WAITING("waiting"),

  /**
   * The trigger has been acquired by a scheduler instance and is about to
   * fire.
   */
  ACQUIRED("acquired"),

  /**
   * The trigger has been paused.
   */
  PAUSED("paused"),

  /**
   * The trigger is paused and its job is executing somewhere.
   */
  PAUSED_AND_BLOCKED("pausedBlocked"),

  /**
   * The job of the trigger disallows concurrent execution and is executing
   * somewhere.
   */
  BLOCKED("blocked"),

  /**
   * The trigger will never fire again.
   */
  COMPLETE("complete"),

  /**
   * The trigger was put in error and will not fire until reset.
   */
  ERROR("error");

  /**
   * The value stored in the database.
   */
  private final String value;

  private StoredTriggerState(String value) {
    this.value = value;
  }

  /**
   * Get the value stored in the database for this state.
   *
   * @return the stored value
   */
  public String getValue() {
    return value;
  }

  /**
   * Get the state for a stored value.
   *
   * @param value
   *          the stored value, can be {@code null}
   *
   * @return the state, or {@code null} if the value is {@code null}
   *
   * @throws IllegalArgumentException
   *           the value is not a known state
   */
  public static StoredTriggerState fromValue(String value) {
    if (value == null) {
      return null;
    }

    for (StoredTriggerState state : values()) {
      if (state.value.equals(value)) {
        return state;
      }
    }

    throw new IllegalArgumentException("Unknown trigger state " + value);
  }

  /**
   * Get the state a newly stored trigger starts in.
   *
   * @param paused
   *          {@code true} if the trigger's group or its job's group is paused
   * @param jobBlocked
   *          {@code true} if the trigger's job is currently blocked
   *
   * @return the initial state
   */
  public static StoredTriggerState initial(boolean paused, boolean jobBlocked) {
    if (paused) {
      return jobBlocked ? PAUSED_AND_BLOCKED : PAUSED;
    } else {
      return jobBlocked ? BLOCKED : WAITING;
    }
  }

  /**
   * The state after a pause.
   *
   * @return the paused state
   */
  public StoredTriggerState paused() {
    switch (this) {
      case WAITING:
      case ACQUIRED:
        return PAUSED;
      case BLOCKED:
        return PAUSED_AND_BLOCKED;
      default:
        return this;
    }
  }

  /**
   * The state after a resume.
   *
   * @param jobBlocked
   *          {@code true} if the trigger's job is currently blocked
   *
   * @return the resumed state
   */
  public StoredTriggerState resumed(boolean jobBlocked) {
    if (isPaused()) {
      return jobBlocked ? BLOCKED : WAITING;
    } else {
      return this;
    }
  }

  /**
   * The state after the trigger's job has become blocked.
   *
   * @return the blocked state
   */
  public StoredTriggerState blocked() {
    switch (this) {
      case WAITING:
        return BLOCKED;
      case PAUSED:
        return PAUSED_AND_BLOCKED;
      default:
        return this;
    }
  }

  /**
   * The state after the trigger's job is no longer blocked.
   *
   * @return the unblocked state
   */
  public StoredTriggerState unblocked() {
    switch (this) {
      case BLOCKED:
        return WAITING;
      case PAUSED_AND_BLOCKED:
        return PAUSED;
      default:
        return this;
    }
  }

  /**
   * The state after an acquired trigger was released without firing.
   *
   * @param jobBlocked
   *          {@code true} if the trigger's job is currently blocked
   *
   * @return the released state
   */
  public StoredTriggerState released(boolean jobBlocked) {
    if (this == ACQUIRED) {
      return jobBlocked ? BLOCKED : WAITING;
    } else {
      return this;
    }
  }

  /**
   * Is the state one of the paused states?
   *
   * @return {@code true} if paused
   */
  public boolean isPaused() {
    return this == PAUSED || this == PAUSED_AND_BLOCKED;
  }

  /**
   * Can a trigger in this state be taken back from a scheduler instance that
   * has died?
   *
   * @return {@code true} if the trigger can be reclaimed
   */
  public boolean isReclaimable() {
    return this == WAITING || this == ACQUIRED;
  }

  /**
   * Get the Quartz trigger state.
   *
   * @return the Quartz state
   */
  public TriggerState toTriggerState() {
    switch (this) {
      case PAUSED:
      case PAUSED_AND_BLOCKED:
        return TriggerState.PAUSED;
      case BLOCKED:
        return TriggerState.BLOCKED;
      case COMPLETE:
        return TriggerState.COMPLETE;
      case ERROR:
        return TriggerState.ERROR;
      default:
        return TriggerState.NORMAL;
    }
  }
}
