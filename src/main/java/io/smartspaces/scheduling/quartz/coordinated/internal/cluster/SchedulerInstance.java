/*
 * Copyright (C) 2016 Keith M. Hughes
 * Forked from code (c) Michael S. Klishin, Alex Petrov, 2011-2015.
 * Forked from code from MuleSoft.
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

import java.util.Date;

/**
 * The liveness record of one scheduler instance.
 */
public class SchedulerInstance {

  private final String name;
  private final String instanceId;
  private final Date expires;
  private final String state;

  public SchedulerInstance(String name, String instanceId, Date expires, String state) {
    this.name = name;
    this.instanceId = instanceId;
    this.expires = expires;
    this.state = state;
  }

  public String getName() {
    return name;
  }

  public String getInstanceId() {
    return instanceId;
  }

  /**
   * Get the time after which the instance is considered dead.
   */
  public Date getExpires() {
    return expires;
  }

  public String getState() {
    return state;
  }

  public boolean isExpired(long nowMillis) {
    return expires == null || expires.getTime() < nowMillis;
  }

  @Override
  public String toString() {
    return "SchedulerInstance [name=" + name + ", instanceId=" + instanceId + ", expires="
        + expires + ", state=" + state + "]";
  }
}
