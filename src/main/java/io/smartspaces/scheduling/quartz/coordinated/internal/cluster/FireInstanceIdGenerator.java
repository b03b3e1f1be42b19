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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the IDs that tell one firing of a trigger from another.
 *
 * <p>
 * The counter is shared by every store in the process and starts from the
 * wall clock, so IDs from a restarted process don't repeat the old ones.
 *
 * @author Keith M. Hughes
 */
public class FireInstanceIdGenerator {

  private static final AtomicLong FIRE_INSTANCE_COUNTER =
      new AtomicLong(System.currentTimeMillis());

  private final String instanceId;

  public FireInstanceIdGenerator(String instanceId) {
    this.instanceId = instanceId;
  }

  /**
   * Get a new fire instance ID.
   *
   * @return the ID, unique to this scheduler instance
   */
  public String nextFireInstanceId() {
    return instanceId + "-" + FIRE_INSTANCE_COUNTER.incrementAndGet();
  }
}
