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

import java.util.Date;

import io.smartspaces.scheduling.quartz.coordinated.internal.util.Clock;

/**
 * A clock that runs with system time, shifted by an adjustable offset.
 */
public class TestClock implements Clock {

  private volatile long offset;

  public void shift(long millis) {
    offset += millis;
  }

  @Override
  public long millis() {
    return System.currentTimeMillis() + offset;
  }

  @Override
  public Date now() {
    return new Date(millis());
  }
}
