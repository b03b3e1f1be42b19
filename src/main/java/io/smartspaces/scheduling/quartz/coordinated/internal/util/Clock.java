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

package io.smartspaces.scheduling.quartz.coordinated.internal.util;

import java.util.Date;

/**
 * The source of time for the job store.
 *
 * <p>
 * Liveness leases and misfire cutoffs are computed from this clock so they can
 * be moved in tests.
 */
public interface Clock {

  /**
   * Return current time in millis.
   */
  long millis();

  /**
   * Return current Date.
   */
  Date now();

  /**
   * Default implementation that returns system time.
   */
  public static final Clock SYSTEM_CLOCK = new Clock() {
    @Override
    public long millis() {
      return System.currentTimeMillis();
    }

    @Override
    public Date now() {
      return new Date();
    }
  };
}
