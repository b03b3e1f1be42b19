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

package io.smartspaces.scheduling.quartz.coordinated.internal.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class CollectionNamesTest {

  @Test
  void defaultPrefixHasNoDots() {
    CollectionNames names = new CollectionNames(null);

    assertEquals("qrtz_triggers", names.getTriggers());
    assertEquals("qrtz_triggers_key", names.getKeyIndexName(names.getTriggers()));
  }

  @Test
  void everyCollectionCarriesTheConfiguredPrefix() {
    CollectionNames names = new CollectionNames("billing.sched.");

    assertEquals(Arrays.asList("billing_sched_schedulers", "billing_sched_calendars",
        "billing_sched_jobs", "billing_sched_triggers", "billing_sched_pausedTriggerGroups",
        "billing_sched_pausedJobGroups", "billing_sched_blockedJobs"), names.getAll());
    for (String name : names.getAll()) {
      assertFalse(name.contains("."), name);
    }
  }
}
