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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;

/**
 * The OrientDB class names for the collections of the job store.
 *
 * <p>
 * OrientDB class names cannot contain dots, so dots in the configured prefix
 * become underscores.
 *
 * @author Keith M. Hughes
 */
public class CollectionNames {

  /**
   * The default prefix for all collection names.
   */
  public static final String DEFAULT_PREFIX = "qrtz.";

  private final String prefix;

  public CollectionNames(String configuredPrefix) {
    String source = configuredPrefix != null ? configuredPrefix : DEFAULT_PREFIX;
    this.prefix = source.replace('.', '_');
  }

  public String getSchedulers() {
    return toClassName(Constants.COLLECTION_SCHEDULERS);
  }

  public String getCalendars() {
    return toClassName(Constants.COLLECTION_CALENDARS);
  }

  public String getTriggers() {
    return toClassName(Constants.COLLECTION_TRIGGERS);
  }

  public String getJobs() {
    return toClassName(Constants.COLLECTION_JOBS);
  }

  public String getPausedTriggerGroups() {
    return toClassName(Constants.COLLECTION_PAUSED_TRIGGER_GROUPS);
  }

  public String getPausedJobGroups() {
    return toClassName(Constants.COLLECTION_PAUSED_JOB_GROUPS);
  }

  public String getBlockedJobs() {
    return toClassName(Constants.COLLECTION_BLOCKED_JOBS);
  }

  /**
   * Get every class name, in the order they are created in.
   *
   * @return all class names
   */
  public List<String> getAll() {
    return Collections.unmodifiableList(Arrays.asList(getSchedulers(), getCalendars(), getJobs(),
        getTriggers(), getPausedTriggerGroups(), getPausedJobGroups(), getBlockedJobs()));
  }

  /**
   * Get the name of the unique index for a class.
   *
   * @param className
   *          the class name
   *
   * @return the index name
   */
  public String getKeyIndexName(String className) {
    return className + "_key";
  }

  private String toClassName(String collection) {
    return prefix + collection;
  }
}
