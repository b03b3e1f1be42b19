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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.quartz.impl.matchers.GroupMatcher;
import org.quartz.impl.matchers.StringMatcher.StringOperatorName;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;

/**
 * A helper for group matchers and for piecing queries together.
 *
 * <p>
 * Only equality matchers are turned into SQL. The other operators are
 * evaluated against group names read from the database, so no user supplied
 * value ever ends up inside a query string.
 */
public class QueryHelper {

  /**
   * Does the matcher only match a single group?
   *
   * @param matcher
   *          the matcher
   *
   * @return {@code true} if the matcher is an equality matcher
   */
  public boolean isEquality(GroupMatcher<?> matcher) {
    return matcher.getCompareWithOperator() == StringOperatorName.EQUALS;
  }

  /**
   * Does a group name satisfy the matcher?
   *
   * @param group
   *          the group name
   * @param matcher
   *          the matcher
   *
   * @return {@code true} if the group matches
   */
  public boolean matches(String group, GroupMatcher<?> matcher) {
    return group != null
        && matcher.getCompareWithOperator().evaluate(group, matcher.getCompareToValue());
  }

  /**
   * Get the groups that a matcher selects.
   *
   * <p>
   * An equality matcher always selects its own value, whether any group of that
   * name is known or not.
   *
   * @param matcher
   *          the matcher
   * @param knownGroups
   *          all group names currently known
   *
   * @return the matching groups, in the order of the known groups
   */
  public Set<String> matchingGroups(GroupMatcher<?> matcher, Collection<String> knownGroups) {
    if (isEquality(matcher)) {
      return Collections.singleton(matcher.getCompareToValue());
    }

    Set<String> groups = new LinkedHashSet<>();
    for (String group : knownGroups) {
      if (matches(group, matcher)) {
        groups.add(group);
      }
    }

    return groups;
  }

  /**
   * Create a where clause that selects a single record by its key.
   *
   * @return the SQL condition, with group and name parameters in that order
   */
  public String keyCondition() {
    return Constants.KEY_GROUP + " = ? AND " + Constants.KEY_NAME + " = ?";
  }

  /**
   * Create a where clause that selects all triggers of a job.
   *
   * @return the SQL condition, with group and name parameters in that order
   */
  public String jobOfTriggerCondition() {
    return Constants.TRIGGER_JOB_GROUP + " = ? AND " + Constants.TRIGGER_JOB_NAME + " = ?";
  }
}
