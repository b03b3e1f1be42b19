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

package io.smartspaces.scheduling.quartz.coordinated.internal.dao;

import java.util.Set;

import com.orientechnologies.orient.core.db.ODatabaseSession;

import io.smartspaces.scheduling.quartz.coordinated.internal.Constants;
import io.smartspaces.scheduling.quartz.coordinated.internal.StandardOrientDbStoreAssembler;
import io.smartspaces.scheduling.quartz.coordinated.internal.util.ODocumentHelper;

/**
 * The Data Access Object for markers that say a whole group is paused.
 *
 * <p>
 * A marker is kept whether or not the group has any members, so members added
 * later start out paused.
 */
public abstract class PausedGroupsDao {

  private final StandardOrientDbStoreAssembler storeAssembler;

  private final String className;
  private final String selectGroups;
  private final String selectByGroup;
  private final String upsertGroup;
  private final String deleteByGroup;

  protected PausedGroupsDao(StandardOrientDbStoreAssembler storeAssembler, String className) {
    this.storeAssembler = storeAssembler;
    this.className = className;

    selectGroups = "SELECT " + Constants.KEY_GROUP + " FROM " + className;
    selectByGroup = "SELECT FROM " + className + " WHERE " + Constants.KEY_GROUP + " = ?";
    upsertGroup = "UPDATE " + className + " SET " + Constants.KEY_GROUP + " = ? UPSERT WHERE "
        + Constants.KEY_GROUP + " = ?";
    deleteByGroup = "DELETE FROM " + className + " WHERE " + Constants.KEY_GROUP + " = ?";
  }

  public Set<String> getPausedGroups() {
    return ODocumentHelper.toDistinctStrings(getConnection().query(selectGroups),
        Constants.KEY_GROUP);
  }

  public boolean isPaused(String group) {
    return ODocumentHelper.firstDocument(getConnection().query(selectByGroup, group)) != null;
  }

  public void pauseGroup(String group) {
    if (group == null) {
      throw new IllegalArgumentException("group cannot be null!");
    }

    getConnection().command(upsertGroup, group, group).close();
  }

  public void unpauseGroup(String group) {
    getConnection().command(deleteByGroup, group).close();
  }

  public void removeAll() {
    getConnection().command("DELETE FROM " + className).close();
  }

  private ODatabaseSession getConnection() {
    return storeAssembler.getOrientDbConnector().getConnection();
  }
}
