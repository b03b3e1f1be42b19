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

package io.smartspaces.scheduling.quartz.coordinated.internal;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.quartz.Job;
import org.quartz.simpl.CascadingClassLoadHelper;
import org.quartz.spi.ClassLoadHelper;

import io.smartspaces.scheduling.quartz.coordinated.NoOpJob;

public class InternalClassLoaderHelperTest {

  private static final String EXTERNAL_JOB_CLASS = "com.example.external.ReportJob";
  private static final String EXTERNAL_OTHER_CLASS = "com.example.external.ReportSettings";

  private ClassLoader externalClassLoader;
  private InternalClassLoaderHelper helper;

  @BeforeEach
  void createHelper() {
    externalClassLoader = new ClassLoader(getClass().getClassLoader()) {
      @Override
      protected Class<?> findClass(String name) throws ClassNotFoundException {
        if (EXTERNAL_JOB_CLASS.equals(name)) {
          return NoOpJob.class;
        }
        if (EXTERNAL_OTHER_CLASS.equals(name)) {
          return String.class;
        }
        throw new ClassNotFoundException(name);
      }
    };

    ClassLoadHelper quartzHelper = new CascadingClassLoadHelper();
    helper = new InternalClassLoaderHelper(externalClassLoader, quartzHelper);
    helper.initialize();
  }

  @Test
  void quartzHelperIsTriedFirst() throws Exception {
    assertSame(NoOpJob.class, helper.loadClass(NoOpJob.class.getName(), Job.class));
  }

  @Test
  void fallsBackToExternalClassLoader() throws Exception {
    assertSame(NoOpJob.class, helper.loadClass(EXTERNAL_JOB_CLASS, Job.class));
    assertSame(externalClassLoader, helper.getClassLoader());
  }

  @Test
  void externalClassOfWrongTypeIsRejected() {
    assertThrows(ClassCastException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        helper.loadClass(EXTERNAL_OTHER_CLASS, Job.class);
      }
    });
  }

  @Test
  void unknownClassIsReported() {
    assertThrows(ClassNotFoundException.class, new Executable() {
      @Override
      public void execute() throws Throwable {
        helper.loadClass("com.example.missing.Job");
      }
    });
  }
}
