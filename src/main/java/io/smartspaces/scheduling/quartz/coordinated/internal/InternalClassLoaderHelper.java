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

import java.io.InputStream;
import java.net.URL;

import org.quartz.spi.ClassLoadHelper;

/**
 * A class load helper that falls back to an external class loader when the
 * helper given by Quartz cannot find a job or trigger class.
 *
 * <p>
 * Used on platforms like OSGi, where the job classes live in another bundle.
 *
 * @author Keith M. Hughes
 */
public class InternalClassLoaderHelper implements ClassLoadHelper {

  /**
   * The class loader tried second.
   */
  private final ClassLoader externalClassLoader;

  /**
   * The helper tried first.
   */
  private final ClassLoadHelper quartzClassLoadHelper;

  public InternalClassLoaderHelper(ClassLoader externalClassLoader,
      ClassLoadHelper quartzClassLoadHelper) {
    this.externalClassLoader = externalClassLoader;
    this.quartzClassLoadHelper = quartzClassLoadHelper;
  }

  @Override
  public void initialize() {
    quartzClassLoadHelper.initialize();
  }

  @Override
  public Class<?> loadClass(String name) throws ClassNotFoundException {
    try {
      return quartzClassLoadHelper.loadClass(name);
    } catch (ClassNotFoundException e) {
      return externalClassLoader.loadClass(name);
    }
  }

  @Override
  public <T> Class<? extends T> loadClass(String name, Class<T> clazz)
      throws ClassNotFoundException {
    try {
      return quartzClassLoadHelper.loadClass(name, clazz);
    } catch (ClassNotFoundException e) {
      return externalClassLoader.loadClass(name).asSubclass(clazz);
    }
  }

  @Override
  public URL getResource(String name) {
    URL url = quartzClassLoadHelper.getResource(name);
    if (url == null) {
      url = externalClassLoader.getResource(name);
    }

    return url;
  }

  @Override
  public InputStream getResourceAsStream(String name) {
    InputStream stream = quartzClassLoadHelper.getResourceAsStream(name);
    if (stream == null) {
      stream = externalClassLoader.getResourceAsStream(name);
    }

    return stream;
  }

  @Override
  public ClassLoader getClassLoader() {
    return externalClassLoader;
  }
}
