/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.tessera.common.config;

import java.io.IOException;
import java.net.URL;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.apache.tessera.common.exceptions.TesseraConfigurationException;
import org.apache.tessera.common.exceptions.UserException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Immutable, layered configuration backed by the TypeSafe configuration library.
 */
public final class TesseraConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TesseraConfig.class);

  private final Config config;

  @VisibleForTesting
  public TesseraConfig(Config config) {
    this.config = config;
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.concise()));
  }

  /**
   * Creates a configuration using the default override file name.
   */
  public static TesseraConfig create() {
    return create(null, null);
  }

  /**
   * @param overrideFileResourcePathname
   *          the classpath resource pathname of the file to use for override purposes; {@code null} uses
   *          {@link CommonConstants#CONFIG_OVERRIDE_RESOURCE_PATHNAME}
   */
  public static TesseraConfig create(String overrideFileResourcePathname) {
    return create(overrideFileResourcePathname, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static TesseraConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  public static TesseraConfig create(Config config) {
    return new TesseraConfig(config.resolve());
  }

  /**
   * Loads configuration in the following order of precedence, highest first:
   * <ul>
   * <li>the given override properties</li>
   * <li>JVM system properties</li>
   * <li>a single copy of "{@code tessera-override.conf}" (or the given override resource)</li>
   * <li>all copies of "{@code tessera-module.conf}"; loading order is indeterminate</li>
   * <li>a single copy of "{@code tessera-default.conf}"</li>
   * </ul>
   */
  private static TesseraConfig create(String overrideFileResourcePathname, Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
            : overrideFileResourcePathname;
    final ClassLoader classLoader = Thread.currentThread().getContextClassLoader();

    // 1. Load defaults configuration file.
    Config fallback = ConfigFactory.empty();
    final URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    if (defaultUrl != null) {
      logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
      fallback = ConfigFactory.parseURL(defaultUrl);
    }

    // 2. Load per-module configuration files.
    logString.append("\nIntermediate Configuration files, in order of precedence:\n");
    for (URL url : getModuleConfigURLs(classLoader)) {
      logString.append("\t- ").append(url).append("\n");
      fallback = ConfigFactory.parseURL(url).withFallback(fallback);
    }

    // 3. Load the override file and the JVM system properties.
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
    }
    Config effectiveConfig = ConfigFactory.systemProperties()
        .withFallback(ConfigFactory.parseResourcesAnySyntax(classLoader, overrideFileResourcePathname))
        .withFallback(fallback);

    // 4. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}", watch.elapsed(TimeUnit.MILLISECONDS), logString);
    return new TesseraConfig(effectiveConfig.resolve());
  }

  private static List<URL> getModuleConfigURLs(ClassLoader classLoader) {
    try {
      return Collections.list(classLoader.getResources(CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME));
    } catch (IOException e) {
      throw UserException.systemError(e)
          .addContext("Failure while scanning the classpath for", CommonConstants.CONFIG_MODULE_RESOURCE_PATHNAME)
          .build(logger);
    }
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public List<String> getStringList(String path) {
    return hasPath(path) ? ImmutableList.copyOf(config.getStringList(path)) : ImmutableList.of();
  }

  public <T> Class<T> getClassAt(String location, Class<T> clazz) throws TesseraConfigurationException {
    final String className = hasPath(location) ? getString(location) : null;
    if (className == null) {
      throw new TesseraConfigurationException(String.format(
          "No class defined at location '%s'. Expected a definition of the class [%s]",
          location, clazz.getCanonicalName()));
    }
    return loadClass(className, location, clazz);
  }

  /**
   * Resolves every class name of the string list at {@code location}; each must be assignable to {@code clazz}.
   */
  public <T> List<Class<? extends T>> getClassesAt(String location, Class<T> clazz)
      throws TesseraConfigurationException {
    ImmutableList.Builder<Class<? extends T>> classes = ImmutableList.builder();
    for (String className : getStringList(location)) {
      classes.add(loadClass(className, location, clazz));
    }
    return classes.build();
  }

  @SuppressWarnings("unchecked")
  private static <T> Class<T> loadClass(String className, String location, Class<? super T> clazz)
      throws TesseraConfigurationException {
    final Class<?> c;
    try {
      c = Class.forName(className);
    } catch (ClassNotFoundException ex) {
      throw new TesseraConfigurationException(String.format(
          "Failure while initializing class [%s] described at configuration value '%s'.", className, location), ex);
    }
    if (!clazz.isAssignableFrom(c)) {
      throw new TesseraConfigurationException(String.format(
          "The class [%s] listed at location '%s' should be of type [%s].  It isn't.",
          className, location, clazz.getCanonicalName()));
    }
    return (Class<T>) c;
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
