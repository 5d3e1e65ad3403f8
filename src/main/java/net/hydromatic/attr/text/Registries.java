/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.attr.text;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Arrays;
import java.util.Map;
import net.hydromatic.attr.value.Service;

/** Implementations of {@link Registry}. */
public final class Registries {
  private Registries() {}

  /** Returns a registry that contains no services. */
  public static Registry empty() {
    return name -> null;
  }

  /**
   * Returns a registry of the given services, keyed by their object names.
   * Throws if two services have the same name.
   */
  public static Registry of(Service... services) {
    return of(Maps.uniqueIndex(Arrays.asList(services), Service::objectName));
  }

  /** Returns a registry backed by a copy of a map. */
  public static Registry of(Map<String, ? extends Service> services) {
    final ImmutableMap<String, Service> map = ImmutableMap.copyOf(services);
    return map::get;
  }
}

// End Registries.java
