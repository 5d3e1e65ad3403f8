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
package net.hydromatic.attr.value;

/**
 * A named service object.
 *
 * <p>Services are the only kind of {@link Face} that has a text
 * representation: an attribute that refers to a service is written as a
 * dictionary with keys {@code Type} and {@code ModuleName}, and the parser
 * turns such a dictionary back into a reference by looking up the module name
 * in a registry.
 */
public interface Service extends Face {
  /** Face name of every service. */
  String FACE_NAME = "IService";

  /** Returns the name under which this service is registered. */
  String objectName();

  @Override
  default String faceName() {
    return FACE_NAME;
  }
}

// End Service.java
