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
package net.hydromatic.jsfmt.doc;

import static java.util.Objects.requireNonNull;

/** Identifier of a {@link Doc.Group}, by which a {@link Doc.Conditional}
 * elsewhere in the document can refer to the mode chosen for the group.
 *
 * <p>Allocate ids from a {@link GroupIdGenerator}; ids from one generator are
 * unique. */
public final class GroupId {
  public final int id;
  /** Name, for debugging. */
  public final String name;

  GroupId(int id, String name) {
    this.id = id;
    this.name = requireNonNull(name);
  }

  @Override public int hashCode() {
    return id;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof GroupId
        && id == ((GroupId) o).id;
  }

  @Override public String toString() {
    return name + "#" + id;
  }
}

// End GroupId.java
