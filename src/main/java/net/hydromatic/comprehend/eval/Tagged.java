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
package net.hydromatic.comprehend.eval;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value of a tagged carrier: a success flag and, on success, a payload.
 *
 * <p>Used where the payload itself may be null, so null cannot signal
 * failure.
 */
public class Tagged {
  public static final Tagged FAILURE = new Tagged(false, null);

  public final boolean ok;
  public final @Nullable Object payload;

  private Tagged(boolean ok, @Nullable Object payload) {
    this.ok = ok;
    this.payload = payload;
  }

  /** Creates a successful value. */
  public static Tagged success(@Nullable Object payload) {
    return new Tagged(true, payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(ok, payload);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tagged
            && ok == ((Tagged) o).ok
            && Objects.equals(payload, ((Tagged) o).payload);
  }

  @Override
  public String toString() {
    return ok ? "ok(" + payload + ")" : "failed";
  }
}

// End Tagged.java
