/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dpc.common;

import java.util.Properties;

import exm.dpc.common.exceptions.InternalInvariantError;
import exm.dpc.common.exceptions.InvalidOptionException;

/**
 * Immutable, validated snapshot of the settings for one compilation.
 * Created once by the driver and passed down to every pass.
 */
public class CompileOptions {

  private final Properties props;

  private CompileOptions(Properties props) throws InvalidOptionException {
    Settings.validateProperties(props);
    this.props = props;
  }

  /**
   * Snapshot the current global settings
   */
  public static CompileOptions fromSettings() throws InvalidOptionException {
    return new CompileOptions(Settings.snapshot());
  }

  /**
   * Options with only built-in defaults
   */
  public static CompileOptions defaults() {
    try {
      return new CompileOptions(Settings.defaultSnapshot());
    } catch (InvalidOptionException e) {
      throw new InternalInvariantError("Bad default settings: "
                                       + e.getMessage());
    }
  }

  /**
   * @return copy of these options with one value replaced
   */
  public CompileOptions with(String key, String value)
                                        throws InvalidOptionException {
    if (props.getProperty(key) == null) {
      throw new InvalidOptionException("Unknown option " + key);
    }
    Properties copy = new Properties();
    copy.putAll(props);
    copy.setProperty(key, value);
    return new CompileOptions(copy);
  }

  public String get(String key) {
    String val = props.getProperty(key);
    if (val == null) {
      throw new InternalInvariantError("Expected config key " + key
                                       + " to exist");
    }
    return val;
  }

  public int getInt(String key) {
    try {
      return Settings.getInt(props, key);
    } catch (InvalidOptionException e) {
      // Already validated at construction
      throw new InternalInvariantError(e.getMessage());
    }
  }

  public boolean getBoolean(String key) {
    try {
      return Settings.getBoolean(props, key);
    } catch (InvalidOptionException e) {
      throw new InternalInvariantError(e.getMessage());
    }
  }

  public boolean debug() {
    return getBoolean(Settings.COMPILER_DEBUG);
  }

  public boolean legacyLayout() {
    return get(Settings.LAYOUT_STRATEGY).equalsIgnoreCase(
                                      Settings.STRATEGY_LEGACY);
  }

  @Override
  public String toString() {
    return props.toString();
  }
}
