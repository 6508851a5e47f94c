// Copyright (c) 2024 The Event Hubs AMQP Java Client Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.eventhubs.client.amqp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable settings of a link, built by the connection scope and applied by the {@link
 * AmqpTransport} when attaching the link.
 */
public final class LinkSettings {

  private final String name;
  private final String address;
  private final int creditWindow;
  private final Map<String, Object> properties;
  private final List<String> desiredCapabilities;
  private final Map<String, Filter> filters;

  private LinkSettings(Builder builder) {
    this.name = builder.name;
    this.address = builder.address;
    this.creditWindow = builder.creditWindow;
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    this.desiredCapabilities = List.copyOf(builder.desiredCapabilities);
    this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String name() {
    return this.name;
  }

  /**
   * Source address for receiving links, node address for management links.
   *
   * @return the address
   */
  public String address() {
    return this.address;
  }

  /**
   * Flow-control credit the transport keeps granted to the peer.
   *
   * @return the credit window
   */
  public int creditWindow() {
    return this.creditWindow;
  }

  public Map<String, Object> properties() {
    return this.properties;
  }

  /**
   * Typed access to a link property.
   *
   * @param key property key
   * @param defaultValue value to return if the property is not set
   * @return the property value or the default value
   * @param <T> property type
   */
  @SuppressWarnings("unchecked")
  public <T> T property(String key, T defaultValue) {
    Object value = this.properties.get(key);
    return value == null ? defaultValue : (T) value;
  }

  /**
   * Capabilities requested from the peer, empty if none.
   *
   * @return the capabilities
   */
  public List<String> desiredCapabilities() {
    return this.desiredCapabilities;
  }

  public Map<String, Filter> filters() {
    return this.filters;
  }

  @Override
  public String toString() {
    return "LinkSettings{"
        + "name='"
        + name
        + '\''
        + ", address='"
        + address
        + '\''
        + ", creditWindow="
        + creditWindow
        + ", properties="
        + properties
        + ", desiredCapabilities="
        + desiredCapabilities
        + ", filters="
        + filters
        + '}';
  }

  /** A source filter, sent as a described type. */
  public static final class Filter {

    private final String descriptor;
    private final Object value;

    public Filter(String descriptor, Object value) {
      this.descriptor = descriptor;
      this.value = value;
    }

    public String descriptor() {
      return this.descriptor;
    }

    public Object value() {
      return this.value;
    }

    @Override
    public String toString() {
      return this.descriptor + "(" + this.value + ")";
    }
  }

  public static final class Builder {

    private String name;
    private String address;
    private int creditWindow = 0;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<String> desiredCapabilities = new ArrayList<>();
    private final Map<String, Filter> filters = new LinkedHashMap<>();

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder address(String address) {
      this.address = address;
      return this;
    }

    public Builder creditWindow(int creditWindow) {
      this.creditWindow = creditWindow;
      return this;
    }

    public Builder property(String key, Object value) {
      this.properties.put(key, value);
      return this;
    }

    public Builder desiredCapability(String capability) {
      this.desiredCapabilities.add(capability);
      return this;
    }

    public Builder filter(String name, String descriptor, Object value) {
      this.filters.put(name, new Filter(descriptor, value));
      return this;
    }

    public LinkSettings build() {
      return new LinkSettings(this);
    }
  }
}
