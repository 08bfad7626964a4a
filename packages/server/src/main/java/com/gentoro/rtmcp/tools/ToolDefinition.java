package com.gentoro.rtmcp.tools;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static description of a tool: what it is called, what it does and which arguments it accepts.
 *
 * <p>{@code readOnly} and {@code destructive} are hints for callers; they are not enforced.
 */
public record ToolDefinition(
    String name,
    String description,
    Set<String> tags,
    boolean readOnly,
    boolean destructive,
    List<ToolProperty> parameters) {

  public ToolDefinition {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Tool name must not be blank");
    }
    description = description == null ? "" : description;
    tags = tags == null ? Set.of() : Set.copyOf(tags);
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }

  public Optional<ToolProperty> parameter(String parameterName) {
    return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
  }

  public List<String> requiredParameterNames() {
    return parameters.stream().filter(ToolProperty::required).map(ToolProperty::name).toList();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String description;
    private final Set<String> tags = new LinkedHashSet<>();
    private boolean readOnly;
    private boolean destructive;
    private final List<ToolProperty> parameters = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder tags(String... tags) {
      this.tags.addAll(Arrays.asList(tags));
      return this;
    }

    public Builder readOnly() {
      this.readOnly = true;
      return this;
    }

    public Builder destructive() {
      this.destructive = true;
      return this;
    }

    public Builder param(ToolProperty property) {
      this.parameters.add(property);
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, tags, readOnly, destructive, parameters);
    }
  }
}
