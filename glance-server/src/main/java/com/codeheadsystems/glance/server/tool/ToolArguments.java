package com.codeheadsystems.glance.server.tool;

import java.util.Map;
import java.util.Optional;

/**
 * Typed read access to the {@code arguments} object of a {@code tools/call} request.
 */
public final class ToolArguments {

  private static final ToolArguments EMPTY = new ToolArguments(Map.of());

  private final Map<String, Object> arguments;

  private ToolArguments(Map<String, Object> arguments) {
    this.arguments = arguments;
  }

  /**
   * Wraps the decoded arguments. A null map means no arguments.
   *
   * @param arguments the arguments, may be null
   * @return the tool arguments
   */
  public static ToolArguments of(Map<String, Object> arguments) {
    return arguments == null || arguments.isEmpty() ? EMPTY : new ToolArguments(arguments);
  }

  public static ToolArguments empty() {
    return EMPTY;
  }

  /**
   * A string argument that must be present and non-blank.
   *
   * @param name the argument name
   * @return the value
   * @throws InvalidToolArgumentException if absent, blank or not a string
   */
  public String requiredString(String name) {
    return optionalString(name)
        .filter(s -> !s.isBlank())
        .orElseThrow(() -> new InvalidToolArgumentException("Missing required argument: " + name));
  }

  /**
   * A string argument that may be absent. Empty strings are treated as absent.
   *
   * @param name the argument name
   * @return the value
   * @throws InvalidToolArgumentException if present but not a string
   */
  public Optional<String> optionalString(String name) {
    Object value = arguments.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (!(value instanceof String)) {
      throw new InvalidToolArgumentException("Argument " + name + " must be a string");
    }
    String text = (String) value;
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  /**
   * An integer argument that may be absent. Whole-valued numbers and numeric strings are
   * accepted since agents are loose about JSON types.
   *
   * @param name the argument name
   * @return the value
   * @throws InvalidToolArgumentException if present but not an integer
   */
  public Optional<Integer> optionalInt(String name) {
    Object value = arguments.get(name);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      if (number == Math.rint(number) && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
        return Optional.of((int) number);
      }
      throw new InvalidToolArgumentException("Argument " + name + " must be an integer");
    }
    if (value instanceof String) {
      try {
        return Optional.of(Integer.parseInt(((String) value).trim()));
      } catch (NumberFormatException e) {
        throw new InvalidToolArgumentException("Argument " + name + " must be an integer");
      }
    }
    throw new InvalidToolArgumentException("Argument " + name + " must be an integer");
  }
}
