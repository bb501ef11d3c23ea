/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.tsa.helper;

import com.google.common.base.Preconditions;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing for algorithm arguments.
 *
 * <p>Each algorithm declares a nested {@code Args} class extending {@link ArgsBase}. Fields carry
 * their defaults and are annotated with {@link ArgsBase.Doc} plus either {@link ArgsBase.Optional}
 * or {@link ArgsBase.Required}. Callers either set fields directly or hand over a name/value map
 * through {@link ArgsBase#populate(Map)}.
 */
public final class AlgorithmBase {
  private AlgorithmBase() {}

  public abstract static class ArgsBase {
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Required {}

    /**
     * Overwrite fields from {@code params}. Keys are field names. Numbers are widened or
     * narrowed to the field type, strings are parsed, enum constants are matched ignoring case.
     *
     * @throws IllegalArgumentException for unknown names and unconvertible values; also when a
     *     {@code @Required} field is missing from {@code params}
     */
    @SuppressWarnings("unchecked")
    public <T extends ArgsBase> T populate(Map<String, ?> params) {
      Preconditions.checkNotNull(params, "params");
      Map<String, Field> fields = argumentFields();

      for (Map.Entry<String, ?> entry : params.entrySet()) {
        Field field = fields.get(entry.getKey());
        if (field == null) {
          throw new IllegalArgumentException(String.format(
              "Unknown argument '%s' for %s; expected one of %s",
              entry.getKey(), getClass().getName(), fields.keySet()));
        }
        set(field, entry.getValue());
      }

      for (Map.Entry<String, Field> entry : fields.entrySet()) {
        if (entry.getValue().isAnnotationPresent(Required.class)
            && !params.containsKey(entry.getKey())) {
          throw new IllegalArgumentException("Missing required argument: " + entry.getKey());
        }
      }
      return (T) this;
    }

    /** Help text for every documented argument, keyed by name. */
    public Map<String, String> describe() {
      Map<String, String> help = new LinkedHashMap<>();
      for (Map.Entry<String, Field> entry : argumentFields().entrySet()) {
        Doc doc = entry.getValue().getAnnotation(Doc.class);
        help.put(entry.getKey(), doc == null ? "" : doc.help());
      }
      return help;
    }

    private Map<String, Field> argumentFields() {
      Map<String, Field> fields = new LinkedHashMap<>();
      for (Class<?> c = getClass(); c != null && c != ArgsBase.class; c = c.getSuperclass()) {
        for (Field f : c.getDeclaredFields()) {
          int mod = f.getModifiers();
          if (Modifier.isStatic(mod) || Modifier.isFinal(mod) || f.isSynthetic()) {
            continue;
          }
          fields.putIfAbsent(f.getName(), f);
        }
      }
      return fields;
    }

    private void set(Field field, Object value) {
      Class<?> type = field.getType();
      try {
        field.setAccessible(true);
        field.set(this, convert(type, value));
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot set argument " + field.getName(), e);
      } catch (RuntimeException e) {
        throw new IllegalArgumentException(String.format(
            "Argument '%s' cannot take value %s as %s", field.getName(), value,
            type.getSimpleName()), e);
      }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convert(Class<?> type, Object value) {
      if (value == null) {
        Preconditions.checkArgument(!type.isPrimitive(), "null for primitive");
        return null;
      }
      if (type == int.class || type == Integer.class) {
        return value instanceof Number ? ((Number) value).intValue()
            : Integer.parseInt(value.toString().trim());
      }
      if (type == long.class || type == Long.class) {
        return value instanceof Number ? ((Number) value).longValue()
            : Long.parseLong(value.toString().trim());
      }
      if (type == double.class || type == Double.class) {
        return value instanceof Number ? ((Number) value).doubleValue()
            : Double.parseDouble(value.toString().trim());
      }
      if (type == boolean.class || type == Boolean.class) {
        if (value instanceof Boolean) {
          return value;
        }
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        Preconditions.checkArgument(s.equals("true") || s.equals("false"), "not a boolean");
        return Boolean.valueOf(s);
      }
      if (type == String.class) {
        return value.toString();
      }
      if (type.isEnum()) {
        if (type.isInstance(value)) {
          return value;
        }
        return Enum.valueOf((Class<Enum>) type, value.toString().trim().toUpperCase(Locale.ROOT));
      }
      Preconditions.checkArgument(type.isInstance(value), "incompatible type");
      return value;
    }
  }
}
