package com.goodmem.outcome;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.time.ZoneId;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Renders variant payloads for {@code toString}. Never throws. */
final class Payloads {

  static final String NON_SERIALIZABLE = "<non-serializable>";

  private static final JsonSerializer<Object> AS_STRING =
      (src, type, context) -> new JsonPrimitive(src.toString());

  private static final Gson GSON =
      new GsonBuilder()
          .serializeNulls()
          .disableHtmlEscaping()
          .serializeSpecialFloatingPointValues()
          .registerTypeHierarchyAdapter(Option.class, new VariantAdapter())
          .registerTypeHierarchyAdapter(Result.class, new VariantAdapter())
          .registerTypeHierarchyAdapter(
              Throwable.class,
              (JsonSerializer<Throwable>) (src, type, context) -> new JsonPrimitive(describe(src)))
          .registerTypeHierarchyAdapter(TemporalAccessor.class, AS_STRING)
          .registerTypeHierarchyAdapter(TemporalAmount.class, AS_STRING)
          .registerTypeHierarchyAdapter(ZoneId.class, AS_STRING)
          .create();

  private Payloads() {
    // Utility class, no instances
  }

  /**
   * Renders {@code value} as JSON, with a few exceptions: nested options and results use their
   * own {@code toString}, throwables render as {@code SimpleName: message}, and anything that
   * cannot be serialized renders as {@value #NON_SERIALIZABLE}.
   */
  @Nonnull
  static String render(@Nullable Object value) {
    if (value instanceof Option<?> || value instanceof Result<?, ?>) {
      return value.toString();
    }
    if (value instanceof Throwable throwable) {
      return describe(throwable);
    }
    if (value != null && (value.getClass().isSynthetic() || value.getClass().isHidden())) {
      // Lambdas and method references.
      return NON_SERIALIZABLE;
    }
    try {
      return GSON.toJson(value);
    } catch (JsonIOException e) {
      // Fields of JDK classes are closed to reflection; their own string form is the best render.
      if (value.getClass().getModule().isNamed()) {
        return GSON.toJson(plain(value));
      }
      return NON_SERIALIZABLE;
    } catch (RuntimeException | StackOverflowError e) {
      // Gson has no cycle detection; a self-referencing graph overflows the stack.
      return NON_SERIALIZABLE;
    }
  }

  /** Writes a nested option or result in its own {@code toString} form, unquoted. */
  private static final class VariantAdapter extends TypeAdapter<Object> {
    @Override
    public void write(JsonWriter out, Object value) throws IOException {
      if (value == null) {
        out.nullValue();
      } else {
        out.jsonValue(value.toString());
      }
    }

    @Override
    public Object read(JsonReader in) {
      throw new UnsupportedOperationException("Rendering only");
    }
  }

  /** Short human description of a throwable, used in messages and renders. */
  @Nonnull
  static String describe(@Nonnull Throwable throwable) {
    String message = throwable.getMessage();
    String name = throwable.getClass().getSimpleName();
    return message == null ? name : name + ": " + message;
  }

  /**
   * Plain string form of a payload for misuse messages. Throwables are described, everything
   * else goes through {@link String#valueOf(Object)}.
   */
  @Nonnull
  static String plain(@Nullable Object value) {
    if (value instanceof Throwable throwable) {
      return describe(throwable);
    }
    try {
      return String.valueOf(value);
    } catch (RuntimeException | StackOverflowError e) {
      return NON_SERIALIZABLE;
    }
  }
}
