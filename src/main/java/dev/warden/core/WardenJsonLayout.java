/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One-line JSON layout for console logging.
 *
 * <p>{@code key=value} tokens of {@code (warden)} messages (code, op, case, ...) are copied into a
 * {@code fields} object so log pipelines can filter on them without parsing the message.
 */
final class WardenJsonLayout extends LayoutBase<ILoggingEvent> {
  private static final Gson GSON =
      new GsonBuilder().disableHtmlEscaping().serializeNulls().create();
  private static final Pattern FIELD = Pattern.compile("(?:^|\\s)([a-zA-Z]+)=([^\\s]+)");
  private static final String PREFIX = "(warden) ";

  @Override
  public String doLayout(ILoggingEvent event) {
    JsonObject json = new JsonObject();
    json.addProperty("ts", Instant.ofEpochMilli(event.getTimeStamp()).toString());
    json.addProperty("level", event.getLevel().toString());
    json.addProperty("logger", event.getLoggerName());
    json.addProperty("thread", event.getThreadName());
    String message = event.getFormattedMessage();
    json.addProperty("message", message);

    JsonObject fields = fields(message);
    if (fields.size() > 0) {
      json.add("fields", fields);
    }

    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null && !mdc.isEmpty()) {
      JsonObject mdcJson = new JsonObject();
      mdc.forEach(mdcJson::addProperty);
      json.add("mdc", mdcJson);
    }

    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      json.addProperty("stack", ThrowableProxyUtil.asString(throwable));
    }
    return GSON.toJson(json) + System.lineSeparator();
  }

  static JsonObject fields(String message) {
    JsonObject fields = new JsonObject();
    if (message == null || !message.startsWith(PREFIX)) {
      return fields;
    }
    Matcher m = FIELD.matcher(message.substring(PREFIX.length()));
    while (m.find()) {
      // message= runs to the next key, so only single-token values are lifted
      if (!"message".equals(m.group(1))) {
        fields.addProperty(m.group(1), m.group(2));
      }
    }
    return fields;
  }
}
