/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import dev.warden.api.ActionKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Runtime configuration loaded from {@code config/warden.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Emits a {@code warden.json5.example} snapshot for ops tooling.
 *   <li>Supports environment overrides for the DB connection ({@code WARDEN_DB_*}).
 *   <li>Parses the database, logging and moderation blocks.
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Warden v1.0.0 configuration (JSON5 with comments)
      // Drop into config/warden.json5.
      // Environment overrides: WARDEN_DB_HOST|PORT|DATABASE|USER|PASSWORD.
      {
        core: {
          db: {
            host: "127.0.0.1",
            port: 3306,
            database: "warden",
            user: "warden",
            password: "change-me",
            tls: { enabled: false },
            session: { forceUtc: true },
            pool: {
              maxPoolSize: 10,
              minimumIdle: 2,
              connectionTimeoutMs: 10000,
              idleTimeoutMs: 600000,
              maxLifetimeMs: 1700000,
              startupAttempts: 3
            }
          },
          log: {
            json: false,
            level: "INFO"
          }
        },
        moderation: {
          // Identical active actions issued within this window are suppressed.
          duplicateWindowMs: 300000,
          // Expiry callbacks firing earlier than end-of-action minus this are treated as anomalies.
          expiryToleranceMs: 1000,
          systemActorId: "system",
          systemActorName: "Warden",
          kinds: [ "mute", "ban", "timeout", "rolepersist", "warn", "kick", "softban", "note" ],
          alerts: { capacity: 20, refillPerSec: 0.2 }
        }
      }
      """;

  private final Db db;
  private final Log log;
  private final Moderation moderation;

  Config(Db db, Log log, Moderation moderation) {
    this.db = db;
    this.log = log;
    this.moderation = moderation;
  }

  /**
   * Database connection block.
   *
   * @return database settings
   */
  public Db db() {
    return db;
  }

  /**
   * Logging configuration.
   *
   * @return logging configuration block
   */
  public Log log() {
    return log;
  }

  /**
   * Moderation lifecycle tuning.
   *
   * @return moderation block
   */
  public Moderation moderation() {
    return moderation;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("warden.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read config: " + path, e);
    }
  }

  /**
   * Parses JSON5 text into a validated config.
   *
   * @param raw JSON5 text
   * @return parsed config
   */
  public static Config parse(String raw) {
    JsonObject root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    JsonObject core = optObject(root, "core");
    if (core == null) {
      throw new IllegalStateException("config missing core{} block");
    }
    Db db = parseDb(optObject(core, "db"));
    Log log = parseLog(optObject(core, "log"));
    Moderation moderation = parseModeration(optObject(root, "moderation"));
    Config config = new Config(db, log, moderation);
    validate(config);
    return config;
  }

  private static String stripJson5(String raw) {
    return raw.replaceAll("(?s)/\\*.*?\\*/", "")
        .replaceAll("(?m)^\\s*//.*$", "")
        .replaceAll("(?m)\\s+//[^\"\\n]*$", "")
        .replaceAll(",(?=\\s*[}\\]])", "");
  }

  private static Db parseDb(JsonObject db) {
    if (db == null) {
      throw new IllegalStateException("config missing core.db{}");
    }
    String envHost = System.getenv("WARDEN_DB_HOST");
    String envPort = System.getenv("WARDEN_DB_PORT");
    String envDatabase = System.getenv("WARDEN_DB_DATABASE");
    String envUser = System.getenv("WARDEN_DB_USER");
    String envPassword = System.getenv("WARDEN_DB_PASSWORD");

    String host = envHost != null ? envHost : optString(db, "host", "127.0.0.1");
    int port = envPort != null ? parsePort(envPort) : optInt(db, "port", 3306);
    String database = envDatabase != null ? envDatabase : optString(db, "database", "warden");
    String user = envUser != null ? envUser : optString(db, "user", "warden");
    String password = envPassword != null ? envPassword : optString(db, "password", "");

    JsonObject tlsObj = optObject(db, "tls");
    boolean tls = tlsObj != null && optBoolean(tlsObj, "enabled", false);

    JsonObject sessionObj = optObject(db, "session");
    boolean forceUtc = sessionObj == null || optBoolean(sessionObj, "forceUtc", true);

    JsonObject poolObj = optObject(db, "pool");
    Pool pool =
        new Pool(
            optInt(poolObj, "maxPoolSize", 10),
            optInt(poolObj, "minimumIdle", 2),
            optLong(poolObj, "connectionTimeoutMs", 10_000L),
            optLong(poolObj, "idleTimeoutMs", 600_000L),
            optLong(poolObj, "maxLifetimeMs", 1_700_000L),
            optInt(poolObj, "startupAttempts", 3));
    return new Db(host, port, database, user, password, tls, forceUtc, pool);
  }

  private static int parsePort(String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("WARDEN_DB_PORT is not a number: " + raw, e);
    }
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, "INFO");
    }
    return new Log(optBoolean(log, "json", false), optString(log, "level", "INFO"));
  }

  private static Moderation parseModeration(JsonObject mod) {
    long window = optLong(mod, "duplicateWindowMs", 300_000L);
    long tolerance = optLong(mod, "expiryToleranceMs", 1_000L);
    String actorId = optString(mod, "systemActorId", "system");
    String actorName = optString(mod, "systemActorName", "Warden");

    Set<ActionKind> kinds = EnumSet.allOf(ActionKind.class);
    if (mod != null && mod.has("kinds") && mod.get("kinds").isJsonArray()) {
      kinds = EnumSet.noneOf(ActionKind.class);
      for (JsonElement el : mod.get("kinds").getAsJsonArray()) {
        String raw = el.getAsString();
        try {
          kinds.add(ActionKind.fromId(raw));
        } catch (IllegalArgumentException e) {
          throw new IllegalStateException("moderation.kinds contains unknown kind: " + raw, e);
        }
      }
    }

    JsonObject alertsObj = optObject(mod, "alerts");
    Alerts alerts =
        new Alerts(optInt(alertsObj, "capacity", 20), optDouble(alertsObj, "refillPerSec", 0.2));
    return new Moderation(window, tolerance, actorId, actorName, Set.copyOf(kinds), alerts);
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static double optDouble(JsonObject obj, String key, double def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsDouble() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static void validate(Config cfg) {
    validateDb(cfg.db());
    validateLog(cfg.log());
    validateModeration(cfg.moderation());
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.host(), "core.db.host");
    requireNonBlank(db.database(), "core.db.database");
    requireNonBlank(db.user(), "core.db.user");
    if (db.port() <= 0 || db.port() > 65535) {
      throw new IllegalStateException("core.db.port must be between 1 and 65535");
    }
    if (db.host().contains(" ")) {
      throw new IllegalStateException("core.db.host must not contain spaces");
    }
    if (!db.database().matches("[A-Za-z0-9_]+")) {
      throw new IllegalStateException("core.db.database must match [A-Za-z0-9_]+");
    }
    Pool pool = db.pool();
    if (pool.maxPoolSize() < 1 || pool.maxPoolSize() > 50) {
      throw new IllegalStateException("core.db.pool.maxPoolSize must be between 1 and 50");
    }
    if (pool.minimumIdle() < 0 || pool.minimumIdle() > pool.maxPoolSize()) {
      throw new IllegalStateException("core.db.pool.minimumIdle must be between 0 and maxPoolSize");
    }
    if (pool.connectionTimeoutMs() < 1_000 || pool.connectionTimeoutMs() > 120_000) {
      throw new IllegalStateException(
          "core.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    if (pool.idleTimeoutMs() >= pool.maxLifetimeMs()) {
      throw new IllegalStateException("core.db.pool.idleTimeoutMs must be less than maxLifetimeMs");
    }
    if (pool.startupAttempts() < 1 || pool.startupAttempts() > 10) {
      throw new IllegalStateException("core.db.pool.startupAttempts must be between 1 and 10");
    }
  }

  private static void validateLog(Log log) {
    requireNonBlank(log.level(), "core.log.level");
    String level = log.level().toUpperCase(Locale.ROOT);
    if (!Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF").contains(level)) {
      throw new IllegalStateException("core.log.level must be a logback level: " + log.level());
    }
  }

  private static void validateModeration(Moderation mod) {
    if (mod.duplicateWindowMs() < 0) {
      throw new IllegalStateException("moderation.duplicateWindowMs must be >= 0");
    }
    if (mod.expiryToleranceMs() < 0 || mod.expiryToleranceMs() > 60_000) {
      throw new IllegalStateException("moderation.expiryToleranceMs must be between 0 and 60000");
    }
    requireNonBlank(mod.systemActorId(), "moderation.systemActorId");
    requireNonBlank(mod.systemActorName(), "moderation.systemActorName");
    if (mod.kinds().isEmpty()) {
      throw new IllegalStateException("moderation.kinds must include at least one kind");
    }
    if (mod.alerts().capacity() < 1) {
      throw new IllegalStateException("moderation.alerts.capacity must be >= 1");
    }
    if (!(mod.alerts().refillPerSec() > 0)) {
      throw new IllegalStateException("moderation.alerts.refillPerSec must be > 0");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(field + " must not be blank");
    }
  }

  /**
   * Database connection block.
   *
   * @param host database host
   * @param port database port
   * @param database schema name
   * @param user login user
   * @param password login password
   * @param tlsEnabled whether to require TLS
   * @param forceUtc whether to pin the session time zone to UTC
   * @param pool Hikari pool settings
   */
  public record Db(
      String host,
      int port,
      String database,
      String user,
      String password,
      boolean tlsEnabled,
      boolean forceUtc,
      Pool pool) {

    /**
     * Fully formed JDBC URL (MariaDB tuned for UTF-8 + UTC).
     *
     * @return JDBC URL string for MariaDB connections
     */
    public String jdbcUrl() {
      StringBuilder url =
          new StringBuilder("jdbc:mariadb://")
              .append(host)
              .append(':')
              .append(port)
              .append('/')
              .append(database)
              .append("?useUnicode=true&characterEncoding=utf8mb4&serverTimezone=UTC");
      if (tlsEnabled) {
        url.append("&sslMode=VERIFY_IDENTITY");
      } else {
        url.append("&sslMode=DISABLE");
      }
      return url.toString();
    }
  }

  /**
   * Hikari pool settings.
   *
   * @param maxPoolSize maximum connections
   * @param minimumIdle idle connections kept warm
   * @param connectionTimeoutMs borrow timeout
   * @param idleTimeoutMs idle eviction timeout
   * @param maxLifetimeMs maximum connection lifetime
   * @param startupAttempts connection attempts before boot fails
   */
  public record Pool(
      int maxPoolSize,
      int minimumIdle,
      long connectionTimeoutMs,
      long idleTimeoutMs,
      long maxLifetimeMs,
      int startupAttempts) {}

  /**
   * Logging block.
   *
   * @param json whether to emit structured JSON logs
   * @param level textual log level for the console logger
   */
  public record Log(boolean json, String level) {}

  /**
   * Moderation lifecycle tuning.
   *
   * @param duplicateWindowMs window in which an identical active action is suppressed
   * @param expiryToleranceMs slack allowed between the scheduled and computed end of an action
   * @param systemActorId actor id recorded for automatic removals
   * @param systemActorName actor name recorded for automatic removals
   * @param kinds action kinds with a running controller
   * @param alerts operator alert throttling
   */
  public record Moderation(
      long duplicateWindowMs,
      long expiryToleranceMs,
      String systemActorId,
      String systemActorName,
      Set<ActionKind> kinds,
      Alerts alerts) {}

  /**
   * Alert throttling, per alert code and operation.
   *
   * @param capacity burst size
   * @param refillPerSec tokens regained per second
   */
  public record Alerts(int capacity, double refillPerSec) {}
}
