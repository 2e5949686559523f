/* Warden © 2025 Warden Devs — MIT */
package dev.warden;

import dev.warden.api.ActionKind;
import dev.warden.api.EffectProvider;
import dev.warden.api.MemberDirectory;
import dev.warden.api.WardenApi;
import dev.warden.core.Config;
import dev.warden.core.CoreServices;
import dev.warden.core.LogbackConfigurator;
import dev.warden.core.Migrations;
import dev.warden.core.Services;
import dev.warden.core.StoreException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Warden entrypoint for a host process.
 *
 * <p>Boot sequence:
 *
 * <ol>
 *   <li>Load config (writes default JSON5 if missing)
 *   <li>Apply the logging block
 *   <li>Start services (Hikari pool, update bus, one controller per enabled kind)
 *   <li>Apply DDL migrations
 *   <li>Expose services through {@link WardenApi}
 *   <li>Recover timers and re-apply effects for active records
 *   <li>Register the shutdown hook
 * </ol>
 */
public final class Warden {
  /** Logger and config name. */
  public static final String ID = "warden";

  private static final Logger LOG = LoggerFactory.getLogger(ID);

  private Warden() {}

  /**
   * Boots Warden from {@code config/warden.json5}.
   *
   * @param providers effect provider per kind
   * @param members rank lookup
   * @return running services
   */
  public static Services boot(Map<ActionKind, EffectProvider> providers, MemberDirectory members) {
    return boot(Path.of("config", ID + ".json5"), providers, members);
  }

  /**
   * Boots Warden from the given config file.
   *
   * @param cfgPath config location
   * @param providers effect provider per kind
   * @param members rank lookup
   * @return running services
   */
  public static Services boot(
      Path cfgPath, Map<ActionKind, EffectProvider> providers, MemberDirectory members) {
    LOG.info("(warden) booting Warden 1.0.0");
    Config cfg = Config.loadOrWriteDefault(cfgPath);
    LogbackConfigurator.configure(cfg.log());

    CoreServices services = CoreServices.start(cfg, providers, members);
    initializeWithServices(services);

    Runtime.getRuntime()
        .addShutdownHook(new Thread(() -> stop(services), "warden-shutdown"));
    return services;
  }

  static void initializeWithServices(Services services) {
    try {
      Migrations.apply(services.dataSource(), Clock.systemUTC());
      WardenApi.bootstrap(services);
      int reapplied = services.recover();
      services.refreshGauges();
      LOG.info("(warden) ready kinds={} reapplied={}", services.kinds(), reapplied);
    } catch (StoreException | IllegalStateException e) {
      WardenApi.clear();
      closeQuietly(services);
      throw e;
    }
  }

  /**
   * Unpublishes and stops the services.
   *
   * @param services running services
   */
  public static void stop(Services services) {
    WardenApi.clear();
    try {
      services.shutdown();
    } catch (IOException | RuntimeException e) {
      LOG.warn("(warden) shutdown error", e);
    }
  }

  private static void closeQuietly(Services services) {
    try {
      services.shutdown();
    } catch (IOException | RuntimeException e) {
      LOG.warn("(warden) cleanup after failed boot", e);
    }
  }
}
