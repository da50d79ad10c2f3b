package ca.gc.cra.runlog.config;

import ca.gc.cra.runlog.application.LoggerRegistry;
import ca.gc.cra.runlog.application.RunLogger;
import ca.gc.cra.runlog.application.port.ClockPort;
import ca.gc.cra.runlog.application.port.MetricsPort;
import ca.gc.cra.runlog.config.RunLogConfig.HandlerSpec;
import ca.gc.cra.runlog.config.RunLogConfig.LoggerSpec;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies a {@link RunLogConfig} to a {@link LoggerRegistry}.
 * <p><strong>Why:</strong> Gives hosts a single startup call that turns declared loggers into live ones.</p>
 * <p><strong>Role:</strong> Composition helper used at process startup.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the registry provides its own locking.</p>
 * <p><strong>Observability:</strong> Logs the number of loggers configured at info level.</p>
 *
 * @since 0.1.0
 */
public final class RunLogBootstrap {
  private static final Logger log = LoggerFactory.getLogger(RunLogBootstrap.class);

  private RunLogBootstrap() {
    // Utility
  }

  /**
   * Creates a registry rooted at the configuration's base directory and applies the configuration to it.
   *
   * @param config configuration to apply
   * @param clock time source for the registry
   * @param metrics metrics sink for the registry
   * @return configured registry; the caller owns and closes it
   */
  public static LoggerRegistry createRegistry(RunLogConfig config, ClockPort clock, MetricsPort metrics) {
    Objects.requireNonNull(config, "config");
    LoggerRegistry registry = new LoggerRegistry(config.baseDirectory(), clock, metrics);
    try {
      apply(config, registry);
    } catch (RuntimeException ex) {
      registry.close();
      throw ex;
    }
    return registry;
  }

  /**
   * Sets the run name, creates each declared logger with its handlers, then wires handler joins.
   * <p>Loggers already present in the registry are reused; handlers they already hold are skipped with the usual
   * duplicate warning.</p>
   *
   * @param config configuration to apply
   * @param registry target registry
   * @return loggers named by the configuration, in declaration order
   * @throws ca.gc.cra.runlog.application.RunLogException if a join names an unknown logger or handler
   */
  public static List<RunLogger> apply(RunLogConfig config, LoggerRegistry registry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(registry, "registry");
    config.runName().ifPresent(registry::setRunName);

    List<RunLogger> configured = new ArrayList<>(config.loggers().size());
    for (LoggerSpec declared : config.loggers()) {
      Path base = declared.baseDirectory().orElse(config.baseDirectory());
      RunLogger logger = registry.getOrCreate(declared.name(), base);
      for (HandlerSpec handler : declared.handlers()) {
        switch (handler.kind()) {
          case CONSOLE -> logger.addConsoleHandler(
              handler.name(), handler.level(), handler.format(), handler.target());
          case FILE -> logger.addFileHandler(handler.name(), handler.level(), handler.format());
          default -> throw new IllegalStateException("Unhandled sink kind " + handler.kind());
        }
      }
      configured.add(logger);
    }
    for (int i = 0; i < configured.size(); i++) {
      RunLogger logger = configured.get(i);
      for (Map.Entry<String, String> join : config.loggers().get(i).joins().entrySet()) {
        logger.joinHandler(join.getValue(), join.getKey());
      }
    }
    log.info("Configured {} logger(s) for run {}", configured.size(), registry.runId());
    return configured;
  }
}
