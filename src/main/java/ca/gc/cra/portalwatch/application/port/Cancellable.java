package ca.gc.cra.portalwatch.application.port;

/**
 * Handle to scheduled or in-flight work that can be abandoned.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Cancellable {
  /**
   * Cancels the work. Idempotent; cancelling finished work has no effect.
   */
  void cancel();

  /** Handle for work that cannot be cancelled or has nothing to cancel. */
  Cancellable NONE = () -> {};
}
