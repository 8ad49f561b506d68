package ca.gc.cra.portalwatch.domain.probe;

/**
 * User-facing connectivity verdict derived from a completed {@link ValidationResult}.
 *
 * @since 0.1.0
 */
public enum ValidationState {
  /** Both probes succeeded, or HTTP-only mode found no portal. */
  INTERNET_CONNECTIVITY("internet-connectivity"),
  /** Neither a portal nor internet access could be confirmed. */
  NO_CONNECTIVITY("no-connectivity"),
  /** The HTTP probe received unexpected content without an explicit redirect. */
  PORTAL_SUSPECTED("portal-suspected"),
  /** The HTTP probe was redirected to a usable sign-in location. */
  PORTAL_REDIRECT("portal-redirect");

  private final String label;

  ValidationState(String label) {
    this.label = label;
  }

  /**
   * Returns the stable textual label used in logs and CLI output.
   *
   * @return label such as {@code portal-redirect}
   */
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
