package ca.gc.cra.portalwatch.domain.probe;

/**
 * HTTP status codes the probe classification cares about.
 */
public final class HttpStatus {
  public static final int OK = 200;
  public static final int NO_CONTENT = 204;
  public static final int MOVED_PERMANENTLY = 301;
  public static final int FOUND = 302;
  public static final int SEE_OTHER = 303;
  public static final int TEMPORARY_REDIRECT = 307;
  public static final int PERMANENT_REDIRECT = 308;

  private HttpStatus() {}

  /**
   * Reports whether a status code is one of the redirects a portal uses to send the user to its sign-in page.
   *
   * @param statusCode HTTP status code
   * @return {@code true} for 301, 302, 303, 307 and 308
   */
  public static boolean isRedirect(int statusCode) {
    return statusCode == MOVED_PERMANENTLY
        || statusCode == FOUND
        || statusCode == SEE_OTHER
        || statusCode == TEMPORARY_REDIRECT
        || statusCode == PERMANENT_REDIRECT;
  }
}
