package ca.gc.cra.portalwatch.domain.probe;

/**
 * Typed transport failure reported by a {@code ProbeClient} instead of an exception.
 *
 * @since 0.1.0
 */
public enum ProbeError {
  /** Name resolution failed. */
  DNS_FAILURE,
  /** Name resolution did not answer in time. */
  DNS_TIMEOUT,
  /** TLS handshake or certificate validation failed. */
  TLS_FAILURE,
  /** TCP connection could not be established. */
  CONNECTION_FAILURE,
  /** The request did not complete before the probe timeout. */
  HTTP_TIMEOUT,
  /** Any other I/O error while exchanging the request. */
  IO_ERROR,
  /** The probe could not be issued at all (resource exhaustion, client bug). */
  INTERNAL_ERROR
}
