package ca.gc.cra.portalwatch.testutil;

import ca.gc.cra.portalwatch.application.port.ConnectStateListener;
import ca.gc.cra.portalwatch.domain.probe.ValidationResult;
import ca.gc.cra.portalwatch.domain.service.ConnectState;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Listener that records transitions and results.
 */
public final class RecordingStateListener implements ConnectStateListener {
  /** One recorded transition. */
  public record Transition(ConnectState previous, ConnectState current, Optional<URI> probeUrl) {}

  private final List<Transition> transitions = new ArrayList<>();
  private final List<ValidationResult> results = new ArrayList<>();

  @Override
  public void onStateChanged(long serviceId, ConnectState previous, ConnectState current, Optional<URI> probeUrl) {
    transitions.add(new Transition(previous, current, probeUrl));
  }

  @Override
  public void onValidationResult(long serviceId, ValidationResult result) {
    results.add(result);
  }

  public List<Transition> transitions() {
    return List.copyOf(transitions);
  }

  public List<ConnectState> states() {
    return transitions.stream().map(Transition::current).toList();
  }

  public List<ValidationResult> results() {
    return List.copyOf(results);
  }
}
