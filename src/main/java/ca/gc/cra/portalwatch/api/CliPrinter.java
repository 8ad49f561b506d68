package ca.gc.cra.portalwatch.api;

import ca.gc.cra.portalwatch.domain.service.ConnectState;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Stdout channel of the CLI: verdicts, state transitions, dry-run plans and usage text.
 *
 * <p>Logs go to stderr through Logback; everything written here is meant for scripts. Sign-in URLs are printed
 * unredacted because the user has to open them.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {}

  /**
   * Prints the final state of a {@code check} run, e.g. {@code redirect-found http://portal.example/login}.
   *
   * @param label state label
   * @param signInUrl sign-in URL appended when present
   */
  static void verdict(String label, Optional<URI> signInUrl) {
    println(withUrl(label, signInUrl));
  }

  /**
   * Prints one {@code watch} transition, e.g. {@code connected -> online}.
   *
   * @param previous state before the change
   * @param current state after the change
   * @param signInUrl sign-in URL appended when present
   */
  static void transition(ConnectState previous, ConnectState current, Optional<URI> signInUrl) {
    println(withUrl(previous.label() + " -> " + current.label(), signInUrl));
  }

  static void printLines(List<String> lines) {
    PrintWriter out = out();
    lines.forEach(out::println);
    out.flush();
  }

  static void println(String line) {
    PrintWriter out = out();
    out.println(line);
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static String withUrl(String text, Optional<URI> signInUrl) {
    return signInUrl.map(url -> text + " " + url).orElse(text);
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer == null ? STDOUT : writer;
  }
}
