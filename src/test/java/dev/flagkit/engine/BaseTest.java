package dev.flagkit.engine;

import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogCapture;
import com.launchdarkly.logging.Logs;

import org.junit.Rule;
import org.junit.rules.TestWatcher;
import org.junit.runner.Description;

import java.util.regex.Pattern;

@SuppressWarnings("javadoc")
public class BaseTest {
  @Rule public DumpLogIfTestFails dumpLogIfTestFails;

  protected final LDLogAdapter testLogging;
  protected final LDLogger testLogger;
  protected final LogCapture logCapture;

  protected BaseTest() {
    logCapture = Logs.capture();
    testLogging = logCapture;
    testLogger = LDLogger.withAdapter(testLogging, "");
    dumpLogIfTestFails = new DumpLogIfTestFails();
  }

  /**
   * Creates a configuration builder with the basic properties that we want for all tests unless
   * otherwise specified: redirect all logging to the test logger for the current test (which will be
   * printed to the console only if the test fails).
   *
   * @return a configuration builder
   */
  protected EngineConfig.Builder baseConfig() {
    return new EngineConfig.Builder()
        .logging(Components.logging(testLogging).level(LDLogLevel.DEBUG));
  }

  /**
   * Tests whether a captured message at the given level matches a regex in full.
   *
   * @param capture the log sink
   * @param level the log level
   * @param regex the pattern; "." also matches line breaks
   * @return true if there is a matching message
   */
  public static boolean hasMessageMatching(LogCapture capture, LDLogLevel level, String regex) {
    Pattern p = Pattern.compile(regex, Pattern.DOTALL);
    for (LogCapture.Message m: capture.getMessages()) {
      if (m.getLevel() == level && p.matcher(m.getText()).matches()) {
        return true;
      }
    }
    return false;
  }

  protected boolean hasLogMessage(LDLogLevel level, String regex) {
    return hasMessageMatching(logCapture, level, regex);
  }

  class DumpLogIfTestFails extends TestWatcher {
    @Override
    protected void failed(Throwable e, Description description) {
      for (LogCapture.Message message: logCapture.getMessages()) {
        System.out.println("LOG {" + description.getDisplayName() + "} >>> " + message.toStringWithTimestamp());
      }
    }
  }
}
