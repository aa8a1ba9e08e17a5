package exm.dpc.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FileDiagnosticsTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private final Logger logger = Logger.getLogger(
                                  FileDiagnosticsTest.class.getName());

  private final List<String> warnings = new ArrayList<String>();

  private final AppenderSkeleton capture = new AppenderSkeleton() {
    @Override
    protected void append(LoggingEvent event) {
      if (event.getLevel().equals(Level.WARN)) {
        warnings.add(event.getRenderedMessage());
      }
    }

    @Override
    public boolean requiresLayout() {
      return false;
    }

    @Override
    public void close() {
    }
  };

  @Before
  public void attach() {
    logger.addAppender(capture);
    logger.setLevel(Level.DEBUG);
  }

  @After
  public void detach() {
    logger.removeAppender(capture);
  }

  /** A directory where a report file is expected cannot be written */
  private FileDiagnostics unwritable() throws Exception {
    File dir = tmp.newFolder();
    return new FileDiagnostics(logger, null, null, dir);
  }

  @Test
  public void testWriteFailureWarnsOnce() throws Exception {
    FileDiagnostics sink = unwritable();
    sink.utilization("stage 0");
    sink.utilization("stage 0");
    assertEquals(warnings.toString(), 1, warnings.size());
    assertTrue(warnings.get(0),
        warnings.get(0).startsWith("Could not write diagnostic file"));
  }

  @Test
  public void testFreshDiagnosticsWarnAgain() throws Exception {
    FileDiagnostics first = new FileDiagnostics(logger, null, null, null);
    assertTrue(first.uniqueWarn("disk full"));
    assertFalse(first.uniqueWarn("disk full"));

    // Next compilation gets its own sink
    FileDiagnostics second = new FileDiagnostics(logger, null, null, null);
    assertTrue(second.uniqueWarn("disk full"));
    assertEquals(2, warnings.size());
  }

  @Test
  public void testUnconfiguredDropsOutput() {
    FileDiagnostics sink = new FileDiagnostics(logger, null, null, null);
    sink.graph("cfg", "digraph {}");
    sink.program("parse", "handler h {}");
    sink.utilization("report");
    sink.close();
    assertTrue(warnings.isEmpty());
  }
}
