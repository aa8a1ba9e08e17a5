package exm.dpc.ui;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class MainTest {

  @Test
  public void testOutputFileFromInput() {
    Main.Args args = new Main.Args("dir/handler.dpt", null, false);
    assertEquals("handler.pipe", Main.selectOutputFile(args).getName());
  }

  @Test
  public void testOutputFileOtherExtension() {
    Main.Args args = new Main.Args("handler.txt", null, false);
    assertEquals("handler.txt.pipe", Main.selectOutputFile(args).getPath());
  }

  @Test
  public void testOutputFileGiven() {
    Main.Args args = new Main.Args("handler.dpt", "out.p4", false);
    assertEquals("out.p4", Main.selectOutputFile(args).getPath());
  }
}
