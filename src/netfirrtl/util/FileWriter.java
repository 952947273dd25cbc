package netfirrtl.util;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.FilterWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for opening output files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Output name that selects standard output. */
  public static final String STDOUT = "-";

  private String base_path = "";
  public FileWriter(String base_path) { this.base_path = base_path; }
  public FileWriter() {}

  /**
   * Opens a buffered UTF-8 writer for file, relative to the base path, creating parent directories as needed.
   * For null or {@link #STDOUT}, returns a writer on standard output that is flushed but not closed by close().
   */
  public Writer OpenOutput(String file) throws IOException {
    if (file == null || file.equals(STDOUT)) {
      return new FilterWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8))) {
        @Override
        public void close() throws IOException {
          flush();
        }
      };
    }
    File outFile = base_path.isEmpty() ? new File(file) : Paths.get(base_path, file).toFile();
    // create output path if necessary
    File parent = outFile.getAbsoluteFile().getParentFile();
    if (parent != null)
      parent.mkdirs();

    logger.info("Writing " + outFile.getPath());
    return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8));
  }
}
