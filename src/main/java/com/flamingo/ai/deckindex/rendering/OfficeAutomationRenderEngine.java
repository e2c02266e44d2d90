package com.flamingo.ai.deckindex.rendering;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.RenderingResourceException;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

/**
 * Engine driving an external office suite in headless mode. Presentations are converted to PDF by
 * the office process, then rasterized with PDFBox. The PDF export leaves hidden slides out, which
 * keeps the page count aligned with the slides the parser extracts.
 *
 * <p>The office process keeps a single user profile and cannot run two conversions at once, which
 * is why all calls go through {@link ExclusiveRenderResource}.
 */
@Slf4j
public class OfficeAutomationRenderEngine implements RenderEngine {

  private static final int PROBE_TIMEOUT_SECONDS = 30;

  private final String command;
  private final int timeoutSeconds;
  private final PdfPageRasterizer pdfRasterizer;
  private final Path tempRoot;

  private Path profileDirectory;
  private Process currentProcess;

  public OfficeAutomationRenderEngine(String command, int timeoutSeconds, float dpi) {
    this(command, timeoutSeconds, dpi, null);
  }

  /**
   * @param tempRoot parent of the profile and conversion directories, the system temp directory
   *     when null
   */
  @VisibleForTesting
  OfficeAutomationRenderEngine(String command, int timeoutSeconds, float dpi, Path tempRoot) {
    this.command = command;
    this.timeoutSeconds = timeoutSeconds;
    this.pdfRasterizer = new PdfPageRasterizer(dpi);
    this.tempRoot = tempRoot;
  }

  @Override
  public String name() {
    return "office";
  }

  @Override
  public void open() {
    Path profile;
    try {
      profile = createTempDirectory("deck-index-office-profile-");
    } catch (IOException e) {
      throw new RenderingResourceException("Cannot create office profile: " + e.getMessage(), e);
    }
    try {
      int exit = run(List.of(command, "--version"), profile, PROBE_TIMEOUT_SECONDS);
      if (exit != 0) {
        throw new RenderingResourceException("Office probe exited with code " + exit);
      }
    } catch (IOException e) {
      deleteQuietly(profile);
      throw new RenderingResourceException("Cannot start office process: " + e.getMessage(), e);
    } catch (RuntimeException e) {
      deleteQuietly(profile);
      throw e;
    }
    profileDirectory = profile;
    log.info("Office render session opened (profile {})", profileDirectory);
  }

  @Override
  public List<Path> render(Path source, Path outputDirectory) {
    String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".pdf")) {
      return pdfRasterizer.rasterize(source, outputDirectory);
    }
    if (profileDirectory == null) {
      throw new RenderingResourceException("Office render session is not open");
    }
    Path workDirectory = null;
    try {
      workDirectory = createTempDirectory("deck-index-convert-");
      List<String> cmd = new ArrayList<>();
      cmd.add(command);
      cmd.add("-env:UserInstallation=" + profileDirectory.toUri());
      cmd.add("--headless");
      cmd.add("--norestore");
      cmd.add("--convert-to");
      cmd.add("pdf");
      cmd.add("--outdir");
      cmd.add(workDirectory.toString());
      cmd.add(source.toAbsolutePath().toString());

      int exit = run(cmd, workDirectory, timeoutSeconds);
      if (exit != 0) {
        throw new RenderingResourceException(
            "Office conversion of " + source.getFileName() + " exited with code " + exit);
      }
      Path pdf = workDirectory.resolve(baseName(source) + ".pdf");
      if (!Files.exists(pdf)) {
        throw new ContentProcessingException(
            "render", "Office produced no output for " + source.getFileName());
      }
      return pdfRasterizer.rasterize(pdf, outputDirectory);
    } catch (IOException e) {
      throw new RenderingResourceException(
          "Office conversion of " + source.getFileName() + " failed: " + e.getMessage(), e);
    } finally {
      deleteQuietly(workDirectory);
    }
  }

  @Override
  public void close() {
    Process process = currentProcess;
    if (process != null && process.isAlive()) {
      log.warn("Killing lingering office process {}", process.pid());
      process.destroyForcibly();
    }
    currentProcess = null;
    deleteQuietly(profileDirectory);
    profileDirectory = null;
    log.info("Office render session closed");
  }

  private int run(List<String> cmd, Path workDirectory, int timeout) throws IOException {
    log.debug("Running {}", cmd);
    ProcessBuilder pb = new ProcessBuilder(cmd);
    pb.redirectErrorStream(true);
    // Output goes to a file so a hanging process cannot block on a full pipe
    pb.redirectOutput(workDirectory.resolve("office.log").toFile());
    Process process = pb.start();
    currentProcess = process;
    try {
      if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new RenderingResourceException("Office process timed out after " + timeout + "s");
      }
      return process.exitValue();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new RenderingResourceException("Interrupted while waiting for office process", e);
    } finally {
      currentProcess = null;
    }
  }

  private Path createTempDirectory(String prefix) throws IOException {
    return tempRoot == null
        ? Files.createTempDirectory(prefix)
        : Files.createTempDirectory(tempRoot, prefix);
  }

  private static String baseName(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static void deleteQuietly(Path directory) {
    if (directory == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(directory);
    } catch (IOException e) {
      log.warn("Could not delete {}: {}", directory, e.getMessage());
    }
  }
}
