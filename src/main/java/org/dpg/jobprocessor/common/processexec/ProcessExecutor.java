package org.dpg.jobprocessor.common.processexec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.config.JobProcessingConfig;
import org.dpg.jobprocessor.exception.ProcessExecutionException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the image tools (exiftool, magick) as child processes with a timeout. Both output streams are
 * drained on their own threads; at most {@value #MAX_CAPTURE_BYTES} bytes of each are kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessExecutor {

    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    private final JobProcessingConfig config;

    /**
     * Runs the command with the configured timeout and fails on a non-zero exit code.
     *
     * @param command     the command and its arguments.
     * @param contextInfo logging context, e.g. the master file name.
     * @param processName short tool name used in logs and error messages.
     * @return the result of the successful run.
     * @throws ProcessExecutionException if the tool exited with a non-zero code.
     * @throws IOException               if the tool could not be started or timed out.
     */
    public ProcessResult run(List<String> command, String contextInfo, String processName)
            throws IOException, InterruptedException, ProcessExecutionException {
        ProcessResult result = execute(command, contextInfo, config.getProcessTimeoutMinutes(), processName);
        if (result.exitCode() != 0) {
            String detail = result.stderr().isEmpty() ? result.stdout() : result.stderr();
            throw new ProcessExecutionException(
                    processName + " failed for " + contextInfo + " with exit code " + result.exitCode() + ": " + detail);
        }
        return result;
    }

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     *
     * @return the exit code and a truncated portion of stdout and stderr.
     * @throws IOException          if the process times out or an I/O error occurs.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
            throws IOException, InterruptedException {
        log.debug("[{}] Running {}: {}", contextInfo, processName, command);
        Process process = new ProcessBuilder(command).start();
        StringBuilder stdoutCapture = new StringBuilder();
        StringBuilder stderrCapture = new StringBuilder();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture::append, null));
            executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture::append,
                                               line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new IOException(processName + " process timed out after " + timeoutMinutes + " minutes.");
            }
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(), stderrCapture.toString().trim());
    }

    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final Consumer<String> captureConsumer;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, Consumer<String> captureConsumer, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.captureConsumer = captureConsumer;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        captureConsumer.accept(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * @param exitCode 0 means success.
     * @param stdout   captured standard output, truncated.
     * @param stderr   captured standard error, truncated.
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
