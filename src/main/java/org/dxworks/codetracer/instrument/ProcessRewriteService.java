package org.dxworks.codetracer.instrument;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a configured command per function: the request goes to its stdin as JSON, the
 * response is read from its stdout.
 */
public class ProcessRewriteService implements RewriteService {
    private final List<String> command;
    private final long timeoutSeconds;
    private final ObjectMapper mapper;
    private final RewriteResponseParser parser;

    public ProcessRewriteService(List<String> command, long timeoutSeconds, ObjectMapper mapper) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Rewrite command is not configured");
        }
        this.command = List.copyOf(command);
        this.timeoutSeconds = timeoutSeconds;
        this.mapper = mapper;
        this.parser = new RewriteResponseParser(mapper);
    }

    /**
     * @throws IOException when the command fails, exits non-zero, outlives the timeout or
     *                     answers with something that is not a rewrite response
     */
    @Override
    public RewriteResponse rewrite(RewriteRequest request) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(request);

        Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();
        boolean exited = false;
        try {
            // both pipes are served off this thread so a command that never reads stdin still times out
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            CompletableFuture<Void> stdin = CompletableFuture.runAsync(() -> writeAll(process.getOutputStream(), payload));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new IOException("Rewrite command timed out after " + timeoutSeconds + "s for "
                        + request.targetFunction.name);
            }
            exited = true;
            if (process.exitValue() != 0) {
                throw new IOException("Rewrite command exited with " + process.exitValue() + " for "
                        + request.targetFunction.name);
            }
            stdin.get(timeoutSeconds, TimeUnit.SECONDS);
            return parser.parse(stdout.get(timeoutSeconds, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the rewrite command", e);
        } catch (ExecutionException e) {
            throw new IOException("Could not exchange data with the rewrite command", e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("Rewrite command output still open after it exited for "
                    + request.targetFunction.name, e);
        } finally {
            if (!exited) {
                process.destroyForcibly();
            }
        }
    }

    private static void writeAll(OutputStream out, byte[] payload) {
        try (OutputStream stream = out) {
            stream.write(payload);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String readAll(InputStream in) {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
