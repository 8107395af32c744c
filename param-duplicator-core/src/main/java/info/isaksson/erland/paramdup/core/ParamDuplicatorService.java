package info.isaksson.erland.paramdup.core;

import com.github.javaparser.ParseProblemException;
import info.isaksson.erland.paramdup.io.SourceScanner;
import info.isaksson.erland.paramdup.rewrite.JavaSourceRewriter;
import info.isaksson.erland.paramdup.rewrite.RewriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Core (embeddable) API: read Java source, duplicate single parameters, write the result.
 *
 * <p>CLI and other wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class ParamDuplicatorService {

    private static final Logger LOG = LoggerFactory.getLogger(ParamDuplicatorService.class);

    /**
     * Rewrite a single file.
     *
     * @throws ParseProblemException if the input is not valid Java; nothing is written then
     * @throws IOException if the input cannot be read or the output cannot be written
     */
    public ParamDuplicatorResult rewriteFile(Path input, Path output, ParamDuplicatorOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        if (output == null) throw new IllegalArgumentException("output must not be null");
        if (options == null) options = new ParamDuplicatorOptions();

        String source = Files.readString(input, StandardCharsets.UTF_8);
        RewriteResult res = new JavaSourceRewriter(options.includeConstructors).rewrite(source);
        writeText(output, res.text);

        LOG.debug("{}: {} declaration(s) modified", input, res.modifiedCount());
        FileOutcome outcome = new FileOutcome(input.getFileName().toString(), res.duplications, null);
        return new ParamDuplicatorResult(input, output, List.of(outcome));
    }

    /**
     * Rewrite every scanned .java file under {@code inputRoot} into the same relative path under
     * {@code outputRoot}.
     *
     * <p>Files are independent, so they are rewritten concurrently; the total is the sum of the
     * per-file counts. A file that does not parse, or is not valid UTF-8, is copied unchanged and
     * reported as a failure.</p>
     */
    public ParamDuplicatorResult rewriteTree(Path inputRoot, Path outputRoot, List<String> excludeGlobs, ParamDuplicatorOptions options) throws IOException {
        if (inputRoot == null) throw new IllegalArgumentException("inputRoot must not be null");
        if (outputRoot == null) throw new IllegalArgumentException("outputRoot must not be null");
        if (options == null) options = new ParamDuplicatorOptions();

        final Path in = inputRoot.toAbsolutePath().normalize();
        final Path out = outputRoot.toAbsolutePath().normalize();
        List<Path> javaFiles = SourceScanner.scan(in, excludeGlobs == null ? List.of() : excludeGlobs, options.includeTests, out);

        final JavaSourceRewriter rewriter = new JavaSourceRewriter(options.includeConstructors);
        List<Callable<FileOutcome>> tasks = new ArrayList<>(javaFiles.size());
        for (Path file : javaFiles) {
            tasks.add(() -> rewriteOne(rewriter, in, out, file));
        }

        int threads = Math.max(1, Math.min(options.threads, Math.max(1, tasks.size())));
        LOG.debug("Rewriting {} file(s) under {} with {} thread(s)", tasks.size(), in, threads);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<FileOutcome> outcomes = new ArrayList<>(tasks.size());
            for (Future<FileOutcome> f : pool.invokeAll(tasks)) {
                outcomes.add(await(f));
            }
            return new ParamDuplicatorResult(in, out, outcomes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while rewriting " + in);
        } finally {
            pool.shutdownNow();
        }
    }

    private static FileOutcome rewriteOne(JavaSourceRewriter rewriter, Path inputRoot, Path outputRoot, Path file) throws IOException {
        String rel = SourceScanner.relativePath(inputRoot, file);
        Path target = outputRoot.resolve(rel);
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            copyBytes(file, target);
            String problem = "not valid UTF-8 (" + e.getMessage() + ")";
            LOG.warn("{}: {}", rel, problem);
            return new FileOutcome(rel, List.of(), problem);
        }

        try {
            RewriteResult res = rewriter.rewrite(source);
            writeText(target, res.text);
            LOG.debug("{}: {} declaration(s) modified", rel, res.modifiedCount());
            return new FileOutcome(rel, res.duplications, null);
        } catch (ParseProblemException e) {
            writeText(target, source);
            String problem = describe(e);
            LOG.warn("{}: {}", rel, problem);
            return new FileOutcome(rel, List.of(), problem);
        }
    }

    private static FileOutcome await(Future<FileOutcome> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) throw (IOException) cause;
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IOException(cause);
        }
    }

    private static void copyBytes(Path source, Path target) throws IOException {
        Path parent = target.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private static void writeText(Path target, String text) throws IOException {
        Path parent = target.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(target, text, StandardCharsets.UTF_8);
    }

    static String describe(ParseProblemException e) {
        int n = e.getProblems().size();
        if (n == 0) return "parse error";
        String first = e.getProblems().get(0).getMessage();
        return "parse error (" + n + (n == 1 ? " problem" : " problems") + "): " + firstLine(first);
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        int nl = s.indexOf('\n');
        return (nl < 0 ? s : s.substring(0, nl)).trim();
    }
}
