package org.javai.remotecall.boundary;

import org.javai.remotecall.Failure;
import org.javai.remotecall.Outcome;
import org.javai.remotecall.RemoteOperation;
import org.javai.remotecall.classify.RetryClassifier;
import org.javai.remotecall.ops.CallReporter;

import java.util.Objects;

/**
 * Translates the checked failure of a remote call into an {@link Outcome}.
 * Catches the exception, classifies it, reports it, and returns {@link Outcome.Fail}.
 *
 * <p>RuntimeExceptions (defects) are not caught; they propagate to the caller unchanged.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Log4jCallReporter());
 *
 * Outcome<Profile> profile = boundary.call("ProfileApi.fetch", () -> api.fetchProfile(id));
 * }</pre>
 */
public final class Boundary {

    private final RetryClassifier classifier;
    private final CallReporter reporter;

    /**
     * Creates a silent Boundary that classifies failures but does not report them.
     */
    public static Boundary silent() {
        return new Boundary(RetryClassifier.defaults(), CallReporter.noOp());
    }

    /**
     * Creates a Boundary with default classification and the specified reporter.
     */
    public static Boundary withReporter(CallReporter reporter) {
        return new Boundary(RetryClassifier.defaults(), reporter);
    }

    public static Boundary of(RetryClassifier classifier, CallReporter reporter) {
        return new Boundary(classifier, reporter);
    }

    public Boundary(RetryClassifier classifier, CallReporter reporter) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw checked exceptions, translating any such exception into an Outcome.
     *
     * @param operation The operation name for context and reporting
     * @param work The remote call
     * @return Ok with the result, or Fail with a classified failure
     */
    public <T> Outcome<T> call(String operation, RemoteOperation<T> work) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.call());
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(operation, e);
        } catch (Exception e) {
            return fail(operation, e);
        }
    }

    private <T> Outcome<T> fail(String operation, Exception e) {
        Failure failure = Failure.of(operation, e, classifier.isRetryable(e));
        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
