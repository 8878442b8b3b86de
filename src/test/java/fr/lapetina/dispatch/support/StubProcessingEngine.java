package fr.lapetina.dispatch.support;

import fr.lapetina.dispatch.domain.model.Envelope;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.model.RequestContext;
import fr.lapetina.dispatch.domain.model.Response;
import fr.lapetina.dispatch.domain.model.Result;
import fr.lapetina.dispatch.infrastructure.engine.ProcessingEngine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Processing engine whose behavior is set by the test. Answers 200 "ok" by default.
 */
public final class StubProcessingEngine implements ProcessingEngine {

    private final AtomicInteger calls = new AtomicInteger(0);
    private final List<RequestContext> contexts = new CopyOnWriteArrayList<>();
    private volatile BiFunction<Envelope, RequestContext, Result<Response>> behavior;
    private volatile long delayMs;

    public StubProcessingEngine() {
        succeedWith(Response.text(200, "ok", 0));
    }

    public StubProcessingEngine succeedWith(Response response) {
        this.behavior = (env, ctx) -> Result.ok(response);
        return this;
    }

    public StubProcessingEngine failWith(ErrorType error) {
        this.behavior = (env, ctx) -> Result.error(error, "stub");
        return this;
    }

    public StubProcessingEngine throwing(RuntimeException exception) {
        this.behavior = (env, ctx) -> {
            throw exception;
        };
        return this;
    }

    public StubProcessingEngine answering(BiFunction<Envelope, RequestContext, Result<Response>> behavior) {
        this.behavior = behavior;
        return this;
    }

    /**
     * Makes every call sleep before answering.
     */
    public StubProcessingEngine delayMs(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    @Override
    public Result<Response> processRequest(Envelope envelope, RequestContext context) {
        calls.incrementAndGet();
        contexts.add(context);
        long delay = delayMs;
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Result.error(ErrorType.TIMEOUT, "interrupted");
            }
        }
        return behavior.apply(envelope, context);
    }

    public int getCalls() {
        return calls.get();
    }

    public List<RequestContext> getContexts() {
        return contexts;
    }

    @Override
    public String getName() {
        return "stub";
    }
}
