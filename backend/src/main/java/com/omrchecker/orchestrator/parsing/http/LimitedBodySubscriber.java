package com.omrchecker.orchestrator.parsing.http;

import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Collects a response body into memory up to a byte limit. Past the limit the subscription is cancelled and
 * the body completes as too large instead of buffering the rest.
 */
final class LimitedBodySubscriber implements HttpResponse.BodySubscriber<LimitedBodySubscriber.Body> {
    private static final long ARRAY_LIMIT = Integer.MAX_VALUE - 8;

    record Body(byte[] bytes, boolean tooLarge) {
        static final Body TOO_LARGE = new Body(null, true);
    }

    private final long maxBytes;
    private final boolean refused;
    private final CompletableFuture<Body> result = new CompletableFuture<>();
    private final List<ByteBuffer> received = new ArrayList<>();
    private Flow.Subscription subscription;
    private long size;

    private LimitedBodySubscriber(long maxBytes, boolean refused) {
        this.maxBytes = Math.min(maxBytes, ARRAY_LIMIT);
        this.refused = refused;
    }

    static HttpResponse.BodyHandler<Body> handler(long maxBytes) {
        return responseInfo -> {
            OptionalLong declared = responseInfo.headers().firstValueAsLong("Content-Length");
            boolean refused = declared.isPresent() && declared.getAsLong() > maxBytes;
            return new LimitedBodySubscriber(maxBytes, refused);
        };
    }

    @Override
    public CompletionStage<Body> getBody() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (refused) {
            subscription.cancel();
            result.complete(Body.TOO_LARGE);
            return;
        }
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
        if (result.isDone()) {
            return;
        }
        for (ByteBuffer item : items) {
            size += item.remaining();
            if (size > maxBytes) {
                received.clear();
                subscription.cancel();
                result.complete(Body.TOO_LARGE);
                return;
            }
            received.add(item);
        }
    }

    @Override
    public void onError(Throwable throwable) {
        received.clear();
        result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
        if (result.isDone()) {
            return;
        }
        byte[] bytes = new byte[(int) size];
        int offset = 0;
        for (ByteBuffer buffer : received) {
            int length = buffer.remaining();
            buffer.get(bytes, offset, length);
            offset += length;
        }
        received.clear();
        result.complete(new Body(bytes, false));
    }
}
