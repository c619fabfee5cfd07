package io.corekit.network;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Transport answering from a script. Once the script is used up the last step repeats.
 */
class ScriptedTransport implements Transport {

    private final Deque<Supplier<CompletableFuture<Response>>> script = new ArrayDeque<>();
    private Supplier<CompletableFuture<Response>> last = () -> CompletableFuture.completedFuture(new Response(200, ""));
    private final List<Request> sent = new CopyOnWriteArrayList<>();

    ScriptedTransport respond(int status, String body) {
        return then(() -> CompletableFuture.completedFuture(new Response(status, body)));
    }

    ScriptedTransport fail(Throwable failure) {
        return then(() -> CompletableFuture.failedFuture(failure));
    }

    ScriptedTransport hang() {
        return then(CompletableFuture::new);
    }

    synchronized ScriptedTransport then(Supplier<CompletableFuture<Response>> step) {
        script.add(step);
        return this;
    }

    @Override
    public synchronized CompletableFuture<Response> send(Request request) {
        sent.add(request);
        if (!script.isEmpty()) {
            last = script.poll();
        }
        return last.get();
    }

    List<Request> sent() {
        return sent;
    }

    int sendCount() {
        return sent.size();
    }
}
