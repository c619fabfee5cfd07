package io.corekit.network.session;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;

public class InMemoryTokenStore implements TokenStore {

    private final AtomicReference<@Nullable Tokens> tokens = new AtomicReference<>();

    @Override
    public Optional<Tokens> load() {
        return Optional.ofNullable(tokens.get());
    }

    @Override
    public void save(Tokens tokens) {
        this.tokens.set(tokens);
    }

    @Override
    public void clear() {
        tokens.set(null);
    }
}
