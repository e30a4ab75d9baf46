package express.mvp.tenacity.client;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Keeps the resumption token in memory for the lifetime of the process. */
public final class InMemoryResumptionTokenStore implements ResumptionTokenStore {

    private final AtomicReference<byte[]> token = new AtomicReference<>();

    @Override
    public void save(byte[] value) {
        token.set(Objects.requireNonNull(value, "token must not be null").clone());
    }

    @Override
    public Optional<byte[]> load() {
        byte[] value = token.get();
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void clear() {
        token.set(null);
    }
}
