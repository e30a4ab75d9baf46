package express.mvp.tenacity.client;

import java.util.Optional;

/**
 * Storage for the opaque token a server issues to resume a session.
 *
 * <p>The client saves the token from each connect acknowledgement and presents the stored token
 * in its next connect message. The token's content is never interpreted. Implementations decide
 * where it lives: memory, a file, a platform key store.
 */
public interface ResumptionTokenStore {

    /**
     * Stores a token, replacing any previous one.
     *
     * @param token the token bytes
     */
    void save(byte[] token);

    /**
     * Returns the stored token.
     *
     * @return the token, or empty if none was saved
     */
    Optional<byte[]> load();

    /** Forgets the stored token. */
    void clear();
}
