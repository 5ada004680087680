package org.gambitpairing.federation;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.gambitpairing.exception.DuplicateFederationCodeException;
import org.gambitpairing.exception.UnknownFederationCodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owned table of federation codes.
 *
 * <p>Lifecycle: create one directory when the process (or test) configures itself,
 * register every federation it needs, hand the directory to whatever resolves
 * player federations, and {@link #close()} it at teardown. A closed directory
 * rejects both registration and lookup. Codes compare case-insensitively and may
 * only be registered once for the lifetime of the directory.
 */
public final class FederationDirectory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FederationDirectory.class);

    private final Map<String, Federation> federations = new LinkedHashMap<>();
    private boolean closed;

    /**
     * Creates a directory pre-populated with FIDE, USCF and CFC.
     */
    public static FederationDirectory withDefaults() {
        FederationDirectory directory = new FederationDirectory();
        directory.register("FIDE", "International Chess Federation");
        directory.register("USCF", "United States Chess Federation");
        directory.register("CFC", "Chess Federation of Canada");
        return directory;
    }

    /**
     * Registers a federation.
     *
     * @throws DuplicateFederationCodeException if the canonical code is already present
     */
    public synchronized Federation register(String code, String name) {
        ensureOpen();
        Federation federation = new Federation(code, name);
        if (federations.containsKey(federation.code())) {
            throw new DuplicateFederationCodeException(federation.code());
        }
        federations.put(federation.code(), federation);
        log.debug("Registered federation {}", federation.code());
        return federation;
    }

    /**
     * Resolves a code to its registered federation.
     *
     * @throws UnknownFederationCodeException if nothing is registered under the code
     */
    public synchronized Federation lookup(String code) {
        ensureOpen();
        Preconditions.checkArgument(code != null, "code");
        Federation federation = federations.get(Federation.canonicalCode(code));
        if (federation == null) {
            throw new UnknownFederationCodeException(code);
        }
        return federation;
    }

    public synchronized boolean contains(String code) {
        ensureOpen();
        return code != null && federations.containsKey(Federation.canonicalCode(code));
    }

    public synchronized ImmutableList<Federation> all() {
        ensureOpen();
        return ImmutableList.copyOf(federations.values());
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Drops every registration. The directory cannot be used afterwards.
     */
    @Override
    public synchronized void close() {
        federations.clear();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Federation directory has been closed");
        }
    }
}
