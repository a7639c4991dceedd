package io.fullerstack.composite.error;

import lombok.Getter;

/**
 * A provider failed while its items were being read into a composite snapshot.
 *
 * <p>The composite that caught the failure keeps serving its previous snapshot.
 * The provider's original exception is available as the cause.
 */
@Getter
public class ProviderReadException extends RuntimeException {

    /**
     * Name of the composite that was recomputing.
     */
    private final String compositeName;

    /**
     * Position of the failing provider in the composite's membership.
     */
    private final int providerIndex;

    public ProviderReadException(String compositeName, int providerIndex, Throwable cause) {
        super("Composite '" + compositeName + "' failed to read provider #" + providerIndex + ": " + cause.getMessage(), cause);
        this.compositeName = compositeName;
        this.providerIndex = providerIndex;
    }
}
