package alpha.tinyhttp.message;

import alpha.tinyhttp.Config;
import alpha.tinyhttp.handler.HasResponse;

import java.io.Serial;

import static alpha.tinyhttp.message.Responses.payloadTooLarge;

/**
 * Thrown when a request does not fit within the configured
 * {@link Config#maxRequestSize()}.
 */
public final class MaxRequestSizeException
             extends RuntimeException implements HasResponse
{
    @Serial
    private static final long serialVersionUID = 1L;

    private final int configuredMax, required;

    /**
     * Constructs a {@code MaxRequestSizeException}.
     *
     * @param configuredMax the configured max request size
     * @param required      bytes needed, or a negative value if not known
     */
    public MaxRequestSizeException(int configuredMax, int required) {
        super(required < 0 ?
                "Request head exceeds " + configuredMax + " bytes." :
                "Request of " + required + " bytes exceeds " + configuredMax + " bytes.");
        this.configuredMax = configuredMax;
        this.required = required;
    }

    /**
     * {@return the configured max request size}
     */
    public int configuredMax() {
        return configuredMax;
    }

    /**
     * {@return the number of bytes the request needs, or -1 if not known}
     */
    public int required() {
        return required < 0 ? -1 : required;
    }

    /**
     * {@return {@link Responses#payloadTooLarge()}}
     */
    @Override
    public Response getResponse() {
        return payloadTooLarge();
    }
}
