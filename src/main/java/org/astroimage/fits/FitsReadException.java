package org.astroimage.fits;

import java.io.IOException;

/**
 * Thrown when a file cannot be decoded into a {@link Raster}.
 */
public class FitsReadException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** The path is not a readable file */
        NOT_FOUND,
        /** The header ended without an END card */
        MALFORMED_HEADER,
        /** NAXIS1 or NAXIS2 resolved to a value &lt;= 0 */
        INVALID_DIMENSIONS,
        /** BITPIX is not one of 8, 16, 32, -32, -64 */
        UNSUPPORTED_ENCODING,
        /** The data ended before all declared pixels were read */
        TRUNCATED_DATA
    }

    private final Reason reason;
    private final String path;

    public FitsReadException(Reason reason, String path, String message) {
        super(message + ": " + path);
        this.reason = reason;
        this.path = path;
    }

    public Reason getReason() {
        return reason;
    }

    public String getPath() {
        return path;
    }
}
