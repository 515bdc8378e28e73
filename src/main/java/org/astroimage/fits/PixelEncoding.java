package org.astroimage.fits;

import java.nio.ByteBuffer;

/**
 * The per-pixel storage encodings selected by BITPIX. Multi-byte samples are
 * always big-endian.
 */
enum PixelEncoding {

    UINT8(8, 1) {
        @Override
        double read(ByteBuffer data) {
            return data.get() & 0xff;
        }
    },
    INT16(16, 2) {
        @Override
        double read(ByteBuffer data) {
            return data.getShort();
        }
    },
    INT32(32, 4) {
        @Override
        double read(ByteBuffer data) {
            return data.getInt();
        }
    },
    FLOAT32(-32, 4) {
        @Override
        double read(ByteBuffer data) {
            return data.getFloat();
        }
    },
    FLOAT64(-64, 8) {
        @Override
        double read(ByteBuffer data) {
            return data.getDouble();
        }
    };

    private final int bitpix;
    private final int bytesPerSample;

    PixelEncoding(int bitpix, int bytesPerSample) {
        this.bitpix = bitpix;
        this.bytesPerSample = bytesPerSample;
    }

    /**
     * Read one raw sample at the buffer's position, advancing it.
     */
    abstract double read(ByteBuffer data);

    int getBytesPerSample() {
        return bytesPerSample;
    }

    /**
     * @return The encoding for the BITPIX value, or null if unsupported
     */
    static PixelEncoding forBitpix(int bitpix) {
        for (PixelEncoding encoding : values()) {
            if (encoding.bitpix == bitpix) {
                return encoding;
            }
        }
        return null;
    }
}
